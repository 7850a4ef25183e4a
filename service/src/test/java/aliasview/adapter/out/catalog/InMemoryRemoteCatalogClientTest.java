package aliasview.adapter.out.catalog;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import aliasview.core.model.CatalogErrorKind;
import aliasview.core.model.CatalogException;
import aliasview.core.model.NamespaceSummary;
import aliasview.core.port.out.RemoteCatalogClient;
import aliasview.mock.CatalogFixtures;

@DisplayName("InMemoryRemoteCatalogClient")
class InMemoryRemoteCatalogClientTest {

    private InMemoryRemoteCatalogClient client;

    @BeforeEach
    void setUp() {
        client = new InMemoryRemoteCatalogClient(List.of(
                CatalogFixtures.namespace("Storage", "Storage/a"),
                CatalogFixtures.namespace("Compute", "Compute/a", "Compute/b")));
    }

    @Test
    @DisplayName("should list namespaces alphabetically")
    void shouldListNamespacesAlphabetically() {
        assertEquals(
                List.of(new NamespaceSummary("Compute"), new NamespaceSummary("Storage")),
                client.listNamespaces());
    }

    @Test
    @DisplayName("should return aliases when expanded")
    void shouldReturnAliasesWhenExpanded() {
        var detail = client.getNamespaceDetail("Compute", RemoteCatalogClient.EXPAND_ALIASES);

        assertEquals(2, detail.resourceTypes().get(0).aliases().size());
    }

    @Test
    @DisplayName("should omit aliases without the expansion")
    void shouldOmitAliasesWithoutExpansion() {
        var detail = client.getNamespaceDetail("Compute", null);

        assertEquals("things", detail.resourceTypes().get(0).resourceType());
        assertTrue(detail.resourceTypes().get(0).aliases().isEmpty());
    }

    @Test
    @DisplayName("should fail for unknown namespaces")
    void shouldFailForUnknownNamespace() {
        var thrown = assertThrows(
                CatalogException.class, () -> client.getNamespaceDetail("Unknown", RemoteCatalogClient.EXPAND_ALIASES));

        assertEquals(CatalogErrorKind.OTHER, thrown.kind());
    }

    @Test
    @DisplayName("should reflect registrations and removals")
    void shouldReflectRegistrationsAndRemovals() {
        client.register(CatalogFixtures.namespace("Network"));
        client.remove("Storage");

        assertEquals(
                List.of(new NamespaceSummary("Compute"), new NamespaceSummary("Network")),
                client.listNamespaces());

        client.clear();

        assertTrue(client.listNamespaces().isEmpty());
    }
}
