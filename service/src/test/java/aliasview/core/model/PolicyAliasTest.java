package aliasview.core.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("PolicyAlias")
class PolicyAliasTest {

    @Nested
    @DisplayName("Construction")
    class ConstructionTests {

        @Test
        @DisplayName("should require namespace, resource type and alias name")
        void shouldRequireIdentityFields() {
            assertThrows(NullPointerException.class, () -> new PolicyAlias(null, "vms", "name", null, null, null));
            assertThrows(
                    NullPointerException.class, () -> new PolicyAlias("Compute", null, "name", null, null, null));
            assertThrows(NullPointerException.class, () -> new PolicyAlias("Compute", "vms", null, null, null, null));
        }

        @Test
        @DisplayName("should allow optional fields to be absent")
        void shouldAllowOptionalFieldsToBeAbsent() {
            var alias = new PolicyAlias("Compute", "vms", "Compute/vms/sku", null, null, null);

            assertNull(alias.defaultPath());
            assertNull(alias.defaultPattern());
            assertNull(alias.type());
        }
    }

    @Nested
    @DisplayName("Searchable text")
    class SearchableTextTests {

        @Test
        @DisplayName("should join identity fields and default path in lowercase")
        void shouldJoinFieldsInLowercase() {
            var alias = new PolicyAlias("Compute", "virtualMachines", "Compute/VM/Sku", "properties.Sku", null, null);

            assertEquals("compute virtualmachines compute/vm/sku properties.sku", alias.searchableText());
        }

        @Test
        @DisplayName("should treat a missing default path as empty")
        void shouldTreatMissingDefaultPathAsEmpty() {
            var alias = new PolicyAlias("Compute", "vms", "name", null, null, null);

            assertEquals("compute vms name ", alias.searchableText());
        }
    }

    @Test
    @DisplayName("AliasPattern.copyOf should copy every field and keep null as null")
    void aliasPatternCopyOf() {
        var source = new AliasPattern("phrase", "variable", "Extract");

        assertEquals(source, AliasPattern.copyOf(source));
        assertNull(AliasPattern.copyOf(null));
    }
}
