package aliasview.core.model;

/**
 * Alias as declared by the remote catalog, before it is flattened into a {@link PolicyAlias}.
 *
 * @param name           the alias name
 * @param defaultPath    the default property path (nullable)
 * @param defaultPattern the default pattern (nullable)
 * @param type           the alias type (nullable)
 */
public record AliasEntry(String name, String defaultPath, AliasPattern defaultPattern, String type) {}
