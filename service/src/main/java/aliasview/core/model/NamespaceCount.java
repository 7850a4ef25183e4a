package aliasview.core.model;

/**
 * Number of aliases declared under a namespace.
 */
public record NamespaceCount(String namespace, long count) {}
