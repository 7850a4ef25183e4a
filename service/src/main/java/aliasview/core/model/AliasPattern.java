package aliasview.core.model;

/**
 * Default pattern attached to an alias. Every component is optional.
 *
 * @param phrase   the pattern phrase (nullable)
 * @param variable the pattern variable (nullable)
 * @param type     the pattern type (nullable)
 */
public record AliasPattern(String phrase, String variable, String type) {

    /**
     * Copies a remote pattern field by field.
     *
     * @param source the remote pattern, may be null
     * @return a detached copy, or null when the source is null
     */
    public static AliasPattern copyOf(AliasPattern source) {
        if (source == null) {
            return null;
        }
        return new AliasPattern(source.phrase(), source.variable(), source.type());
    }
}
