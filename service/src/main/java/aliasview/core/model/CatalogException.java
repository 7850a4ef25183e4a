package aliasview.core.model;

import java.util.Objects;

/**
 * Failure raised by the catalog engine or its remote collaborator, tagged with a {@link CatalogErrorKind}.
 */
public class CatalogException extends RuntimeException {

    private final CatalogErrorKind kind;

    public CatalogException(CatalogErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind cannot be null");
    }

    public CatalogException(CatalogErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind cannot be null");
    }

    public CatalogErrorKind kind() {
        return kind;
    }

    /**
     * Classifies any throwable. Throwables not raised as {@link CatalogException} are {@link CatalogErrorKind#OTHER}.
     *
     * @param error the failure to classify
     * @return the error kind
     */
    public static CatalogErrorKind kindOf(Throwable error) {
        if (error instanceof CatalogException catalogException) {
            return catalogException.kind();
        }
        return CatalogErrorKind.OTHER;
    }

    public static CatalogException auth(String message) {
        return new CatalogException(CatalogErrorKind.AUTH, message);
    }

    public static CatalogException transientFailure(String message) {
        return new CatalogException(CatalogErrorKind.TRANSIENT, message);
    }

    public static CatalogException transientFailure(String message, Throwable cause) {
        return new CatalogException(CatalogErrorKind.TRANSIENT, message, cause);
    }
}
