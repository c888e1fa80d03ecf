package db.tagged.error;

/**
 * Root of the unchecked failures raised by the tagged schema layer.
 * Every subclass describes a caller contract violation; none is retried internally.
 */
public class SchemaException extends RuntimeException {
    public SchemaException(String message) {
        super(message);
    }

    public SchemaException(String message, Throwable cause) {
        super(message, cause);
    }
}
