package db.tagged.error;

/** Primary key or auto increment configuration a schema cannot carry. */
public class SchemaValidationException extends SchemaException {
    public SchemaValidationException(String message) {
        super(message);
    }
}
