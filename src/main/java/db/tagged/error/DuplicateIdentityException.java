package db.tagged.error;

/** Two columns of one collection share a tag or a name. */
public abstract class DuplicateIdentityException extends SchemaException {
    protected DuplicateIdentityException(String message) {
        super(message);
    }
}
