package db.tagged.error;

public class TagSpaceExhaustedException extends SchemaException {
    public TagSpaceExhaustedException(String message) {
        super(message);
    }
}
