package db.tagged.error;

public class DuplicateTagException extends DuplicateIdentityException {
    private final long tag;

    public DuplicateTagException(long tag, String firstName, String secondName) {
        super("Duplicate tag " + Long.toUnsignedString(tag) + " on columns '" + firstName + "' and '" + secondName + "'");
        this.tag = tag;
    }

    public long tag() { return tag; }
}
