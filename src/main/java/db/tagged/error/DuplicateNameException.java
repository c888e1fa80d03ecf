package db.tagged.error;

public class DuplicateNameException extends DuplicateIdentityException {
    private final String name;

    public DuplicateNameException(String name) {
        super("Duplicate column name '" + name + "'");
        this.name = name;
    }

    public String name() { return name; }
}
