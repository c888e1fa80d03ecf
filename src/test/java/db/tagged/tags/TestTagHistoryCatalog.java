package db.tagged.tags;

/**
 * In-memory only catalog for tests: never touches a history file.
 */
public class TestTagHistoryCatalog extends TagHistoryCatalog {
    public TestTagHistoryCatalog() {
        super();
    }
}
