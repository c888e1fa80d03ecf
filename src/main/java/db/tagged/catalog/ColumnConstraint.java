package db.tagged.catalog;

/** Column-level constraints recorded with a column definition. */
public enum ColumnConstraint {
    NOT_NULL
}
