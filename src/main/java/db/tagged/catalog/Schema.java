package db.tagged.catalog;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import db.tagged.error.SchemaValidationException;
import db.tagged.error.UnmappableColumnException;

/**
 * A table version's columns plus the cached primary-key / non-key partition.
 * Keyed schemas describe storable tables; unkeyed schemas describe projections and
 * result sets and carry no primary key.
 */
public final class Schema {
    private final ColumnCollection allColumns;
    private final List<Column> primaryKeyColumns;
    private final List<Column> nonKeyColumns;
    private final boolean unkeyed;

    private Schema(ColumnCollection allColumns, boolean unkeyed) {
        this.allColumns = allColumns;
        this.unkeyed = unkeyed;
        List<Column> pk = new ArrayList<>();
        List<Column> nonPk = new ArrayList<>();
        for (Column c : allColumns) {
            if (!unkeyed && c.partOfPrimaryKey()) pk.add(c);
            else nonPk.add(c);
        }
        this.primaryKeyColumns = List.copyOf(pk);
        this.nonKeyColumns = List.copyOf(nonPk);
    }

    /** Keyed table schema; primary-key columns must be non-nullable and at most one column may auto increment. */
    public static Schema of(ColumnCollection columns) {
        if (columns == null) throw new IllegalArgumentException("columns must not be null");
        int autoIncrement = 0;
        for (Column c : columns) {
            if (c.partOfPrimaryKey() && c.nullable()) {
                throw new SchemaValidationException("Primary key column '" + c.name() + "' must not be nullable");
            }
            if (c.autoIncrement()) autoIncrement++;
        }
        if (autoIncrement > 1) {
            throw new SchemaValidationException("At most one auto increment column allowed, found " + autoIncrement);
        }
        return new Schema(columns, false);
    }

    public static Schema of(Column... columns) {
        return of(ColumnCollection.of(columns));
    }

    /** Schema without a primary key, for projections and result sets. No key validation applies. */
    public static Schema unkeyed(ColumnCollection columns) {
        if (columns == null) throw new IllegalArgumentException("columns must not be null");
        return new Schema(columns, true);
    }

    public ColumnCollection allColumns() { return allColumns; }
    public List<Column> primaryKeyColumns() { return primaryKeyColumns; }
    public List<Column> nonKeyColumns() { return nonKeyColumns; }

    public boolean isUnkeyed() { return unkeyed; }

    public boolean isKeyless() { return primaryKeyColumns.isEmpty(); }

    public Optional<Column> column(long tag) { return allColumns.byTag(tag); }

    public Optional<Column> columnNamed(String name) { return allColumns.byName(name); }

    public int size() { return allColumns.size(); }

    /**
     * Unkeyed schema holding the named columns in the order given, tags unchanged.
     * An empty list projects every column.
     */
    public Schema project(List<String> names) {
        if (names == null || names.isEmpty()) return unkeyed(allColumns);
        List<Column> cols = new ArrayList<>(names.size());
        for (String name : names) {
            Column c = allColumns.byName(name)
                .orElseThrow(() -> new UnmappableColumnException("Column not found in schema: " + name));
            cols.add(c);
        }
        return unkeyed(ColumnCollection.of(cols));
    }

    /** Rules applied when a table is created: a primary key must exist and auto increment must be integral. */
    public void validateForInsert() {
        if (isKeyless()) throw new SchemaValidationException("Invalid schema: no primary key columns");
        for (Column c : allColumns) {
            if (c.autoIncrement() && !c.type().kind().isIntegral()) {
                throw new SchemaValidationException("Auto increment column '" + c.name() + "' must be an integer type, found " + c.type());
            }
        }
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Schema other && unkeyed == other.unkeyed && allColumns.equals(other.allColumns);
    }

    @Override
    public int hashCode() { return allColumns.hashCode() * 31 + (unkeyed ? 1 : 0); }

    @Override
    public String toString() {
        return (unkeyed ? "UnkeyedSchema" : "Schema") + allColumns;
    }
}
