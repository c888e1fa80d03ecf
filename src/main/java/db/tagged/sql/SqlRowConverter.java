package db.tagged.sql;

import java.util.ArrayList;
import java.util.List;

import db.tagged.catalog.Column;
import db.tagged.catalog.Schema;
import db.tagged.catalog.StoredValue;
import db.tagged.error.NonNullableColumnException;
import db.tagged.error.ValueConversionException;
import db.tagged.row.TaggedRow;

/**
 * Converts rows between the engine's ordinal form and the tag-keyed form.
 * Slot i of an ordinal row belongs to column i of the schema's declared order.
 */
public final class SqlRowConverter {
    private SqlRowConverter() {}

    /** One slot per column in declared order; absent tags become null. */
    public static SqlRow toSqlRow(TaggedRow row, Schema schema) {
        List<Column> cols = schema.allColumns().columns();
        List<Object> out = new ArrayList<>(cols.size());
        for (Column col : cols) {
            StoredValue v = row.values().get(col.tag());
            if (v == null) {
                out.add(null);
                continue;
            }
            try {
                out.add(col.type().toExternal(v));
            } catch (ValueConversionException e) {
                throw new ValueConversionException("Column '" + col.name() + "': " + e.getMessage(), e);
            }
        }
        return new SqlRow(out);
    }

    public static SqlRow toSqlRow(TaggedRow row) {
        return toSqlRow(row, row.schema());
    }

    /** Null slots are omitted from the tagged row; a null for a non-nullable column fails. */
    public static TaggedRow toTaggedRow(SqlRow row, Schema schema) {
        List<Column> cols = schema.allColumns().columns();
        if (row.size() != cols.size()) {
            throw new IllegalArgumentException("Arity mismatch: expected " + cols.size() + " values, got " + row.size());
        }
        TaggedRow.Builder b = TaggedRow.builder(schema);
        for (int i = 0; i < cols.size(); i++) {
            Column col = cols.get(i);
            Object val = row.get(i);
            if (val == null) {
                if (!col.nullable()) throw new NonNullableColumnException(col.name());
                continue;
            }
            try {
                b.set(col.tag(), col.type().fromExternal(val));
            } catch (ValueConversionException e) {
                throw new ValueConversionException("Column '" + col.name() + "': " + e.getMessage(), e);
            }
        }
        return b.build();
    }

    public static List<TaggedRow> toTaggedRows(List<SqlRow> rows, Schema schema) {
        List<TaggedRow> out = new ArrayList<>(rows.size());
        for (SqlRow r : rows) out.add(toTaggedRow(r, schema));
        return out;
    }
}
