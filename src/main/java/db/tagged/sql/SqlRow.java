package db.tagged.sql;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Ordinal row exchanged with the query engine. A null slot is SQL NULL.
 * Length and meaning of each slot come from the accompanying column list.
 */
public record SqlRow(List<Object> values) {
    public SqlRow {
        if (values == null) throw new IllegalArgumentException("values must not be null");
        values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    public static SqlRow of(Object... values) {
        return new SqlRow(Arrays.asList(values));
    }

    public Object get(int i) { return values.get(i); }

    public int size() { return values.size(); }

    @Override
    public String toString() { return "SqlRow" + values; }
}
