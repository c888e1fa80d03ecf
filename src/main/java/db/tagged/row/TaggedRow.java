package db.tagged.row;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

import db.tagged.catalog.Column;
import db.tagged.catalog.Schema;
import db.tagged.catalog.StoredValue;
import db.tagged.error.NonNullableColumnException;
import db.tagged.error.UnmappableColumnException;

/**
 * Row values keyed by column tag, interpreted against one schema.
 * A tag missing from the row is NULL for that column; there is no null sentinel value.
 * Every tag in the row exists in the schema. Non-nullable columns are enforced by
 * {@link Builder#build()}, while {@link Builder#buildPartial()} allows transient partial rows.
 */
public final class TaggedRow {
    private final Schema schema;
    private final SortedMap<Long, StoredValue> values;

    private TaggedRow(Schema schema, SortedMap<Long, StoredValue> values) {
        this.schema = schema;
        this.values = Collections.unmodifiableSortedMap(values);
    }

    public static Builder builder(Schema schema) {
        return new Builder(schema);
    }

    /** Checked construction: every tag must belong to the schema and non-nullable columns must be present. */
    public static TaggedRow of(Schema schema, Map<Long, StoredValue> values) {
        Builder b = builder(schema);
        values.forEach(b::set);
        return b.build();
    }

    public Schema schema() { return schema; }

    public Optional<StoredValue> value(long tag) { return Optional.ofNullable(values.get(tag)); }

    public boolean contains(long tag) { return values.containsKey(tag); }

    public Set<Long> tags() { return values.keySet(); }

    /** Present values, ascending unsigned tag order. */
    public SortedMap<Long, StoredValue> values() { return values; }

    public int size() { return values.size(); }

    /** Primary key values in key order; a null slot stands for a missing key value in a partial row. */
    public List<StoredValue> keyValues() {
        List<StoredValue> key = new ArrayList<>(schema.primaryKeyColumns().size());
        for (Column c : schema.primaryKeyColumns()) key.add(values.get(c.tag()));
        return Collections.unmodifiableList(key);
    }

    public TaggedRow with(long tag, StoredValue value) {
        Builder b = toBuilder();
        b.set(tag, value);
        return b.buildPartial();
    }

    public TaggedRow without(long tag) {
        Builder b = toBuilder();
        b.values.remove(tag);
        return b.buildPartial();
    }

    private Builder toBuilder() {
        Builder b = new Builder(schema);
        b.values.putAll(values);
        return b;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof TaggedRow other && schema.equals(other.schema) && values.equals(other.values);
    }

    @Override
    public int hashCode() { return Objects.hash(schema, values); }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        boolean first = true;
        for (Map.Entry<Long, StoredValue> e : values.entrySet()) {
            if (!first) sb.append(", ");
            sb.append(Long.toUnsignedString(e.getKey())).append(": ").append(e.getValue());
            first = false;
        }
        return sb.append('}').toString();
    }

    /** Mutable, single-use accumulator for one row. */
    public static final class Builder {
        private final Schema schema;
        private final SortedMap<Long, StoredValue> values = new TreeMap<>(Long::compareUnsigned);

        private Builder(Schema schema) {
            this.schema = Objects.requireNonNull(schema, "schema");
        }

        public Builder set(long tag, StoredValue value) {
            if (!schema.allColumns().containsTag(tag)) {
                throw new UnmappableColumnException("Tag " + Long.toUnsignedString(tag) + " is not in schema " + schema);
            }
            if (value == null) values.remove(tag);
            else values.put(tag, value);
            return this;
        }

        public TaggedRow build() {
            for (Column c : schema.allColumns()) {
                if (!c.nullable() && !values.containsKey(c.tag())) {
                    throw new NonNullableColumnException(c.name());
                }
            }
            return buildPartial();
        }

        public TaggedRow buildPartial() {
            return new TaggedRow(schema, new TreeMap<>(values));
        }
    }
}
