package db.tagged.row;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import db.tagged.catalog.Column;
import db.tagged.catalog.Schema;
import db.tagged.catalog.StoredValue;
import db.tagged.error.TypeMismatchException;

/**
 * Projects rows of the mapping's source schema into its destination schema.
 * Values are copied verbatim; converting across types is up to the caller beforehand.
 */
public class RowConverter {
    private final TagMapping mapping;

    public RowConverter(TagMapping mapping) {
        if (mapping == null) throw new IllegalArgumentException("mapping must not be null");
        this.mapping = mapping;
    }

    public static RowConverter identity(Schema schema) {
        return new RowConverter(TagMapping.identity(schema));
    }

    public TagMapping mapping() { return mapping; }

    public TaggedRow convert(TaggedRow row) {
        if (!row.schema().equals(mapping.source())) {
            throw new IllegalArgumentException("Row schema does not match mapping source schema");
        }
        Schema dstSchema = mapping.destination();
        TaggedRow.Builder out = TaggedRow.builder(dstSchema);
        for (Map.Entry<Long, Long> e : mapping.entries().entrySet()) {
            StoredValue v = row.values().get(e.getKey());
            if (v == null) continue;
            Column dst = dstSchema.column(e.getValue()).orElseThrow();
            if (!dst.type().accepts(v)) {
                Column src = row.schema().column(e.getKey()).orElseThrow();
                throw new TypeMismatchException("Column '" + src.name() + "' holds " + v.kind()
                    + " but destination column '" + dst.name() + "' is " + dst.type());
            }
            out.set(dst.tag(), v);
        }
        return out.build();
    }

    public List<TaggedRow> convertAll(List<TaggedRow> rows) {
        List<TaggedRow> out = new ArrayList<>(rows.size());
        for (TaggedRow r : rows) out.add(convert(r));
        return out;
    }
}
