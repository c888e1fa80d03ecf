package db.tagged.row;

import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import db.tagged.catalog.Column;
import db.tagged.catalog.Schema;
import db.tagged.error.UnmappableColumnException;

/**
 * Partial function from source tags to destination tags between two schemas.
 * Source tags without an entry are dropped during conversion; destination tags without a
 * source are left NULL (or rejected if non-nullable) by the {@link RowConverter}.
 *
 * Explicit entries strictly override name matches: an explicit entry replaces the name
 * match of its source tag and removes any name match aimed at the same destination tag.
 */
public final class TagMapping {
    private static final Logger LOG = LoggerFactory.getLogger(TagMapping.class);

    private final Schema source;
    private final Schema destination;
    private final Map<Long, Long> srcToDst;

    private TagMapping(Schema source, Schema destination, Map<Long, Long> srcToDst) {
        this.source = source;
        this.destination = destination;
        this.srcToDst = Collections.unmodifiableMap(srcToDst);
    }

    /** Case-sensitive name match; unmatched source columns are dropped. */
    public static TagMapping byName(Schema source, Schema destination) {
        return builder(source, destination).matchByName().build();
    }

    /** Name match that requires every source column to find a destination column. */
    public static TagMapping byNameStrict(Schema source, Schema destination) {
        TagMapping m = byName(source, destination);
        for (Column c : source.allColumns()) {
            if (!m.srcToDst.containsKey(c.tag())) {
                throw new UnmappableColumnException("Source column '" + c.name() + "' has no match in destination schema");
            }
        }
        return m;
    }

    public static TagMapping explicit(Schema source, Schema destination, Map<Long, Long> srcToDst) {
        Builder b = builder(source, destination);
        srcToDst.forEach(b::map);
        return b.build();
    }

    public static TagMapping identity(Schema schema) {
        Builder b = builder(schema, schema);
        for (long tag : schema.allColumns().tags()) b.map(tag, tag);
        return b.build();
    }

    public static Builder builder(Schema source, Schema destination) {
        return new Builder(source, destination);
    }

    public Schema source() { return source; }
    public Schema destination() { return destination; }

    public OptionalLong destinationTag(long srcTag) {
        Long dst = srcToDst.get(srcTag);
        return dst == null ? OptionalLong.empty() : OptionalLong.of(dst);
    }

    /** Entries in source declared order. */
    public Map<Long, Long> entries() { return srcToDst; }

    public int size() { return srcToDst.size(); }

    public boolean isEmpty() { return srcToDst.isEmpty(); }

    @Override
    public String toString() { return "TagMapping" + srcToDst; }

    public static final class Builder {
        private final Schema source;
        private final Schema destination;
        private boolean byName;
        private final Map<Long, Long> explicit = new LinkedHashMap<>();

        private Builder(Schema source, Schema destination) {
            if (source == null || destination == null) throw new IllegalArgumentException("source and destination schemas required");
            this.source = source;
            this.destination = destination;
        }

        public Builder matchByName() {
            this.byName = true;
            return this;
        }

        public Builder map(long srcTag, long dstTag) {
            if (!source.allColumns().containsTag(srcTag)) {
                throw new UnmappableColumnException("Source tag " + Long.toUnsignedString(srcTag) + " is not in source schema");
            }
            if (!destination.allColumns().containsTag(dstTag)) {
                throw new UnmappableColumnException("Destination tag " + Long.toUnsignedString(dstTag) + " is not in destination schema");
            }
            explicit.put(srcTag, dstTag);
            return this;
        }

        public TagMapping build() {
            Map<Long, Long> named = new HashMap<>();
            if (byName) {
                for (Column src : source.allColumns()) {
                    destination.columnNamed(src.name()).ifPresent(dst -> named.put(src.tag(), dst.tag()));
                }
                Iterator<Map.Entry<Long, Long>> it = named.entrySet().iterator();
                while (it.hasNext()) {
                    Map.Entry<Long, Long> e = it.next();
                    if (explicit.containsKey(e.getKey()) || explicit.containsValue(e.getValue())) it.remove();
                }
            }

            Map<Long, Long> out = new LinkedHashMap<>();
            Map<Long, Long> claimedBy = new HashMap<>();
            for (long srcTag : source.allColumns().tags()) {
                Long dst = explicit.containsKey(srcTag) ? explicit.get(srcTag) : named.get(srcTag);
                if (dst == null) continue;
                Long other = claimedBy.putIfAbsent(dst, srcTag);
                if (other != null) {
                    throw new UnmappableColumnException("Destination tag " + Long.toUnsignedString(dst)
                        + " is mapped from both source tags " + Long.toUnsignedString(other) + " and " + Long.toUnsignedString(srcTag));
                }
                out.put(srcTag, dst);
            }
            LOG.debug("Built tag mapping with {} of {} source columns mapped", out.size(), source.size());
            return new TagMapping(source, destination, out);
        }
    }
}
