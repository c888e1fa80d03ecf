package db.tagged.tags;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import db.tagged.config.TaggedSchemaConfig;
import db.tagged.error.TagSpaceExhaustedException;

/**
 * Hands out tags for columns being added to a table.
 * New tags start above the highest user tag in the history, increase monotonically and
 * skip anything already in the history, so a retired tag is never reused. Tags at or above
 * the reserved minimum belong to system tables and are never returned.
 *
 * The allocator is a pure function of its input. Reading the history and recording the new
 * tags atomically per table is the job of whoever commits the schema.
 */
public class TagAllocator {
    private static final Logger LOG = LoggerFactory.getLogger(TagAllocator.class);

    private final long firstTag;
    private final long reservedTagMin;

    public TagAllocator() {
        this(TaggedSchemaConfig.load());
    }

    public TagAllocator(TaggedSchemaConfig config) {
        this.firstTag = config.firstTag;
        this.reservedTagMin = config.reservedTagMin;
    }

    public List<Long> allocate(Set<Long> tagHistory, List<String> newColumnNames) {
        if (tagHistory == null) throw new IllegalArgumentException("tagHistory must not be null");
        if (newColumnNames == null) throw new IllegalArgumentException("newColumnNames must not be null");
        if (newColumnNames.isEmpty()) return List.of();

        long next = firstTag;
        for (long t : tagHistory) {
            if (Long.compareUnsigned(t, reservedTagMin) < 0 && Long.compareUnsigned(t, next) >= 0) {
                next = t + 1;
            }
        }

        List<Long> out = new ArrayList<>(newColumnNames.size());
        for (String name : newColumnNames) {
            while (tagHistory.contains(next)) next++;
            if (Long.compareUnsigned(next, reservedTagMin) >= 0) {
                throw new TagSpaceExhaustedException("No free tag below " + Long.toUnsignedString(reservedTagMin)
                    + " for column '" + name + "' (" + out.size() + " of " + newColumnNames.size() + " allocated)");
            }
            out.add(next);
            next++;
        }
        LOG.debug("Allocated tags {} for columns {}", out, newColumnNames);
        return Collections.unmodifiableList(out);
    }

    public List<Long> allocateFor(TagHistorySource history, String tableName, List<String> newColumnNames) {
        return allocate(history.tagHistory(tableName), newColumnNames);
    }
}
