package db.tagged.tags;

import java.util.Set;

/**
 * Every tag a table has ever used: tags of its current schema plus tags retired by drops.
 * Implemented by whatever layer versions committed schemas.
 */
@FunctionalInterface
public interface TagHistorySource {
    /** Returns the table's tag history; an unknown table has an empty history. */
    Set<Long> tagHistory(String tableName);
}
