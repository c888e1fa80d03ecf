package db.tagged.export;

import java.io.Closeable;
import java.io.IOException;

import db.tagged.catalog.Schema;
import db.tagged.row.TaggedRow;

/**
 * Sink for finished rows of one schema.
 * close() completes the output; a writer that cannot complete it must say so by failing.
 */
public interface RowWriter extends Closeable {
    Schema schema();
    void writeRow(TaggedRow row) throws IOException;
}
