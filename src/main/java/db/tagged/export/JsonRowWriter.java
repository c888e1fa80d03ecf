package db.tagged.export;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.stream.JsonWriter;

import db.tagged.catalog.Column;
import db.tagged.catalog.Schema;
import db.tagged.catalog.StoredValue;
import db.tagged.config.TaggedSchemaConfig;
import db.tagged.error.IncompleteWriteException;
import db.tagged.error.ValueConversionException;
import db.tagged.row.TaggedRow;

/**
 * Streams rows as {"rows":[{...},{...}]} without holding the document in memory.
 * Each row is an object keyed by column name in declared order; NULL columns are left out.
 *
 * The closing "]}" is written only by a successful close(). After any failed write, or
 * after abandon(), the output is left unterminated and the writer reports
 * {@link IncompleteWriteException} instead.
 */
public class JsonRowWriter implements RowWriter {
    private static final Logger LOG = LoggerFactory.getLogger(JsonRowWriter.class);

    private final Schema schema;
    private final Writer sink;
    private final JsonWriter json;
    private int rowsWritten;
    private Throwable failure;
    private boolean closed;

    public JsonRowWriter(Writer out, Schema schema, TaggedSchemaConfig config) throws IOException {
        if (out == null || schema == null || config == null) throw new IllegalArgumentException("writer, schema and config required");
        this.schema = schema;
        this.sink = new BufferedWriter(out, config.writeBufferSize);
        this.json = new JsonWriter(sink);
        json.setHtmlSafe(false);
        json.beginObject();
        json.name(config.rowsFieldName);
        json.beginArray();
    }

    public JsonRowWriter(Writer out, Schema schema) throws IOException {
        this(out, schema, TaggedSchemaConfig.load());
    }

    /** Opens a writer on a file, creating parent directories as needed. */
    public static JsonRowWriter open(Path path, Schema schema, TaggedSchemaConfig config) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        Writer w = new OutputStreamWriter(Files.newOutputStream(path), StandardCharsets.UTF_8);
        try {
            return new JsonRowWriter(w, schema, config);
        } catch (IOException e) {
            w.close();
            throw e;
        }
    }

    @Override
    public Schema schema() { return schema; }

    public int rowsWritten() { return rowsWritten; }

    public boolean failed() { return failure != null; }

    @Override
    public void writeRow(TaggedRow row) throws IOException {
        if (closed) throw new IOException("already closed");
        if (failure != null) throw new IOException("Writer failed earlier, output is incomplete", failure);
        try {
            json.beginObject();
            for (Column col : schema.allColumns()) {
                StoredValue v = row.values().get(col.tag());
                if (v == null) continue;
                json.name(col.name());
                writeValue(col, col.type().toExternal(v));
            }
            json.endObject();
            rowsWritten++;
        } catch (IOException | RuntimeException e) {
            failure = e;
            throw e;
        }
    }

    private void writeValue(Column col, Object external) throws IOException {
        if (external instanceof Boolean b) {
            json.value(b);
        } else if (external instanceof Double d) {
            if (d.isNaN() || d.isInfinite()) {
                throw new ValueConversionException("Column '" + col.name() + "': " + d + " has no JSON form");
            }
            json.value(d);
        } else if (external instanceof Long || external instanceof BigInteger) {
            json.value((Number) external);
        } else if (external instanceof UUID || external instanceof String) {
            json.value(external.toString());
        } else {
            throw new ValueConversionException("Column '" + col.name() + "': unsupported value " + external);
        }
    }

    /** Stops the export without terminating the document. Always reports the output as incomplete. */
    public void abandon(String reason) throws IOException {
        if (failure == null) failure = new IllegalStateException(reason);
        close();
    }

    @Override
    public void close() throws IOException {
        if (closed) throw new IOException("already closed");
        closed = true;
        if (failure != null) {
            // the sink is closed without the closing tokens
            try {
                json.flush();
            } catch (IOException e) {
                failure.addSuppressed(e);
            } finally {
                closeSink(failure);
            }
            LOG.warn("JSON export left incomplete after {} rows", rowsWritten, failure);
            throw new IncompleteWriteException("Export incomplete after " + rowsWritten + " rows: " + failure.getMessage(), rowsWritten, failure);
        }
        try {
            json.endArray();
            json.endObject();
            json.flush();
        } catch (IOException e) {
            closeSink(e);
            throw new IncompleteWriteException("Failed completing export after " + rowsWritten + " rows", rowsWritten, e);
        }
        json.close();
        LOG.debug("JSON export complete, {} rows", rowsWritten);
    }

    private void closeSink(Throwable primary) {
        try {
            sink.close();
        } catch (IOException e) {
            primary.addSuppressed(e);
        }
    }
}
