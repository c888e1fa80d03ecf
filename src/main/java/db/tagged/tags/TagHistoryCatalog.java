package db.tagged.tags;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;

import db.tagged.catalog.Schema;

/**
 * Records every tag each table has ever committed. History only grows: dropping a column
 * retires its tag but keeps it reserved. When constructed with a file the catalog is
 * loaded from and saved to JSON after every change.
 */
public class TagHistoryCatalog implements TagHistorySource {
    private static final Logger LOG = LoggerFactory.getLogger(TagHistoryCatalog.class);

    private final Map<String, SortedSet<Long>> history = new HashMap<>();
    private final Path file; // null: in-memory only

    private final Gson gson = new GsonBuilder().setPrettyPrinting().create();

    public TagHistoryCatalog(Path file) {
        this.file = file;
        if (file != null) load();
    }

    protected TagHistoryCatalog() {
        this.file = null;
    }

    /** Adds all tags of the committed schema to the table's history. */
    public synchronized void recordSchema(String tableName, Schema schema) {
        SortedSet<Long> tags = tagsOf(tableName);
        boolean changed = false;
        for (long tag : schema.allColumns().tags()) changed |= tags.add(tag);
        if (changed) save();
    }

    /** Keeps a dropped column's tag reserved. */
    public synchronized void retireTag(String tableName, long tag) {
        if (tagsOf(tableName).add(tag)) save();
    }

    @Override
    public synchronized Set<Long> tagHistory(String tableName) {
        SortedSet<Long> tags = history.get(tableName);
        return tags == null ? Set.of() : Collections.unmodifiableSet(new TreeSet<>(tags));
    }

    public synchronized Set<String> tableNames() {
        return Set.copyOf(history.keySet());
    }

    private SortedSet<Long> tagsOf(String tableName) {
        if (tableName == null || tableName.isBlank()) throw new IllegalArgumentException("tableName required");
        return history.computeIfAbsent(tableName, t -> new TreeSet<>(Long::compareUnsigned));
    }

    private void load() {
        if (!Files.exists(file)) return;
        Type type = new TypeToken<Map<String, TreeSet<Long>>>(){}.getType();
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            Map<String, TreeSet<Long>> loaded = gson.fromJson(reader, type);
            if (loaded != null) {
                loaded.forEach((table, tags) -> tagsOf(table).addAll(tags));
            }
            LOG.debug("Loaded tag history for {} tables from {}", history.size(), file);
        } catch (IOException e) {
            LOG.error("Failed loading tag history file: {}", file, e);
            throw new UncheckedIOException(e);
        } catch (JsonParseException e) {
            LOG.error("Corrupt tag history file: {}", file, e);
            throw e;
        }
    }

    private void save() {
        if (file == null) return;
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
                gson.toJson(new TreeMap<>(history), writer);
            }
        } catch (IOException e) {
            LOG.error("Failed saving tag history file: {}", file, e);
            throw new UncheckedIOException(e);
        }
    }
}
