package eti.domain.discovery;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * History store persisted as a JSON object of address to count.
 * The file is rewritten after every increment; write failures are logged and the in-memory count is kept.
 *
 * @since 16/10/2026
 */
public class JsonFileConnectionHistoryStore implements IConnectionHistoryStore {
    private static final Logger logger = LoggerFactory.getLogger(JsonFileConnectionHistoryStore.class);
    private static final Type COUNTS_TYPE = new TypeToken<Map<String, Integer>>() { }.getType();

    private final Path file;
    private final Gson gson = new GsonBuilder().setPrettyPrinting().create();
    private final Map<String, Integer> counts;

    public JsonFileConnectionHistoryStore(Path file) {
        this.file = file;
        this.counts = load(file);
    }

    @Override
    public synchronized int getSuccessCount(String address) {
        return counts.getOrDefault(address, 0);
    }

    @Override
    public synchronized int incrementSuccessCount(String address) {
        int updated = counts.merge(address, 1, Integer::sum);
        save();
        return updated;
    }

    private Map<String, Integer> load(Path path) {
        if (!Files.isRegularFile(path)) {
            logger.debug("No connection history at {}, starting empty", path);
            return new HashMap<>();
        }
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            Map<String, Integer> loaded = gson.fromJson(reader, COUNTS_TYPE);
            logger.info("Loaded connection history for {} printers from {}", loaded != null ? loaded.size() : 0, path);
            return loaded != null ? new HashMap<>(loaded) : new HashMap<>();
        } catch (IOException | JsonParseException e) {
            logger.warn("Failed to read connection history from '{}': {}", path, e.getMessage());
            return new HashMap<>();
        }
    }

    private void save() {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path temp = file.resolveSibling(file.getFileName() + ".tmp");
            try (Writer writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
                gson.toJson(new TreeMap<>(counts), COUNTS_TYPE, writer);
            }
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            logger.warn("Failed to persist connection history to '{}': {}", file, e.getMessage());
        }
    }
}
