package com.hedgedata.data.cache;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hedgedata.core.model.FinancialRecord;
import com.hedgedata.core.model.RecordKind;
import com.hedgedata.data.HttpClientFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Record cache that survives restarts. Each (kind, ticker) collection lives in
 * {@code <cacheDir>/<TICKER>/<kind>.json}, is loaded on first access and
 * rewritten after every merge. A failed write is logged and the merged
 * collection is still served from memory.
 */
public class JsonFileRecordCache extends InMemoryRecordCache {

    private static final Logger log = LoggerFactory.getLogger(JsonFileRecordCache.class);

    private final Path cacheDir;
    private final ObjectMapper mapper;

    public JsonFileRecordCache(Path cacheDir) {
        this.cacheDir = cacheDir;
        this.mapper = HttpClientFactory.getMapper();
    }

    public Path getCacheDir() {
        return cacheDir;
    }

    Path fileFor(RecordKind<?> kind, String ticker) {
        return cacheDir.resolve(sanitize(ticker)).resolve(kind.getKey() + ".json");
    }

    @Override
    protected <T extends FinancialRecord> List<T> loadExisting(RecordKind<T> kind, String ticker) {
        Path file = fileFor(kind, ticker);
        if (!Files.isRegularFile(file)) {
            return List.of();
        }
        try {
            JavaType type = mapper.getTypeFactory().constructCollectionType(List.class, kind.getType());
            List<T> records = mapper.readValue(file.toFile(), type);
            log.debug("Loaded {} {} for {} from {}", records.size(), kind, ticker, file);
            return records;
        } catch (IOException e) {
            log.warn("Ignoring unreadable cache file {}: {}", file, e.getMessage());
            return List.of();
        }
    }

    @Override
    protected <T extends FinancialRecord> void persist(RecordKind<T> kind, String ticker, List<T> records) {
        Path file = fileFor(kind, ticker);
        try {
            Files.createDirectories(file.getParent());
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            mapper.writeValue(tmp.toFile(), records);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            // The merged batch stays in memory; only its durability is lost
            log.warn("Failed to write cache file {}: {}", file, e.getMessage());
        }
    }

    @Override
    public void clear() {
        super.clear();
        if (Files.isDirectory(cacheDir)) {
            try (Stream<Path> dirs = Files.list(cacheDir)) {
                dirs.filter(Files::isDirectory).forEach(this::deleteTree);
            } catch (IOException e) {
                log.warn("Failed to clear cache directory {}: {}", cacheDir, e.getMessage());
            }
        }
    }

    @Override
    public void clear(String ticker) {
        super.clear(ticker);
        deleteTree(cacheDir.resolve(sanitize(normalizeTicker(ticker))));
    }

    private void deleteTree(Path root) {
        if (!Files.exists(root)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(root)) {
            paths.sorted(Comparator.reverseOrder()).forEach(path -> {
                try {
                    Files.delete(path);
                } catch (IOException e) {
                    log.warn("Failed to delete {}: {}", path, e.getMessage());
                }
            });
        } catch (IOException e) {
            log.warn("Failed to walk {}: {}", root, e.getMessage());
        }
    }

    // Tickers like "BRK/B" or "../x" must stay one directory below cacheDir
    static String sanitize(String ticker) {
        String cleaned = ticker.replaceAll("[^A-Za-z0-9._-]", "_");
        return cleaned.replace("..", "__");
    }
}
