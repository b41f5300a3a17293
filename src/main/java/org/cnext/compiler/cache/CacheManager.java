package org.cnext.compiler.cache;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import org.cnext.compiler.frontend.headers.HeaderSymbolCache;
import org.cnext.compiler.frontend.module.DependencyNode;
import org.cnext.compiler.frontend.module.IncludeCacheLookup;
import org.cnext.compiler.frontend.module.IncludeDirective;
import org.cnext.compiler.frontend.semantics.SourceLanguage;
import org.cnext.compiler.frontend.semantics.Symbol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * The on-disk cache of foreign header scans, stored under a project's {@code .cnx/} directory:
 * <pre>
 *   .cnx/
 *     config.json          format version and tool version
 *     cache/symbols.json   one entry per header: mtime, language, includes, symbols
 * </pre>
 * An entry is used only while the header's modification time is unchanged. A different
 * format or tool version discards every entry. Both files are replaced atomically on
 * {@link #save()}.
 */
public class CacheManager implements IncludeCacheLookup, HeaderSymbolCache {

    private static final Logger log = LoggerFactory.getLogger(CacheManager.class);

    public static final int FORMAT_VERSION = 1;

    static final String CONFIG_FILE = "config.json";
    static final String CACHE_DIR = "cache";
    static final String SYMBOLS_FILE = "symbols.json";

    private static final Type ENTRIES_TYPE = new TypeToken<LinkedHashMap<String, HeaderEntry>>() { }.getType();

    private final Path directory;
    private final String toolVersion;
    private final Gson gson = new GsonBuilder().setPrettyPrinting().create();
    private final Map<String, HeaderEntry> entries = new LinkedHashMap<>();
    private boolean dirty;

    /**
     * @param directory   The cache directory, usually {@code <project>/.cnx}.
     * @param toolVersion The version of the running compiler.
     */
    public CacheManager(Path directory, String toolVersion) {
        this.directory = directory;
        this.toolVersion = toolVersion;
    }

    /**
     * Creates a manager and loads the existing cache, if any.
     */
    public static CacheManager open(Path directory, String toolVersion) {
        CacheManager manager = new CacheManager(directory, toolVersion);
        manager.load();
        return manager;
    }

    /**
     * Reads the cache files. A missing, outdated or unreadable cache leaves the manager empty.
     */
    public void load() {
        entries.clear();
        Path configPath = directory.resolve(CONFIG_FILE);
        Path symbolsPath = directory.resolve(CACHE_DIR).resolve(SYMBOLS_FILE);
        if (!Files.isRegularFile(configPath) || !Files.isRegularFile(symbolsPath)) {
            log.debug("No symbol cache at {}", directory);
            return;
        }
        try {
            CacheMetadata metadata = gson.fromJson(Files.readString(configPath, StandardCharsets.UTF_8),
                    CacheMetadata.class);
            if (metadata == null || metadata.formatVersion != FORMAT_VERSION
                    || !toolVersion.equals(metadata.toolVersion)) {
                log.debug("Symbol cache at {} was written by another version, discarding it", directory);
                dirty = true;
                return;
            }
            Map<String, HeaderEntry> loaded = gson.fromJson(Files.readString(symbolsPath, StandardCharsets.UTF_8),
                    ENTRIES_TYPE);
            if (loaded != null) {
                entries.putAll(loaded);
            }
            log.debug("Loaded {} cached header(s) from {}", entries.size(), directory);
        } catch (IOException | JsonParseException e) {
            log.warn("Ignoring unreadable symbol cache at {}: {}", directory, e.getMessage());
            entries.clear();
            dirty = true;
        }
    }

    @Override
    public Optional<CachedHeader> lookup(String absolutePath, long lastModified) {
        return validEntry(absolutePath, lastModified)
                .map(entry -> new CachedHeader(entry.language,
                        entry.includes == null ? List.of() : entry.includes));
    }

    @Override
    public Optional<List<Symbol>> cachedSymbols(String absolutePath, long lastModified) {
        Optional<HeaderEntry> entry = validEntry(absolutePath, lastModified);
        if (entry.isEmpty() || entry.get().symbols == null) {
            return Optional.empty();
        }
        try {
            List<Symbol> symbols = new ArrayList<>();
            for (CachedSymbol cached : entry.get().symbols) {
                symbols.add(cached.toSymbol());
            }
            log.debug("Cache hit for {} ({} symbols)", absolutePath, symbols.size());
            return Optional.of(symbols);
        } catch (IllegalStateException e) {
            log.debug("Dropping damaged cache entry for {}: {}", absolutePath, e.getMessage());
            entries.remove(absolutePath);
            dirty = true;
            return Optional.empty();
        }
    }

    @Override
    public void store(DependencyNode header, List<Symbol> symbols) {
        HeaderEntry entry = new HeaderEntry();
        entry.lastModified = header.lastModified();
        entry.language = header.language();
        entry.includes = header.includes();
        entry.symbols = new ArrayList<>();
        for (Symbol symbol : symbols) {
            entry.symbols.add(CachedSymbol.from(symbol));
        }
        entries.put(header.absolutePath(), entry);
        dirty = true;
        log.debug("Cached {} symbol(s) of {}", symbols.size(), header.absolutePath());
    }

    /**
     * Drops the entries of headers outside {@code reachable}, such as headers no unit includes
     * any more.
     *
     * @param reachable The canonical paths of the headers of the current dependency graph.
     * @return the number of entries dropped.
     */
    public int retainOnly(Collection<String> reachable) {
        int before = entries.size();
        if (entries.keySet().retainAll(new HashSet<>(reachable))) {
            dirty = true;
            log.debug("Dropped {} stale header entries from {}", before - entries.size(), directory);
        }
        return before - entries.size();
    }

    /**
     * Writes the cache if anything changed since it was loaded.
     *
     * @throws CacheException if the cache files cannot be written.
     */
    public void save() {
        if (!dirty) {
            return;
        }
        CacheMetadata metadata = new CacheMetadata();
        metadata.formatVersion = FORMAT_VERSION;
        metadata.toolVersion = toolVersion;
        try {
            Path cacheDir = directory.resolve(CACHE_DIR);
            Files.createDirectories(cacheDir);
            writeAtomically(directory.resolve(CONFIG_FILE), gson.toJson(metadata));
            writeAtomically(cacheDir.resolve(SYMBOLS_FILE), gson.toJson(entries, ENTRIES_TYPE));
        } catch (IOException e) {
            throw new CacheException("Failed to write symbol cache to " + directory, e);
        }
        dirty = false;
        log.debug("Saved {} cached header(s) to {}", entries.size(), directory);
    }

    public int size() {
        return entries.size();
    }

    public Path getDirectory() {
        return directory;
    }

    /**
     * Deletes a cache directory and everything below it.
     *
     * @return true if the directory existed.
     * @throws CacheException if the directory cannot be removed.
     */
    public static boolean clear(Path directory) {
        if (!Files.exists(directory)) {
            return false;
        }
        try (Stream<Path> paths = Files.walk(directory)) {
            List<Path> ordered = paths.sorted(Comparator.reverseOrder()).toList();
            for (Path path : ordered) {
                Files.delete(path);
            }
        } catch (IOException e) {
            throw new CacheException("Failed to delete cache directory " + directory, e);
        }
        log.info("Removed cache directory {}", directory);
        return true;
    }

    private Optional<HeaderEntry> validEntry(String absolutePath, long lastModified) {
        HeaderEntry entry = entries.get(absolutePath);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.lastModified != lastModified || entry.language == null) {
            log.debug("Cache entry for {} is stale", absolutePath);
            return Optional.empty();
        }
        return Optional.of(entry);
    }

    private static void writeAtomically(Path target, String content) throws IOException {
        Path tempFile = target.resolveSibling(target.getFileName() + "." + UUID.randomUUID() + ".tmp");
        Files.writeString(tempFile, content, StandardCharsets.UTF_8);
        try {
            Files.move(tempFile, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            try {
                Files.deleteIfExists(tempFile);
            } catch (IOException suppressed) {
                e.addSuppressed(suppressed);
            }
            throw e;
        }
    }

    static final class CacheMetadata {
        int formatVersion;
        String toolVersion;
    }

    static final class HeaderEntry {
        long lastModified;
        SourceLanguage language;
        List<IncludeDirective> includes;
        List<CachedSymbol> symbols;
    }
}
