package org.cnext.compiler.cache;

import org.cnext.compiler.frontend.module.DependencyNode;
import org.cnext.compiler.frontend.module.IncludeDirective;
import org.cnext.compiler.frontend.semantics.SourceLanguage;
import org.cnext.compiler.frontend.semantics.Symbol;
import org.cnext.compiler.frontend.semantics.SymbolOrigin;
import org.cnext.compiler.frontend.semantics.TypeInfo;
import org.cnext.compiler.frontend.semantics.TypeKind;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests persistence and invalidation of the header symbol cache.
 */
public class CacheManagerTest {

    private static final String HEADER = "/work/include/board.h";
    private static final long MTIME = 1_700_000_000_000L;

    @TempDir
    Path tempDir;

    private static List<Symbol> boardSymbols() {
        SymbolOrigin origin = new SymbolOrigin(HEADER, 3, SourceLanguage.C);
        TypeInfo u8 = TypeInfo.scalar("uint8_t", TypeKind.UNSIGNED, 8);
        TypeInfo i32 = TypeInfo.scalar("int32_t", TypeKind.SIGNED, 32);
        Map<String, TypeInfo> fields = new LinkedHashMap<>();
        fields.put("id", u8);
        fields.put("offset", i32);
        Map<String, Long> modes = new LinkedHashMap<>();
        modes.put("MODE_OFF", 0L);
        modes.put("MODE_ON", 4L);
        return List.of(
                new Symbol.StructSymbol("Board", origin, TypeInfo.struct("Board", fields)),
                new Symbol.EnumSymbol("Mode", origin, TypeInfo.scalar("Mode", TypeKind.ENUM, 32), modes),
                new Symbol.FunctionSymbol("board_init", origin, i32,
                        List.of(new Symbol.Parameter("id", u8, false)), true, false),
                new Symbol.MacroConstantSymbol("BOARD_COUNT", origin, i32, "4"),
                new Symbol.VariableSymbol("board_ticks", origin, i32, true));
    }

    private static DependencyNode boardNode(long lastModified) {
        return new DependencyNode(HEADER, SourceLanguage.C, "", lastModified,
                List.of(new IncludeDirective("stdint.h", true, 1)), List.of(), false);
    }

    @Test
    @Tag("unit")
    void symbolsSurviveSaveAndLoad() {
        Path cacheDir = tempDir.resolve(".cnx");
        CacheManager writer = new CacheManager(cacheDir, "1.0.0");
        writer.store(boardNode(MTIME), boardSymbols());
        writer.save();

        assertThat(cacheDir.resolve("config.json")).exists();
        assertThat(cacheDir.resolve("cache").resolve("symbols.json")).exists();

        CacheManager reader = CacheManager.open(cacheDir, "1.0.0");
        assertThat(reader.size()).isEqualTo(1);
        assertThat(reader.cachedSymbols(HEADER, MTIME)).hasValue(boardSymbols());
        assertThat(reader.lookup(HEADER, MTIME)).hasValueSatisfying(cached -> {
            assertThat(cached.language()).isEqualTo(SourceLanguage.C);
            assertThat(cached.includes()).containsExactly(new IncludeDirective("stdint.h", true, 1));
        });
    }

    @Test
    @Tag("unit")
    void changedModificationTimeInvalidatesEntry() {
        CacheManager manager = new CacheManager(tempDir.resolve(".cnx"), "1.0.0");
        manager.store(boardNode(MTIME), boardSymbols());

        assertThat(manager.cachedSymbols(HEADER, MTIME + 1)).isEmpty();
        assertThat(manager.lookup(HEADER, MTIME + 1)).isEmpty();
        assertThat(manager.cachedSymbols("/work/include/other.h", MTIME)).isEmpty();
    }

    @Test
    @Tag("unit")
    void unreachableHeadersAreDropped() {
        Path cacheDir = tempDir.resolve(".cnx");
        CacheManager writer = new CacheManager(cacheDir, "1.0.0");
        writer.store(boardNode(MTIME), boardSymbols());
        writer.store(new DependencyNode("/work/include/legacy.h", SourceLanguage.C, "", MTIME, List.of(), List.of(),
                false), List.of());
        writer.save();

        CacheManager reader = CacheManager.open(cacheDir, "1.0.0");
        assertThat(reader.retainOnly(List.of(HEADER))).isEqualTo(1);
        assertThat(reader.retainOnly(List.of(HEADER))).isZero();
        reader.save();

        CacheManager reopened = CacheManager.open(cacheDir, "1.0.0");
        assertThat(reopened.size()).isEqualTo(1);
        assertThat(reopened.cachedSymbols(HEADER, MTIME)).hasValue(boardSymbols());
    }

    @Test
    @Tag("unit")
    void otherToolVersionDiscardsCache() {
        Path cacheDir = tempDir.resolve(".cnx");
        CacheManager writer = new CacheManager(cacheDir, "1.0.0");
        writer.store(boardNode(MTIME), boardSymbols());
        writer.save();

        CacheManager reader = CacheManager.open(cacheDir, "2.0.0");

        assertThat(reader.size()).isZero();
        assertThat(reader.cachedSymbols(HEADER, MTIME)).isEmpty();
    }

    @Test
    @Tag("unit")
    void corruptCacheIsIgnored() throws IOException {
        Path cacheDir = tempDir.resolve(".cnx");
        CacheManager writer = new CacheManager(cacheDir, "1.0.0");
        writer.store(boardNode(MTIME), boardSymbols());
        writer.save();
        Files.writeString(cacheDir.resolve("cache").resolve("symbols.json"), "{ not json");

        CacheManager reader = CacheManager.open(cacheDir, "1.0.0");

        assertThat(reader.size()).isZero();
        reader.store(boardNode(MTIME), boardSymbols());
        reader.save();
        assertThat(CacheManager.open(cacheDir, "1.0.0").size()).isEqualTo(1);
    }

    @Test
    @Tag("unit")
    void missingCacheLoadsEmpty() {
        CacheManager manager = CacheManager.open(tempDir.resolve("absent"), "1.0.0");

        assertThat(manager.size()).isZero();
        manager.save();
        assertThat(tempDir.resolve("absent")).doesNotExist();
    }

    @Test
    @Tag("unit")
    void clearRemovesDirectoryOnce() {
        Path cacheDir = tempDir.resolve(".cnx");
        CacheManager writer = new CacheManager(cacheDir, "1.0.0");
        writer.store(boardNode(MTIME), boardSymbols());
        writer.save();

        assertThat(CacheManager.clear(cacheDir)).isTrue();
        assertThat(cacheDir).doesNotExist();
        assertThat(CacheManager.clear(cacheDir)).isFalse();
    }
}
