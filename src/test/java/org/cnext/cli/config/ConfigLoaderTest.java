package org.cnext.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link ConfigLoader} covering the configuration priority hierarchy:
 * <ol>
 *   <li>System Properties (highest priority)</li>
 *   <li>Configuration File</li>
 *   <li>Default reference configuration (lowest priority)</li>
 * </ol>
 */
@Tag("unit")
public class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty("cnext.cache.directory");
        ConfigFactory.invalidateCaches();
    }

    @Test
    @DisplayName("loadDefaults should expose the reference configuration")
    void loadDefaults_shouldExposeReferenceConfig() {
        Config config = ConfigLoader.loadDefaults();

        assertNotNull(config);
        assertEquals(".cnx", config.getString("cnext.cache.directory"));
        assertTrue(config.getBoolean("cnext.cache.enabled"));
        assertEquals(".h", config.getString("cnext.output.header-extension"));
        assertTrue(config.getStringList("cnext.include-paths").isEmpty());
    }

    @Test
    @DisplayName("loadFromFile should override defaults and keep the rest")
    void loadFromFile_shouldOverrideDefaults() {
        Config config = ConfigLoader.loadFromFile(testResource("test-config.conf"));

        assertEquals("build/.cnx-cache", config.getString("cnext.cache.directory"));
        assertFalse(config.getBoolean("cnext.cache.enabled"));
        assertEquals(List.of("vendor/include"), config.getStringList("cnext.include-paths"));
        assertEquals(".c", config.getString("cnext.output.source-extension"));
    }

    @Test
    @DisplayName("System property should override file configuration")
    void loadFromFile_systemPropertyShouldOverrideFileConfig() {
        System.setProperty("cnext.cache.directory", "from-system");
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.loadFromFile(testResource("test-config.conf"));

        assertEquals("from-system", config.getString("cnext.cache.directory"));
        assertFalse(config.getBoolean("cnext.cache.enabled"));
    }

    @Test
    @DisplayName("resolve should use an explicitly named file")
    void resolve_shouldUseExplicitFile() {
        List<String> messages = new ArrayList<>();

        Config config = ConfigLoader.resolve(testResource("test-config.conf"),
                (level, message) -> messages.add(level + " " + message));

        assertEquals("build/.cnx-cache", config.getString("cnext.cache.directory"));
        assertEquals(1, messages.size());
        assertTrue(messages.get(0).contains("--config"));
    }

    @Test
    @DisplayName("resolve should reject a missing explicit file")
    void resolve_shouldRejectMissingExplicitFile() {
        File missing = tempDir.resolve("absent.conf").toFile();

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> ConfigLoader.resolve(missing, (level, message) -> { }));
        assertTrue(e.getMessage().contains("absent.conf"));
    }

    private File testResource(final String name) {
        final URL url = getClass().getResource(name);
        assertNotNull(url, "Test resource not found: " + name);
        try {
            return new File(url.toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }
}
