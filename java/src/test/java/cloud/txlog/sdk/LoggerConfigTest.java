package cloud.txlog.sdk;

import cloud.txlog.sdk.ids.RandomIdGenerator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

import static org.junit.jupiter.api.Assertions.*;

class LoggerConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void appliesDefaultsForOptionalFields() {
        LoggerConfig config = LoggerConfig.builder().build();

        assertEquals(LoggerConfig.DEFAULT_LOGGER_NAME, config.getLoggerName());
        assertEquals(LoggerConfig.DEFAULT_SERVICE_NAME, config.getServiceName());
        assertEquals(Level.INFO, config.getLevel());
        assertNull(config.getExporterOptions());
        assertInstanceOf(RandomIdGenerator.class, config.getIdGenerator());
        assertNotNull(config.getClock());
        assertEquals(0, config.getFlushConcurrency());
    }

    @Test
    void honoursExplicitSettings() {
        Clock clock = Clock.systemUTC();
        LoggerConfig config = LoggerConfig.builder()
            .loggerName("Test")
            .serviceName("TestService")
            .level(Level.ERROR)
            .exporterOptions(Map.of("filepath", "/var/log/"))
            .clock(clock)
            .flushConcurrency(4)
            .build();

        assertEquals("Test", config.getLoggerName());
        assertEquals("TestService", config.getServiceName());
        assertEquals(Level.ERROR, config.getLevel());
        assertEquals(Map.of("filepath", "/var/log/"), config.getExporterOptions());
        assertSame(clock, config.getClock());
        assertEquals(4, config.getFlushConcurrency());
    }

    @Test
    void rejectsNegativeFlushConcurrency() {
        LoggerConfig.Builder builder = LoggerConfig.builder().flushConcurrency(-1);

        assertThrows(IllegalArgumentException.class, builder::build);
    }

    @Test
    void builderChangesDoNotLeakIntoBuiltConfig() {
        Map<String, String> options = new HashMap<>();
        options.put("filename", "a");
        LoggerConfig config = LoggerConfig.builder().exporterOptions(options).build();

        options.put("filename", "b");

        assertEquals("a", config.getExporterOptions().get("filename"));
        assertThrows(UnsupportedOperationException.class, () -> config.getExporterOptions().put("x", "y"));
    }

    @Test
    void fromOptionsReadsRecognisedKeysAndKeepsEverything() {
        Map<String, String> options = Map.of(
            "loggerName", "Test",
            "serviceName", "TestService",
            "level", "DEBUG",
            "filepath", "/tmp/",
            "filename", "test_log"
        );

        LoggerConfig config = LoggerConfig.fromOptions(options);

        assertEquals("Test", config.getLoggerName());
        assertEquals("TestService", config.getServiceName());
        assertEquals(Level.DEBUG, config.getLevel());
        assertEquals(options, config.getExporterOptions());
    }

    @Test
    void fromOptionsWithNullMapUsesDefaults() {
        LoggerConfig config = LoggerConfig.fromOptions(null);

        assertEquals(LoggerConfig.DEFAULT_LOGGER_NAME, config.getLoggerName());
        assertNull(config.getExporterOptions());
    }

    @Test
    void unrecognisedLevelValueFallsBackToInfo() {
        assertEquals(Level.INFO, LoggerConfig.fromOptions(Map.of("level", "error")).getLevel());
        assertEquals(Level.INFO, LoggerConfig.fromOptions(Map.of("level", "VERBOSE")).getLevel());
        assertEquals(Level.INFO, LoggerConfig.fromOptions(Map.of("level", "")).getLevel());
        assertEquals(Level.ERROR, LoggerConfig.fromOptions(Map.of("level", "ERROR")).getLevel());
    }

    @Test
    void loadsConfigFileFromClasspathFixture() throws Exception {
        LoggerConfig config = LoggerConfig.load(fixture("txlog-config.json"));

        assertEquals("Test", config.getLoggerName());
        assertEquals("TestService", config.getServiceName());
        assertEquals(Level.WARNING, config.getLevel());
        assertEquals("logs/", config.getExporterOptions().get("filepath"));
        assertEquals("test_log", config.getExporterOptions().get("filename"));
    }

    @Test
    void missingFileIsConfigurationError() {
        Path missing = tempDir.resolve("test_config_invalid.json");

        ConfigurationException ex = assertThrows(ConfigurationException.class, () -> LoggerConfig.load(missing));
        assertTrue(ex.getMessage().startsWith("read config"));
    }

    @Test
    void nonStringValueIsConfigurationError() throws Exception {
        Path file = tempDir.resolve("test_config_invalid_format.json");
        Files.writeString(file, "{\"intval\": 0}", StandardCharsets.UTF_8);

        ConfigurationException ex = assertThrows(ConfigurationException.class, () -> LoggerConfig.load(file));
        assertTrue(ex.getMessage().contains("'intval' must be a string"));
    }

    @Test
    void nonObjectRootIsConfigurationError() throws Exception {
        Path file = tempDir.resolve("array.json");
        Files.writeString(file, "[\"level\", \"INFO\"]", StandardCharsets.UTF_8);

        assertThrows(ConfigurationException.class, () -> LoggerConfig.load(file));
    }

    @Test
    void malformedJsonIsConfigurationError() throws Exception {
        Path file = tempDir.resolve("broken.json");
        Files.writeString(file, "{\"level\": ", StandardCharsets.UTF_8);

        assertThrows(ConfigurationException.class, () -> LoggerConfig.load(file));
    }

    private static Path fixture(String name) throws URISyntaxException {
        return Path.of(Objects.requireNonNull(LoggerConfigTest.class.getClassLoader().getResource(name)).toURI());
    }
}
