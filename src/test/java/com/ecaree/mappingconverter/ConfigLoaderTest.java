package com.ecaree.mappingconverter;

import com.ecaree.mappingconverter.config.ConfigLoader;
import com.ecaree.mappingconverter.config.ConverterConfig;
import com.ecaree.mappingconverter.manifest.ManifestClient;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class ConfigLoaderTest {
    @TempDir
    Path tempDir;

    private static InputStream yaml(String content) {
        return new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    public void testDefaults() throws IOException {
        ConverterConfig config = ConfigLoader.load((File) null);

        assertEquals(ManifestClient.VERSION_MANIFEST_URL, config.getManifestUrl());
        assertEquals(10_000, config.getConnectTimeoutMillis());
        assertEquals(30_000, config.getReadTimeoutMillis());
        assertEquals("client", config.getDefaultSide());
        assertNull(config.getReportDir());
    }

    @Test
    public void testLoadFile() throws IOException {
        File configFile = tempDir.resolve("converter.yml").toFile();
        Files.writeString(configFile.toPath(), """
                manifestUrl: https://example.com/manifest.json
                connectTimeoutMillis: 5000
                defaultSide: server
                reportDir: build/reports
                """);

        ConverterConfig config = ConfigLoader.load(configFile);

        assertEquals("https://example.com/manifest.json", config.getManifestUrl());
        assertEquals(5000, config.getConnectTimeoutMillis());
        assertEquals(30_000, config.getReadTimeoutMillis(), "Unset keys keep their default");
        assertEquals("server", config.getDefaultSide());
        assertEquals("build/reports", config.getReportDir());
    }

    @Test
    public void testEmptyDocument() throws IOException {
        assertEquals(new ConverterConfig(), ConfigLoader.load(yaml("")));
    }

    @Test
    public void testMissingFile() {
        File missing = tempDir.resolve("missing.yml").toFile();
        assertThrows(IOException.class, () -> ConfigLoader.load(missing));
    }

    @Test
    public void testUnknownKey() {
        assertThrows(IOException.class, () -> ConfigLoader.load(yaml("colour: blue\n")));
    }

    @Test
    public void testInvalidValues() {
        assertThrows(IllegalArgumentException.class, () -> ConfigLoader.load(yaml("defaultSide: both\n")));
        assertThrows(IllegalArgumentException.class, () -> ConfigLoader.load(yaml("manifestUrl: ''\n")));
    }
}
