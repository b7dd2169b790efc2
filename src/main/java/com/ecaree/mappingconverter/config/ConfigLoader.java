package com.ecaree.mappingconverter.config;

import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;

/**
 * 从 YAML 加载 {@link ConverterConfig}
 * 示例：
 * <pre>
 * manifestUrl: https://piston-meta.mojang.com/mc/game/version_manifest_v2.json
 * connectTimeoutMillis: 5000
 * defaultSide: server
 * </pre>
 */
@Slf4j
public class ConfigLoader {
    private ConfigLoader() {
    }

    /**
     * @param configFile 为 null 时返回默认配置
     */
    public static ConverterConfig load(File configFile) throws IOException {
        if (configFile == null) {
            return new ConverterConfig();
        }
        if (!configFile.exists()) {
            throw new IOException("Config file does not exist: " + configFile);
        }

        log.info("Loading config: {}", configFile);
        try (InputStream is = new FileInputStream(configFile)) {
            return load(is);
        }
    }

    public static ConverterConfig load(InputStream is) throws IOException {
        Yaml yaml = new Yaml(new Constructor(ConverterConfig.class, new LoaderOptions()));
        try {
            ConverterConfig config = yaml.load(is);
            return config != null ? validate(config) : new ConverterConfig();
        } catch (YAMLException e) {
            throw new IOException("Invalid config: " + e.getMessage(), e);
        }
    }

    private static ConverterConfig validate(ConverterConfig config) {
        String side = config.getDefaultSide();
        if (!"client".equals(side) && !"server".equals(side)) {
            throw new IllegalArgumentException("defaultSide must be 'client' or 'server', got: " + side);
        }
        if (config.getManifestUrl() == null || config.getManifestUrl().isEmpty()) {
            throw new IllegalArgumentException("manifestUrl must not be empty");
        }
        return config;
    }
}
