package com.ecaree.mappingconverter.config;

import com.ecaree.mappingconverter.manifest.ManifestClient;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 转换器配置
 * 可由 YAML 文件提供，命令行参数优先
 */
@Data
@NoArgsConstructor
public class ConverterConfig {
    /**
     * 版本列表地址
     * 默认 Mojang 官方 version_manifest_v2.json
     */
    private String manifestUrl = ManifestClient.VERSION_MANIFEST_URL;

    private int connectTimeoutMillis = 10_000;
    private int readTimeoutMillis = 30_000;

    /**
     * 默认获取的映射：client 或 server
     */
    private String defaultSide = "client";

    /**
     * 转换报告输出目录，为空则不生成报告
     */
    private String reportDir;
}
