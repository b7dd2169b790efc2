package com.ecaree.mappingconverter.mapping;

import com.ecaree.mappingconverter.convert.ConversionResult;
import com.ecaree.mappingconverter.convert.ProguardConverter;
import com.ecaree.mappingconverter.manifest.DownloadInfo;
import com.ecaree.mappingconverter.manifest.Library;
import com.ecaree.mappingconverter.manifest.LibraryArtifacts;
import com.ecaree.mappingconverter.manifest.ManifestClient;
import com.ecaree.mappingconverter.manifest.ManifestException;
import com.ecaree.mappingconverter.manifest.RootManifest;
import com.ecaree.mappingconverter.manifest.VersionManifest;
import com.ecaree.mappingconverter.manifest.VersionRelease;
import com.ecaree.mappingconverter.util.FileUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.io.IOException;
import java.util.Optional;

/**
 * 通过版本清单获取 Mojang 官方映射
 */
@Slf4j
@RequiredArgsConstructor
public class MappingResolver {
    private final ManifestClient client;

    public static void checkSide(String side) {
        if (!"client".equals(side) && !"server".equals(side)) {
            throw new IllegalArgumentException("Side must be 'client' or 'server', got: " + side);
        }
    }

    public VersionManifest resolveVersion(String mcVersion) throws ManifestException {
        RootManifest manifest = client.fetchRootManifest();
        VersionRelease release = manifest.findVersion(mcVersion)
                .orElseThrow(() -> new ManifestException("Version not found in manifest: " + mcVersion));
        return client.fetchVersionManifest(release);
    }

    /**
     * @return ProGuard 格式的原始映射文本
     */
    public String resolveMojangMappings(String mcVersion, String side) throws ManifestException {
        checkSide(side);

        log.info("Resolving Mojang {} mappings for {}", side, mcVersion);
        return downloadMappings(resolveVersion(mcVersion), side);
    }

    public String downloadMappings(VersionManifest version, String side) throws ManifestException {
        checkSide(side);

        DownloadInfo mappings = version.getDownloads() != null
                ? version.getDownloads().getMappings(side)
                : null;
        if (mappings == null || mappings.getUrl() == null) {
            throw new ManifestException("Mappings not found for " + side + " in version " + version.getId());
        }

        log.info("Downloading from: {}", mappings.getUrl());
        return client.downloadString(mappings);
    }

    public ConversionResult resolveAndConvert(String mcVersion, String side) throws ManifestException {
        return ProguardConverter.convertWithResult(resolveMojangMappings(mcVersion, side));
    }

    public MappingData loadMojangMappings(String mcVersion, String side) throws IOException {
        return MappingLoader.loadText(resolveAndConvert(mcVersion, side).getOutput());
    }

    /**
     * 下载当前系统允许的库到 librariesDir，保持 Maven 目录结构
     * 供 remap 的 --library 做继承关系解析
     *
     * @return 写入的文件数
     */
    public int downloadLibraries(VersionManifest version, File librariesDir) throws IOException {
        int written = 0;
        for (Library library : version.getLibraries()) {
            Optional<LibraryArtifacts> downloaded = client.downloadLibrary(library);
            if (downloaded.isEmpty()) {
                continue;
            }

            LibraryArtifacts artifacts = downloaded.get();
            FileUtils.writeBytesToFile(new File(librariesDir, artifacts.getArtifactPath()), artifacts.getArtifactBytes());
            written++;
            if (artifacts.hasNative()) {
                FileUtils.writeBytesToFile(new File(librariesDir, artifacts.getNativePath().get()), artifacts.getNativeBytes());
                written++;
            }
        }

        log.info("Downloaded {} library files to {}", written, librariesDir);
        return written;
    }
}
