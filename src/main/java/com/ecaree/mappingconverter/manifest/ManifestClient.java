package com.ecaree.mappingconverter.manifest;

import com.ecaree.mappingconverter.config.ConverterConfig;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.HttpURLConnection;
import java.net.MalformedURLException;
import java.net.URL;
import java.net.URLConnection;
import java.nio.charset.StandardCharsets;
import java.time.OffsetDateTime;
import java.util.Optional;

/**
 * 启动器元数据客户端
 * 请求 → 解码 → 返回或抛出 {@link ManifestException}，不重试、不缓存
 */
@Slf4j
@Getter
public class ManifestClient {
    public static final String VERSION_MANIFEST_URL = "https://piston-meta.mojang.com/mc/game/version_manifest_v2.json";

    static final Gson GSON = new GsonBuilder()
            .registerTypeAdapter(OffsetDateTime.class, new OffsetDateTimeAdapter())
            .create();

    private final String manifestUrl;
    private final int connectTimeoutMillis;
    private final int readTimeoutMillis;

    public ManifestClient(String manifestUrl, int connectTimeoutMillis, int readTimeoutMillis) {
        this.manifestUrl = manifestUrl;
        this.connectTimeoutMillis = connectTimeoutMillis;
        this.readTimeoutMillis = readTimeoutMillis;
    }

    public ManifestClient(ConverterConfig config) {
        this(config.getManifestUrl(), config.getConnectTimeoutMillis(), config.getReadTimeoutMillis());
    }

    public ManifestClient() {
        this(new ConverterConfig());
    }

    public RootManifest fetchRootManifest() throws ManifestException {
        return fetchRootManifest(manifestUrl);
    }

    public RootManifest fetchRootManifest(String url) throws ManifestException {
        log.info("Fetching version manifest: {}", url);
        return fetchJson(toUrl(url), RootManifest.class);
    }

    public VersionManifest fetchVersionManifest(VersionRelease release) throws ManifestException {
        return fetchVersionManifest(release.getUrl());
    }

    public VersionManifest fetchVersionManifest(URL url) throws ManifestException {
        log.info("Fetching version: {}", url);
        return fetchJson(url, VersionManifest.class);
    }

    public byte[] download(URL url) throws ManifestException {
        try (InputStream is = openStream(url)) {
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            is.transferTo(out);
            return out.toByteArray();
        } catch (ManifestException e) {
            throw e;
        } catch (IOException e) {
            throw new ManifestException("Failed to download " + url, e);
        }
    }

    public byte[] download(DownloadInfo info) throws ManifestException {
        return download(info.getUrl());
    }

    public byte[] download(LibraryDownload libraryDownload) throws ManifestException {
        return download(libraryDownload.getUrl());
    }

    public String downloadString(URL url) throws ManifestException {
        return new String(download(url), StandardCharsets.UTF_8);
    }

    public String downloadString(DownloadInfo info) throws ManifestException {
        return downloadString(info.getUrl());
    }

    /**
     * 以流的方式下载，调用方负责关闭
     */
    public InputStream openStream(URL url) throws ManifestException {
        try {
            URLConnection connection = url.openConnection();
            connection.setConnectTimeout(connectTimeoutMillis);
            connection.setReadTimeout(readTimeoutMillis);

            if (connection instanceof HttpURLConnection) {
                HttpURLConnection http = (HttpURLConnection) connection;
                int status = http.getResponseCode();
                if (status < 200 || status >= 300) {
                    http.disconnect();
                    throw new ManifestException("HTTP " + status + " for " + url);
                }
            }

            return connection.getInputStream();
        } catch (ManifestException e) {
            throw e;
        } catch (IOException e) {
            throw new ManifestException("Failed to open " + url, e);
        }
    }

    public InputStream openStream(DownloadInfo info) throws ManifestException {
        return openStream(info.getUrl());
    }

    /**
     * 下载库及当前系统的原生库
     *
     * @return 规则不允许时为空
     */
    public Optional<LibraryArtifacts> downloadLibrary(Library library) throws ManifestException {
        return downloadLibrary(library, OsName.current());
    }

    public Optional<LibraryArtifacts> downloadLibrary(Library library, OsName os) throws ManifestException {
        if (!library.isAllowed(os)) {
            log.debug("Library {} is not allowed on {}", library.getName(), os);
            return Optional.empty();
        }

        LibraryDownload artifact = library.getArtifact();
        if (artifact == null) {
            throw new ManifestException("Library has no artifact: " + library.getName());
        }
        byte[] artifactBytes = download(artifact);

        Optional<LibraryDownload> nativeDownload = library.getNative(os);
        if (nativeDownload.isEmpty()) {
            return Optional.of(new LibraryArtifacts(artifact.getPath(), artifactBytes, null, null));
        }

        LibraryDownload nativeArtifact = nativeDownload.get();
        byte[] nativeBytes = download(nativeArtifact);
        return Optional.of(new LibraryArtifacts(artifact.getPath(), artifactBytes, nativeArtifact.getPath(), nativeBytes));
    }

    private <T> T fetchJson(URL url, Class<T> type) throws ManifestException {
        String content = downloadString(url);
        T result;
        try {
            result = GSON.fromJson(content, type);
        } catch (JsonParseException e) {
            throw new ManifestException("Failed to decode " + type.getSimpleName() + " from " + url, e);
        }
        if (result == null) {
            throw new ManifestException("Empty response from " + url);
        }
        return result;
    }

    private static URL toUrl(String url) throws ManifestException {
        try {
            return new URL(url);
        } catch (MalformedURLException e) {
            throw new ManifestException("Invalid URL: " + url, e);
        }
    }
}
