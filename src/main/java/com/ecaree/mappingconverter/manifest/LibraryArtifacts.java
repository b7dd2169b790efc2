package com.ecaree.mappingconverter.manifest;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Optional;

/**
 * 已下载的库文件：主 artifact 以及当前系统的原生库（如果有）
 */
@Getter
@RequiredArgsConstructor
public class LibraryArtifacts {
    private final String artifactPath;
    private final byte[] artifactBytes;
    private final String nativePath;
    private final byte[] nativeBytes;

    public boolean hasNative() {
        return nativePath != null;
    }

    public Optional<String> getNativePath() {
        return Optional.ofNullable(nativePath);
    }
}
