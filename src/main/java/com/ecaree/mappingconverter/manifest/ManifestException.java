package com.ecaree.mappingconverter.manifest;

import java.io.IOException;

/**
 * 获取元数据失败：网络错误、非 2xx 响应或 JSON 解析失败
 * 调用方不重试
 */
public class ManifestException extends IOException {
    public ManifestException(String message) {
        super(message);
    }

    public ManifestException(String message, Throwable cause) {
        super(message, cause);
    }
}
