package com.ecaree.mappingconverter.manifest;

import com.google.gson.annotations.SerializedName;

import java.util.Locale;

/**
 * 库规则和原生库使用的操作系统名
 */
public enum OsName {
    @SerializedName("linux")
    LINUX,
    @SerializedName("windows")
    WINDOWS,
    @SerializedName("osx")
    OSX;

    public static OsName current() {
        return fromSystemProperty(System.getProperty("os.name", ""));
    }

    public static OsName fromSystemProperty(String osName) {
        String name = osName.toLowerCase(Locale.ROOT);
        if (name.startsWith("windows")) {
            return WINDOWS;
        }
        if (name.startsWith("mac") || name.contains("darwin")) {
            return OSX;
        }
        return LINUX;
    }
}
