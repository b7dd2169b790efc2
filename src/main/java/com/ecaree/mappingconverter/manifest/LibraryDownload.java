package com.ecaree.mappingconverter.manifest;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.net.URL;

@Data
@NoArgsConstructor
public class LibraryDownload {
    /**
     * 相对 libraries 目录的路径
     */
    private String path;
    private String sha1;
    private long size;
    private URL url;
}
