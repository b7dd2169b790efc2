package com.ecaree.mappingconverter.manifest;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.net.URL;

@Data
@NoArgsConstructor
public class DownloadInfo {
    private String sha1;
    private long size;
    private URL url;
}
