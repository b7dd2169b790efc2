package com.ecaree.mappingconverter.manifest;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

@Data
@NoArgsConstructor
public class LibraryDownloads {
    private LibraryDownload artifact;

    /**
     * 分类器 → 下载信息，原生库通过 {@link Library#getNatives()} 中的分类器名查找
     */
    private Map<String, LibraryDownload> classifiers = new HashMap<>();
}
