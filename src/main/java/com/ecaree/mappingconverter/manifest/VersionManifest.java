package com.ecaree.mappingconverter.manifest;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 单个版本的描述，只保留下载和库信息
 */
@Data
@NoArgsConstructor
public class VersionManifest {
    private VersionDownloads downloads;
    private String id;
    private List<Library> libraries = new ArrayList<>();
}
