package com.ecaree.mappingconverter.manifest;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Data
@NoArgsConstructor
public class Library {
    private LibraryDownloads downloads;
    private LibraryExtractInstructions extract = new LibraryExtractInstructions();

    /**
     * Maven 坐标，如 org.lwjgl:lwjgl:3.3.1
     */
    private String name;

    /**
     * 操作系统 → 原生库分类器名
     */
    private Map<OsName, String> natives = new HashMap<>();
    private List<Rule> rules = new ArrayList<>();

    /**
     * 所有规则都允许时才下载
     */
    public boolean isAllowed(OsName os) {
        return rules == null || rules.stream().allMatch(rule -> rule.allows(os));
    }

    public LibraryDownload getArtifact() {
        return downloads != null ? downloads.getArtifact() : null;
    }

    public Optional<LibraryDownload> getNative(OsName os) {
        if (natives == null || downloads == null || downloads.getClassifiers() == null) {
            return Optional.empty();
        }
        String classifier = natives.get(os);
        if (classifier == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(downloads.getClassifiers().get(classifier));
    }
}
