package com.ecaree.mappingconverter.convert;

import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * 第一遍扫描：只处理类行，建立 可读类名描述符 → 混淆类名 的表
 * 必须在第二遍之前完成，才能解析向前引用的类
 */
@Slf4j
public class NameTableBuilder {
    private NameTableBuilder() {
    }

    public static NameTable build(List<String> lines) {
        NameTable nameTable = new NameTable();

        for (String line : lines) {
            if (line.startsWith(MappingLineClassifier.MEMBER_INDENT)) continue;

            MappingLine mappingLine = MappingLineClassifier.classify(line);
            if (mappingLine.getKind() != MappingLine.Kind.CLASS_HEADER) continue;

            // key 不查表，条目之间互不依赖
            nameTable.put(DescriptorEncoder.encodeBase(mappingLine.getDeobfName()), mappingLine.getObfName());
        }

        log.debug("Name table built: {} classes, {} duplicates", nameTable.size(), nameTable.getDuplicateCount());
        return nameTable;
    }
}
