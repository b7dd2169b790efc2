package com.ecaree.mappingconverter.mapping;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import net.md_5.specialsource.JarMapping;

import java.util.Map;

/**
 * 映射数据容器
 * 包含 SpecialSource 的 JarMapping 和按可读名索引的 MappingEntry
 */
@Getter
@RequiredArgsConstructor
public class MappingData {
    private final JarMapping jarMapping;

    /**
     * Key: {@link MappingEntry#getReadableKey()}
     */
    private final Map<String, MappingEntry> entries;

    public MappingEntry getClassEntry(String readableClassName) {
        return entries.get(readableClassName);
    }

    public MappingEntry getFieldEntry(String readableOwner, String readableName) {
        return entries.get(readableOwner + "/" + readableName);
    }

    public MappingEntry getMethodEntry(String readableOwner, String readableName, String readableDescriptor) {
        return entries.get(readableOwner + "/" + readableName + " " + readableDescriptor);
    }

    /**
     * 映射类名，未映射的内部类沿用外部类的映射
     */
    public String mapClass(String className) {
        if (className == null) return null;

        String mapped = jarMapping.classes.get(className);
        if (mapped != null) {
            return mapped;
        }

        int dollarIdx = className.lastIndexOf('$');
        if (dollarIdx != -1) {
            String outer = className.substring(0, dollarIdx);
            String mappedOuter = mapClass(outer);
            if (mappedOuter != null && !mappedOuter.equals(outer)) {
                return mappedOuter + className.substring(dollarIdx);
            }
        }

        return className;
    }

    public String mapField(String obfOwner, String obfName) {
        return jarMapping.fields.getOrDefault(obfOwner + "/" + obfName, obfName);
    }

    public String mapMethod(String obfOwner, String obfName, String obfDescriptor) {
        return jarMapping.methods.getOrDefault(obfOwner + "/" + obfName + " " + obfDescriptor, obfName);
    }

    public int getClassCount() {
        return jarMapping.classes.size();
    }

    public int getFieldCount() {
        return jarMapping.fields.size();
    }

    public int getMethodCount() {
        return jarMapping.methods.size();
    }
}
