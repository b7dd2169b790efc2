package com.ecaree.mappingconverter.mapping;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 解析 JarMapping 中的字段/方法 key
 */
public class MappingKeyParser {
    private MappingKeyParser() {
    }

    /**
     * 格式：owner/name
     */
    public static FieldKey parseFieldKey(String key) {
        int slashIdx = key.lastIndexOf('/');
        String owner = slashIdx > 0 ? key.substring(0, slashIdx) : "";
        String name = slashIdx > 0 ? key.substring(slashIdx + 1) : key;
        return new FieldKey(owner, name);
    }

    /**
     * 格式：owner/name desc
     */
    public static MethodKey parseMethodKey(String key) {
        int spaceIdx = key.indexOf(' ');
        if (spaceIdx < 0) {
            return null;
        }

        String ownerAndName = key.substring(0, spaceIdx);
        String descriptor = key.substring(spaceIdx + 1);

        int slashIdx = ownerAndName.lastIndexOf('/');
        if (slashIdx < 0) {
            return null;
        }

        return new MethodKey(ownerAndName.substring(0, slashIdx), ownerAndName.substring(slashIdx + 1), descriptor);
    }

    @Getter
    @RequiredArgsConstructor
    public static class FieldKey {
        private final String owner;
        private final String name;
    }

    @Getter
    @RequiredArgsConstructor
    public static class MethodKey {
        private final String owner;
        private final String name;
        private final String descriptor;
    }
}
