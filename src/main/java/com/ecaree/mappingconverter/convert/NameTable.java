package com.ecaree.mappingconverter.convert;

import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 类名表
 * Key: 可读类名的描述符形式（Lcom/example/Foo;）
 * Value: 原始混淆类名
 * 重复 key 时后出现的覆盖先出现的
 */
@Slf4j
public class NameTable {
    private final Map<String, String> classes = new LinkedHashMap<>();
    private int duplicateCount;

    public void put(String descriptor, String obfName) {
        String previous = classes.put(descriptor, obfName);
        if (previous != null) {
            duplicateCount++;
            log.debug("Duplicate class {}: {} replaced by {}", descriptor, previous, obfName);
        }
    }

    public String get(String descriptor) {
        return classes.get(descriptor);
    }

    public int size() {
        return classes.size();
    }

    public boolean isEmpty() {
        return classes.isEmpty();
    }

    public int getDuplicateCount() {
        return duplicateCount;
    }
}
