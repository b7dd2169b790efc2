package com.ecaree.mappingconverter.mapping;

import com.ecaree.mappingconverter.convert.ProguardConverter;
import lombok.extern.slf4j.Slf4j;
import net.md_5.specialsource.JarMapping;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.HashMap;
import java.util.Map;

/**
 * 映射加载器
 * 支持以下格式：
 * - TSRG（{@link ProguardConverter} 的输出）
 * - ProGuard（先转换为 TSRG 再加载）
 */
@Slf4j
public class MappingLoader {
    private MappingLoader() {
    }

    public static MappingData load(File mappingFile) throws IOException {
        String fileName = mappingFile.getName().toLowerCase();
        String content = Files.readString(mappingFile.toPath(), StandardCharsets.UTF_8);

        if (fileName.endsWith(".tsrg")) {
            return loadText(content);
        }
        if (content.contains(" -> ")) {
            log.info("Detected ProGuard mappings, converting: {}", mappingFile);
            return loadProguard(content);
        }
        return loadText(content);
    }

    public static MappingData loadProguard(String proguardMappings) throws IOException {
        return loadText(ProguardConverter.convert(proguardMappings));
    }

    /**
     * 加载 TSRG 文本
     * SpecialSource 的 JarMapping.loadMappings 识别以 "\t" 开头的 TSRG 成员行
     */
    public static MappingData loadText(String tsrg) throws IOException {
        JarMapping jarMapping = new JarMapping();

        try (BufferedReader reader = new BufferedReader(new StringReader(tsrg))) {
            jarMapping.loadMappings(reader, null, null, false);
        }

        return convertJarMappingToMappingData(jarMapping);
    }

    private static MappingData convertJarMappingToMappingData(JarMapping jarMapping) {
        Map<String, MappingEntry> entries = new HashMap<>();

        for (Map.Entry<String, String> entry : jarMapping.classes.entrySet()) {
            MappingEntry classEntry = MappingEntry.forClass(entry.getKey(), entry.getValue());
            entries.put(classEntry.getReadableKey(), classEntry);
        }

        for (Map.Entry<String, String> entry : jarMapping.fields.entrySet()) {
            MappingKeyParser.FieldKey fieldKey = MappingKeyParser.parseFieldKey(entry.getKey());
            String readableOwner = jarMapping.classes.getOrDefault(fieldKey.getOwner(), fieldKey.getOwner());

            MappingEntry fieldEntry = MappingEntry.forField(
                    fieldKey.getOwner(), fieldKey.getName(), readableOwner, entry.getValue());
            entries.put(fieldEntry.getReadableKey(), fieldEntry);
        }

        for (Map.Entry<String, String> entry : jarMapping.methods.entrySet()) {
            MappingKeyParser.MethodKey methodKey = MappingKeyParser.parseMethodKey(entry.getKey());
            if (methodKey == null) continue;

            String readableOwner = jarMapping.classes.getOrDefault(methodKey.getOwner(), methodKey.getOwner());
            String readableDescriptor = remapDescriptor(methodKey.getDescriptor(), jarMapping);

            MappingEntry methodEntry = MappingEntry.forMethod(
                    methodKey.getOwner(), methodKey.getName(), methodKey.getDescriptor(),
                    readableOwner, entry.getValue(), readableDescriptor);
            entries.put(methodEntry.getReadableKey(), methodEntry);
        }

        log.debug("Loaded {} mapping entries", entries.size());
        return new MappingData(jarMapping, entries);
    }

    static String remapDescriptor(String descriptor, JarMapping jarMapping) {
        if (descriptor == null) return null;

        StringBuilder result = new StringBuilder();
        int i = 0;

        while (i < descriptor.length()) {
            char c = descriptor.charAt(i);

            if (c == 'L') {
                int end = descriptor.indexOf(';', i);
                if (end < 0) {
                    result.append(descriptor.substring(i));
                    break;
                }
                String className = descriptor.substring(i + 1, end);
                String mappedClass = jarMapping.classes.getOrDefault(className, className);
                result.append('L').append(mappedClass).append(';');
                i = end + 1;
            } else {
                // 基本类型、数组前缀和括号
                result.append(c);
                i++;
            }
        }

        return result.toString();
    }
}
