package com.ecaree.mappingconverter.mapping;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * 统一的映射条目
 * 记录类/字段/方法在混淆侧和可读侧的名称
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class MappingEntry {
    private final Type type;
    private final String obfOwner;      // 类：null，字段/方法：所属类（内部格式）
    private final String obfName;
    private final String obfDescriptor; // 类/字段：null，方法：混淆侧描述符
    private final String readableOwner;
    private final String readableName;
    private final String readableDescriptor;

    public static MappingEntry forClass(String obfName, String readableName) {
        return new MappingEntry(Type.CLASS, null, obfName, null, null, readableName, null);
    }

    public static MappingEntry forField(String obfOwner, String obfName,
                                        String readableOwner, String readableName) {
        return new MappingEntry(Type.FIELD, obfOwner, obfName, null, readableOwner, readableName, null);
    }

    public static MappingEntry forMethod(String obfOwner, String obfName, String obfDescriptor,
                                         String readableOwner, String readableName, String readableDescriptor) {
        return new MappingEntry(Type.METHOD, obfOwner, obfName, obfDescriptor,
                readableOwner, readableName, readableDescriptor);
    }

    /**
     * 生成用于查找的 key
     * 类：readable 类名（内部格式）
     * 字段：readableOwner/readableName
     * 方法：readableOwner/readableName readableDescriptor
     */
    public String getReadableKey() {
        return switch (type) {
            case CLASS -> readableName;
            case FIELD -> readableOwner + "/" + readableName;
            case METHOD -> readableOwner + "/" + readableName + " " + readableDescriptor;
        };
    }

    public enum Type {
        CLASS,
        FIELD,
        METHOD
    }
}
