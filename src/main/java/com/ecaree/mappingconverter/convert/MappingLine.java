package com.ecaree.mappingconverter.convert;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.List;

/**
 * ProGuard 映射文件中的一行
 * 由 {@link MappingLineClassifier} 分类得到
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class MappingLine {
    private final Kind kind;
    private final String raw;
    private final String deobfName;          // 类：点号分隔的类名，方法：函数名，字段：字段名
    private final String obfName;            // 类：冒号前的混淆名，成员：混淆成员名
    private final List<String> parameterTypes; // 仅方法
    private final String returnType;           // 仅方法，已去掉行号前缀

    public static MappingLine comment(String raw) {
        return new MappingLine(Kind.COMMENT, raw, null, null, Collections.emptyList(), null);
    }

    public static MappingLine skipped(String raw) {
        return new MappingLine(Kind.SKIPPED, raw, null, null, Collections.emptyList(), null);
    }

    public static MappingLine classHeader(String raw, String deobfName, String obfName) {
        return new MappingLine(Kind.CLASS_HEADER, raw, deobfName, obfName, Collections.emptyList(), null);
    }

    public static MappingLine method(String raw, String functionName, String obfName,
                                     List<String> parameterTypes, String returnType) {
        return new MappingLine(Kind.METHOD, raw, functionName, obfName,
                Collections.unmodifiableList(parameterTypes), returnType);
    }

    public static MappingLine field(String raw, String fieldName, String obfName) {
        return new MappingLine(Kind.FIELD, raw, fieldName, obfName, Collections.emptyList(), null);
    }

    public boolean isMember() {
        return kind == Kind.METHOD || kind == Kind.FIELD;
    }

    public enum Kind {
        COMMENT,
        CLASS_HEADER,
        METHOD,
        FIELD,
        SKIPPED
    }
}
