package com.ecaree.mappingconverter.convert;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * ProGuard 映射行分类器
 * 格式：
 * - "# ..." → 注释
 * - "com.example.Foo -> a:" → 类
 * - "    [1:2:]int count -> a" → 字段
 * - "    [1:2:]void tick(int,java.lang.String) -> b" → 方法
 * 不符合格式的行归为 SKIPPED，不报错
 */
public class MappingLineClassifier {
    public static final String SEPARATOR = " -> ";
    public static final String MEMBER_INDENT = "    ";

    private MappingLineClassifier() {
    }

    public static MappingLine classify(String line) {
        if (line.startsWith("#")) {
            return MappingLine.comment(line);
        }

        // 保留空串，"a -> " 仍视为两段
        String[] parts = line.split(SEPARATOR, -1);
        if (parts.length < 2) {
            return MappingLine.skipped(line);
        }

        String deobfSide = parts[0];
        String obfSide = parts[1].trim();

        if (line.startsWith(MEMBER_INDENT)) {
            return classifyMember(line, deobfSide, obfSide);
        }

        return MappingLine.classHeader(line, deobfSide, stripColon(obfSide));
    }

    private static MappingLine classifyMember(String line, String deobfSide, String obfName) {
        String[] tokens = deobfSide.trim().split("\\s+");
        if (tokens.length < 2) {
            return MappingLine.skipped(line);
        }

        String memberName = tokens[1];
        if (!memberName.contains("(") || !memberName.contains(")")) {
            return MappingLine.field(line, memberName, obfName);
        }

        // 去掉 "12:15:" 之类的行号前缀
        String returnType = tokens[0].substring(tokens[0].lastIndexOf(':') + 1);
        String functionName = memberName.substring(0, memberName.indexOf('('));

        String afterParen = memberName.substring(memberName.lastIndexOf('(') + 1);
        int closeIdx = afterParen.indexOf(')');
        String parameterList = closeIdx >= 0 ? afterParen.substring(0, closeIdx) : afterParen;

        List<String> parameterTypes = parameterList.isEmpty()
                ? new ArrayList<>()
                : new ArrayList<>(Arrays.asList(parameterList.split(",", -1)));

        return MappingLine.method(line, functionName, obfName, parameterTypes, returnType);
    }

    /**
     * 截取第一个冒号之前的部分
     */
    static String stripColon(String obfSide) {
        int colonIdx = obfSide.indexOf(':');
        return colonIdx >= 0 ? obfSide.substring(0, colonIdx) : obfSide;
    }
}
