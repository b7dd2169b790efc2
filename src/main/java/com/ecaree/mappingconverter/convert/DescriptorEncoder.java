package com.ecaree.mappingconverter.convert;

import java.util.Map;

/**
 * 类型描述符编码
 * int → I，com.example.Foo → Lcom/example/Foo;，int[][] → [[I
 * 类名出现在 {@link NameTable} 中时替换为混淆名
 */
public class DescriptorEncoder {
    public static final String ARRAY_MARKER = "[]";

    private static final Map<String, String> PRIMITIVES = Map.of(
            "int", "I",
            "double", "D",
            "boolean", "Z",
            "float", "F",
            "long", "J",
            "byte", "B",
            "short", "S",
            "char", "C",
            "void", "V"
    );

    private DescriptorEncoder() {
    }

    public static String encode(String token, NameTable nameTable) {
        int dimensions = countArrayDimensions(token);
        String base = token.substring(0, token.length() - dimensions * ARRAY_MARKER.length());

        String descriptor = encodeBase(base);

        String obfName = nameTable.get(descriptor);
        if (obfName != null) {
            descriptor = "L" + obfName + ";";
        }
        if (descriptor.indexOf('.') >= 0) {
            descriptor = descriptor.replace('.', '/');
        }

        return "[".repeat(dimensions) + descriptor;
    }

    /**
     * 不查表的基本编码：基本类型为单字母，其余包装为 L...;
     */
    public static String encodeBase(String token) {
        String primitive = PRIMITIVES.get(token);
        if (primitive != null) {
            return primitive;
        }
        return "L" + token.replace('.', '/') + ";";
    }

    public static int countArrayDimensions(String token) {
        int count = 0;
        int end = token.length();
        while (end >= ARRAY_MARKER.length() && token.startsWith(ARRAY_MARKER, end - ARRAY_MARKER.length())) {
            count++;
            end -= ARRAY_MARKER.length();
        }
        return count;
    }

    public static boolean isPrimitive(String token) {
        return PRIMITIVES.containsKey(token);
    }

    /**
     * Lcom/example/Foo; → com/example/Foo
     * 基本类型原样返回
     */
    public static String toInternalName(String descriptor) {
        if (descriptor.length() >= 2 && descriptor.charAt(0) == 'L' && descriptor.endsWith(";")) {
            return descriptor.substring(1, descriptor.length() - 1);
        }
        return descriptor;
    }
}
