package com.ecaree.mappingconverter.convert;

import lombok.RequiredArgsConstructor;

/**
 * 第二遍扫描的输出
 * 类：obf/Name com/example/Name
 * 方法：\tobf (params)ret name
 * 字段：\tobf name
 */
@RequiredArgsConstructor
public class MappingEmitter {
    private final NameTable nameTable;

    /**
     * @return 输出行（不含换行符），注释和跳过的行返回 null
     */
    public String emit(MappingLine line) {
        return switch (line.getKind()) {
            case CLASS_HEADER -> emitClass(line);
            case METHOD -> emitMethod(line);
            case FIELD -> "\t" + line.getObfName() + " " + line.getDeobfName();
            case COMMENT, SKIPPED -> null;
        };
    }

    private String emitClass(MappingLine line) {
        String obfInternal = DescriptorEncoder.toInternalName(DescriptorEncoder.encodeBase(line.getObfName()));
        String deobfInternal = DescriptorEncoder.toInternalName(DescriptorEncoder.encodeBase(line.getDeobfName()));
        return obfInternal + " " + deobfInternal;
    }

    private String emitMethod(MappingLine line) {
        StringBuilder sb = new StringBuilder();
        sb.append('\t').append(line.getObfName()).append(" (");
        for (String parameterType : line.getParameterTypes()) {
            sb.append(DescriptorEncoder.encode(parameterType, nameTable));
        }
        sb.append(')').append(DescriptorEncoder.encode(line.getReturnType(), nameTable));
        sb.append(' ').append(line.getDeobfName());
        return sb.toString();
    }
}
