package com.ecaree.mappingconverter.convert;

import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * ProGuard → TSRG 转换
 * 两遍扫描同一份输入：
 * 1. {@link NameTableBuilder} 收集所有类名
 * 2. 逐行分类并由 {@link MappingEmitter} 输出
 * 每次调用使用独立的 {@link NameTable}，可并发调用
 */
@Slf4j
public class ProguardConverter {
    private ProguardConverter() {
    }

    public static String convert(String mappings) {
        return convertWithResult(mappings).getOutput();
    }

    public static ConversionResult convertWithResult(String mappings) {
        return convertLines(mappings.lines().collect(Collectors.toList()));
    }

    public static ConversionResult convert(Reader reader) throws IOException {
        try (BufferedReader bufferedReader = new BufferedReader(reader)) {
            return convertLines(bufferedReader.lines().collect(Collectors.toList()));
        }
    }

    public static ConversionResult convert(File mappingFile) throws IOException {
        return convert(Files.newBufferedReader(mappingFile.toPath(), StandardCharsets.UTF_8));
    }

    public static ConversionResult convertLines(List<String> lines) {
        NameTable nameTable = NameTableBuilder.build(lines);
        MappingEmitter emitter = new MappingEmitter(nameTable);

        StringBuilder output = new StringBuilder();
        List<ConversionResult.SkippedLine> skippedLines = new ArrayList<>();
        int classCount = 0;
        int methodCount = 0;
        int fieldCount = 0;
        int commentCount = 0;

        int lineNumber = 0;
        for (String line : lines) {
            lineNumber++;
            MappingLine mappingLine = MappingLineClassifier.classify(line);

            switch (mappingLine.getKind()) {
                case CLASS_HEADER:
                    classCount++;
                    break;
                case METHOD:
                    methodCount++;
                    break;
                case FIELD:
                    fieldCount++;
                    break;
                case COMMENT:
                    commentCount++;
                    break;
                case SKIPPED:
                    if (!line.isBlank()) {
                        log.debug("Skipping line {}: {}", lineNumber, line);
                        skippedLines.add(new ConversionResult.SkippedLine(lineNumber, line));
                    }
                    break;
            }

            String emitted = emitter.emit(mappingLine);
            if (emitted != null) {
                output.append(emitted).append('\n');
            }
        }

        log.info("Converted mappings: {} classes, {} methods, {} fields, {} skipped",
                classCount, methodCount, fieldCount, skippedLines.size());

        return new ConversionResult(output.toString(), classCount, methodCount, fieldCount, commentCount,
                nameTable.getDuplicateCount(), skippedLines);
    }
}
