package com.ecaree.mappingconverter.convert;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

import java.util.List;

/**
 * 转换结果
 * 输出文本不受统计信息影响
 */
@Getter
@RequiredArgsConstructor
public class ConversionResult {
    private final String output;
    private final int classCount;
    private final int methodCount;
    private final int fieldCount;
    private final int commentCount;
    private final int duplicateClassCount;

    /**
     * 被跳过的非空行
     */
    private final List<SkippedLine> skippedLines;

    public int getSkippedCount() {
        return skippedLines.size();
    }

    @Getter
    @ToString
    @RequiredArgsConstructor
    public static class SkippedLine {
        private final int lineNumber;
        private final String text;
    }
}
