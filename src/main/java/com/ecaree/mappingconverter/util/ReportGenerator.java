package com.ecaree.mappingconverter.util;

import com.ecaree.mappingconverter.convert.ConversionResult;
import lombok.RequiredArgsConstructor;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.text.SimpleDateFormat;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;

/**
 * 转换报告生成器
 */
@RequiredArgsConstructor
public class ReportGenerator {
    private final File reportsDir;
    private final String taskName;

    private final List<String> summary = new ArrayList<>();

    public void addSummary(String message) {
        summary.add(message);
    }

    public File generate(ConversionResult result) throws IOException {
        FileUtils.ensureDirectory(reportsDir);

        String timestamp = new SimpleDateFormat("yyyyMMdd_HHmmss").format(new Date());
        File reportFile = new File(reportsDir, taskName + "_" + timestamp + ".txt");

        try (PrintWriter writer = new PrintWriter(Files.newBufferedWriter(reportFile.toPath(), StandardCharsets.UTF_8))) {
            writer.println("Conversion Report: " + taskName);
            writer.println("Generated: " + new SimpleDateFormat("yyyy-MM-dd HH:mm:ss").format(new Date()));
            writer.println();

            writer.println("[Summary]");
            for (String s : summary) {
                writer.println("  " + s);
            }
            writer.println();

            writer.println("[Statistics]");
            writer.println("Classes:           " + result.getClassCount());
            writer.println("Methods:           " + result.getMethodCount());
            writer.println("Fields:            " + result.getFieldCount());
            writer.println("Comments:          " + result.getCommentCount());
            writer.println("Duplicate classes: " + result.getDuplicateClassCount());
            writer.println("Skipped lines:     " + result.getSkippedCount());
            writer.println();

            if (!result.getSkippedLines().isEmpty()) {
                writer.println("[Skipped Lines]");
                for (ConversionResult.SkippedLine line : result.getSkippedLines()) {
                    writer.println("? " + line.getLineNumber() + ": " + line.getText());
                }
                writer.println();
            }

            writer.println("End of Report");
        }

        return reportFile;
    }
}
