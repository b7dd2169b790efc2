package com.ecaree.mappingconverter.cli;

import com.ecaree.mappingconverter.convert.ConversionResult;
import com.ecaree.mappingconverter.convert.ProguardConverter;
import com.ecaree.mappingconverter.util.FileUtils;
import com.ecaree.mappingconverter.util.ReportGenerator;
import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.io.IOException;

@Slf4j
@Command(name = "convert", description = "Convert a ProGuard mapping file to TSRG.")
public class ConvertCommand extends AbstractCommand {
    @Parameters(index = "0", description = "ProGuard mapping file.", paramLabel = "<input>")
    private File input;

    @Option(
            names = {"-o", "--output"},
            description = "Output file. Defaults to the input name with a .tsrg extension.",
            paramLabel = "<file>")
    private File output;

    @Option(
            names = "--report-dir",
            description = "Write a conversion report to this directory.",
            paramLabel = "<dir>")
    private File reportDir;

    @Override
    protected void execute() throws IOException {
        if (!input.exists()) {
            throw new IOException("Input file does not exist: " + input);
        }

        File target = output != null
                ? output
                : new File(input.getAbsoluteFile().getParentFile(), FileUtils.getBaseName(input) + ".tsrg");

        log.info("Converting {} -> {}", input, target);
        ConversionResult result = ProguardConverter.convert(input);
        FileUtils.writeStringToFile(target, result.getOutput());

        writeReport(result, input.getName(), resolveReportDir());
    }

    private File resolveReportDir() throws IOException {
        if (reportDir != null) {
            return reportDir;
        }
        String configured = getConfig().getReportDir();
        return configured != null ? new File(configured) : null;
    }

    static void writeReport(ConversionResult result, String source, File reportDir) throws IOException {
        if (result.getSkippedCount() > 0) {
            log.warn("{} malformed lines skipped", result.getSkippedCount());
        }
        if (reportDir == null) {
            return;
        }

        ReportGenerator report = new ReportGenerator(reportDir, "convert");
        report.addSummary("Source: " + source);
        File reportFile = report.generate(result);
        log.info("Report generated: {}", reportFile);
    }
}
