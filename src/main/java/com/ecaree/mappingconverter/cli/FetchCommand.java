package com.ecaree.mappingconverter.cli;

import com.ecaree.mappingconverter.config.ConverterConfig;
import com.ecaree.mappingconverter.convert.ConversionResult;
import com.ecaree.mappingconverter.convert.ProguardConverter;
import com.ecaree.mappingconverter.manifest.ManifestClient;
import com.ecaree.mappingconverter.manifest.VersionManifest;
import com.ecaree.mappingconverter.mapping.MappingResolver;
import com.ecaree.mappingconverter.util.FileUtils;
import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.io.IOException;

@Slf4j
@Command(name = "fetch", description = "Download official mappings for a version and convert them to TSRG.")
public class FetchCommand extends AbstractCommand {
    @Parameters(index = "0", description = "Version id, e.g. 1.20.1.", paramLabel = "<version>")
    private String version;

    @Option(
            names = {"-s", "--side"},
            description = "client or server. Defaults to the configured side.",
            paramLabel = "<side>")
    private String side;

    @Option(
            names = {"-o", "--output"},
            description = "Output file. Defaults to <version>-<side>.tsrg (.txt with --raw).",
            paramLabel = "<file>")
    private File output;

    @Option(names = "--raw", description = "Save the ProGuard mappings without converting them.")
    private boolean raw;

    @Option(
            names = "--libraries",
            description = "Also download the version's libraries for this system into this directory.",
            paramLabel = "<dir>")
    private File librariesDir;

    @Option(names = "--manifest-url", description = "Override the version manifest URL.", paramLabel = "<url>")
    private String manifestUrl;

    @Override
    protected void execute() throws IOException {
        ConverterConfig config = getConfig();
        String effectiveSide = side != null ? side : config.getDefaultSide();
        MappingResolver.checkSide(effectiveSide);

        String url = manifestUrl != null ? manifestUrl : config.getManifestUrl();
        ManifestClient client = new ManifestClient(url, config.getConnectTimeoutMillis(), config.getReadTimeoutMillis());
        MappingResolver resolver = new MappingResolver(client);

        log.info("Resolving Mojang {} mappings for {}", effectiveSide, version);
        VersionManifest versionManifest = resolver.resolveVersion(version);
        String mappings = resolver.downloadMappings(versionManifest, effectiveSide);

        File target = output != null
                ? output
                : new File(version + "-" + effectiveSide + (raw ? ".txt" : ".tsrg"));

        if (raw) {
            FileUtils.writeStringToFile(target, mappings);
        } else {
            ConversionResult result = ProguardConverter.convertWithResult(mappings);
            FileUtils.writeStringToFile(target, result.getOutput());
            String reportDir = config.getReportDir();
            ConvertCommand.writeReport(result, version + " " + effectiveSide,
                    reportDir != null ? new File(reportDir) : null);
        }

        log.info("Saved mappings: {}", target);

        if (librariesDir != null) {
            resolver.downloadLibraries(versionManifest, librariesDir);
        }
    }
}
