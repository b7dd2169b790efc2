package com.ecaree.mappingconverter.cli;

import com.ecaree.mappingconverter.config.ConverterConfig;
import com.ecaree.mappingconverter.manifest.ManifestClient;
import com.ecaree.mappingconverter.manifest.ReleaseKind;
import com.ecaree.mappingconverter.manifest.RootManifest;
import com.ecaree.mappingconverter.manifest.VersionRelease;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.List;

@Command(name = "versions", description = "List versions from the version manifest.")
public class VersionsCommand extends AbstractCommand {
    @Spec
    private CommandSpec spec;

    @Option(
            names = {"-t", "--type"},
            description = "Only list versions of this type: ${COMPLETION-CANDIDATES}.",
            paramLabel = "<type>")
    private ReleaseKind type;

    @Option(names = "--manifest-url", description = "Override the version manifest URL.", paramLabel = "<url>")
    private String manifestUrl;

    @Override
    protected void execute() throws IOException {
        ConverterConfig config = getConfig();
        String url = manifestUrl != null ? manifestUrl : config.getManifestUrl();
        ManifestClient client = new ManifestClient(url, config.getConnectTimeoutMillis(), config.getReadTimeoutMillis());

        RootManifest manifest = client.fetchRootManifest();
        List<VersionRelease> versions = type != null ? manifest.versionsOfKind(type) : manifest.getVersions();

        PrintWriter out = spec.commandLine().getOut();
        if (manifest.getLatest() != null) {
            out.printf("latest release: %s, latest snapshot: %s%n",
                    manifest.getLatest().getRelease(), manifest.getLatest().getSnapshot());
        }
        for (VersionRelease version : versions) {
            out.printf("%s\t%s\t%s%n", version.getId(), version.getKind(), version.getReleaseTime());
        }
        out.flush();
    }
}
