package com.ecaree.mappingconverter.cli;

import com.ecaree.mappingconverter.mapping.MappingData;
import com.ecaree.mappingconverter.mapping.MappingLoader;
import com.ecaree.mappingconverter.remap.JarRemapper;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

@Command(name = "remap", description = "Remap an obfuscated JAR with TSRG or ProGuard mappings.")
public class RemapCommand extends AbstractCommand {
    @Parameters(index = "0", description = "Obfuscated JAR.", paramLabel = "<input>")
    private File input;

    @Option(
            names = {"-m", "--mappings"},
            required = true,
            description = "TSRG file, or a ProGuard file which is converted first.",
            paramLabel = "<file>")
    private File mappings;

    @Option(names = {"-o", "--output"}, required = true, description = "Remapped JAR.", paramLabel = "<file>")
    private File output;

    @Option(
            names = {"-l", "--library"},
            description = "JAR used only for inheritance lookups. May be repeated.",
            paramLabel = "<jar>")
    private List<File> libraries = new ArrayList<>();

    @Override
    protected void execute() throws IOException {
        if (!mappings.exists()) {
            throw new IOException("Mapping file does not exist: " + mappings);
        }

        MappingData mappingData = MappingLoader.load(mappings);
        new JarRemapper(mappingData).remap(input, output, libraries);
    }
}
