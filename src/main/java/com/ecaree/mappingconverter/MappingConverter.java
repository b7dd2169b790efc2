package com.ecaree.mappingconverter;

import com.ecaree.mappingconverter.cli.ConvertCommand;
import com.ecaree.mappingconverter.cli.FetchCommand;
import com.ecaree.mappingconverter.cli.RemapCommand;
import com.ecaree.mappingconverter.cli.VersionsCommand;
import com.ecaree.mappingconverter.config.ConfigLoader;
import com.ecaree.mappingconverter.config.ConverterConfig;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.io.IOException;

/**
 * 命令行入口
 * <pre>
 * mapping-converter convert client.txt -o client.tsrg
 * mapping-converter fetch 1.20.1 --side server -o server.tsrg
 * mapping-converter versions --type release
 * mapping-converter remap --mappings client.tsrg client.jar -o client-named.jar
 * </pre>
 */
@Command(
        name = "mapping-converter",
        mixinStandardHelpOptions = true,
        version = "mapping-converter 1.0.0",
        description = "Converts ProGuard mappings to TSRG and fetches Mojang launcher metadata.",
        subcommands = {
                ConvertCommand.class,
                FetchCommand.class,
                VersionsCommand.class,
                RemapCommand.class
        })
public class MappingConverter {
    @Option(
            names = {"-c", "--config"},
            description = "YAML config file.",
            paramLabel = "<file>")
    private File configFile;

    private ConverterConfig config;

    public ConverterConfig getConfig() throws IOException {
        if (config == null) {
            config = ConfigLoader.load(configFile);
        }
        return config;
    }

    public static CommandLine commandLine() {
        return new CommandLine(new MappingConverter())
                .setCaseInsensitiveEnumValuesAllowed(true);
    }

    public static void main(String... args) {
        System.exit(commandLine().execute(args));
    }
}
