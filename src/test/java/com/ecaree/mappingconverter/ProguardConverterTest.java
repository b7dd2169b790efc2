package com.ecaree.mappingconverter;

import com.ecaree.mappingconverter.convert.ConversionResult;
import com.ecaree.mappingconverter.convert.NameTable;
import com.ecaree.mappingconverter.convert.NameTableBuilder;
import com.ecaree.mappingconverter.convert.ProguardConverter;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ProguardConverterTest {
    @TempDir
    Path tempDir;

    private static final String MAPPINGS = """
            # compiler: R8
            # pg_map_id: 1a2b3c
            com.example.Foo -> x:
                int count -> a
                void tick() -> b
                com.example.Foo get(int) -> c
                1:5:com.example.Bar[] bars(java.lang.String,int[][]) -> d
            com.example.Bar -> y:
                long[] values -> a
                6:7:void accept(com.example.Foo,boolean) -> b
            """;

    @Test
    public void testClassHeader() {
        assertEquals("x com/example/Foo\n", ProguardConverter.convert("com.example.Foo -> x:\n"));
    }

    @Test
    public void testField() {
        String output = ProguardConverter.convert("""
                com.example.Foo -> x:
                    int count -> a
                """);

        assertEquals("x com/example/Foo\n\ta count\n", output);
    }

    @Test
    public void testMethodWithoutParameters() {
        String output = ProguardConverter.convert("""
                com.example.Foo -> x:
                    void tick() -> b
                """);

        assertTrue(output.contains("\tb ()V tick\n"), "Output was: " + output);
    }

    @Test
    public void testMethodWithKnownReturnType() {
        String output = ProguardConverter.convert("""
                com.example.Foo -> x:
                    com.example.Foo get(int) -> c
                """);

        assertTrue(output.contains("\tc (I)Lx; get\n"), "Output was: " + output);
    }

    @Test
    public void testFullFile() {
        String expected = """
                x com/example/Foo
                \ta count
                \tb ()V tick
                \tc (I)Lx; get
                \td (Ljava/lang/String;[[I)[Ly; bars
                y com/example/Bar
                \ta values
                \tb (Lx;Z)V accept
                """;

        assertEquals(expected, ProguardConverter.convert(MAPPINGS));
    }

    @Test
    public void testForwardReference() {
        String output = ProguardConverter.convert("""
                com.example.Foo -> x:
                    void link(com.example.Later) -> a
                com.example.Later -> z:
                """);

        assertTrue(output.contains("\ta (Lz;)V link\n"),
                "Class declared later in the file should still resolve, output was: " + output);
    }

    @Test
    public void testUnknownClassKeepsReadableName() {
        String output = ProguardConverter.convert("""
                com.example.Foo -> x:
                    java.util.List items(java.lang.Object[]) -> a
                """);

        assertTrue(output.contains("\ta ([Ljava/lang/Object;)Ljava/util/List; items\n"), "Output was: " + output);
    }

    @Test
    public void testQualifiedObfuscatedNames() {
        String output = ProguardConverter.convert("""
                com.example.Foo -> net.a.b:
                    com.example.Foo self() -> a
                """);

        assertEquals("net/a/b com/example/Foo\n\ta ()Lnet/a/b; self\n", output);
    }

    @Test
    public void testDuplicateClassLastWins() {
        String mappings = """
                com.example.Dup -> p:
                com.example.Dup -> q:
                com.example.User -> u:
                    com.example.Dup dup() -> a
                """;

        ConversionResult result = ProguardConverter.convertWithResult(mappings);

        assertEquals("p com/example/Dup\nq com/example/Dup\nu com/example/User\n\ta ()Lq; dup\n", result.getOutput());
        assertEquals(1, result.getDuplicateClassCount());

        NameTable nameTable = NameTableBuilder.build(mappings.lines().toList());
        assertEquals(2, nameTable.size());
        assertEquals("q", nameTable.get("Lcom/example/Dup;"));
    }

    @Test
    public void testCommentsAndMalformedLinesProduceNoOutput() {
        ConversionResult result = ProguardConverter.convertWithResult("""
                # comment -> with separator
                this line has no separator

                com.example.Foo -> x:
                    broken -> a
                    # indented comment
                """);

        assertEquals("x com/example/Foo\n", result.getOutput());
        assertEquals(1, result.getCommentCount());
        assertEquals(3, result.getSkippedCount(), "Blank lines should not be reported as skipped");
        assertEquals(2, result.getSkippedLines().get(0).getLineNumber());
    }

    @Test
    public void testCommentWithSeparatorIsNotAClass() {
        NameTable nameTable = NameTableBuilder.build(List.of("# com.example.Foo -> x:"));
        assertTrue(nameTable.isEmpty());
    }

    @Test
    public void testStatistics() {
        ConversionResult result = ProguardConverter.convertWithResult(MAPPINGS);

        assertEquals(2, result.getClassCount());
        assertEquals(4, result.getMethodCount());
        assertEquals(2, result.getFieldCount());
        assertEquals(2, result.getCommentCount());
        assertEquals(0, result.getSkippedCount());
    }

    @Test
    public void testEmptyInput() {
        assertEquals("", ProguardConverter.convert(""));
    }

    @Test
    public void testReaderAndFileInput() throws IOException {
        File mappingFile = tempDir.resolve("mapping.txt").toFile();
        Files.writeString(mappingFile.toPath(), MAPPINGS);

        String expected = ProguardConverter.convert(MAPPINGS);
        assertEquals(expected, ProguardConverter.convert(mappingFile).getOutput());
        assertEquals(expected, ProguardConverter.convert(new StringReader(MAPPINGS)).getOutput());
    }

    @Test
    public void testWindowsLineEndings() {
        String crlf = MAPPINGS.replace("\n", "\r\n");
        assertEquals(ProguardConverter.convert(MAPPINGS), ProguardConverter.convert(crlf));
    }
}
