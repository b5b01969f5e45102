package org.dxworks.texmd;

import org.dxworks.texmd.convert.ConverterRegistry;
import org.dxworks.texmd.latex.LatexContext;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class TexmdConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void missingFileGivesDefaults() {
        TexmdConfig config = TexmdConfig.load(tempDir.resolve("texmd-config.yml"));
        assertEquals(20000, config.getMaxFileLines());
        assertTrue(config.getMacros().isEmpty());
        assertTrue(config.getEnvironments().isEmpty());
    }

    @Test
    void yamlExtendsMacroTable() throws IOException {
        Path file = tempDir.resolve("texmd-config.yml");
        Files.writeString(file, "maxFileLines: 500\n"
                + "macros:\n"
                + "  keyword: \"{\"\n"
                + "  theorem: \"[{\"\n"
                + "environments:\n"
                + "  lemma: \"[\"\n", StandardCharsets.UTF_8);

        TexmdConfig config = TexmdConfig.load(file);
        assertEquals(500, config.getMaxFileLines());
        assertEquals(Map.of("keyword", "{", "theorem", "[{"), config.getMacros());

        LatexContext context = config.latexContext();
        assertEquals("{", context.macroSpec("keyword"));
        assertEquals("[", context.environmentSpec("lemma"));
        assertEquals("*[{", context.macroSpec("section"));
    }

    @Test
    void invalidSpecsAreIgnored() throws IOException {
        Path file = tempDir.resolve("texmd-config.yml");
        Files.writeString(file, "macros:\n"
                + "  good: \"{{\"\n"
                + "  bad: \"(x)\"\n", StandardCharsets.UTF_8);

        TexmdConfig config = TexmdConfig.load(file);
        assertEquals(Map.of("good", "{{"), config.getMacros());
        assertEquals(20000, config.getMaxFileLines());
    }

    @Test
    void unreadableYamlFallsBackToDefaults() throws IOException {
        Path file = tempDir.resolve("texmd-config.yml");
        Files.writeString(file, "macros: [unclosed\n", StandardCharsets.UTF_8);

        TexmdConfig config = TexmdConfig.load(file);
        assertEquals(20000, config.getMaxFileLines());
        assertTrue(config.getMacros().isEmpty());
    }

    @Test
    void withKeepsPositiveLimitOnly() {
        assertEquals(10, TexmdConfig.with(10, null, null).getMaxFileLines());
        assertEquals(20000, TexmdConfig.with(0, Map.of(), Map.of()).getMaxFileLines());
    }

    @Test
    void configuredMacroChangesParsing() {
        TexmdConfig config = TexmdConfig.with(0, Map.of("keyword", "{"), Map.of());
        TexDocumentParser parser = new TexDocumentParser(config.latexContext(),
                ConverterRegistry.defaultRegistry());

        assertEquals(1, parser.parseDocument("\\keyword{x}").getChildren().size());
        assertEquals(2, new TexDocumentParser().parseDocument("\\keyword{x}").getChildren().size());
    }
}
