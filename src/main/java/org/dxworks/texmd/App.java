package org.dxworks.texmd;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.commonmark.node.Document;
import org.dxworks.texmd.convert.ConverterRegistry;
import org.dxworks.texmd.markdown.MarkdownPrinter;
import org.dxworks.texmd.tex.TexDocNode;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

public class App {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final String REPORT_FILE_NAME = "texmd-report.jsonl";

    public static void main(String[] args) throws Exception {
        if (args.length < 2) {
            System.err.println("Usage: java -jar texmd.jar <input-file-or-folder> <output-folder>");
            System.err.println("  <input-file-or-folder>: LaTeX file, or folder searched for *.tex files");
            System.err.println("  <output-folder>:        Folder receiving the .md files and " + REPORT_FILE_NAME);
            System.exit(2);
        }

        Path input = Paths.get(args[0]);
        if (!Files.exists(input)) {
            System.err.println("Error: Input path does not exist: " + input);
            System.exit(1);
        }

        Path outputDir = Paths.get(args[1]);
        Summary summary = run(input, outputDir, TexmdConfig.load());

        System.out.println("\n" + "=".repeat(60));
        System.out.println("Conversion complete!");
        System.out.println("Successfully converted: " + summary.converted + " files");
        if (summary.errors > 0) {
            System.out.println("Errors: " + summary.errors);
        }
        System.out.println("Output written to: " + outputDir.toAbsolutePath());
        System.out.println("=".repeat(60));
    }

    /**
     * Converts every LaTeX file under {@code input} into {@code outputDir} and writes the run
     * report. A file that fails to convert is reported and skipped.
     */
    public static Summary run(Path input, Path outputDir, TexmdConfig config) throws IOException {
        Files.createDirectories(outputDir);

        System.out.println("Starting LaTeX conversion...");
        System.out.println("Input: " + input.toAbsolutePath());

        List<Path> files = collectTexFiles(input, config.getMaxFileLines());
        System.out.println("Found " + files.size() + " LaTeX files");

        TexDocumentParser parser = new TexDocumentParser(config.latexContext(), ConverterRegistry.defaultRegistry());
        MarkdownPrinter printer = new MarkdownPrinter();
        Path absoluteInput = input.toAbsolutePath().normalize();
        Path baseDir = Files.isDirectory(absoluteInput) ? absoluteInput : absoluteInput.getParent();
        Summary summary = new Summary();
        Instant startTime = Instant.now();

        try (BufferedWriter writer = Files.newBufferedWriter(outputDir.resolve(REPORT_FILE_NAME), StandardCharsets.UTF_8)) {
            Map<String, Object> runInfo = new LinkedHashMap<>();
            runInfo.put("kind", "run");
            runInfo.put("started_at", startTime.toString());
            runInfo.put("input_path", input.toString());
            runInfo.put("total_files", files.size());
            writeRecord(writer, runInfo);

            int current = 0;
            for (Path file : files) {
                current++;
                System.out.println("[" + current + "/" + files.size() + "] Converting: " + file.getFileName());

                Map<String, Object> record = new LinkedHashMap<>();
                record.put("file", file.toString());
                try {
                    Path target = convertFile(parser, printer, file, outputDir.resolve(markdownName(baseDir, file)));
                    record.put("kind", "converted");
                    record.put("output", target.toString());
                    summary.converted++;
                } catch (IOException | RuntimeException e) {
                    record.put("kind", "error");
                    record.put("error", e.getMessage());
                    summary.errors++;
                    System.err.println("  Error converting " + file.getFileName() + ": " + e.getMessage());
                }
                writeRecord(writer, record);
            }

            Instant endTime = Instant.now();
            Map<String, Object> doneInfo = new LinkedHashMap<>();
            doneInfo.put("kind", "done");
            doneInfo.put("ended_at", endTime.toString());
            doneInfo.put("files_converted", summary.converted);
            doneInfo.put("files_with_errors", summary.errors);
            doneInfo.put("duration_seconds", Duration.between(startTime, endTime).getSeconds());
            writeRecord(writer, doneInfo);
        }
        return summary;
    }

    public static Path convertFile(TexDocumentParser parser, MarkdownPrinter printer,
                                   Path source, Path target) throws IOException {
        TexDocNode doc = parser.loadDocument(source);
        Document markdown = parser.toMarkdown(doc);
        if (target.getParent() != null) {
            Files.createDirectories(target.getParent());
        }
        Files.writeString(target, printer.print(markdown), StandardCharsets.UTF_8);
        return target;
    }

    static List<Path> collectTexFiles(Path input, int maxFileLines) throws IOException {
        List<Path> files = new ArrayList<>();
        if (Files.isDirectory(input)) {
            try (Stream<Path> stream = Files.walk(input)) {
                stream.filter(Files::isRegularFile)
                      .filter(App::isTexFile)
                      .filter(p -> withinMaxLines(p, maxFileLines))
                      .sorted()
                      .forEach(files::add);
            }
        } else if (Files.isRegularFile(input) && withinMaxLines(input, maxFileLines)) {
            files.add(input);
        }
        return files;
    }

    private static boolean isTexFile(Path path) {
        return path.getFileName().toString().toLowerCase().endsWith(".tex");
    }

    private static boolean withinMaxLines(Path path, int maxFileLines) {
        try (Stream<String> lines = Files.lines(path, StandardCharsets.UTF_8)) {
            long count = lines.limit((long) maxFileLines + 1L).count();
            if (count > maxFileLines) {
                System.out.println("Skipping " + path.getFileName() + ": more than " + maxFileLines + " lines");
                return false;
            }
            return true;
        } catch (IOException | UncheckedIOException e) {
            // Let the conversion itself report unreadable files
            return true;
        }
    }

    private static Path markdownName(Path baseDir, Path file) {
        String name = baseDir.relativize(file.toAbsolutePath().normalize()).toString();
        int dot = name.lastIndexOf('.');
        return Paths.get((dot > 0 ? name.substring(0, dot) : name) + ".md");
    }

    private static void writeRecord(BufferedWriter writer, Map<String, Object> record) throws IOException {
        writer.write(MAPPER.writeValueAsString(record));
        writer.newLine();
        writer.flush();
    }

    public static class Summary {
        public int converted;
        public int errors;
    }
}
