package org.dxworks.jsxframe;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.dxworks.jsxframe.ast.BabelAstReader;
import org.dxworks.jsxframe.ast.Program;
import org.dxworks.jsxframe.compiler.JsxCompiler;
import org.dxworks.jsxframe.model.CompilationResult;
import org.dxworks.jsxframe.model.Diagnostic;
import org.dxworks.jsxframe.model.TemplateManifest;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

public class App {
    static final String AST_SUFFIX = ".ast.json";
    static final String REPORT_FILE_NAME = "jsxframe-report.jsonl";
    static final String OUTPUT_COLLISION = "OUTPUT_COLLISION";

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final ObjectMapper PRETTY_MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public static void main(String[] args) throws Exception {
        if (args.length < 2) {
            System.err.println("Usage: java -jar jsxframe.jar <input-path> <output-dir>");
            System.err.println("  <input-path>: Babel AST file (*" + AST_SUFFIX + ") or a directory of them");
            System.err.println("  <output-dir>: Directory receiving .cs files, template manifests and the report");
            System.exit(2);
        }

        Path input = Paths.get(args[0]);
        if (!Files.exists(input)) {
            System.err.println("Error: Input path does not exist: " + input);
            System.exit(1);
        }

        int errors = run(input, Paths.get(args[1]), JsxframeConfig.load());
        System.exit(errors > 0 ? 1 : 0);
    }

    /**
     * Compiles every AST file under {@code input} into {@code outputDir}.
     *
     * @return the number of files that could not be compiled
     */
    public static int run(Path input, Path outputDir, JsxframeConfig config) throws IOException {
        Files.createDirectories(outputDir);
        Path report = outputDir.resolve(REPORT_FILE_NAME);

        System.out.println("Starting JSX compilation...");
        System.out.println("Input: " + input.toAbsolutePath());

        List<Path> files = collectAstFiles(input, config.getMaxFileBytes());
        System.out.println("Found " + files.size() + " AST files");

        JsxCompiler compiler = new JsxCompiler(config.getNamespace(), Clock.systemUTC());
        Instant startTime = Instant.now();
        AtomicInteger successCount = new AtomicInteger(0);
        AtomicInteger errorCount = new AtomicInteger(0);
        AtomicInteger componentCount = new AtomicInteger(0);
        AtomicInteger progressCounter = new AtomicInteger(0);

        try (BufferedWriter writer = Files.newBufferedWriter(report, StandardCharsets.UTF_8)) {
            Map<String, Object> runInfo = new LinkedHashMap<>();
            runInfo.put("kind", "run");
            runInfo.put("started_at", startTime.toString());
            runInfo.put("input_path", input.toString());
            runInfo.put("total_files", files.size());
            writeLine(writer, runInfo);

            Stream<Path> stream = config.isParallel() ? files.parallelStream() : files.stream();
            List<FileOutcome> outcomes = stream.map(file -> {
                int current = progressCounter.incrementAndGet();
                synchronized (System.out) {
                    System.out.println("[" + current + "/" + files.size() + "] Compiling: " + file.getFileName());
                }
                try {
                    return new FileOutcome(file, compileFile(file, compiler), null);
                } catch (Exception e) {
                    return new FileOutcome(file, null, e);
                }
            }).collect(Collectors.toList());

            // written in input order so colliding outputs always resolve the same way
            Map<Path, Path> claimedOutputs = new HashMap<>();
            for (FileOutcome outcome : outcomes) {
                Path file = outcome.file();
                if (outcome.error() != null) {
                    reportError(writer, file, outcome.error());
                    errorCount.incrementAndGet();
                    continue;
                }
                try {
                    CompilationResult result = outcome.result();
                    writeOutputs(file, result, outputDirFor(input, file, outputDir), config, claimedOutputs);

                    Map<String, Object> compiled = new LinkedHashMap<>();
                    compiled.put("kind", "compiled");
                    compiled.put("file", file.toString());
                    compiled.put("components", result.components);
                    compiled.put("failed_components", result.failedComponents);
                    compiled.put("diagnostics", result.diagnostics);
                    writeLine(writer, compiled);

                    successCount.incrementAndGet();
                    componentCount.addAndGet(result.components.size());
                } catch (Exception e) {
                    reportError(writer, file, e);
                    errorCount.incrementAndGet();
                }
            }

            Instant endTime = Instant.now();
            Map<String, Object> doneInfo = new LinkedHashMap<>();
            doneInfo.put("kind", "done");
            doneInfo.put("ended_at", endTime.toString());
            doneInfo.put("files_compiled", successCount.get());
            doneInfo.put("files_with_errors", errorCount.get());
            doneInfo.put("components_compiled", componentCount.get());
            doneInfo.put("duration_seconds", Duration.between(startTime, endTime).getSeconds());
            writeLine(writer, doneInfo);
        }

        System.out.println("\n" + "=".repeat(60));
        System.out.println("Compilation complete!");
        System.out.println("Successfully compiled: " + successCount.get() + " files, "
                + componentCount.get() + " components");
        if (errorCount.get() > 0) {
            System.out.println("Errors: " + errorCount.get());
        }
        System.out.println("Output written to: " + outputDir.toAbsolutePath());
        System.out.println("=".repeat(60));
        return errorCount.get();
    }

    public static CompilationResult compileFile(Path file, JsxCompiler compiler) {
        Program program = new BabelAstReader().read(file);
        return compiler.compile(program);
    }

    static String baseName(Path file) {
        String name = file.getFileName().toString();
        return name.endsWith(AST_SUFFIX) ? name.substring(0, name.length() - AST_SUFFIX.length()) : name;
    }

    /**
     * Mirrors the file's directory, relative to the input root, under {@code outputDir}.
     */
    static Path outputDirFor(Path input, Path file, Path outputDir) {
        if (!Files.isDirectory(input)) {
            return outputDir;
        }
        Path parent = input.relativize(file).getParent();
        return parent == null ? outputDir : outputDir.resolve(parent);
    }

    private static void writeOutputs(Path file, CompilationResult result, Path targetDir, JsxframeConfig config,
                                     Map<Path, Path> claimedOutputs) throws IOException {
        Files.createDirectories(targetDir);
        Files.writeString(targetDir.resolve(baseName(file) + ".cs"), result.csharp, StandardCharsets.UTF_8);
        if (!config.isEmitTemplateManifests()) {
            return;
        }
        for (Map.Entry<String, TemplateManifest> entry : result.manifests.entrySet()) {
            Path manifest = targetDir.resolve(entry.getKey() + ".templates.json");
            Path owner = claimedOutputs.putIfAbsent(manifest, file);
            if (owner != null) {
                result.diagnostics.add(new Diagnostic(Diagnostic.Severity.WARNING, OUTPUT_COLLISION, entry.getKey(),
                        "Manifest " + manifest.getFileName() + " already written for " + owner + ", skipped"));
                continue;
            }
            Files.writeString(manifest, PRETTY_MAPPER.writeValueAsString(entry.getValue()), StandardCharsets.UTF_8);
        }
    }

    private static void reportError(BufferedWriter writer, Path file, Exception e) {
        Map<String, String> error = new LinkedHashMap<>();
        error.put("kind", "error");
        error.put("file", file.toString());
        error.put("error", e.getMessage());
        try {
            writeLine(writer, error);
        } catch (IOException ioException) {
            System.err.println("Failed to write error for " + file + ": " + ioException.getMessage());
        }
        System.err.println("  Error compiling " + file.getFileName() + ": " + e.getMessage());
    }

    private static void writeLine(BufferedWriter writer, Object line) throws IOException {
        String json = MAPPER.writeValueAsString(line);
        synchronized (writer) {
            writer.write(json);
            writer.newLine();
            writer.flush();
        }
    }

    static List<Path> collectAstFiles(Path input, long maxFileBytes) throws IOException {
        List<Path> files = new ArrayList<>();
        if (Files.isDirectory(input)) {
            try (Stream<Path> stream = Files.walk(input)) {
                stream.filter(Files::isRegularFile)
                      .filter(App::isAstFile)
                      .filter(p -> withinMaxBytes(p, maxFileBytes))
                      .sorted()
                      .forEach(files::add);
            }
        } else if (Files.isRegularFile(input) && withinMaxBytes(input, maxFileBytes)) {
            files.add(input);
        }
        return files;
    }

    private static boolean isAstFile(Path path) {
        return path.getFileName().toString().endsWith(AST_SUFFIX);
    }

    private static boolean withinMaxBytes(Path path, long maxFileBytes) {
        try {
            return Files.size(path) <= maxFileBytes;
        } catch (IOException e) {
            return true;
        }
    }

    private record FileOutcome(Path file, CompilationResult result, Exception error) {
    }
}
