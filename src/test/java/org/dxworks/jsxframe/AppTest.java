package org.dxworks.jsxframe;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AppTest {

    private static final Path SAMPLES = Paths.get("src/test/resources/samples");
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String NAMELESS_ELEMENT_AST = "{\"type\":\"Program\",\"body\":[{"
            + "\"type\":\"FunctionDeclaration\",\"id\":{\"type\":\"Identifier\",\"name\":\"Nameless\"},"
            + "\"params\":[],\"body\":{\"type\":\"BlockStatement\",\"body\":[{\"type\":\"ReturnStatement\","
            + "\"argument\":{\"type\":\"JSXElement\",\"openingElement\":{\"type\":\"JSXOpeningElement\","
            + "\"name\":{\"type\":\"JSXIdentifier\"},\"attributes\":[]},\"children\":[]}}]}}]}";

    @TempDir
    Path tempDir;

    @Test
    void baseNameDropsTheAstSuffix() {
        assertEquals("Counter", App.baseName(Paths.get("src", "Counter.ast.json")));
        assertEquals("notes.json", App.baseName(Paths.get("notes.json")));
    }

    @Test
    void collectsSortedAstFilesWithinTheSizeLimit() throws Exception {
        Path input = Files.createDirectories(tempDir.resolve("in"));
        Files.writeString(input.resolve("b.ast.json"), "{}");
        Files.writeString(input.resolve("a.ast.json"), "{}");
        Files.writeString(input.resolve("big.ast.json"), "{\"padding\":\"" + "x".repeat(100) + "\"}");
        Files.writeString(input.resolve("readme.md"), "#");

        List<Path> files = App.collectAstFiles(input, 50);

        assertEquals(List.of(input.resolve("a.ast.json"), input.resolve("b.ast.json")), files);
    }

    @Test
    void compilesSamplesAndWritesReport() throws Exception {
        Path input = Files.createDirectories(tempDir.resolve("in"));
        Files.copy(SAMPLES.resolve("Counter.ast.json"), input.resolve("Counter.ast.json"));
        Files.copy(SAMPLES.resolve("TodoList.ast.json"), input.resolve("TodoList.ast.json"));
        Files.writeString(input.resolve("Broken.ast.json"), "{\"type\":\"Identifier\"}");
        Path output = tempDir.resolve("out");

        int errors = App.run(input, output, JsxframeConfig.with("Demo.Components", true, false, 1_000_000));

        assertEquals(1, errors);
        String counter = Files.readString(output.resolve("Counter.cs"));
        assertTrue(counter.contains("namespace Demo.Components;"));
        assertTrue(counter.contains("public partial class Counter : MinimactComponent"));
        assertTrue(Files.exists(output.resolve("TodoList.cs")));
        assertFalse(Files.exists(output.resolve("Broken.cs")));

        JsonNode manifest = MAPPER.readTree(output.resolve("TodoList.templates.json").toFile());
        assertEquals("TodoList", manifest.get("component").asText());
        assertEquals("todos", manifest.get("loopTemplates").get(0).get("stateKey").asText());

        List<JsonNode> report = readReport(output);
        assertEquals(5, report.size());
        assertEquals("run", report.get(0).get("kind").asText());
        assertEquals(3, report.get(0).get("total_files").asInt());
        assertEquals("error", report.get(1).get("kind").asText());
        assertTrue(report.get(1).get("file").asText().endsWith("Broken.ast.json"));
        assertEquals("compiled", report.get(2).get("kind").asText());
        assertEquals("Counter", report.get(2).get("components").get(0).asText());

        JsonNode done = report.get(4);
        assertEquals("done", done.get("kind").asText());
        assertEquals(2, done.get("files_compiled").asInt());
        assertEquals(1, done.get("files_with_errors").asInt());
        assertEquals(2, done.get("components_compiled").asInt());
    }

    @Test
    void manifestsCanBeSwitchedOff() throws Exception {
        Path output = tempDir.resolve("out");

        App.run(SAMPLES.resolve("TodoList.ast.json"), output, JsxframeConfig.with(null, false, false, 1_000_000));

        assertTrue(Files.exists(output.resolve("TodoList.cs")));
        assertFalse(Files.exists(output.resolve("TodoList.templates.json")));
    }

    @Test
    void componentFailureDoesNotStopTheRun() throws Exception {
        Path input = Files.createDirectories(tempDir.resolve("in"));
        Files.copy(SAMPLES.resolve("Counter.ast.json"), input.resolve("Counter.ast.json"));
        Files.writeString(input.resolve("Nameless.ast.json"), NAMELESS_ELEMENT_AST);
        Path output = tempDir.resolve("out");

        int errors = App.run(input, output, JsxframeConfig.with(null, true, true, 1_000_000));

        assertEquals(0, errors);
        assertTrue(Files.exists(output.resolve("Counter.cs")));
        assertTrue(Files.exists(output.resolve("Nameless.cs")));

        List<JsonNode> report = readReport(output);
        assertEquals(4, report.size());
        JsonNode nameless = report.get(2);
        assertEquals("compiled", nameless.get("kind").asText());
        assertEquals("Nameless", nameless.get("failed_components").get(0).asText());
        assertEquals("done", report.get(3).get("kind").asText());
        assertEquals(2, report.get(3).get("files_compiled").asInt());
    }

    @Test
    void nestedInputsKeepTheirDirectories() throws Exception {
        Path input = tempDir.resolve("in");
        Files.createDirectories(input.resolve("admin"));
        Files.createDirectories(input.resolve("shop"));
        Files.copy(SAMPLES.resolve("Counter.ast.json"), input.resolve("admin").resolve("Widget.ast.json"));
        Files.copy(SAMPLES.resolve("Counter.ast.json"), input.resolve("shop").resolve("Widget.ast.json"));
        Path output = tempDir.resolve("out");

        App.run(input, output, JsxframeConfig.with(null, true, false, 1_000_000));

        assertTrue(Files.exists(output.resolve("admin").resolve("Widget.cs")));
        assertTrue(Files.exists(output.resolve("shop").resolve("Widget.cs")));
        assertTrue(Files.exists(output.resolve("admin").resolve("Counter.templates.json")));
        assertTrue(Files.exists(output.resolve("shop").resolve("Counter.templates.json")));
        assertFalse(Files.exists(output.resolve("Widget.cs")));
    }

    @Test
    void sameComponentInOneDirectoryKeepsTheFirstManifest() throws Exception {
        Path input = Files.createDirectories(tempDir.resolve("in"));
        Files.copy(SAMPLES.resolve("Counter.ast.json"), input.resolve("Counter.ast.json"));
        Files.copy(SAMPLES.resolve("Counter.ast.json"), input.resolve("CounterCopy.ast.json"));
        Path output = tempDir.resolve("out");

        App.run(input, output, JsxframeConfig.with(null, true, true, 1_000_000));

        List<JsonNode> report = readReport(output);
        assertFalse(hasDiagnostic(report.get(1), App.OUTPUT_COLLISION));
        assertTrue(report.get(2).get("file").asText().endsWith("CounterCopy.ast.json"));
        assertTrue(hasDiagnostic(report.get(2), App.OUTPUT_COLLISION));
        assertTrue(Files.exists(output.resolve("Counter.templates.json")));
    }

    private static List<JsonNode> readReport(Path output) throws Exception {
        List<JsonNode> report = new ArrayList<>();
        for (String line : Files.readAllLines(output.resolve(App.REPORT_FILE_NAME))) {
            report.add(MAPPER.readTree(line));
        }
        return report;
    }

    private static boolean hasDiagnostic(JsonNode line, String code) {
        for (JsonNode diagnostic : line.get("diagnostics")) {
            if (code.equals(diagnostic.get("code").asText())) {
                return true;
            }
        }
        return false;
    }
}
