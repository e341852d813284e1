package org.dxworks.jsxframe.compiler;

import org.dxworks.jsxframe.TestUtils;
import org.dxworks.jsxframe.ast.BabelAstReader;
import org.dxworks.jsxframe.model.CompilationResult;
import org.dxworks.jsxframe.model.ItemTemplate;
import org.dxworks.jsxframe.model.LoopTemplate;
import org.dxworks.jsxframe.model.Template;
import org.dxworks.jsxframe.model.TemplateManifest;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

class ManifestPlaceholderTest {

    private static final Path SAMPLES = Paths.get("src/test/resources/samples");
    private static final Pattern PLACEHOLDER = Pattern.compile("\\{(\\d+)}");

    @ParameterizedTest
    @ValueSource(strings = {"Counter.ast.json", "TodoList.ast.json"})
    void everyPlaceholderHasExactlyOneBinding(String sample) {
        CompilationResult result = new JsxCompiler("Demo.Components", TestUtils.FIXED_CLOCK)
                .compile(new BabelAstReader().read(SAMPLES.resolve(sample)));

        List<String> checked = new ArrayList<>();
        for (TemplateManifest manifest : result.manifests.values()) {
            for (Map.Entry<String, Template> entry : manifest.templates.entrySet()) {
                Template template = entry.getValue();
                assertPlaceholders(entry.getKey(), template.template, template.bindings);
                assertEquals(template.bindings.size(), template.slots.size(), entry.getKey());
                checked.add(entry.getKey());
            }
            if (manifest.loopTemplates != null) {
                for (LoopTemplate loop : manifest.loopTemplates) {
                    checkItem(loop.stateKey, loop.itemTemplate, checked);
                }
            }
        }

        assertFalse(checked.isEmpty(), "no templates in " + sample);
    }

    private static void checkItem(String where, ItemTemplate item, List<String> checked) {
        if (item.template != null) {
            assertPlaceholders(where, item.template, item.bindings);
            checked.add(where);
        }
        if (item.propsTemplates != null) {
            for (Map.Entry<String, Template> prop : item.propsTemplates.entrySet()) {
                assertPlaceholders(where + "@" + prop.getKey(), prop.getValue().template, prop.getValue().bindings);
                checked.add(where + "@" + prop.getKey());
            }
        }
        if (item.childrenTemplates != null) {
            for (ItemTemplate child : item.childrenTemplates) {
                checkItem(where, child, checked);
            }
        }
    }

    // indices run 0..n-1 with n the binding count
    private static void assertPlaceholders(String where, String template, List<String> bindings) {
        TreeSet<Integer> indices = new TreeSet<>();
        Matcher matcher = PLACEHOLDER.matcher(template);
        while (matcher.find()) {
            indices.add(Integer.parseInt(matcher.group(1)));
        }
        int size = bindings == null ? 0 : bindings.size();
        assertEquals(size, indices.size(), where + ": " + template);
        if (!indices.isEmpty()) {
            assertEquals(0, indices.first(), where);
            assertEquals(size - 1, indices.last(), where);
        }
    }
}
