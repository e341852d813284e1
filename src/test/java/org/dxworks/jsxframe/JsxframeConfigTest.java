package org.dxworks.jsxframe;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsxframeConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void missingFileGivesDefaults() {
        JsxframeConfig config = JsxframeConfig.load(tempDir.resolve("absent.yml"));

        assertEquals(JsxframeConfig.DEFAULT_NAMESPACE, config.getNamespace());
        assertTrue(config.isEmitTemplateManifests());
        assertTrue(config.isParallel());
        assertEquals(JsxframeConfig.DEFAULT_MAX_FILE_BYTES, config.getMaxFileBytes());
    }

    @Test
    void yamlOverridesOnlyWhatItSets() throws Exception {
        Path file = tempDir.resolve(JsxframeConfig.CONFIG_FILE_NAME);
        Files.writeString(file, "namespace: \"  Shop.Web.Components \"\nparallel: false\n");

        JsxframeConfig config = JsxframeConfig.load(file);

        assertEquals("Shop.Web.Components", config.getNamespace());
        assertFalse(config.isParallel());
        assertTrue(config.isEmitTemplateManifests());
        assertEquals(JsxframeConfig.DEFAULT_MAX_FILE_BYTES, config.getMaxFileBytes());
    }

    @Test
    void unreadableYamlFallsBackToDefaults() throws Exception {
        Path file = tempDir.resolve("broken.yml");
        Files.writeString(file, "namespace: [unclosed\n");

        assertEquals(JsxframeConfig.DEFAULT_NAMESPACE, JsxframeConfig.load(file).getNamespace());
    }

    @Test
    void blankNamespaceAndNonPositiveLimitAreReplaced() {
        JsxframeConfig config = JsxframeConfig.with(" ", false, true, 0);

        assertEquals(JsxframeConfig.DEFAULT_NAMESPACE, config.getNamespace());
        assertFalse(config.isEmitTemplateManifests());
        assertEquals(JsxframeConfig.DEFAULT_MAX_FILE_BYTES, config.getMaxFileBytes());
    }
}
