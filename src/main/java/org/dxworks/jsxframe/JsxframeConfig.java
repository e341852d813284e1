package org.dxworks.jsxframe;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class JsxframeConfig {
    private static final Logger log = LoggerFactory.getLogger(JsxframeConfig.class);

    static final String CONFIG_FILE_NAME = "jsxframe-config.yml";
    static final String DEFAULT_NAMESPACE = "Minimact.Components";
    static final boolean DEFAULT_EMIT_TEMPLATE_MANIFESTS = true;
    static final boolean DEFAULT_PARALLEL = true;
    static final long DEFAULT_MAX_FILE_BYTES = 5L * 1024 * 1024;

    private final String namespace;
    private final boolean emitTemplateManifests;
    private final boolean parallel;
    private final long maxFileBytes;

    private JsxframeConfig(String namespace, boolean emitTemplateManifests, boolean parallel, long maxFileBytes) {
        this.namespace = namespace;
        this.emitTemplateManifests = emitTemplateManifests;
        this.parallel = parallel;
        this.maxFileBytes = maxFileBytes;
    }

    public String getNamespace() {
        return namespace;
    }

    public boolean isEmitTemplateManifests() {
        return emitTemplateManifests;
    }

    public boolean isParallel() {
        return parallel;
    }

    public long getMaxFileBytes() {
        return maxFileBytes;
    }

    public static JsxframeConfig defaults() {
        return new JsxframeConfig(DEFAULT_NAMESPACE, DEFAULT_EMIT_TEMPLATE_MANIFESTS, DEFAULT_PARALLEL,
                DEFAULT_MAX_FILE_BYTES);
    }

    public static JsxframeConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static JsxframeConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                return with(yamlConfig.namespace,
                        yamlConfig.emitTemplateManifests != null ? yamlConfig.emitTemplateManifests : DEFAULT_EMIT_TEMPLATE_MANIFESTS,
                        yamlConfig.parallel != null ? yamlConfig.parallel : DEFAULT_PARALLEL,
                        yamlConfig.maxFileBytes != null ? yamlConfig.maxFileBytes : DEFAULT_MAX_FILE_BYTES);
            }
        } catch (IOException e) {
            log.warn("Could not read {}, using defaults: {}", configPath, e.getMessage());
        }

        return defaults();
    }

    public static JsxframeConfig with(String namespace, boolean emitTemplateManifests, boolean parallel, long maxFileBytes) {
        String effectiveNamespace = (namespace != null && !namespace.isBlank()) ? namespace.trim() : DEFAULT_NAMESPACE;
        long effectiveMaxFileBytes = maxFileBytes > 0 ? maxFileBytes : DEFAULT_MAX_FILE_BYTES;
        return new JsxframeConfig(effectiveNamespace, emitTemplateManifests, parallel, effectiveMaxFileBytes);
    }

    private static class YamlConfig {
        public String namespace;
        public Boolean emitTemplateManifests;
        public Boolean parallel;
        public Long maxFileBytes;
    }
}
