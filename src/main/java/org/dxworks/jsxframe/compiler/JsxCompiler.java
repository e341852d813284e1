package org.dxworks.jsxframe.compiler;

import org.dxworks.jsxframe.analyzer.ComponentAssembler;
import org.dxworks.jsxframe.ast.Program;
import org.dxworks.jsxframe.generator.CSharpFileGenerator;
import org.dxworks.jsxframe.generator.ComponentGenerator;
import org.dxworks.jsxframe.model.CompilationResult;
import org.dxworks.jsxframe.model.ComponentDescriptor;
import org.dxworks.jsxframe.templates.TemplateManifestBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Compiles every component of one source file. Holds no per-file state, so one instance can
 * compile files concurrently.
 */
public class JsxCompiler {
    private static final Logger log = LoggerFactory.getLogger(JsxCompiler.class);

    private final String namespace;
    private final TemplateManifestBuilder manifests;

    public JsxCompiler(String namespace, Clock clock) {
        this.namespace = namespace;
        this.manifests = new TemplateManifestBuilder(clock);
    }

    public CompilationResult compile(Program program) {
        CompilationResult result = new CompilationResult();
        Diagnostics diagnostics = new Diagnostics();
        Set<String> externalImports = ComponentLocator.externalImports(program);

        List<List<String>> classes = new ArrayList<>();
        boolean hasPlugins = false;

        Set<String> seen = new HashSet<>();
        for (ComponentLocator.LocatedComponent located : ComponentLocator.locate(program)) {
            ComponentDescriptor component = new ComponentDescriptor(located.name);
            CompilerContext context = new CompilerContext(component, diagnostics);
            try {
                if (!seen.add(component.name)) {
                    throw new StructuralValidationException(
                            "Component \"" + component.name + "\" is declared more than once");
                }
                new ComponentAssembler(context).assemble(located.function, externalImports);
                classes.add(new ComponentGenerator(context).generate());
            } catch (StructuralValidationException e) {
                diagnostics.error(Diagnostics.STRUCTURAL, component.name, e.getMessage());
                result.failedComponents.add(component.name);
                continue;
            } catch (RuntimeException e) {
                log.debug("[{}] Compilation failed", component.name, e);
                diagnostics.error(Diagnostics.INTERNAL, component.name, "Compilation failed: " + e);
                result.failedComponents.add(component.name);
                continue;
            }

            result.components.add(component.name);
            hasPlugins |= !component.pluginUsages.isEmpty();
            if (component.hasTemplates()) {
                result.manifests.put(component.name, manifests.build(component));
            }
        }

        log.debug("Compiled {} components, {} failed", result.components.size(), result.failedComponents.size());
        result.csharp = new CSharpFileGenerator(namespace).generate(classes, hasPlugins);
        result.diagnostics.addAll(diagnostics.entries());
        return result;
    }
}
