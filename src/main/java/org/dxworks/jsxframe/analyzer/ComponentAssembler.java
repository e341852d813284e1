package org.dxworks.jsxframe.analyzer;

import org.dxworks.jsxframe.ast.BlockStatement;
import org.dxworks.jsxframe.ast.Expression;
import org.dxworks.jsxframe.ast.FunctionExpression;
import org.dxworks.jsxframe.ast.ReturnStatement;
import org.dxworks.jsxframe.ast.Statement;
import org.dxworks.jsxframe.compiler.CompilerContext;
import org.dxworks.jsxframe.compiler.Diagnostics;
import org.dxworks.jsxframe.generator.ExpressionGenerator;
import org.dxworks.jsxframe.model.ComponentDescriptor;
import org.dxworks.jsxframe.templates.AttributeTemplateExtractor;
import org.dxworks.jsxframe.templates.ExpressionTemplateExtractor;
import org.dxworks.jsxframe.templates.LoopTemplateExtractor;
import org.dxworks.jsxframe.templates.StructuralTemplateExtractor;
import org.dxworks.jsxframe.templates.TextTemplateExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;

/**
 * Phase one of compiling a component: reads the untouched function tree and fills a
 * {@link ComponentDescriptor}. Nothing here emits C# except initial values.
 */
public class ComponentAssembler {
    private static final Logger log = LoggerFactory.getLogger(ComponentAssembler.class);

    private final CompilerContext context;
    private final ExpressionGenerator expressions;

    public ComponentAssembler(CompilerContext context) {
        this.context = context;
        this.expressions = new ExpressionGenerator(context);
    }

    public ComponentDescriptor assemble(FunctionExpression function, Set<String> externalImports) {
        ComponentDescriptor component = context.component();
        component.function = function;
        component.externalImports.addAll(externalImports);
        component.props.addAll(PropExtractor.extract(function));

        new HookDecomposer(context, expressions).decompose(function.body);
        if (function.body instanceof BlockStatement block) {
            new LocalVariableExtractor(context, expressions).extract(block);
            component.renderBody = renderBody(block);
        } else if (function.body instanceof Expression expr) {
            component.renderBody = expr;
        }

        PropTypeInference.infer(component.props, function.body);

        if (component.renderBody != null) {
            extractTemplates(component);
            component.pluginUsages.addAll(new PluginAnalyzer(context).analyze(component.renderBody));
        }
        EventHandlerCollector.collect(component);

        log.debug("[{}] {} props, {} state, {} handlers, {} text templates, {} loops, {} structural, {} expressions",
                component.name, component.props.size(), component.useState.size(), component.eventHandlers.size(),
                component.templates.size(), component.loopTemplates.size(), component.structuralTemplates.size(),
                component.expressionTemplates.size());
        return component;
    }

    /**
     * The argument of the last top-level return.
     */
    static Expression renderBody(BlockStatement body) {
        Expression result = null;
        for (Statement statement : body.body) {
            if (statement instanceof ReturnStatement ret && ret.argument != null) {
                result = ret.argument;
            }
        }
        return result;
    }

    private void extractTemplates(ComponentDescriptor component) {
        Expression render = component.renderBody;
        guarded("text", () -> component.templates.putAll(TextTemplateExtractor.extract(render)));
        guarded("attribute", () -> component.templates.putAll(AttributeTemplateExtractor.extract(render)));
        guarded("loop", () -> component.loopTemplates.addAll(new LoopTemplateExtractor(context).extract(render)));
        guarded("structural",
                () -> component.structuralTemplates.addAll(new StructuralTemplateExtractor(context).extract(render)));
        guarded("expression",
                () -> component.expressionTemplates.addAll(new ExpressionTemplateExtractor(context).extract(render)));
    }

    // a failing extractor never stops code generation
    private void guarded(String kind, Runnable extraction) {
        try {
            extraction.run();
        } catch (RuntimeException e) {
            context.warn(Diagnostics.TEMPLATE_EXTRACTION, "Failed to extract " + kind + " templates: " + e.getMessage());
        }
    }
}
