package org.dxworks.jsxframe.generator;

import org.dxworks.jsxframe.compiler.CompilerContext;
import org.junit.jupiter.api.Test;

import static org.dxworks.jsxframe.Js.*;
import static org.dxworks.jsxframe.TestUtils.context;
import static org.junit.jupiter.api.Assertions.assertEquals;

class RenderBodyGeneratorTest {

    private final CompilerContext context = context("View");
    private final ExpressionGenerator expressions = new ExpressionGenerator(context);
    private final RenderBodyGenerator generator =
            new RenderBodyGenerator(new JsxGenerator(context, expressions), expressions);

    @Test
    void missingBodyRendersEmptyText() {
        assertEquals("        return new VText(\"\");", generator.generate(null, 2));
    }

    @Test
    void jsxIsReturnedDirectly() {
        assertEquals("return new VElement(\"hr\", new Dictionary<string, string>());",
                generator.generate(el("hr"), 0));
    }

    @Test
    void ternaryBecomesConditionalReturn() {
        assertEquals("return ready\n"
                        + "    ? new VElement(\"p\", new Dictionary<string, string>())\n"
                        + "    : new VElement(\"span\", new Dictionary<string, string>());",
                generator.generate(cond(id("ready"), el("p"), el("span")), 0));
    }

    @Test
    void logicalAndBecomesGuardedReturn() {
        assertEquals("if (open)\n"
                        + "{\n"
                        + "    return new VElement(\"dialog\", new Dictionary<string, string>());\n"
                        + "}\n"
                        + "return new VText(\"\");",
                generator.generate(and(id("open"), el("dialog")), 0));
    }

    @Test
    void topLevelMapIsWrappedInAFragment() {
        assertEquals("return new Fragment(tags.Select(tag => new VElement(\"i\", new Dictionary<string, string>())).ToArray());",
                generator.generate(method(id("tags"), "map", arrow("tag", el("i"))), 0));
    }
}
