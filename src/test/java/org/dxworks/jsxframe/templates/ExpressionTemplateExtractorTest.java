package org.dxworks.jsxframe.templates;

import org.dxworks.jsxframe.ast.Expression;
import org.dxworks.jsxframe.model.ExpressionTemplate;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.dxworks.jsxframe.Js.*;
import static org.dxworks.jsxframe.TestUtils.context;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExpressionTemplateExtractorTest {

    private List<ExpressionTemplate> extract(Expression renderBody) {
        return new ExpressionTemplateExtractor(context("Cart")).extract(renderBody);
    }

    @Test
    void numberFormattingCall() {
        ExpressionTemplate template = extract(el("div", el("span", expr(method(id("price"), "toFixed", num(2)))))).get(0);

        assertEquals("methodCall", template.type);
        assertEquals("price", template.stateKey);
        assertEquals("price", template.binding);
        assertEquals("toFixed", template.method);
        assertEquals(List.of(2L), template.args);
        assertEquals("numberFormat", template.transform.type);
        assertEquals(List.of(0, 0), template.path);
    }

    @Test
    void unsupportedMethodsAreSkipped() {
        assertTrue(extract(el("div", expr(method(id("name"), "repeat", num(3))))).isEmpty());
    }

    @Test
    void singleVariableArithmeticRecordsOperations() {
        ExpressionTemplate template = extract(el("p", expr(bin("*", id("count"), num(2))))).get(0);

        assertEquals("binaryExpression", template.type);
        assertEquals("count", template.stateKey);
        assertEquals("arithmetic", template.transform.type);
        Map<String, Object> operation = template.transform.operations.get(0);
        assertEquals("*", operation.get("op"));
        assertEquals(2L, operation.get("value"));
        assertEquals("right", operation.get("side"));
    }

    @Test
    void severalVariablesGiveAnInformationalFormula() {
        ExpressionTemplate template = extract(el("p", expr(bin("+", member("cart", "subtotal"), id("tax"))))).get(0);

        assertEquals("complexExpression", template.type);
        assertEquals(List.of("cart.subtotal", "tax"), template.bindings);
        assertEquals("cart.subtotal + tax", template.expression);
        assertEquals("cart", template.stateKey);
        assertNull(template.transform);
    }

    @Test
    void lengthPropertyAndSignFlip() {
        List<ExpressionTemplate> templates = extract(
                el("div", expr(member("items", "length")), expr(unary("-", id("balance")))));

        assertEquals(2, templates.size());
        assertEquals("memberExpression", templates.get(0).type);
        assertEquals("items.length", templates.get(0).binding);
        assertEquals("length", templates.get(0).transform.property);
        assertEquals("unaryExpression", templates.get(1).type);
        assertEquals("-", templates.get(1).transform.operator);
        assertEquals(List.of(1), templates.get(1).path);
    }

    @Test
    void attributeExpressionsCarryTheAttributeName() {
        ExpressionTemplate template = extract(
                el("progress", attrs(attr("value", bin("/", id("done"), num(100)))))).get(0);

        assertEquals("value", template.attribute);
        assertEquals(List.of(), template.path);
    }

    @Test
    void identifiersAndConditionalsAreLeftToOtherTemplates() {
        assertTrue(extract(el("div", expr(id("name")), expr(cond(id("a"), str("x"), str("y"))),
                expr(and(id("b"), el("i"))))).isEmpty());
    }
}
