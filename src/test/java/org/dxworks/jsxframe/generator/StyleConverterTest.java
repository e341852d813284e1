package org.dxworks.jsxframe.generator;

import org.junit.jupiter.api.Test;

import static org.dxworks.jsxframe.Js.*;
import static org.junit.jupiter.api.Assertions.assertEquals;

class StyleConverterTest {

    @Test
    void camelCaseKeysBecomeKebabCase() {
        assertEquals("background-color", StyleConverter.camelToKebab("backgroundColor"));
        assertEquals("color", StyleConverter.camelToKebab("color"));
    }

    @Test
    void numbersGetPixelsAndComputedValuesAreDropped() {
        assertEquals("padding: 4px; display: flex; opacity: 0.5px",
                StyleConverter.toCss(object("padding", num(4), "display", str("flex"),
                        "opacity", num(0.5), "width", bin("*", id("w"), num(2)))));
    }
}
