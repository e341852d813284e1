package org.dxworks.jsxframe.ast;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.dxworks.jsxframe.Js.*;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AstHelperTest {

    @Test
    void pluginElementsAreRecognisedByTag() {
        assertTrue(AstHelper.isPluginElement(el("Plugin")));
        assertTrue(AstHelper.isPluginElement(el("Plugin.Clock")));
        assertFalse(AstHelper.isPluginElement(el("PluginList")));
        assertFalse(AstHelper.isPluginElement(el("div")));
    }

    @Test
    void walkVisitsBlockBodiedCallbacks() {
        List<Pattern> params = List.of(id("item"));
        Expression render = el("ul", expr(method(id("items"), "map",
                arrowBlock(params, ret(el("li", expr(member("item", "name"))))))));

        assertEquals(2, AstHelper.findAll(render, JsxElement.class).size());
    }
}
