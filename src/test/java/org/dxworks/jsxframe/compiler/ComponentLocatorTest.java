package org.dxworks.jsxframe.compiler;

import org.dxworks.jsxframe.ast.ExportDefaultDeclaration;
import org.dxworks.jsxframe.ast.Program;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.dxworks.jsxframe.Js.*;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ComponentLocatorTest {

    @Test
    void findsDeclaredExportedAndArrowComponents() {
        Program program = program(
                component("Header", ret(el("h1"))),
                export(component("Footer", ret(el("footer")))),
                new ExportDefaultDeclaration(component("Page", ret(el("main")))),
                constDecl("Card", arrow(el("div"))),
                component("helper", ret(nul())),
                constDecl("Title", str("not a function")));

        List<String> names = ComponentLocator.locate(program).stream()
                .map(c -> c.name)
                .collect(Collectors.toList());

        assertEquals(List.of("Header", "Footer", "Page", "Card"), names);
    }

    @Test
    void declarationsKeepTheirBody() {
        ComponentLocator.LocatedComponent located = ComponentLocator.locate(
                program(component("Box", List.of(props("size")), ret(el("div"))))).get(0);

        assertEquals("Box", located.function.id);
        assertEquals(1, located.function.params.size());
    }

    @Test
    void onlyThirdPartyImportsAreExternal() {
        Program program = program(
                importFrom("react", "useMemo"),
                importFrom("minimact", "useState"),
                importFrom("./utils", "format"),
                importFrom("./styles.css"),
                importFrom("date-fns", "format", "addDays"),
                importFrom("lodash", "_"));

        assertEquals(Set.of("useMemo", "format", "addDays", "_"), ComponentLocator.externalImports(program));
        assertFalse(ComponentLocator.isExternal("minimact-punch"));
        assertFalse(ComponentLocator.isExternal("theme.scss"));
        assertTrue(ComponentLocator.isExternal("@tanstack/query"));
    }
}
