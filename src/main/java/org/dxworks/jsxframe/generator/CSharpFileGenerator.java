package org.dxworks.jsxframe.generator;

import java.util.ArrayList;
import java.util.List;

/**
 * Wraps the generated component classes of one source file in usings and a file-scoped
 * namespace.
 */
public class CSharpFileGenerator {

    private static final List<String> USINGS = List.of(
            "using Minimact.AspNetCore.Core;",
            "using Minimact.AspNetCore.Extensions;",
            "using MinimactHelpers = Minimact.AspNetCore.Core.Minimact;",
            "using System.Collections.Generic;",
            "using System.Linq;",
            "using System.Threading.Tasks;");

    private final String namespace;

    public CSharpFileGenerator(String namespace) {
        this.namespace = namespace;
    }

    /**
     * @param classes    the lines of each component class, in source order
     * @param hasPlugins whether any component renders a plugin element
     */
    public String generate(List<List<String>> classes, boolean hasPlugins) {
        List<String> lines = new ArrayList<>(USINGS);
        if (hasPlugins) {
            lines.add("using Minimact.AspNetCore.Plugins;");
        }
        lines.add("");
        lines.add("namespace " + namespace + ";");
        lines.add("");
        for (List<String> componentClass : classes) {
            lines.addAll(componentClass);
            lines.add("");
        }
        return String.join("\n", lines);
    }
}
