package org.dxworks.jsxframe.generator;

import java.util.Arrays;
import java.util.stream.Collectors;

public class CSharpStrings {

    private CSharpStrings() {
    }

    /**
     * Escapes text for a regular (non-verbatim) C# string literal.
     */
    public static String escape(String value) {
        if (value == null) return "";
        return value
                .replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\n", "\\n")
                .replace("\r", "\\r")
                .replace("\t", "\\t");
    }

    public static String quote(String value) {
        return "\"" + escape(value) + "\"";
    }

    /**
     * Prefixes every non-empty line; empty lines stay empty.
     */
    public static String indent(String code, int spaces) {
        String prefix = " ".repeat(spaces);
        return Arrays.stream(code.split("\n", -1))
                .map(line -> line.isEmpty() ? "" : prefix + line)
                .collect(Collectors.joining("\n"));
    }

    public static String indentLevel(int level) {
        return "    ".repeat(level);
    }
}
