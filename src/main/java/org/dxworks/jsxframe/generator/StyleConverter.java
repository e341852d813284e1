package org.dxworks.jsxframe.generator;

import org.dxworks.jsxframe.ast.AstHelper;
import org.dxworks.jsxframe.ast.Identifier;
import org.dxworks.jsxframe.ast.NumericLiteral;
import org.dxworks.jsxframe.ast.ObjectExpression;
import org.dxworks.jsxframe.ast.ObjectMember;
import org.dxworks.jsxframe.ast.ObjectProperty;
import org.dxworks.jsxframe.ast.StringLiteral;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns inline style objects into CSS text: {@code {marginTop: 12}} becomes {@code margin-top: 12px}.
 */
public class StyleConverter {

    private StyleConverter() {
    }

    public static String camelToKebab(String name) {
        StringBuilder out = new StringBuilder();
        for (char c : name.toCharArray()) {
            if (Character.isUpperCase(c)) {
                out.append('-').append(Character.toLowerCase(c));
            } else {
                out.append(c);
            }
        }
        return out.toString();
    }

    public static String toCss(ObjectExpression style) {
        List<String> declarations = new ArrayList<>();
        for (ObjectMember member : style.properties) {
            if (member instanceof ObjectProperty property && !property.computed) {
                String key = property.keyName();
                String value = cssValue(property);
                if (key != null && value != null) {
                    declarations.add(camelToKebab(key) + ": " + value);
                }
            }
        }
        return String.join("; ", declarations);
    }

    // computed values have no static CSS form
    private static String cssValue(ObjectProperty property) {
        if (property.value instanceof StringLiteral str) {
            return str.value;
        }
        if (property.value instanceof NumericLiteral num) {
            return AstHelper.formatNumber(num.value) + "px";
        }
        if (property.value instanceof Identifier id) {
            return id.name;
        }
        return null;
    }
}
