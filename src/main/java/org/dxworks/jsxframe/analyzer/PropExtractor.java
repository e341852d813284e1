package org.dxworks.jsxframe.analyzer;

import org.dxworks.jsxframe.ast.FunctionExpression;
import org.dxworks.jsxframe.ast.Identifier;
import org.dxworks.jsxframe.ast.ObjectMember;
import org.dxworks.jsxframe.ast.ObjectPattern;
import org.dxworks.jsxframe.ast.ObjectProperty;
import org.dxworks.jsxframe.ast.Pattern;
import org.dxworks.jsxframe.ast.TsPropertySignature;
import org.dxworks.jsxframe.ast.TsTypeLiteral;
import org.dxworks.jsxframe.model.PropInfo;

import java.util.ArrayList;
import java.util.List;

public class PropExtractor {

    private PropExtractor() {
    }

    /**
     * Props of {@code function C({ a, b }: { a: string })} come from the destructuring, typed by an
     * inline type literal when there is one; {@code function C(props)} gives one dynamic prop.
     */
    public static List<PropInfo> extract(FunctionExpression function) {
        List<PropInfo> props = new ArrayList<>();
        if (function.params.isEmpty()) {
            return props;
        }

        Pattern first = function.params.get(0);
        if (first instanceof ObjectPattern pattern) {
            TsTypeLiteral typeLiteral = pattern.typeAnnotation instanceof TsTypeLiteral literal ? literal : null;
            for (ObjectMember member : pattern.properties) {
                if (member instanceof ObjectProperty property && !property.computed
                        && property.key instanceof Identifier key) {
                    props.add(new PropInfo(key.name, declaredType(typeLiteral, key.name)));
                }
            }
        } else if (first instanceof Identifier id) {
            props.add(new PropInfo(id.name, "dynamic"));
        }
        return props;
    }

    private static String declaredType(TsTypeLiteral typeLiteral, String name) {
        if (typeLiteral == null) {
            return "dynamic";
        }
        TsPropertySignature signature = typeLiteral.member(name);
        if (signature == null || signature.typeAnnotation == null) {
            return "dynamic";
        }
        return TypeConversion.tsTypeToCSharpType(signature.typeAnnotation);
    }
}
