package org.dxworks.jsxframe.generator;

import org.dxworks.jsxframe.ast.ObjectExpression;
import org.dxworks.jsxframe.ast.ObjectMember;
import org.dxworks.jsxframe.ast.ObjectProperty;
import org.dxworks.jsxframe.model.PluginUsage;

import java.util.ArrayList;
import java.util.List;

public class PluginNodeGenerator {

    private final ExpressionGenerator expressions;

    public PluginNodeGenerator(ExpressionGenerator expressions) {
        this.expressions = expressions;
    }

    /**
     * {@code new PluginNode("Name", state)}, followed by a version comment when one was given.
     */
    public String generate(PluginUsage usage) {
        String node = "new PluginNode(\"" + usage.pluginName + "\", " + stateExpression(usage.stateBinding) + ")";
        if (usage.version != null) {
            return node + " /* v" + usage.version + " */";
        }
        return node;
    }

    String stateExpression(PluginUsage.StateBinding binding) {
        switch (binding.kind) {
            case IDENTIFIER:
                return binding.name;
            case MEMBER_EXPRESSION:
                return binding.binding;
            case OBJECT_EXPRESSION:
                return inlineObject((ObjectExpression) binding.expression);
            default:
                return expressions.generate(binding.expression);
        }
    }

    private String inlineObject(ObjectExpression object) {
        List<String> props = new ArrayList<>();
        for (ObjectMember member : object.properties) {
            if (member instanceof ObjectProperty property && property.keyName() != null) {
                props.add(property.keyName() + " = " + expressions.generate(property.value));
            }
        }
        if (props.isEmpty()) {
            return "new { }";
        }
        return "new { " + String.join(", ", props) + " }";
    }
}
