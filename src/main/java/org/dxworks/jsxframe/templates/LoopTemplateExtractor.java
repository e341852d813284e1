package org.dxworks.jsxframe.templates;

import org.dxworks.jsxframe.ast.ArrayExpression;
import org.dxworks.jsxframe.ast.AstHelper;
import org.dxworks.jsxframe.ast.BlockStatement;
import org.dxworks.jsxframe.ast.CallExpression;
import org.dxworks.jsxframe.ast.ConditionalExpression;
import org.dxworks.jsxframe.ast.Expression;
import org.dxworks.jsxframe.ast.FunctionExpression;
import org.dxworks.jsxframe.ast.Identifier;
import org.dxworks.jsxframe.ast.JsxAttribute;
import org.dxworks.jsxframe.ast.JsxAttributeItem;
import org.dxworks.jsxframe.ast.JsxChild;
import org.dxworks.jsxframe.ast.JsxElement;
import org.dxworks.jsxframe.ast.JsxExpressionContainer;
import org.dxworks.jsxframe.ast.JsxFragment;
import org.dxworks.jsxframe.ast.JsxText;
import org.dxworks.jsxframe.ast.LogicalExpression;
import org.dxworks.jsxframe.ast.MemberExpression;
import org.dxworks.jsxframe.ast.Node;
import org.dxworks.jsxframe.ast.Pattern;
import org.dxworks.jsxframe.ast.ReturnStatement;
import org.dxworks.jsxframe.ast.SpreadElement;
import org.dxworks.jsxframe.ast.Statement;
import org.dxworks.jsxframe.ast.StringLiteral;
import org.dxworks.jsxframe.ast.TemplateLiteral;
import org.dxworks.jsxframe.compiler.CompilerContext;
import org.dxworks.jsxframe.compiler.Diagnostics;
import org.dxworks.jsxframe.model.ItemTemplate;
import org.dxworks.jsxframe.model.LoopTemplate;
import org.dxworks.jsxframe.model.Template;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Finds {@code array.map(item => <li>...</li>)} calls and describes the item element with
 * bindings relative to the item ({@code item.text}).
 */
public class LoopTemplateExtractor {

    private final CompilerContext context;
    private final List<LoopTemplate> loops = new ArrayList<>();

    public LoopTemplateExtractor(CompilerContext context) {
        this.context = context;
    }

    public List<LoopTemplate> extract(Expression renderBody) {
        loops.clear();
        if (renderBody instanceof JsxElement || renderBody instanceof JsxFragment) {
            traverse(renderBody);
        } else {
            findMapExpressions(renderBody);
        }
        return new ArrayList<>(loops);
    }

    private void traverse(Node node) {
        List<JsxChild> children;
        if (node instanceof JsxElement element) {
            for (JsxAttributeItem item : element.attributes) {
                if (item instanceof JsxAttribute attr && attr.expression() != null) {
                    findMapExpressions(attr.expression());
                }
            }
            children = element.children;
        } else if (node instanceof JsxFragment fragment) {
            children = fragment.children;
        } else {
            return;
        }
        for (JsxChild child : children) {
            if (child instanceof JsxExpressionContainer container && !container.isEmpty()) {
                findMapExpressions(container.expression);
            } else if (child instanceof JsxElement || child instanceof JsxFragment) {
                traverse(child);
            }
        }
    }

    private void findMapExpressions(Expression expr) {
        if (expr == null) return;

        if (expr instanceof CallExpression call && call.callee instanceof MemberExpression callee) {
            if ("map".equals(callee.propertyName())) {
                LoopTemplate loop = extractLoop(call, callee);
                if (loop != null) {
                    loops.add(loop);
                }
            }
            // items.filter(...).map(...)
            findMapExpressions(callee.object);
        } else if (expr instanceof LogicalExpression logical) {
            findMapExpressions(logical.left);
            findMapExpressions(logical.right);
        } else if (expr instanceof ConditionalExpression cond) {
            findMapExpressions(cond.test);
            findMapExpressions(cond.consequent);
            findMapExpressions(cond.alternate);
        }
    }

    private LoopTemplate extractLoop(CallExpression call, MemberExpression callee) {
        String arrayBinding = arrayBinding(callee.object);
        if (arrayBinding == null) {
            context.warn(Diagnostics.TEMPLATE_EXTRACTION, "[Loop Template] Could not extract array binding from .map()");
            return null;
        }
        if (!(call.argument(0) instanceof FunctionExpression callback)) {
            context.warn(Diagnostics.TEMPLATE_EXTRACTION, "[Loop Template] .map() callback is not a function");
            return null;
        }

        String itemVar = paramName(callback, 0);
        LoopScope scope = new LoopScope(itemVar != null ? itemVar : "item", paramName(callback, 1));

        JsxElement element = jsxFromCallback(callback);
        if (element == null) {
            context.warn(Diagnostics.TEMPLATE_EXTRACTION, "[Loop Template] .map() callback does not return JSX element");
            return null;
        }

        LoopTemplate loop = new LoopTemplate();
        loop.stateKey = arrayBinding;
        loop.arrayBinding = arrayBinding;
        loop.itemVar = scope.itemVar;
        loop.indexVar = scope.indexVar;
        loop.keyBinding = keyBinding(element, scope);
        loop.itemTemplate = elementTemplate(element, scope);
        return loop;
    }

    private static final class LoopScope {
        final String itemVar;
        final String indexVar;

        LoopScope(String itemVar, String indexVar) {
            this.itemVar = itemVar;
            this.indexVar = indexVar;
        }
    }

    /**
     * {@code todos} gives todos, {@code this.state.items} gives items, {@code [...todos]} and
     * {@code todos.slice()} give todos.
     */
    static String arrayBinding(Expression expr) {
        if (expr instanceof Identifier id) {
            return id.name;
        }
        if (expr instanceof MemberExpression member) {
            return member.propertyName();
        }
        if (expr instanceof CallExpression call && call.callee instanceof MemberExpression callee) {
            return arrayBinding(callee.object);
        }
        if (expr instanceof ArrayExpression array && !array.elements.isEmpty()
                && array.elements.get(0) instanceof SpreadElement spread) {
            return arrayBinding(spread.argument);
        }
        return null;
    }

    private static String paramName(FunctionExpression callback, int index) {
        if (index >= callback.params.size()) {
            return null;
        }
        Pattern param = callback.params.get(index);
        return param instanceof Identifier id ? id.name : null;
    }

    private static JsxElement jsxFromCallback(FunctionExpression callback) {
        Node body = callback.body;
        if (body instanceof JsxElement element) {
            return element;
        }
        if (body instanceof BlockStatement block) {
            JsxElement result = null;
            for (Statement statement : block.body) {
                if (statement instanceof ReturnStatement ret && ret.argument instanceof JsxElement element) {
                    result = element;
                }
            }
            return result;
        }
        if (body instanceof ConditionalExpression cond && cond.consequent instanceof JsxElement element) {
            return element;
        }
        if (body instanceof LogicalExpression logical && logical.isAnd() && logical.right instanceof JsxElement element) {
            return element;
        }
        return null;
    }

    private static String keyBinding(JsxElement element, LoopScope scope) {
        JsxAttribute key = element.attribute("key");
        if (key == null || key.expression() == null) {
            return null;
        }
        return bindingPath(key.expression(), scope);
    }

    private static ItemTemplate elementTemplate(JsxElement element, LoopScope scope) {
        Map<String, Template> props = propTemplates(element, scope);
        List<ItemTemplate> children = childTemplates(element, scope);
        return ItemTemplate.element(element.name, props.isEmpty() ? null : props,
                children.isEmpty() ? null : children);
    }

    private static Map<String, Template> propTemplates(JsxElement element, LoopScope scope) {
        Map<String, Template> props = new LinkedHashMap<>();
        for (JsxAttributeItem item : element.attributes) {
            if (!(item instanceof JsxAttribute attr) || attr.name.equals("key")) {
                continue;
            }
            if (attr.value instanceof StringLiteral str) {
                Template template = new Template();
                template.template = str.value;
                template.type = "static";
                props.put(attr.name, template);
                continue;
            }
            Expression expr = attr.expression();
            if (expr == null) {
                continue;
            }
            Template template = null;
            if (expr instanceof ConditionalExpression cond) {
                template = conditionalTemplate(cond, scope);
            }
            if (template == null && expr instanceof TemplateLiteral literal) {
                template = templateLiteral(literal, scope);
            }
            if (template == null) {
                String binding = bindingPath(expr, scope);
                if (binding != null) {
                    template = single(binding, "binding");
                }
            }
            if (template != null) {
                props.put(attr.name, template);
            }
        }
        return props;
    }

    private static List<ItemTemplate> childTemplates(JsxElement element, LoopScope scope) {
        List<ItemTemplate> children = new ArrayList<>();
        for (JsxChild child : element.children) {
            if (child instanceof JsxText text) {
                String content = text.value.strip();
                if (!content.isEmpty()) {
                    children.add(ItemTemplate.text(content, List.of(), List.of()));
                }
            } else if (child instanceof JsxExpressionContainer container && !container.isEmpty()) {
                ItemTemplate text = expressionText(container.expression, scope);
                if (text != null) {
                    children.add(text);
                }
            } else if (child instanceof JsxElement nested) {
                children.add(elementTemplate(nested, scope));
            }
        }
        return children;
    }

    private static ItemTemplate expressionText(Expression expr, LoopScope scope) {
        if (expr instanceof ConditionalExpression cond) {
            Template conditional = conditionalTemplate(cond, scope);
            if (conditional != null) {
                ItemTemplate text = ItemTemplate.text(conditional.template, conditional.bindings, conditional.slots);
                text.conditionalTemplates = conditional.conditionalTemplates;
                text.conditionalBindingIndex = conditional.conditionalBindingIndex;
                return text;
            }
        }
        String binding = bindingPath(expr, scope);
        if (binding == null) {
            return null;
        }
        return ItemTemplate.text("{0}", List.of(binding), List.of(0));
    }

    private static Template conditionalTemplate(ConditionalExpression cond, LoopScope scope) {
        String binding = bindingPath(cond.test, scope);
        if (binding == null) {
            return null;
        }
        Object whenTrue = AstHelper.literalValue(cond.consequent);
        Object whenFalse = AstHelper.literalValue(cond.alternate);
        if (whenTrue == null || whenFalse == null) {
            return null;
        }
        Template template = single(binding, "conditional");
        template.conditionalTemplates = new LinkedHashMap<>();
        template.conditionalTemplates.put("true", whenTrue);
        template.conditionalTemplates.put("false", whenFalse);
        template.conditionalBindingIndex = 0;
        return template;
    }

    private static Template templateLiteral(TemplateLiteral literal, LoopScope scope) {
        Template template = new Template();
        StringBuilder text = new StringBuilder();
        for (int i = 0; i < literal.quasis.size(); i++) {
            text.append(literal.quasis.get(i));
            if (i < literal.expressions.size()) {
                String binding = bindingPath(literal.expressions.get(i), scope);
                if (binding == null) {
                    return null;
                }
                template.slots.add(text.length());
                text.append('{').append(i).append('}');
                template.bindings.add(binding);
            }
        }
        template.template = text.toString();
        template.type = "template-literal";
        return template;
    }

    private static Template single(String binding, String type) {
        Template template = new Template();
        template.template = "{0}";
        template.bindings.add(binding);
        template.slots.add(0);
        template.type = type;
        return template;
    }

    /**
     * Item-relative path: {@code todo.text} becomes {@code item.text} and the index variable
     * becomes {@code index}. The bare item variable and outer names give null.
     */
    private static String bindingPath(Expression expr, LoopScope scope) {
        if (expr instanceof Identifier id) {
            if (id.name.equals(scope.itemVar)) {
                return null;
            }
            if (id.name.equals(scope.indexVar) || id.name.equals("index")) {
                return "index";
            }
            return null;
        }
        if (expr instanceof MemberExpression) {
            String path = AstHelper.strictMemberPath(expr);
            if (path != null && path.startsWith(scope.itemVar + ".")) {
                return "item" + path.substring(scope.itemVar.length());
            }
        }
        return null;
    }
}
