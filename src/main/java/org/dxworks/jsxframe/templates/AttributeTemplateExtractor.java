package org.dxworks.jsxframe.templates;

import org.dxworks.jsxframe.ast.Expression;
import org.dxworks.jsxframe.ast.Identifier;
import org.dxworks.jsxframe.ast.JsxAttribute;
import org.dxworks.jsxframe.ast.JsxAttributeItem;
import org.dxworks.jsxframe.ast.JsxElement;
import org.dxworks.jsxframe.ast.TemplateLiteral;
import org.dxworks.jsxframe.model.Template;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Template literals in attribute position, e.g. {@code className={`count-${count}`}}, keyed
 * {@code <tag>[<path>].@<attribute>}.
 */
public class AttributeTemplateExtractor extends ElementPathWalker {

    private final Map<String, Template> templates = new LinkedHashMap<>();

    private AttributeTemplateExtractor() {
    }

    public static Map<String, Template> extract(Expression renderBody) {
        AttributeTemplateExtractor extractor = new AttributeTemplateExtractor();
        extractor.walk(renderBody);
        return extractor.templates;
    }

    @Override
    protected void visitElement(JsxElement element, int index, List<Integer> parentPath, List<Integer> path) {
        for (JsxAttributeItem item : element.attributes) {
            if (item instanceof JsxAttribute attr && attr.expression() instanceof TemplateLiteral literal) {
                Template template = fromTemplateLiteral(literal);
                template.path = path;
                template.attribute = attr.name;
                String key = element.name + "[" + path.stream().map(String::valueOf).collect(Collectors.joining(","))
                        + "].@" + attr.name;
                templates.put(key, template);
            }
        }
        visitChildrenOf(element, path);
    }

    private static Template fromTemplateLiteral(TemplateLiteral literal) {
        Template template = new Template();
        StringBuilder text = new StringBuilder();
        for (int i = 0; i < literal.quasis.size(); i++) {
            text.append(literal.quasis.get(i));
            if (i < literal.expressions.size()) {
                Expression expr = literal.expressions.get(i);
                template.slots.add(text.length());
                text.append('{').append(i).append('}');
                template.bindings.add(expr instanceof Identifier id ? id.name : TextTemplateExtractor.COMPLEX);
            }
        }
        template.template = text.toString();
        template.type = "attribute";
        return template;
    }
}
