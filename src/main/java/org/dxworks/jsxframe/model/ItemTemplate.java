package org.dxworks.jsxframe.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Map;

/**
 * Node of a loop body: an {@code Element} with prop and child templates, or a {@code Text}
 * (type {@code conditional} for literal ternaries) whose bindings are relative to the item.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ItemTemplate {
    public String type;
    public String tag;
    public Map<String, Template> propsTemplates;
    public List<ItemTemplate> childrenTemplates;
    public String template;
    public List<String> bindings;
    public List<Integer> slots;
    public Map<String, Object> conditionalTemplates;
    public Integer conditionalBindingIndex;

    public static ItemTemplate element(String tag, Map<String, Template> propsTemplates,
                                       List<ItemTemplate> childrenTemplates) {
        ItemTemplate item = new ItemTemplate();
        item.type = "Element";
        item.tag = tag;
        item.propsTemplates = propsTemplates;
        item.childrenTemplates = childrenTemplates;
        return item;
    }

    public static ItemTemplate text(String template, List<String> bindings, List<Integer> slots) {
        ItemTemplate item = new ItemTemplate();
        item.type = "Text";
        item.template = template;
        item.bindings = bindings;
        item.slots = slots;
        return item;
    }
}
