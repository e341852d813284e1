package org.dxworks.jsxframe.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Parameterized text: {@code template} holds {@code {0}, {1}, ...} placeholders, one binding per
 * placeholder, and {@code slots} holds each placeholder's character offset.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Template {
    public String template;
    public List<String> bindings = new ArrayList<>();
    public List<Integer> slots = new ArrayList<>();
    public List<Integer> path;
    @JsonIgnore
    public String attribute;
    public String type;
    public Map<String, Object> conditionalTemplates;
    public Transform transform;
    public Boolean nullable;
    public Integer conditionalBindingIndex;
}
