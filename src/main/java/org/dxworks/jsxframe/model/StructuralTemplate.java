package org.dxworks.jsxframe.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class StructuralTemplate {
    public String type;
    public String stateKey;
    public String conditionBinding;
    /** {@code true/false} for ternaries, {@code truthy/falsy} for logical AND. */
    public Map<String, BranchTemplate> branches = new LinkedHashMap<>();
    public List<Integer> path;
}
