package org.dxworks.jsxframe.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Map;

/**
 * Simplified subtree of a structural branch. Props map to a string, {@code {binding: name}} or
 * {@code {expression: true}}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BranchTemplate {
    public String type;
    public String tag;
    public Map<String, Object> props;
    public List<BranchTemplate> children;
    public String content;

    public static BranchTemplate nullBranch() {
        BranchTemplate branch = new BranchTemplate();
        branch.type = "Null";
        return branch;
    }

    public static BranchTemplate text(String content) {
        BranchTemplate branch = new BranchTemplate();
        branch.type = "Text";
        branch.content = content;
        return branch;
    }
}
