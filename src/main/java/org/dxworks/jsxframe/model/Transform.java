package org.dxworks.jsxframe.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Map;

/**
 * Whitelisted, side-effect free operation a runtime can re-apply to fresh state.
 * Only the fields relevant to the transform family are set.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Transform {
    public String type;
    public String method;
    public List<Object> args;
    public String property;
    public String operator;
    public List<Map<String, Object>> operations;

    public static Transform methodCall(String method, List<Object> args) {
        Transform transform = new Transform();
        transform.method = method;
        transform.args = args;
        return transform;
    }

    public static Transform of(String type, String method, List<Object> args) {
        Transform transform = methodCall(method, args);
        transform.type = type;
        return transform;
    }
}
