package org.dxworks.jsxframe.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * A computed value with a machine-applicable transform. {@code complexExpression} entries carry
 * only the formula text and are informational.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ExpressionTemplate {
    public String type;
    public String stateKey;
    public String binding;
    public List<String> bindings;
    public String method;
    public List<Object> args;
    public String property;
    public String operator;
    public String expression;
    public Transform transform;
    public List<Integer> path;
    public String attribute;
}
