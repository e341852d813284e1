package org.dxworks.jsxframe.model;

import org.dxworks.jsxframe.ast.Expression;

public class EffectInfo {
    public Expression body;
    public Expression dependencies;

    public EffectInfo(Expression body, Expression dependencies) {
        this.body = body;
        this.dependencies = dependencies;
    }
}
