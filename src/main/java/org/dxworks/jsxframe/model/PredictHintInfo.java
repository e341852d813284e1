package org.dxworks.jsxframe.model;

import org.dxworks.jsxframe.ast.Expression;

public class PredictHintInfo {
    public String hintId;
    public Expression predictedState;

    public PredictHintInfo(String hintId, Expression predictedState) {
        this.hintId = hintId;
        this.predictedState = predictedState;
    }
}
