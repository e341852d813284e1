package org.dxworks.jsxframe.model;

import org.dxworks.jsxframe.ast.Expression;

/**
 * A {@code useMicroTask} or {@code useMacroTask} callback. Micro tasks have no delay.
 */
public class ScheduledTaskInfo {
    public Expression body;
    public Integer delay;

    public ScheduledTaskInfo(Expression body, Integer delay) {
        this.body = body;
        this.delay = delay;
    }
}
