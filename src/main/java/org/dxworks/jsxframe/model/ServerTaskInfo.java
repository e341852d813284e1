package org.dxworks.jsxframe.model;

import org.dxworks.jsxframe.ast.FunctionExpression;

import java.util.ArrayList;
import java.util.List;

/**
 * An async function that runs on the server; emitted as a {@code [ServerTask]} method.
 */
public class ServerTaskInfo {
    public String name;
    public FunctionExpression function;
    public List<ParameterInfo> parameters = new ArrayList<>();
    public boolean streaming;
    public Integer estimatedChunks;
    public String returnType = "object";
    public String runtime = "csharp";
    public boolean parallel;

    public ServerTaskInfo(String name, FunctionExpression function) {
        this.name = name;
        this.function = function;
    }
}
