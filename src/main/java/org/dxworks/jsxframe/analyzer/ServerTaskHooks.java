package org.dxworks.jsxframe.analyzer;

import org.dxworks.jsxframe.ast.BooleanLiteral;
import org.dxworks.jsxframe.ast.CallExpression;
import org.dxworks.jsxframe.ast.Expression;
import org.dxworks.jsxframe.ast.FunctionExpression;
import org.dxworks.jsxframe.ast.Identifier;
import org.dxworks.jsxframe.ast.NumericLiteral;
import org.dxworks.jsxframe.ast.ObjectExpression;
import org.dxworks.jsxframe.ast.ObjectMember;
import org.dxworks.jsxframe.ast.ObjectProperty;
import org.dxworks.jsxframe.ast.Pattern;
import org.dxworks.jsxframe.ast.StringLiteral;
import org.dxworks.jsxframe.ast.TsTypeReference;
import org.dxworks.jsxframe.ast.TypeNode;
import org.dxworks.jsxframe.ast.VariableDeclarator;
import org.dxworks.jsxframe.compiler.CompilerContext;
import org.dxworks.jsxframe.compiler.Diagnostics;
import org.dxworks.jsxframe.model.PaginatedTaskInfo;
import org.dxworks.jsxframe.model.ParameterInfo;
import org.dxworks.jsxframe.model.ServerTaskInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@code useServerTask} and {@code usePaginatedServerTask}: async functions that become
 * {@code [ServerTask]} methods.
 */
class ServerTaskHooks {
    private static final Logger log = LoggerFactory.getLogger(ServerTaskHooks.class);

    static final int DEFAULT_PAGE_SIZE = 20;

    private final CompilerContext context;

    ServerTaskHooks(CompilerContext context) {
        this.context = context;
    }

    void extractServerTask(CallExpression call, VariableDeclarator declarator) {
        String taskName = declarator.name();
        FunctionExpression function = asyncFunction("useServerTask", call.argument(0));
        if (taskName == null || function == null) {
            return;
        }

        ServerTaskInfo task = new ServerTaskInfo(taskName, function);
        task.streaming = function.generator;
        for (Pattern param : function.params) {
            if (param instanceof Identifier id) {
                String type = id.typeAnnotation != null
                        ? TypeConversion.extractTypeAnnotation(id.typeAnnotation)
                        : "object";
                task.parameters.add(new ParameterInfo(id.name, type));
            }
        }

        Map<String, Expression> options = options(call.argument(1));
        if (options.get("stream") instanceof BooleanLiteral stream) {
            task.streaming = stream.value;
        }
        if (options.get("estimatedChunks") instanceof NumericLiteral chunks) {
            task.estimatedChunks = (int) chunks.value;
        }
        if (options.get("runtime") instanceof StringLiteral runtime) {
            task.runtime = runtime.value;
        }
        if (options.get("parallel") instanceof BooleanLiteral parallel) {
            task.parallel = parallel.value;
        }
        task.returnType = returnType(function);

        context.component().serverTasks.add(task);
    }

    void extractPaginatedServerTask(CallExpression call, VariableDeclarator declarator) {
        String taskName = declarator.name();
        FunctionExpression fetchFunction = asyncFunction("usePaginatedServerTask", call.argument(0));
        if (taskName == null || fetchFunction == null) {
            return;
        }

        String runtime = "csharp";
        boolean parallel = false;
        int pageSize = DEFAULT_PAGE_SIZE;
        Map<String, Expression> options = options(call.argument(1));
        if (options.get("runtime") instanceof StringLiteral str) {
            runtime = str.value;
        }
        if (options.get("parallel") instanceof BooleanLiteral bool) {
            parallel = bool.value;
        }
        if (options.get("pageSize") instanceof NumericLiteral num) {
            pageSize = (int) num.value;
        }

        String fetchTaskName = taskName + "_fetch";
        ServerTaskInfo fetch = new ServerTaskInfo(fetchTaskName, fetchFunction);
        fetch.parameters.addAll(List.of(
                new ParameterInfo("page", "int"),
                new ParameterInfo("pageSize", "int"),
                new ParameterInfo("filters", "object")));
        fetch.returnType = "List<object>";
        fetch.runtime = runtime;
        fetch.parallel = parallel;
        context.component().serverTasks.add(fetch);

        String countTaskName = null;
        if (options.get("getTotalCount") instanceof FunctionExpression countFunction) {
            countTaskName = taskName + "_count";
            ServerTaskInfo count = new ServerTaskInfo(countTaskName, countFunction);
            count.parameters.add(new ParameterInfo("filters", "object"));
            count.returnType = "int";
            count.runtime = runtime;
            context.component().serverTasks.add(count);
        }

        context.component().paginatedTasks.add(
                new PaginatedTaskInfo(taskName, fetchTaskName, countTaskName, pageSize, runtime, parallel));
        log.debug("[{}] Paginated task {}: fetch={}, count={}", context.componentName(), taskName,
                fetchTaskName, countTaskName);
    }

    private FunctionExpression asyncFunction(String hook, Expression argument) {
        if (!(argument instanceof FunctionExpression function)) {
            context.warn(Diagnostics.MALFORMED_HOOK, "[" + hook + "] First argument must be an async function");
            return null;
        }
        if (!function.async) {
            context.warn(Diagnostics.MALFORMED_HOOK, "[" + hook + "] Function must be async");
            return null;
        }
        return function;
    }

    /**
     * {@code Promise<T>} unwraps to T; no annotation means {@code object}.
     */
    static String returnType(FunctionExpression function) {
        TypeNode annotation = function.returnType;
        if (annotation == null) {
            return "object";
        }
        if (annotation instanceof TsTypeReference reference
                && reference.name.equals("Promise")
                && !reference.typeArguments.isEmpty()) {
            return TypeConversion.extractTypeAnnotation(reference.typeArguments.get(0));
        }
        return TypeConversion.extractTypeAnnotation(annotation);
    }

    private static Map<String, Expression> options(Expression argument) {
        Map<String, Expression> options = new LinkedHashMap<>();
        if (argument instanceof ObjectExpression object) {
            for (ObjectMember member : object.properties) {
                if (member instanceof ObjectProperty property
                        && !property.computed
                        && property.key instanceof Identifier key
                        && property.value instanceof Expression value) {
                    options.put(key.name, value);
                }
            }
        }
        return options;
    }
}
