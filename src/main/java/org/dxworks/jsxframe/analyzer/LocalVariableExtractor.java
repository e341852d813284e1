package org.dxworks.jsxframe.analyzer;

import org.dxworks.jsxframe.ast.ArrayExpression;
import org.dxworks.jsxframe.ast.AstHelper;
import org.dxworks.jsxframe.ast.BinaryExpression;
import org.dxworks.jsxframe.ast.BlockStatement;
import org.dxworks.jsxframe.ast.CallExpression;
import org.dxworks.jsxframe.ast.ConditionalExpression;
import org.dxworks.jsxframe.ast.ExpressionStatement;
import org.dxworks.jsxframe.ast.FunctionExpression;
import org.dxworks.jsxframe.ast.Identifier;
import org.dxworks.jsxframe.ast.LogicalExpression;
import org.dxworks.jsxframe.ast.MemberExpression;
import org.dxworks.jsxframe.ast.Node;
import org.dxworks.jsxframe.ast.ObjectExpression;
import org.dxworks.jsxframe.ast.ObjectMember;
import org.dxworks.jsxframe.ast.ObjectProperty;
import org.dxworks.jsxframe.ast.ReturnStatement;
import org.dxworks.jsxframe.ast.Statement;
import org.dxworks.jsxframe.ast.VariableDeclaration;
import org.dxworks.jsxframe.ast.VariableDeclarator;
import org.dxworks.jsxframe.compiler.CompilerContext;
import org.dxworks.jsxframe.generator.ExpressionGenerator;
import org.dxworks.jsxframe.model.ComponentDescriptor;
import org.dxworks.jsxframe.model.EventHandlerInfo;
import org.dxworks.jsxframe.model.LocalVariable;

import java.util.Set;

/**
 * Declarations of the component body itself (not of nested functions). Functions become
 * event handlers; anything touching an external import is computed on the client.
 */
public class LocalVariableExtractor {

    private final CompilerContext context;
    private final ExpressionGenerator expressions;

    public LocalVariableExtractor(CompilerContext context, ExpressionGenerator expressions) {
        this.context = context;
        this.expressions = expressions;
    }

    public void extract(BlockStatement body) {
        visitBlock(body);
    }

    private void visitBlock(BlockStatement block) {
        for (Statement statement : block.body) {
            if (statement instanceof VariableDeclaration declaration) {
                for (VariableDeclarator declarator : declaration.declarations) {
                    extractDeclarator(declarator);
                }
            }
            visitNested(statement);
        }
    }

    // Blocks nested in control flow still belong to the component function.
    private void visitNested(Node node) {
        for (Node child : AstHelper.children(node)) {
            if (AstHelper.isFunction(child)) {
                continue;
            }
            if (child instanceof BlockStatement block) {
                visitBlock(block);
            } else {
                visitNested(child);
            }
        }
    }

    private void extractDeclarator(VariableDeclarator declarator) {
        if (declarator.init instanceof CallExpression call) {
            String callee = AstHelper.calleeName(call);
            if (callee != null && callee.startsWith("use")) {
                return;
            }
        }
        if (!(declarator.id instanceof Identifier id) || declarator.init == null) {
            return;
        }

        ComponentDescriptor component = context.component();
        Set<String> externalImports = component.externalImports;

        if (declarator.init instanceof FunctionExpression function) {
            if (usesExternalLibrary(function.body, externalImports)) {
                component.localVariables.add(new LocalVariable(id.name, "dynamic", "null", true, true, function));
            } else {
                component.eventHandlers.add(new EventHandlerInfo(id.name, function.params, function.body));
            }
            return;
        }

        boolean clientComputed = usesExternalLibrary(declarator.init, externalImports);
        String type = id.typeAnnotation != null ? TypeConversion.tsTypeToCSharpType(id.typeAnnotation) : "var";
        component.localVariables.add(new LocalVariable(id.name, type, expressions.generate(declarator.init),
                clientComputed, false, declarator.init));
    }

    /**
     * True when the expression reads one of the given import bindings, looking through member
     * objects, calls, operators, literals, function bodies and simple statements.
     */
    public static boolean usesExternalLibrary(Node node, Set<String> externalImports) {
        if (node == null || externalImports.isEmpty()) {
            return false;
        }
        if (node instanceof Identifier id) {
            return externalImports.contains(id.name);
        }
        if (node instanceof MemberExpression member) {
            return usesExternalLibrary(member.object, externalImports);
        }
        if (node instanceof CallExpression call) {
            return usesExternalLibrary(call.callee, externalImports)
                    || call.arguments.stream().anyMatch(arg -> usesExternalLibrary(arg, externalImports));
        }
        if (node instanceof BinaryExpression binary) {
            return usesExternalLibrary(binary.left, externalImports) || usesExternalLibrary(binary.right, externalImports);
        }
        if (node instanceof LogicalExpression logical) {
            return usesExternalLibrary(logical.left, externalImports) || usesExternalLibrary(logical.right, externalImports);
        }
        if (node instanceof ConditionalExpression cond) {
            return usesExternalLibrary(cond.test, externalImports)
                    || usesExternalLibrary(cond.consequent, externalImports)
                    || usesExternalLibrary(cond.alternate, externalImports);
        }
        if (node instanceof ArrayExpression array) {
            return array.elements.stream().anyMatch(el -> usesExternalLibrary(el, externalImports));
        }
        if (node instanceof ObjectExpression object) {
            for (ObjectMember member : object.properties) {
                if (member instanceof ObjectProperty property && usesExternalLibrary(property.value, externalImports)) {
                    return true;
                }
            }
            return false;
        }
        if (node instanceof FunctionExpression function) {
            return usesExternalLibrary(function.body, externalImports);
        }
        if (node instanceof BlockStatement block) {
            return block.body.stream().anyMatch(stmt -> usesExternalLibrary(stmt, externalImports));
        }
        if (node instanceof ReturnStatement ret) {
            return usesExternalLibrary(ret.argument, externalImports);
        }
        if (node instanceof ExpressionStatement stmt) {
            return usesExternalLibrary(stmt.expression, externalImports);
        }
        return false;
    }
}
