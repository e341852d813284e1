package org.dxworks.jsxframe.compiler;

import org.dxworks.jsxframe.ast.ExportDefaultDeclaration;
import org.dxworks.jsxframe.ast.ExportNamedDeclaration;
import org.dxworks.jsxframe.ast.FunctionDeclaration;
import org.dxworks.jsxframe.ast.FunctionExpression;
import org.dxworks.jsxframe.ast.ImportDeclaration;
import org.dxworks.jsxframe.ast.ImportSpecifier;
import org.dxworks.jsxframe.ast.Node;
import org.dxworks.jsxframe.ast.Program;
import org.dxworks.jsxframe.ast.Statement;
import org.dxworks.jsxframe.ast.VariableDeclaration;
import org.dxworks.jsxframe.ast.VariableDeclarator;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Finds the components of a file (top-level functions whose name starts with an uppercase
 * letter) and the local names bound by imports of external libraries.
 */
public class ComponentLocator {

    public static class LocatedComponent {
        public final String name;
        public final FunctionExpression function;

        LocatedComponent(String name, FunctionExpression function) {
            this.name = name;
            this.function = function;
        }
    }

    private ComponentLocator() {
    }

    public static List<LocatedComponent> locate(Program program) {
        List<LocatedComponent> components = new ArrayList<>();
        for (Statement statement : program.body) {
            collect(unwrap(statement), components);
        }
        return components;
    }

    private static Node unwrap(Statement statement) {
        if (statement instanceof ExportNamedDeclaration export) {
            return export.declaration;
        }
        if (statement instanceof ExportDefaultDeclaration export) {
            return export.declaration;
        }
        return statement;
    }

    private static void collect(Node node, List<LocatedComponent> components) {
        if (node instanceof FunctionDeclaration declaration && isComponentName(declaration.id)) {
            components.add(new LocatedComponent(declaration.id, asExpression(declaration)));
        } else if (node instanceof VariableDeclaration declaration) {
            for (VariableDeclarator declarator : declaration.declarations) {
                String name = declarator.name();
                if (isComponentName(name) && declarator.init instanceof FunctionExpression function) {
                    components.add(new LocatedComponent(name, function));
                }
            }
        }
    }

    static boolean isComponentName(String name) {
        return name != null && !name.isEmpty() && Character.isUpperCase(name.charAt(0));
    }

    private static FunctionExpression asExpression(FunctionDeclaration declaration) {
        return new FunctionExpression(declaration.id, declaration.params, declaration.body, false,
                declaration.async, declaration.generator, declaration.returnType);
    }

    /**
     * Local names of imports from outside the framework, relative paths and stylesheets.
     */
    public static Set<String> externalImports(Program program) {
        Set<String> names = new LinkedHashSet<>();
        for (Statement statement : program.body) {
            if (statement instanceof ImportDeclaration declaration && isExternal(declaration.source)) {
                for (ImportSpecifier specifier : declaration.specifiers) {
                    names.add(specifier.local);
                }
            }
        }
        return names;
    }

    static boolean isExternal(String source) {
        if (source == null) {
            return false;
        }
        if (source.startsWith("minimact") || source.startsWith(".") || source.startsWith("/")) {
            return false;
        }
        return !source.endsWith(".css") && !source.endsWith(".scss") && !source.endsWith(".sass");
    }
}
