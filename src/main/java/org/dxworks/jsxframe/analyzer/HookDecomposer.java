package org.dxworks.jsxframe.analyzer;

import org.dxworks.jsxframe.ast.ArrayPattern;
import org.dxworks.jsxframe.ast.AstHelper;
import org.dxworks.jsxframe.ast.BooleanLiteral;
import org.dxworks.jsxframe.ast.CallExpression;
import org.dxworks.jsxframe.ast.Expression;
import org.dxworks.jsxframe.ast.Identifier;
import org.dxworks.jsxframe.ast.MemberExpression;
import org.dxworks.jsxframe.ast.Node;
import org.dxworks.jsxframe.ast.NumericLiteral;
import org.dxworks.jsxframe.ast.ObjectExpression;
import org.dxworks.jsxframe.ast.ObjectMember;
import org.dxworks.jsxframe.ast.ObjectProperty;
import org.dxworks.jsxframe.ast.RegExpLiteral;
import org.dxworks.jsxframe.ast.StringLiteral;
import org.dxworks.jsxframe.ast.VariableDeclarator;
import org.dxworks.jsxframe.compiler.CompilerContext;
import org.dxworks.jsxframe.compiler.Diagnostics;
import org.dxworks.jsxframe.generator.ExpressionGenerator;
import org.dxworks.jsxframe.model.ComponentDescriptor;
import org.dxworks.jsxframe.model.DropdownInfo;
import org.dxworks.jsxframe.model.EffectInfo;
import org.dxworks.jsxframe.model.MarkdownInfo;
import org.dxworks.jsxframe.model.ModalInfo;
import org.dxworks.jsxframe.model.MvcStateInfo;
import org.dxworks.jsxframe.model.MvcViewModelInfo;
import org.dxworks.jsxframe.model.PredictHintInfo;
import org.dxworks.jsxframe.model.PubInfo;
import org.dxworks.jsxframe.model.RefInfo;
import org.dxworks.jsxframe.model.ScheduledTaskInfo;
import org.dxworks.jsxframe.model.SignalRInfo;
import org.dxworks.jsxframe.model.StateInfo;
import org.dxworks.jsxframe.model.SubInfo;
import org.dxworks.jsxframe.model.TemplateBaseInfo;
import org.dxworks.jsxframe.model.ToggleInfo;
import org.dxworks.jsxframe.model.ValidationInfo;
import org.dxworks.jsxframe.model.Zone;

/**
 * Recognises hook calls anywhere in a component body and records them on the descriptor.
 * A call whose shape does not match its hook is reported as a warning and skipped.
 */
public class HookDecomposer {

    private final CompilerContext context;
    private final ExpressionGenerator expressions;
    private final ServerTaskHooks serverTasks;

    public HookDecomposer(CompilerContext context, ExpressionGenerator expressions) {
        this.context = context;
        this.expressions = expressions;
        this.serverTasks = new ServerTaskHooks(context);
    }

    public void decompose(Node body) {
        visit(body);
    }

    private void visit(Node node) {
        if (node instanceof VariableDeclarator declarator && declarator.init instanceof CallExpression call) {
            visit(declarator.id);
            extractHook(call, declarator);
            visitChildren(call);
            return;
        }
        if (node instanceof CallExpression call) {
            extractHook(call, null);
        }
        visitChildren(node);
    }

    private void visitChildren(Node node) {
        for (Node child : AstHelper.children(node)) {
            visit(child);
        }
    }

    /**
     * @param declarator the declaration the call initialises, null for a bare call
     */
    void extractHook(CallExpression call, VariableDeclarator declarator) {
        String hook = AstHelper.calleeName(call);
        if (hook == null) {
            return;
        }

        switch (hook) {
            case "useState":
                extractState(call, declarator, hook, Zone.SERVER);
                break;
            case "useClientState":
                extractState(call, declarator, hook, Zone.CLIENT);
                break;
            case "useStateX":
                context.warn(Diagnostics.UNSUPPORTED_TRANSFORM, "useStateX projections are not supported");
                break;
            case "useEffect":
                component().useEffect.add(new EffectInfo(call.argument(0), call.argument(1)));
                break;
            case "useRef":
                extractRef(call, declarator);
                break;
            case "useMarkdown":
                extractMarkdown(call, declarator);
                break;
            case "useTemplate":
                extractTemplate(call);
                break;
            case "useValidation":
                extractValidation(call, declarator);
                break;
            case "useModal":
                if (named(hook, declarator)) {
                    component().useModal.add(new ModalInfo(declarator.name()));
                }
                break;
            case "useToggle":
                extractToggle(call, declarator);
                break;
            case "useDropdown":
                if (named(hook, declarator)) {
                    String route = call.argument(0) instanceof MemberExpression member ? expressions.generate(member) : null;
                    component().useDropdown.add(new DropdownInfo(declarator.name(), route));
                }
                break;
            case "usePub":
                if (named(hook, declarator)) {
                    component().usePub.add(new PubInfo(declarator.name(), stringValue(call.argument(0))));
                }
                break;
            case "useSub":
                if (named(hook, declarator)) {
                    component().useSub.add(new SubInfo(declarator.name(), stringValue(call.argument(0)),
                            call.argument(1) != null));
                }
                break;
            case "useMicroTask":
                component().useMicroTask.add(new ScheduledTaskInfo(call.argument(0), null));
                break;
            case "useMacroTask":
                int delay = call.argument(1) instanceof NumericLiteral num ? (int) num.value : 0;
                component().useMacroTask.add(new ScheduledTaskInfo(call.argument(0), delay));
                break;
            case "useSignalR":
                if (named(hook, declarator)) {
                    component().useSignalR.add(new SignalRInfo(declarator.name(), stringValue(call.argument(0)),
                            call.argument(1) != null));
                }
                break;
            case "usePredictHint":
                component().usePredictHint.add(new PredictHintInfo(stringValue(call.argument(0)), call.argument(1)));
                break;
            case "useServerTask":
                if (named(hook, declarator)) {
                    serverTasks.extractServerTask(call, declarator);
                }
                break;
            case "usePaginatedServerTask":
                if (named(hook, declarator)) {
                    serverTasks.extractPaginatedServerTask(call, declarator);
                }
                break;
            case "useMvcState":
                extractMvcState(call, declarator);
                break;
            case "useMvcViewModel":
                if (named(hook, declarator)) {
                    component().useMvcViewModel.add(new MvcViewModelInfo(declarator.name()));
                }
                break;
            default:
                break;
        }
    }

    private void extractState(CallExpression call, VariableDeclarator declarator, String hook, Zone zone) {
        ArrayPattern pattern = arrayPattern(hook, declarator);
        if (pattern == null) {
            return;
        }
        String name = pattern.nameAt(0);
        if (name == null) {
            malformed(hook, "first element of the destructuring must be an identifier");
            return;
        }
        Expression initial = call.argument(0);
        String type = call.typeArguments.isEmpty()
                ? TypeConversion.inferType(initial)
                : TypeConversion.tsTypeToCSharpType(call.typeArguments.get(0));
        StateInfo state = new StateInfo(name, pattern.nameAt(1), expressions.generate(initial), type);

        if (zone == Zone.SERVER) {
            component().useState.add(state);
        } else {
            component().useClientState.add(state);
        }
        component().stateTypes.put(name, zone);
    }

    private void extractRef(CallExpression call, VariableDeclarator declarator) {
        if (named("useRef", declarator)) {
            component().useRef.add(new RefInfo(declarator.name(), expressions.generate(call.argument(0))));
        }
    }

    private void extractMarkdown(CallExpression call, VariableDeclarator declarator) {
        ArrayPattern pattern = arrayPattern("useMarkdown", declarator);
        if (pattern == null || pattern.nameAt(0) == null) {
            return;
        }
        String name = pattern.nameAt(0);
        component().useMarkdown.add(new MarkdownInfo(name, pattern.nameAt(1), expressions.generate(call.argument(0))));
        component().stateTypes.put(name, Zone.MARKDOWN);
    }

    private void extractTemplate(CallExpression call) {
        if (!(call.argument(0) instanceof StringLiteral templateName)) {
            malformed("useTemplate", "template name must be a string literal");
            return;
        }
        TemplateBaseInfo template = new TemplateBaseInfo(templateName.value);
        if (call.argument(1) instanceof ObjectExpression props) {
            for (ObjectMember member : props.properties) {
                if (member instanceof ObjectProperty property && !property.computed
                        && property.key instanceof Identifier key) {
                    String value = property.value instanceof Expression expr ? AstHelper.literalText(expr) : null;
                    template.props.put(key.name, value != null ? value : "");
                }
            }
        }
        component().useTemplate = template;
    }

    private void extractValidation(CallExpression call, VariableDeclarator declarator) {
        if (!named("useValidation", declarator)) {
            return;
        }
        String name = declarator.name();
        String fieldKey = call.argument(0) instanceof StringLiteral key ? key.value : name;
        ValidationInfo validation = new ValidationInfo(name, fieldKey);
        if (call.argument(1) instanceof ObjectExpression rules) {
            for (ObjectMember member : rules.properties) {
                if (member instanceof ObjectProperty property && !property.computed
                        && property.key instanceof Identifier key) {
                    validation.rules.put(key.name, ruleValue(property.value));
                }
            }
        }
        component().useValidation.add(validation);
    }

    private static Object ruleValue(Node value) {
        if (value instanceof RegExpLiteral regex) {
            return "/" + regex.pattern + "/" + regex.flags;
        }
        if (value instanceof StringLiteral || value instanceof NumericLiteral || value instanceof BooleanLiteral) {
            return AstHelper.literalValue((Expression) value);
        }
        return null;
    }

    private void extractToggle(CallExpression call, VariableDeclarator declarator) {
        ArrayPattern pattern = arrayPattern("useToggle", declarator);
        if (pattern == null) {
            return;
        }
        if (pattern.nameAt(0) == null || pattern.nameAt(1) == null) {
            malformed("useToggle", "expected [value, toggle] identifiers");
            return;
        }
        component().useToggle.add(new ToggleInfo(pattern.nameAt(0), pattern.nameAt(1),
                expressions.generate(call.argument(0))));
    }

    private void extractMvcState(CallExpression call, VariableDeclarator declarator) {
        ArrayPattern pattern = arrayPattern("useMvcState", declarator);
        if (pattern == null) {
            return;
        }
        if (!(call.argument(0) instanceof StringLiteral property)) {
            malformed("useMvcState", "Property name must be a string literal");
            return;
        }
        String name = pattern.nameAt(0);
        if (name == null) {
            malformed("useMvcState", "first element of the destructuring must be an identifier");
            return;
        }
        String setter = pattern.elements.size() > 1 ? pattern.nameAt(1) : null;
        String type = call.typeArguments.isEmpty()
                ? "dynamic"
                : TypeConversion.tsTypeToCSharpType(call.typeArguments.get(0));

        component().useMvcState.add(new MvcStateInfo(name, setter, property.value, type));
        component().stateTypes.put(name, Zone.MVC);
    }

    private ArrayPattern arrayPattern(String hook, VariableDeclarator declarator) {
        if (declarator == null || !(declarator.id instanceof ArrayPattern pattern)) {
            malformed(hook, "result must be destructured into an array pattern");
            return null;
        }
        return pattern;
    }

    private boolean named(String hook, VariableDeclarator declarator) {
        if (declarator == null || declarator.name() == null) {
            malformed(hook, "result must be assigned to a variable");
            return false;
        }
        return true;
    }

    private void malformed(String hook, String message) {
        context.warn(Diagnostics.MALFORMED_HOOK, "[" + hook + "] " + message);
    }

    private static String stringValue(Expression expr) {
        return expr instanceof StringLiteral str ? str.value : null;
    }

    private ComponentDescriptor component() {
        return context.component();
    }
}
