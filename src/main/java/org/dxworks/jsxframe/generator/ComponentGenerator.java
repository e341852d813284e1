package org.dxworks.jsxframe.generator;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.dxworks.jsxframe.analyzer.TypeConversion;
import org.dxworks.jsxframe.ast.ArrayExpression;
import org.dxworks.jsxframe.ast.AstHelper;
import org.dxworks.jsxframe.ast.BlockStatement;
import org.dxworks.jsxframe.ast.Expression;
import org.dxworks.jsxframe.ast.FunctionExpression;
import org.dxworks.jsxframe.ast.Identifier;
import org.dxworks.jsxframe.ast.Pattern;
import org.dxworks.jsxframe.ast.Statement;
import org.dxworks.jsxframe.compiler.CompilerContext;
import org.dxworks.jsxframe.model.ComponentDescriptor;
import org.dxworks.jsxframe.model.EffectInfo;
import org.dxworks.jsxframe.model.EventHandlerInfo;
import org.dxworks.jsxframe.model.LocalVariable;
import org.dxworks.jsxframe.model.LoopTemplate;
import org.dxworks.jsxframe.model.MarkdownInfo;
import org.dxworks.jsxframe.model.MvcStateInfo;
import org.dxworks.jsxframe.model.MvcViewModelInfo;
import org.dxworks.jsxframe.model.ParameterInfo;
import org.dxworks.jsxframe.model.PropInfo;
import org.dxworks.jsxframe.model.PubInfo;
import org.dxworks.jsxframe.model.RefInfo;
import org.dxworks.jsxframe.model.ServerTaskInfo;
import org.dxworks.jsxframe.model.SignalRInfo;
import org.dxworks.jsxframe.model.StateInfo;
import org.dxworks.jsxframe.model.SubInfo;
import org.dxworks.jsxframe.model.ToggleInfo;
import org.dxworks.jsxframe.model.ValidationInfo;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Phase two: emits the C# partial class of one analysed component. Reads the descriptor only;
 * the source tree is reached through the nodes it recorded.
 */
public class ComponentGenerator {

    private static final ObjectMapper LOOP_JSON = new ObjectMapper();

    private final CompilerContext context;
    private final ExpressionGenerator expressions;
    private final StatementGenerator statements;
    private final RenderBodyGenerator renderBody;
    private final ServerTaskTranspiler serverTasks = new ServerTaskTranspiler();

    public ComponentGenerator(CompilerContext context) {
        this.context = context;
        this.expressions = new ExpressionGenerator(context);
        this.statements = new StatementGenerator(expressions);
        this.renderBody = new RenderBodyGenerator(new JsxGenerator(context, expressions), expressions);
    }

    public List<String> generate() {
        ComponentDescriptor component = context.component();
        List<String> lines = new ArrayList<>();

        for (LoopTemplate loop : component.loopTemplates) {
            lines.add("[LoopTemplate(\"" + loop.stateKey + "\", @\"" + loopJson(loop).replace("\"", "\"\"") + "\")]");
        }

        lines.add("[Component]");
        String baseClass = component.useTemplate != null ? component.useTemplate.name : "MinimactComponent";
        lines.add("public partial class " + component.name + " : " + baseClass);
        lines.add("{");

        addFields(component, lines);
        addServerTasks(component, lines);
        addRender(component, lines);
        addEffects(component, lines);
        addHandlers(component, lines);
        addHookMethods(component, lines);

        lines.add("}");
        return lines;
    }

    private void addFields(ComponentDescriptor component, List<String> lines) {
        if (component.useTemplate != null) {
            for (Map.Entry<String, String> prop : component.useTemplate.props.entrySet()) {
                lines.add("    public override string " + AstHelper.capitalize(prop.getKey()) + " => "
                        + CSharpStrings.quote(prop.getValue()) + ";");
                lines.add("");
            }
        }

        for (PropInfo prop : component.props) {
            lines.add("    [Prop]");
            lines.add("    public " + prop.type + " " + prop.name + " { get; set; }");
            lines.add("");
        }

        for (StateInfo state : component.useState) {
            lines.add("    [State]");
            lines.add("    private " + state.type + " " + state.name + " = " + state.initialValue + ";");
            lines.add("");
        }

        // view-model values already live in the State dictionary
        for (MvcStateInfo mvc : component.useMvcState) {
            String type = mvc.type != null ? mvc.type : "dynamic";
            lines.add("    // MVC State property: " + mvc.propertyName);
            lines.add("    private " + type + " " + mvc.name + " => GetState<" + type + ">(\"" + mvc.propertyName + "\");");
            lines.add("");
        }

        for (MvcViewModelInfo viewModel : component.useMvcViewModel) {
            lines.add("    // useMvcViewModel - read-only access to entire ViewModel");
            lines.add("    private dynamic " + viewModel.name + " = null;");
            lines.add("");
        }

        for (RefInfo ref : component.useRef) {
            lines.add("    [Ref]");
            lines.add("    private object " + ref.name + " = " + ref.initialValue + ";");
            lines.add("");
        }

        for (MarkdownInfo markdown : component.useMarkdown) {
            lines.add("    [Markdown]");
            lines.add("    [State]");
            lines.add("    private string " + markdown.name + " = " + markdown.initialValue + ";");
            lines.add("");
        }

        for (ValidationInfo validation : component.useValidation) {
            addValidation(validation, lines);
        }

        component.useModal.forEach(modal -> {
            lines.add("    private ModalState " + modal.name + " = new ModalState();");
            lines.add("");
        });

        for (ToggleInfo toggle : component.useToggle) {
            lines.add("    [State]");
            lines.add("    private bool " + toggle.name + " = " + toggle.initialValue + ";");
            lines.add("");
        }

        component.useDropdown.forEach(dropdown -> {
            lines.add("    private DropdownState " + dropdown.name + " = new DropdownState();");
            lines.add("");
        });

        for (PubInfo pub : component.usePub) {
            lines.add("    // usePub: " + pub.name);
            lines.add("    private string " + pub.name + "_channel = " + quoteOrNull(pub.channel) + ";");
            lines.add("");
        }

        for (SubInfo sub : component.useSub) {
            lines.add("    // useSub: " + sub.name);
            lines.add("    private string " + sub.name + "_channel = " + quoteOrNull(sub.channel) + ";");
            lines.add("    private dynamic " + sub.name + "_value = null;");
            lines.add("");
        }

        for (int i = 0; i < component.useMicroTask.size(); i++) {
            lines.add("    // useMicroTask " + i);
            lines.add("    private bool _microTaskScheduled_" + i + " = false;");
            lines.add("");
        }

        for (int i = 0; i < component.useMacroTask.size(); i++) {
            lines.add("    // useMacroTask " + i + " (delay: " + component.useMacroTask.get(i).delay + "ms)");
            lines.add("    private bool _macroTaskScheduled_" + i + " = false;");
            lines.add("");
        }

        for (SignalRInfo signalR : component.useSignalR) {
            lines.add("    // useSignalR: " + signalR.name);
            lines.add("    private string " + signalR.name + "_hubUrl = " + quoteOrNull(signalR.hubUrl) + ";");
            lines.add("    private bool " + signalR.name + "_connected = false;");
            lines.add("    private string " + signalR.name + "_connectionId = null;");
            lines.add("    private string " + signalR.name + "_error = null;");
            lines.add("");
        }

        for (int i = 0; i < component.usePredictHint.size(); i++) {
            String hintId = component.usePredictHint.get(i).hintId;
            String hintLiteral = CSharpStrings.quote(hintId != null ? hintId : "hint_" + i);
            lines.add("    // usePredictHint: " + hintLiteral);
            lines.add("    private string _hintId_" + i + " = " + hintLiteral + ";");
            lines.add("");
        }

        List<LocalVariable> clientComputed = component.localVariables.stream().filter(v -> v.clientComputed).toList();
        if (!clientComputed.isEmpty()) {
            lines.add("    // Client-computed properties (external libraries)");
            for (LocalVariable variable : clientComputed) {
                String type = TypeConversion.inferCSharpTypeFromInit(variable.init);
                lines.add("    [ClientComputed(\"" + variable.name + "\")]");
                lines.add("    private " + type + " " + variable.name + " => GetClientState<" + type + ">(\""
                        + variable.name + "\", default);");
                lines.add("");
            }
        }
    }

    private static void addValidation(ValidationInfo validation, List<String> lines) {
        Map<String, Object> rules = validation.rules;
        lines.add("    [Validation]");
        lines.add("    private ValidationField " + validation.name + " = new ValidationField");
        lines.add("    {");
        lines.add("        FieldKey = " + CSharpStrings.quote(validation.fieldKey) + ",");
        if (Boolean.TRUE.equals(rules.get("required"))) {
            lines.add("        Required = true,");
        }
        if (isSet(rules.get("minLength"))) {
            lines.add("        MinLength = " + ruleText(rules.get("minLength")) + ",");
        }
        if (isSet(rules.get("maxLength"))) {
            lines.add("        MaxLength = " + ruleText(rules.get("maxLength")) + ",");
        }
        if (isSet(rules.get("pattern"))) {
            lines.add("        Pattern = @\"" + ruleText(rules.get("pattern")).replace("\"", "\"\"") + "\",");
        }
        if (isSet(rules.get("message"))) {
            lines.add("        Message = " + CSharpStrings.quote(ruleText(rules.get("message"))));
        }
        lines.add("    };");
        lines.add("");
    }

    // zero, false and empty rules are left out
    private static boolean isSet(Object value) {
        if (value == null || Boolean.FALSE.equals(value) || "".equals(value)) {
            return false;
        }
        return !(value instanceof Number number) || number.doubleValue() != 0;
    }

    private static String ruleText(Object value) {
        if (value instanceof Double number) {
            return AstHelper.formatNumber(number);
        }
        return String.valueOf(value);
    }

    private void addServerTasks(ComponentDescriptor component, List<String> lines) {
        for (int i = 0; i < component.serverTasks.size(); i++) {
            ServerTaskInfo task = component.serverTasks.get(i);
            String taskId = "serverTask_" + i;

            lines.add("");
            lines.add("    [ServerTask(\"" + taskId + "\"" + (task.streaming ? ", Streaming = true" : "") + ")]");

            List<String> params = new ArrayList<>();
            for (ParameterInfo param : task.parameters) {
                params.add(param.type + " " + param.name);
            }
            if (task.streaming) {
                params.add("[EnumeratorCancellation] CancellationToken cancellationToken = default");
            } else {
                params.add("IProgress<double> progress");
                params.add("CancellationToken cancellationToken");
            }
            String returnType = task.streaming
                    ? "IAsyncEnumerable<" + task.returnType + ">"
                    : "Task<" + task.returnType + ">";

            lines.add("    private async " + returnType + " " + AstHelper.capitalize(taskId) + "("
                    + String.join(", ", params) + ")");
            lines.add("    {");
            lines.add(CSharpStrings.indent(serverTasks.transpileFunction(task.function), 8));
            lines.add("    }");
        }
    }

    private void addRender(ComponentDescriptor component, List<String> lines) {
        String method = component.useTemplate != null ? "RenderContent" : "Render";
        lines.add("    protected override VNode " + method + "()");
        lines.add("    {");

        // template base classes sync state themselves
        if (component.useTemplate == null) {
            lines.add("        StateManager.SyncMembersToState(this);");
            lines.add("");
        }

        if (!component.useMvcState.isEmpty()) {
            lines.add("        // MVC State - read from State dictionary");
            for (MvcStateInfo mvc : component.useMvcState) {
                String type = mvc.type != null && !mvc.type.equals("object") ? mvc.type : "dynamic";
                lines.add("        var " + mvc.name + " = GetState<" + type + ">(\"" + mvc.propertyName + "\");");
            }
            lines.add("");
        }

        List<LocalVariable> locals = component.localVariables.stream().filter(v -> !v.clientComputed).toList();
        for (LocalVariable local : locals) {
            lines.add("        " + local.type + " " + local.name + " = " + local.initialValue + ";");
        }
        if (!locals.isEmpty()) {
            lines.add("");
        }

        lines.add(renderBody.generate(component.renderBody, 2));
        lines.add("    }");
    }

    private void addEffects(ComponentDescriptor component, List<String> lines) {
        for (int i = 0; i < component.useEffect.size(); i++) {
            EffectInfo effect = component.useEffect.get(i);
            lines.add("");
            if (effect.dependencies instanceof ArrayExpression deps) {
                for (Expression dep : deps.elements) {
                    if (dep instanceof Identifier id) {
                        lines.add("    [OnStateChanged(\"" + id.name + "\")]");
                    }
                }
            }
            lines.add("    private void Effect_" + i + "()");
            lines.add("    {");
            if (effect.body instanceof FunctionExpression function) {
                if (function.body instanceof BlockStatement block) {
                    for (Statement statement : block.body) {
                        lines.add("        " + statements.generate(statement));
                    }
                } else {
                    lines.add("        " + expressions.generate(function.body) + ";");
                }
            }
            lines.add("    }");
        }
    }

    private void addHandlers(ComponentDescriptor component, List<String> lines) {
        for (EventHandlerInfo handler : component.eventHandlers) {
            lines.add("");
            List<String> params = new ArrayList<>();
            for (Pattern param : handler.params) {
                params.add(param instanceof Identifier id ? "dynamic " + id.name : "dynamic arg");
            }
            // public so the hub can invoke them
            lines.add("    public void " + handler.name + "(" + String.join(", ", params) + ")");
            lines.add("    {");
            if (handler.body instanceof BlockStatement block) {
                for (Statement statement : block.body) {
                    String code = statements.generate(statement);
                    if (!code.isEmpty()) {
                        lines.add("        " + code);
                    }
                }
            } else if (handler.body != null) {
                lines.add("        " + expressions.generate(handler.body) + ";");
            }
            lines.add("    }");
        }
    }

    private void addHookMethods(ComponentDescriptor component, List<String> lines) {
        for (ToggleInfo toggle : component.useToggle) {
            lines.add("");
            lines.add("    private void " + toggle.toggleFunc + "()");
            lines.add("    {");
            lines.add("        " + toggle.name + " = !" + toggle.name + ";");
            lines.add("        SetState(\"" + toggle.name + "\", " + toggle.name + ");");
            lines.add("    }");
        }

        for (PubInfo pub : component.usePub) {
            lines.add("");
            lines.add("    // Publish to " + pub.name + "_channel");
            lines.add("    private void " + pub.name + "(dynamic value, PubSubOptions? options = null)");
            lines.add("    {");
            lines.add("        EventAggregator.Instance.Publish(" + pub.name + "_channel, value, options);");
            lines.add("    }");
        }

        // one override subscribes every channel
        if (!component.useSub.isEmpty()) {
            lines.add("");
            lines.add("    protected override void OnInitialized()");
            lines.add("    {");
            lines.add("        base.OnInitialized();");
            for (SubInfo sub : component.useSub) {
                lines.add("");
                lines.add("        // Subscribe to " + sub.name + "_channel");
                lines.add("        EventAggregator.Instance.Subscribe(" + sub.name + "_channel, (msg) => {");
                lines.add("            " + sub.name + "_value = msg.Value;");
                lines.add("            SetState(\"" + sub.name + "_value\", " + sub.name + "_value);");
                lines.add("        });");
            }
            lines.add("    }");
        }

        for (SignalRInfo signalR : component.useSignalR) {
            lines.add("");
            lines.add("    // SignalR send method for " + signalR.name);
            lines.add("    private async Task " + signalR.name + "_send(string methodName, params object[] args)");
            lines.add("    {");
            lines.add("        if (HubContext != null && ConnectionId != null)");
            lines.add("        {");
            lines.add("            await HubContext.Clients.Client(ConnectionId).SendAsync(methodName, args);");
            lines.add("        }");
            lines.add("    }");
        }

        for (MvcStateInfo mvc : component.useMvcState) {
            if (mvc.setter == null) {
                continue;
            }
            String type = mvc.type != null && !mvc.type.equals("object") ? mvc.type : "dynamic";
            lines.add("");
            lines.add("    private void " + mvc.setter + "(" + type + " value)");
            lines.add("    {");
            lines.add("        SetState(\"" + mvc.propertyName + "\", value);");
            lines.add("    }");
        }
    }

    private static String quoteOrNull(String value) {
        return value != null ? CSharpStrings.quote(value) : "null";
    }

    private static String loopJson(LoopTemplate loop) {
        try {
            return LOOP_JSON.writeValueAsString(loop);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize loop template for " + loop.stateKey, e);
        }
    }
}
