package org.dxworks.jsxframe.model;

import org.dxworks.jsxframe.ast.Expression;
import org.dxworks.jsxframe.ast.FunctionExpression;
import org.dxworks.jsxframe.ast.JsxAttribute;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Everything the analysis phase learns about one component. Code emission reads it and never
 * goes back to the source tree except through {@link #renderBody} and the recorded nodes.
 */
public class ComponentDescriptor {
    public String name;
    public FunctionExpression function;
    public List<PropInfo> props = new ArrayList<>();

    public List<StateInfo> useState = new ArrayList<>();
    public List<StateInfo> useClientState = new ArrayList<>();
    public List<EffectInfo> useEffect = new ArrayList<>();
    public List<RefInfo> useRef = new ArrayList<>();
    public List<MarkdownInfo> useMarkdown = new ArrayList<>();
    public TemplateBaseInfo useTemplate;
    public List<ValidationInfo> useValidation = new ArrayList<>();
    public List<ModalInfo> useModal = new ArrayList<>();
    public List<ToggleInfo> useToggle = new ArrayList<>();
    public List<DropdownInfo> useDropdown = new ArrayList<>();
    public List<PubInfo> usePub = new ArrayList<>();
    public List<SubInfo> useSub = new ArrayList<>();
    public List<ScheduledTaskInfo> useMicroTask = new ArrayList<>();
    public List<ScheduledTaskInfo> useMacroTask = new ArrayList<>();
    public List<SignalRInfo> useSignalR = new ArrayList<>();
    public List<PredictHintInfo> usePredictHint = new ArrayList<>();
    public List<ServerTaskInfo> serverTasks = new ArrayList<>();
    public List<PaginatedTaskInfo> paginatedTasks = new ArrayList<>();
    public List<MvcStateInfo> useMvcState = new ArrayList<>();
    public List<MvcViewModelInfo> useMvcViewModel = new ArrayList<>();

    public List<LocalVariable> localVariables = new ArrayList<>();
    public List<EventHandlerInfo> eventHandlers = new ArrayList<>();
    /** Handler method name chosen for each {@code on*} attribute of the render tree. */
    public Map<JsxAttribute, String> handlerNames = new IdentityHashMap<>();

    public Map<String, Zone> stateTypes = new LinkedHashMap<>();
    public Set<String> externalImports = new LinkedHashSet<>();
    public List<PluginUsage> pluginUsages = new ArrayList<>();

    /** Argument of the component's final top-level return; null when it renders nothing. */
    public Expression renderBody;

    public Map<String, Template> templates = new LinkedHashMap<>();
    public List<LoopTemplate> loopTemplates = new ArrayList<>();
    public List<StructuralTemplate> structuralTemplates = new ArrayList<>();
    public List<ExpressionTemplate> expressionTemplates = new ArrayList<>();

    public ComponentDescriptor(String name) {
        this.name = name;
    }

    public boolean hasTemplates() {
        return !templates.isEmpty() || !loopTemplates.isEmpty()
                || !structuralTemplates.isEmpty() || !expressionTemplates.isEmpty();
    }
}
