package org.dxworks.jsxframe.compiler;

import org.dxworks.jsxframe.model.ComponentDescriptor;
import org.dxworks.jsxframe.model.StateInfo;

/**
 * Per-component state shared by the analysis and emission passes. One instance per component;
 * never shared between threads.
 */
public class CompilerContext {
    private final ComponentDescriptor component;
    private final Diagnostics diagnostics;

    public CompilerContext(ComponentDescriptor component, Diagnostics diagnostics) {
        this.component = component;
        this.diagnostics = diagnostics;
    }

    public ComponentDescriptor component() {
        return component;
    }

    public Diagnostics diagnostics() {
        return diagnostics;
    }

    public String componentName() {
        return component.name;
    }

    /**
     * The state variable whose setter has the given name, if any.
     */
    public StateInfo stateForSetter(String setter) {
        for (StateInfo state : component.useState) {
            if (setter.equals(state.setter)) {
                return state;
            }
        }
        for (StateInfo state : component.useClientState) {
            if (setter.equals(state.setter)) {
                return state;
            }
        }
        return null;
    }

    public void warn(String code, String message) {
        diagnostics.warn(code, component.name, message);
    }
}
