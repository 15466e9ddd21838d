package org.spacompose.module;

import java.util.Map;

/**
 * Selects the input or the output side of a module.
 */
public enum PortKind {
    INPUT("input") {
        @Override
        Map<String, Port> ports(Module module) {
            return module.inputMap();
        }
    },
    OUTPUT("output") {
        @Override
        Map<String, Port> ports(Module module) {
            return module.outputMap();
        }
    };

    private final String displayName;

    PortKind(String displayName) {
        this.displayName = displayName;
    }

    abstract Map<String, Port> ports(Module module);

    public String displayName() {
        return displayName;
    }
}
