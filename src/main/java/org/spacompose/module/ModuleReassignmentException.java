package org.spacompose.module;

import org.spacompose.SpaModuleException;

/**
 * Thrown when a name already bound to a submodule is assigned again, or when a module that is
 * already registered is registered a second time.
 */
public class ModuleReassignmentException extends SpaModuleException {

    private final String name;

    /**
     * @param name    The name being assigned.
     * @param message Description of the conflict.
     */
    public ModuleReassignmentException(String name, String message) {
        super(message);
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
