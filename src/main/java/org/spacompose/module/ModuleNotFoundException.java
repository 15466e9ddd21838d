package org.spacompose.module;

import org.spacompose.SpaModuleException;

/**
 * Thrown when a module path does not lead to a module.
 */
public class ModuleNotFoundException extends SpaModuleException {

    private final String path;

    /**
     * @param path The requested path.
     */
    public ModuleNotFoundException(String path) {
        super("Could not find module '" + path + "'.");
        this.path = path;
    }

    public String getPath() {
        return path;
    }
}
