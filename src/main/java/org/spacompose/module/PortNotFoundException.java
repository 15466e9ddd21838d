package org.spacompose.module;

import org.spacompose.SpaModuleException;

/**
 * Thrown when a port path does not lead to an input or output.
 */
public class PortNotFoundException extends SpaModuleException {

    private final String path;
    private final PortKind kind;

    /**
     * @param path The requested path.
     * @param kind Whether an input or an output was requested.
     */
    public PortNotFoundException(String path, PortKind kind) {
        super("Could not find module " + kind.displayName() + " '" + path + "'.");
        this.path = path;
        this.kind = kind;
    }

    public String getPath() {
        return path;
    }

    public PortKind getKind() {
        return kind;
    }
}
