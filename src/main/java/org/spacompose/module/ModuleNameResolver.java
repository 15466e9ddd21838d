package org.spacompose.module;

import org.spacompose.diagnostics.DiagnosticsEngine;

import java.util.Map;
import java.util.Optional;

/**
 * Resolves dotted paths such as {@code "cortex.buffer.default"} to modules and ports.
 * <p>
 * A port path is tried in this order at every level: a port of the current module, the
 * {@code "default"} port of a child of that name, and finally the deprecated
 * {@code module_port} form. A successful legacy lookup reports
 * {@link DiagnosticsEngine#DEPRECATED_UNDERSCORE} but does not fail.
 */
public class ModuleNameResolver {

    static final String DEFAULT_PORT = "default";

    private final DiagnosticsEngine diagnostics;

    /**
     * @param diagnostics Receives deprecation diagnostics.
     */
    public ModuleNameResolver(DiagnosticsEngine diagnostics) {
        this.diagnostics = diagnostics;
    }

    /**
     * Resolves a module path.
     *
     * @param root        The module to start from.
     * @param path        A dotted path.
     * @param stripOutput If true, a final segment naming one of the current module's ports
     *                    resolves to that module.
     * @return The module.
     * @throws ModuleNotFoundException if the path leads nowhere.
     */
    public Module getModule(Module root, String path, boolean stripOutput) {
        return findModule(root, path, stripOutput)
                .orElseThrow(() -> new ModuleNotFoundException(path));
    }

    private Optional<Module> findModule(Module current, String path, boolean stripOutput) {
        ModulePath split = ModulePath.parse(path);
        Map<String, Module> children = current.childMap();
        if (!split.isLeaf()) {
            Module child = children.get(split.head());
            if (child == null) {
                return Optional.empty();
            }
            return findModule(child, split.remainder(), stripOutput);
        }
        if (children.containsKey(path)) {
            return Optional.of(children.get(path));
        }
        if (stripOutput && (current.inputMap().containsKey(path) || current.outputMap().containsKey(path))) {
            return Optional.of(current);
        }
        return Optional.empty();
    }

    /**
     * Resolves a port path.
     *
     * @param root The module to start from.
     * @param path A dotted path, a child name, or a legacy {@code module_port} name.
     * @param kind Input or output.
     * @return The port.
     * @throws PortNotFoundException if the path leads nowhere.
     */
    public Port getPort(Module root, String path, PortKind kind) {
        return findPort(root, path, kind)
                .orElseThrow(() -> new PortNotFoundException(path, kind));
    }

    private Optional<Port> findPort(Module current, String path, PortKind kind) {
        ModulePath split = ModulePath.parse(path);
        Map<String, Module> children = current.childMap();
        if (!split.isLeaf()) {
            Module child = children.get(split.head());
            if (child == null) {
                return Optional.empty();
            }
            return findPort(child, split.remainder(), kind);
        }

        Port own = kind.ports(current).get(path);
        if (own != null) {
            return Optional.of(own);
        }
        Module child = children.get(path);
        if (child != null) {
            return findPort(child, DEFAULT_PORT, kind);
        }
        return findLegacyPort(current, path, kind);
    }

    private Optional<Port> findLegacyPort(Module current, String path, PortKind kind) {
        Optional<ModulePath> legacy = ModulePath.parseLegacy(path);
        if (legacy.isEmpty()) {
            return Optional.empty();
        }
        Module child = current.childMap().get(legacy.get().head());
        if (child == null) {
            return Optional.empty();
        }
        Optional<Port> port = findPort(child, legacy.get().remainder(), kind);
        port.ifPresent(p -> diagnostics.reportDeprecation(DiagnosticsEngine.DEPRECATED_UNDERSCORE,
                "Underscore notation for inputs and outputs is deprecated. "
                        + "Use dot notation " + legacy.get().head() + "." + legacy.get().remainder() + " instead.",
                path));
        return port;
    }

    /**
     * Lists the port names of the direct children of {@code root} in legacy form: the child name
     * for a {@code "default"} port, {@code child_port} otherwise.
     * <p>
     * The result is lazy and can be iterated any number of times; each iteration reflects the
     * current children.
     *
     * @param root The module whose children are listed.
     * @param kind Input or output.
     * @return The names, children in registration order and ports in declaration order.
     */
    public Iterable<String> listPorts(Module root, PortKind kind) {
        return () -> root.childMap().entrySet().stream()
                .flatMap(child -> kind.ports(child.getValue()).keySet().stream()
                        .map(port -> DEFAULT_PORT.equals(port) ? child.getKey() : child.getKey() + "_" + port))
                .iterator();
    }
}
