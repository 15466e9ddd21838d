package org.spacompose.module;

import java.util.Optional;

/**
 * A dotted module path split into its first segment and the rest.
 *
 * @param head      The first segment.
 * @param remainder Everything after the first dot, or {@code null} for a single-segment path.
 */
public record ModulePath(String head, String remainder) {

    /**
     * Splits a path on its first dot.
     *
     * @param path A path such as {@code "a.b.c"}.
     * @return {@code ("a", "b.c")}, or {@code (path, null)} when there is no dot.
     */
    public static ModulePath parse(String path) {
        int dot = path.indexOf('.');
        if (dot < 0) {
            return new ModulePath(path, null);
        }
        return new ModulePath(path.substring(0, dot), path.substring(dot + 1));
    }

    /**
     * Splits a legacy {@code module_port} name on its last underscore.
     * <p>
     * Names whose module or port part contains an underscore are ambiguous; the last underscore
     * always wins, so {@code "my_module_x"} is module {@code "my_module"}, port {@code "x"}.
     *
     * @param name The legacy name.
     * @return {@code (module, port)}, or empty if the name has no underscore.
     */
    public static Optional<ModulePath> parseLegacy(String name) {
        int underscore = name.lastIndexOf('_');
        if (underscore < 0) {
            return Optional.empty();
        }
        return Optional.of(new ModulePath(name.substring(0, underscore), name.substring(underscore + 1)));
    }

    public boolean isLeaf() {
        return remainder == null;
    }
}
