package org.spacompose.module;

import org.spacompose.network.Network;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;

/**
 * Checks, when a module's construction scope closes cleanly, that every module nested in it was
 * registered under a name.
 * <p>
 * Nesting is what the network recorded while its scope was open; registration is what the
 * builder named. Modules are compared by identity.
 */
public final class StructuralValidator {

    private StructuralValidator() {
    }

    /**
     * @param module The module whose scope is closing.
     * @throws StructuralIntegrityException naming the first nested module that is not registered.
     */
    public static void validate(Module module) {
        Set<Module> registered = Collections.newSetFromMap(new IdentityHashMap<>());
        registered.addAll(module.childMap().values());
        for (Network network : module.getNetworks()) {
            if (network instanceof Module && !registered.contains(network)) {
                throw new StructuralIntegrityException(network, module);
            }
        }
    }
}
