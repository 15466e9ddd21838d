package org.spacompose.module;

import org.spacompose.SpaModuleException;
import org.spacompose.network.Network;

/**
 * Thrown when a module's construction scope closes while a module nested in it was never
 * registered under a name.
 */
public class StructuralIntegrityException extends SpaModuleException {

    private final transient Network offender;

    /**
     * @param offender The unregistered nested module.
     * @param owner    The module whose scope was closing.
     */
    public StructuralIntegrityException(Network offender, Network owner) {
        super(offender + " must be set as an attribute of " + owner + ".");
        this.offender = offender;
    }

    public Network getOffender() {
        return offender;
    }
}
