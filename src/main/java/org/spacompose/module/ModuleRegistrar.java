package org.spacompose.module;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.spacompose.params.FieldValidationException;
import org.spacompose.params.IErrorReportingPolicy;
import org.spacompose.params.Param;
import org.spacompose.vocab.VocabularyMap;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Binds names within a module: submodules are registered, parameters are validated and
 * anything else is stored as a plain attribute.
 * <p>
 * A name bound to a submodule can never be bound again. Registering a submodule labels it (if it
 * has no label yet), resolves its raw port dimensions against the <em>parent's</em>
 * {@link VocabularyMap} so that siblings of equal dimensionality share one vocabulary, and
 * finally calls {@link Module#onAdd(Module)}.
 */
public class ModuleRegistrar {

    private static final Logger LOG = LoggerFactory.getLogger(ModuleRegistrar.class);

    private final IErrorReportingPolicy errorReporting;

    /**
     * @param errorReporting How parameter validation failures are reported.
     */
    public ModuleRegistrar(IErrorReportingPolicy errorReporting) {
        this.errorReporting = errorReporting;
    }

    /**
     * Binds {@code value} to {@code name} within {@code owner}.
     *
     * @param owner The module being built.
     * @param name  The attribute name.
     * @param value A submodule, {@link Param#DEFAULT}, a parameter value or any other attribute.
     * @throws ModuleReassignmentException if {@code name} is already bound to a submodule.
     * @throws FieldValidationException    if {@code name} is a parameter and the value violates it.
     */
    public void assign(Module owner, String name, Object value) {
        requireUnbound(owner, name, value);
        if (value instanceof Module module) {
            register(owner, name, module);
            return;
        }
        Optional<Param<?>> param = owner.findParam(name);
        if (param.isEmpty()) {
            owner.attributeMap().put(name, value);
            return;
        }
        write(owner, param.get(), value);
    }

    /**
     * Registers {@code value} as the submodule {@code name} of {@code parent}.
     *
     * @param parent The owning module.
     * @param name   The submodule name.
     * @param value  The submodule.
     * @throws ModuleReassignmentException if {@code name} is already bound to a submodule,
     *                                     {@code value} is already registered elsewhere, or
     *                                     {@code value} is {@code parent} or one of its ancestors.
     * @throws org.spacompose.vocab.InvalidDimensionException if a port declares a non-positive dimensionality.
     */
    public void register(Module parent, String name, Module value) {
        requireUnbound(parent, name, value);
        if (value.getParent().isPresent()) {
            throw new ModuleReassignmentException(name, "Cannot register " + value + " as '" + name + "' in "
                    + parent + ": it is already registered in " + value.getParent().get() + ".");
        }
        for (Module ancestor = parent; ancestor != null; ancestor = ancestor.getParent().orElse(null)) {
            if (ancestor == value) {
                throw new ModuleReassignmentException(name, "Cannot register " + value + " as '" + name + "' in "
                        + parent + ": a module cannot contain itself.");
            }
        }

        VocabularyMap vocabs = parent.getVocabs();
        Map<String, Port> inputs = resolvePorts(value.inputMap(), vocabs);
        Map<String, Port> outputs = resolvePorts(value.outputMap(), vocabs);

        if (value.getLabel() == null) {
            value.setLabel(name);
        }
        parent.childMap().put(name, value);
        value.setParent(parent);
        value.inputMap().putAll(inputs);
        value.outputMap().putAll(outputs);
        LOG.debug("Registered {} as '{}' in {}", value, name, parent);

        value.onAdd(parent);
    }

    private static Map<String, Port> resolvePorts(Map<String, Port> ports, VocabularyMap vocabs) {
        Map<String, Port> resolved = new LinkedHashMap<>();
        ports.forEach((portName, port) -> resolved.put(portName, port.resolve(vocabs)));
        return resolved;
    }

    private <T> void write(Module owner, Param<T> param, Object value) {
        Object raw = value == Param.DEFAULT
                ? owner.getParamDefaults().lookup(owner.getClass(), param)
                : value;
        try {
            owner.paramValueMap().put(param, param.validate(owner.toString(), raw));
        } catch (FieldValidationException e) {
            throw errorReporting.report(e);
        }
    }

    private static void requireUnbound(Module owner, String name, Object value) {
        if (owner.childMap().containsKey(name)) {
            throw new ModuleReassignmentException(name, "Cannot re-assign module-attribute '" + name + "' to "
                    + value + ". SPA module-attributes can only be assigned once.");
        }
    }

    public IErrorReportingPolicy getErrorReporting() {
        return errorReporting;
    }
}
