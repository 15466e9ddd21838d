package org.spacompose.params;

import java.util.HashMap;
import java.util.Map;

/**
 * Per-type defaults for declared parameters.
 * <p>
 * Lookup walks from the concrete type towards {@link Object}; the first type with a configured
 * value wins. Below that come the base values (usually read from configuration) and finally the
 * parameter's built-in default.
 */
public class ParamDefaults {

    private final Map<String, Object> baseValues;
    private final Map<Class<?>, Map<String, Object>> typeValues = new HashMap<>();

    /**
     * Creates defaults without base values.
     */
    public ParamDefaults() {
        this(Map.of());
    }

    /**
     * @param baseValues Parameter name to value, applying to every type.
     */
    public ParamDefaults(Map<String, Object> baseValues) {
        this.baseValues = new HashMap<>(baseValues);
    }

    /**
     * Configures a default for one type and its subclasses.
     *
     * @param type  The type.
     * @param param The parameter.
     * @param value The raw default; validated when it is used.
     */
    public void configure(Class<?> type, Param<?> param, Object value) {
        typeValues.computeIfAbsent(type, t -> new HashMap<>()).put(param.name(), value);
    }

    /**
     * Resolves the default for a parameter of the given type.
     *
     * @param type  The concrete type of the owner.
     * @param param The parameter.
     * @return The raw configured default, or the parameter's built-in default.
     */
    public Object lookup(Class<?> type, Param<?> param) {
        for (Class<?> c = type; c != null; c = c.getSuperclass()) {
            Map<String, Object> values = typeValues.get(c);
            if (values != null && values.containsKey(param.name())) {
                return values.get(param.name());
            }
        }
        if (baseValues.containsKey(param.name())) {
            return baseValues.get(param.name());
        }
        return param.defaultValue();
    }
}
