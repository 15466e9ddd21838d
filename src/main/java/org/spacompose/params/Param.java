package org.spacompose.params;

/**
 * A declared, constrained field of a module.
 * <p>
 * Writes go through {@link #validate(String, Object)}, which converts the raw value to the
 * parameter's type and checks its constraint. Passing {@link #DEFAULT} to a builder write means
 * "use the configured default for this module type".
 *
 * @param <T> The value type.
 */
public abstract class Param<T> {

    /** Sentinel requesting the configured default instead of an explicit value. */
    public static final Object DEFAULT = new Object() {
        @Override
        public String toString() {
            return "Default";
        }
    };

    private final String name;
    private final T defaultValue;

    protected Param(String name, T defaultValue) {
        this.name = name;
        this.defaultValue = defaultValue;
    }

    public String name() {
        return name;
    }

    public T defaultValue() {
        return defaultValue;
    }

    /**
     * Converts and checks a raw value.
     *
     * @param owner The label or type name of the object being written, for error messages.
     * @param raw   The value to write.
     * @return The converted value.
     * @throws FieldValidationException if the value cannot be converted or violates the constraint.
     */
    public abstract T validate(String owner, Object raw);

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + name + "]";
    }
}
