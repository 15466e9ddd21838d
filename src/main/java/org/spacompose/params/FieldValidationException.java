package org.spacompose.params;

import org.spacompose.SpaModuleException;

/**
 * Thrown when a write to a declared parameter violates the parameter's constraint.
 * <p>
 * The message names the owner, the field and the violated constraint. A cause is attached when
 * the violation was detected by a lower-level conversion (for example a failed number parse);
 * {@link #withoutCause()} produces the user-facing copy used by simplified error reporting.
 */
public class FieldValidationException extends SpaModuleException {

    private final String owner;
    private final String field;
    private final String constraint;

    /**
     * @param owner      Label or type of the object whose field was written.
     * @param field      The parameter name.
     * @param constraint Description of the violated constraint.
     * @param value      The rejected value.
     * @param cause      The low-level failure, or {@code null}.
     */
    public FieldValidationException(String owner, String field, String constraint, Object value, Throwable cause) {
        super(formatMessage(owner, field, constraint, value), cause);
        this.owner = owner;
        this.field = field;
        this.constraint = constraint;
    }

    private FieldValidationException(FieldValidationException source) {
        super(source.getMessage());
        this.owner = source.owner;
        this.field = source.field;
        this.constraint = source.constraint;
    }

    private static String formatMessage(String owner, String field, String constraint, Object value) {
        return owner + "." + field + ": " + constraint + " (got " + value + ")";
    }

    /**
     * @return A copy carrying the same message, field and constraint but no cause chain.
     */
    public FieldValidationException withoutCause() {
        return new FieldValidationException(this);
    }

    public String getOwner() {
        return owner;
    }

    public String getField() {
        return field;
    }

    public String getConstraint() {
        return constraint;
    }
}
