package org.spacompose.params;

/**
 * Decides how a field validation failure is presented to the caller of a builder operation.
 */
@FunctionalInterface
public interface IErrorReportingPolicy {

    /** Rethrows the validation failure as raised, cause chain included. */
    IErrorReportingPolicy FULL = e -> e;

    /** Rethrows a copy that identifies field and constraint but drops the cause chain. */
    IErrorReportingPolicy SIMPLIFIED = FieldValidationException::withoutCause;

    /**
     * @param exception The failure raised by the parameter.
     * @return The exception to throw in its place.
     */
    FieldValidationException report(FieldValidationException exception);

    /**
     * @param simplified Whether simplified reporting is configured.
     * @return {@link #SIMPLIFIED} or {@link #FULL}.
     */
    static IErrorReportingPolicy of(boolean simplified) {
        return simplified ? SIMPLIFIED : FULL;
    }
}
