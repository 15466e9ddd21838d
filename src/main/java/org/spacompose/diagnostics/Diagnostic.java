package org.spacompose.diagnostics;

/**
 * A single non-fatal finding reported while composing or addressing a module tree.
 *
 * @param severity The severity of the finding.
 * @param code     A stable, machine-readable code (e.g. {@code SPA-DEPRECATED-UNDERSCORE}).
 * @param message  The human-readable description.
 * @param subject  The name or path the finding is about.
 */
public record Diagnostic(Severity severity, String code, String message, String subject) {

    /**
     * Severity levels of a diagnostic. None of them aborts the operation that reported it.
     */
    public enum Severity {
        /** Behavior that still works but will be removed. */
        DEPRECATION,
        /** Suspicious but accepted input. */
        WARNING
    }

    @Override
    public String toString() {
        return severity + " [" + code + "] " + subject + ": " + message;
    }
}
