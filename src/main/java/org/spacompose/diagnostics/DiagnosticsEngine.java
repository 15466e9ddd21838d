package org.spacompose.diagnostics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects diagnostics reported while building and addressing modules.
 * <p>
 * Diagnostics are kept apart from the exception hierarchy: reporting one never fails the
 * operation in progress. Every report is also logged at WARN.
 */
public class DiagnosticsEngine {

    private static final Logger LOG = LoggerFactory.getLogger(DiagnosticsEngine.class);

    /** Code of the diagnostic emitted when a port is addressed as {@code module_port}. */
    public static final String DEPRECATED_UNDERSCORE = "SPA-DEPRECATED-UNDERSCORE";

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports use of deprecated behavior.
     *
     * @param code    The stable diagnostic code.
     * @param message The description.
     * @param subject The name or path concerned.
     */
    public void reportDeprecation(String code, String message, String subject) {
        report(new Diagnostic(Diagnostic.Severity.DEPRECATION, code, message, subject));
    }

    /**
     * Reports a warning.
     *
     * @param code    The stable diagnostic code.
     * @param message The description.
     * @param subject The name or path concerned.
     */
    public void reportWarning(String code, String message, String subject) {
        report(new Diagnostic(Diagnostic.Severity.WARNING, code, message, subject));
    }

    private void report(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
        LOG.warn("{}", diagnostic);
    }

    /**
     * @return An unmodifiable view of all diagnostics in report order.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    public boolean hasWarnings() {
        return !diagnostics.isEmpty();
    }

    /**
     * @param code A diagnostic code.
     * @return True if at least one diagnostic with this code was reported.
     */
    public boolean hasCode(String code) {
        return diagnostics.stream().anyMatch(d -> d.code().equals(code));
    }

    public void clear() {
        diagnostics.clear();
    }

    /**
     * @return One line per diagnostic, or an empty string if there are none.
     */
    public String summary() {
        StringBuilder sb = new StringBuilder();
        for (Diagnostic d : diagnostics) {
            if (sb.length() > 0) sb.append(System.lineSeparator());
            sb.append(d);
        }
        return sb.toString();
    }
}
