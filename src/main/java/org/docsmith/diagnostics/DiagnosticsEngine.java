package org.docsmith.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Collects the diagnostics of a documentation run so that callers can inspect
 * them after parsing, independently of the logging backend.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports a handler that matched a statement but has no processing routine.
     *
     * @param handler    The name of the handler.
     * @param message    The failure message.
     * @param fileName   The file being parsed.
     * @param lineNumber The line of the statement.
     */
    public void reportUnimplemented(String handler, String message, String fileName, int lineNumber) {
        diagnostics.add(new Diagnostic(Diagnostic.Cause.UNIMPLEMENTED_HANDLER, message, fileName, lineNumber, handler, null));
    }

    /**
     * Reports a statement a handler refused to document.
     *
     * @param handler    The name of the handler.
     * @param statement  The text of the rejected statement.
     * @param message    The rejection message.
     * @param fileName   The file being parsed.
     * @param lineNumber The line of the statement.
     */
    public void reportUndocumentable(String handler, String statement, String message, String fileName, int lineNumber) {
        diagnostics.add(new Diagnostic(Diagnostic.Cause.UNDOCUMENTABLE, message, fileName, lineNumber, handler, statement));
    }

    /**
     * Reports a reference whose target could not be found.
     *
     * @param handler    The handler registering the holder, or {@code null}.
     * @param type       The expected type of the target ("class", "module", ...).
     * @param path       The path of the missing target.
     * @param fileName   The file being parsed.
     * @param lineNumber The line of the statement.
     */
    public void reportUnresolved(String handler, String type, String path, String fileName, int lineNumber) {
        String message = String.format("The %s %s has not yet been recognized; load the file defining it before this one.",
                type, path);
        diagnostics.add(new Diagnostic(Diagnostic.Cause.UNRESOLVED_REFERENCE, message, fileName, lineNumber, handler, path));
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one error exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }

    /**
     * @param type The severity to filter by.
     * @return The matching diagnostics in reporting order.
     */
    public List<Diagnostic> ofType(Diagnostic.Type type) {
        return diagnostics.stream().filter(d -> d.type() == type).toList();
    }

    /**
     * @param cause The cause to filter by.
     * @return The matching diagnostics in reporting order.
     */
    public List<Diagnostic> ofCause(Diagnostic.Cause cause) {
        return diagnostics.stream().filter(d -> d.cause() == cause).toList();
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * @return All diagnostics, one per line.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
