package org.docsmith.diagnostics;

/**
 * A problem found while handlers turned one statement into documentation objects.
 *
 * @param cause      What went wrong; determines the {@link Type}.
 * @param message    The human readable message.
 * @param fileName   The file being parsed.
 * @param lineNumber The line of the statement, 0 if unknown.
 * @param handler    The handler that was running, or {@code null} outside of a handler.
 * @param subject    The path the diagnostic is about (e.g. the missing superclass), or {@code null}.
 */
public record Diagnostic(
        Cause cause,
        String message,
        String fileName,
        int lineNumber,
        String handler,
        String subject
) {
    /**
     * Severity of a diagnostic.
     */
    public enum Type {
        /** A handler defect; the statement was not documented by that handler. */
        ERROR,
        /** The documentation may be incomplete or speculative. */
        WARNING
    }

    /**
     * The situations a documentation run reports.
     */
    public enum Cause {
        /** A handler was declared for a statement but has no processing routine. */
        UNIMPLEMENTED_HANDLER(Type.ERROR),
        /** A handler rejected its statement. */
        UNDOCUMENTABLE(Type.WARNING),
        /** A namespace or superclass reference was still unknown after all retries. */
        UNRESOLVED_REFERENCE(Type.WARNING);

        private final Type type;

        Cause(Type type) {
            this.type = type;
        }

        public Type type() {
            return type;
        }
    }

    /**
     * @return The severity implied by the cause.
     */
    public Type type() {
        return cause.type();
    }

    @Override
    public String toString() {
        String origin = handler == null ? "" : " (in " + handler + ")";
        return String.format("[%s] %s:%d: %s%s", type(), fileName, lineNumber, message, origin);
    }
}
