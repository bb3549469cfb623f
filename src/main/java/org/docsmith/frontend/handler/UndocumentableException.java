package org.docsmith.frontend.handler;

/**
 * Thrown by a handler when a statement it matched cannot be documented, for
 * example a class whose name is computed at runtime. The statement is skipped
 * with a warning; processing continues with the next statement.
 */
public class UndocumentableException extends Exception {

    /**
     * @param message What could not be documented.
     */
    public UndocumentableException(String message) {
        super(message);
    }
}
