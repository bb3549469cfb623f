package org.docsmith.frontend.handler;

/**
 * Thrown when a handler that was declared without a processing routine is invoked.
 * This is a defect in the handler plugin, not in the documented source.
 */
public class UnimplementedHandlerException extends RuntimeException {

    private final String handlerName;

    /**
     * @param handlerName The name of the declared handler.
     */
    public UnimplementedHandlerException(String handlerName) {
        super(handlerName + " did not implement a process routine for handling.");
        this.handlerName = handlerName;
    }

    /**
     * @return The name of the declared handler.
     */
    public String getHandlerName() {
        return handlerName;
    }
}
