package org.docsmith.frontend.handler;

import java.util.List;

/**
 * Service interface through which handler plugins contribute descriptors.
 * Providers are listed in {@code META-INF/services/org.docsmith.frontend.handler.IHandlerProvider}
 * and picked up by {@link HandlerRegistry#discover(ClassLoader)}.
 */
public interface IHandlerProvider {

    /**
     * @return The family the descriptors are registered under.
     */
    default String family() {
        return HandlerRegistry.DEFAULT_FAMILY;
    }

    /**
     * @return The descriptors, in the order they should be tried.
     */
    List<HandlerDescriptor> handlers();
}
