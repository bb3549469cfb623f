package org.docsmith.testing;

import org.docsmith.frontend.handler.HandlerDescriptor;
import org.docsmith.frontend.handler.IHandlerProvider;

import java.util.List;

/**
 * Contributes {@link SampleHandlers} through {@link java.util.ServiceLoader}.
 */
public class SampleHandlerProvider implements IHandlerProvider {

    @Override
    public List<HandlerDescriptor> handlers() {
        return SampleHandlers.all();
    }
}
