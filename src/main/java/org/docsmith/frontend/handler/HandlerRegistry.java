package org.docsmith.frontend.handler;

import org.docsmith.frontend.parser.Statement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;

/**
 * Registry for statement handlers.
 * Descriptors are grouped by family; within a family they keep registration order,
 * which is also the order in which matching handlers run.
 */
public class HandlerRegistry {

    /** Family used when none is given. */
    public static final String DEFAULT_FAMILY = "default";

    private static final Logger LOG = LoggerFactory.getLogger(HandlerRegistry.class);

    private final Map<String, List<HandlerDescriptor>> families = new LinkedHashMap<>();

    /**
     * Registers a handler in the default family.
     * @param descriptor The handler.
     */
    public void register(HandlerDescriptor descriptor) {
        register(DEFAULT_FAMILY, descriptor);
    }

    /**
     * Appends a handler to a family.
     * @param family     The family name.
     * @param descriptor The handler.
     */
    public void register(String family, HandlerDescriptor descriptor) {
        Objects.requireNonNull(descriptor, "descriptor");
        families.computeIfAbsent(family, f -> new ArrayList<>()).add(descriptor);
        LOG.debug("Registered handler '{}' in family '{}' matching {}", descriptor.name(), family, descriptor.match());
    }

    /**
     * @param family The family name.
     * @return The handlers of the family in registration order.
     */
    public List<HandlerDescriptor> handlers(String family) {
        return Collections.unmodifiableList(families.getOrDefault(family, List.of()));
    }

    /**
     * Selects the default-family handlers that apply to a statement.
     * @param statement The statement.
     * @return The matching handlers in registration order, possibly empty.
     */
    public List<HandlerDescriptor> select(Statement statement) {
        return select(DEFAULT_FAMILY, statement);
    }

    /**
     * Selects the handlers of a family that apply to a statement.
     * @param family    The family name.
     * @param statement The statement.
     * @return The matching handlers in registration order, possibly empty.
     */
    public List<HandlerDescriptor> select(String family, Statement statement) {
        return handlers(family).stream().filter(d -> d.handles(statement)).toList();
    }

    /**
     * Removes all handlers of all families.
     */
    public void clear() {
        families.clear();
    }

    /**
     * Removes all handlers of one family.
     * @param family The family name.
     */
    public void clear(String family) {
        families.remove(family);
    }

    /**
     * Creates a registry populated from every {@link IHandlerProvider} visible to the class loader.
     * @param classLoader The class loader to search.
     * @return A new registry instance.
     */
    public static HandlerRegistry discover(ClassLoader classLoader) {
        HandlerRegistry registry = new HandlerRegistry();
        for (IHandlerProvider provider : ServiceLoader.load(IHandlerProvider.class, classLoader)) {
            List<HandlerDescriptor> descriptors = provider.handlers();
            LOG.info("Loading {} handler(s) from {}", descriptors.size(), provider.getClass().getName());
            for (HandlerDescriptor descriptor : descriptors) {
                registry.register(provider.family(), descriptor);
            }
        }
        return registry;
    }
}
