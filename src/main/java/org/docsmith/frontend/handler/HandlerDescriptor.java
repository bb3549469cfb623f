package org.docsmith.frontend.handler;

import org.docsmith.frontend.parser.Statement;
import org.docsmith.model.DocObject;

import java.util.List;
import java.util.Objects;

/**
 * A registered handler: its name, the rule selecting its statements and the routine processing them.
 *
 * @param name      A human readable name used in logs and diagnostics.
 * @param match     The rule deciding which statements the handler sees.
 * @param processor The processing routine, or {@code null} if the handler was only declared.
 */
public record HandlerDescriptor(
        String name,
        MatchRule match,
        IStatementHandler processor
) {

    public HandlerDescriptor {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(match, "match");
    }

    /**
     * Creates a descriptor.
     * @param name      The handler name.
     * @param match     The match rule.
     * @param processor The processing routine.
     * @return The descriptor.
     */
    public static HandlerDescriptor of(String name, MatchRule match, IStatementHandler processor) {
        return new HandlerDescriptor(name, match, processor);
    }

    /**
     * Declares a handler without a processing routine. Invoking it fails with
     * {@link UnimplementedHandlerException}.
     * @param name  The handler name.
     * @param match The match rule.
     * @return The descriptor.
     */
    public static HandlerDescriptor declare(String name, MatchRule match) {
        return new HandlerDescriptor(name, match, null);
    }

    /**
     * @param statement The statement to test.
     * @return {@code true} if this handler applies to the statement.
     */
    public boolean handles(Statement statement) {
        return match.matches(statement);
    }

    /**
     * Runs the processing routine.
     * @param context The handler context.
     * @return The produced objects.
     * @throws UndocumentableException if the handler rejects the statement.
     * @throws UnimplementedHandlerException if no routine was declared.
     */
    public List<? extends DocObject> process(HandlerContext context) throws UndocumentableException {
        if (processor == null) {
            throw new UnimplementedHandlerException(name);
        }
        List<? extends DocObject> produced = processor.process(context);
        return produced == null ? List.of() : produced;
    }
}
