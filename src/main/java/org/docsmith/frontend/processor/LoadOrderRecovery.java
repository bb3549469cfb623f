package org.docsmith.frontend.processor;

import org.docsmith.model.Reference;

/**
 * Gives the driver a chance to load more source before a missing reference is retried,
 * e.g. by parsing a file that has not been processed yet.
 */
@FunctionalInterface
public interface LoadOrderRecovery {

    /** Recovery that never makes progress. */
    LoadOrderRecovery NONE = (missing, attempt) -> false;

    /**
     * @param missing The reference that could not be resolved.
     * @param attempt The retry number, starting at 1.
     * @return {@code true} if more source was loaded and a retry may succeed.
     */
    boolean recover(Reference.Unresolved missing, int attempt);
}
