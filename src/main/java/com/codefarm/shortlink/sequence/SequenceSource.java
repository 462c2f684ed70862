package com.codefarm.shortlink.sequence;

/**
 * Shared, durable counter that feeds generated codes.
 * <p>
 * Implementations must be atomic across every process that talks to the same backend and must
 * never hand out a value twice, including after a restart. Values start at 1.
 */
public interface SequenceSource {

    /**
     * @return the next unused value
     * @throws com.codefarm.shortlink.exception.SequenceUnavailableException if the backend cannot
     *         perform the atomic increment; callers must abort rather than fall back
     */
    long next();
}
