package com.codefarm.shortlink.config;

import java.util.function.Supplier;

/**
 * Thread-bound choice of connection pool for {@link ReplicaRoutingDataSource}. Everything runs on
 * the primary unless wrapped in {@link #onReplica(Supplier)}.
 */
public final class DataSourceRoute {

    public enum Target {
        PRIMARY,
        REPLICA
    }

    private static final ThreadLocal<Target> CURRENT = new ThreadLocal<>();

    private DataSourceRoute() {
    }

    public static Target current() {
        Target target = CURRENT.get();
        return target == null ? Target.PRIMARY : target;
    }

    /**
     * Runs {@code work} with connections taken from the read-only replica. Only for reporting reads:
     * the replica may lag the primary.
     */
    public static <T> T onReplica(Supplier<T> work) {
        Target previous = CURRENT.get();
        CURRENT.set(Target.REPLICA);
        try {
            return work.get();
        } finally {
            if (previous == null) {
                CURRENT.remove();
            } else {
                CURRENT.set(previous);
            }
        }
    }
}
