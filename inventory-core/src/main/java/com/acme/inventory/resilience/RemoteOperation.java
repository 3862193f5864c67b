package com.acme.inventory.resilience;

/** A call to an unreliable remote system. */
@FunctionalInterface
public interface RemoteOperation<T> {
    T call() throws Exception;
}
