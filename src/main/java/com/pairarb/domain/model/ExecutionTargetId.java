package com.pairarb.domain.model;

/**
 * Opaque handle minted once per execution target by the registry.
 *
 * <p>The handle is carried verbatim in every order tag so that asynchronously delivered
 * order events can be routed back to their target without relying on object identity.
 */
public record ExecutionTargetId(long value) {

    @Override
    public String toString() {
        return Long.toString(value);
    }
}
