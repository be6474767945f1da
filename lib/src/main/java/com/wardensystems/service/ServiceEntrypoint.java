package com.wardensystems.service;

/**
 * Creates the handler for a new execution unit. Called once per start and once per restart, so each
 * instance begins with fresh state.
 */
@FunctionalInterface
public interface ServiceEntrypoint {

    ServiceHandler<?> create();
}
