package com.z254.bulwark.governance.gateway;

/**
 * Unit of work run under governance.
 */
@FunctionalInterface
public interface GovernedWork<T> {

    T execute() throws Exception;
}
