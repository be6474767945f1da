package com.wardensystems.service;

import com.wardensystems.ServiceCallException;
import com.wardensystems.ServiceTimeoutException;
import org.slf4j.Logger;

import java.time.Duration;
import java.util.Map;

/**
 * Runtime facilities available to a {@link ServiceHandler} inside its execution unit.
 */
public interface ServiceContext {

    /**
     * Returns the name this service is registered under.
     *
     * @return the service name
     */
    String serviceName();

    /**
     * Calls another service and waits for its answer using the default call timeout.
     *
     * <p>The calling service's loop is blocked until the answer arrives; requests queued behind the
     * current one wait meanwhile.</p>
     *
     * @param target the service to call
     * @param action the action to request
     * @param payload the request payload
     * @return the response payload
     * @throws ServiceTimeoutException if no answer arrives in time
     * @throws ServiceCallException if the target answers with an ERROR or is unavailable
     */
    Map<String, Object> call(String target, String action, Map<String, Object> payload);

    /**
     * Calls another service and waits up to {@code timeout} for its answer.
     *
     * @param target the service to call
     * @param action the action to request
     * @param payload the request payload
     * @param timeout the maximum time to wait
     * @return the response payload
     * @throws ServiceTimeoutException if no answer arrives in time
     * @throws ServiceCallException if the target answers with an ERROR or is unavailable
     */
    Map<String, Object> call(String target, String action, Map<String, Object> payload, Duration timeout);

    /**
     * Atomically increments one of this service's counters in the shared statistics store.
     *
     * @param counter the counter name
     * @return the value after incrementing
     */
    long increment(String counter);

    /**
     * Reads one of this service's counters.
     *
     * @param counter the counter name
     * @return the current value
     */
    long counter(String counter);

    /**
     * Returns a logger named after this service.
     *
     * @return the logger
     */
    Logger getLogger();
}
