package com.wardensystems.supervisor;

import com.wardensystems.service.ServiceContext;
import com.wardensystems.stats.StatisticsStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;

/**
 * Context handed to a handler; routes calls through the supervisor so they use the shared reply path.
 */
class ServiceContextImpl implements ServiceContext {

    private final String serviceName;
    private final ServiceSupervisor supervisor;
    private final StatisticsStore statistics;
    private final Logger logger;

    ServiceContextImpl(String serviceName, ServiceSupervisor supervisor, StatisticsStore statistics) {
        this.serviceName = serviceName;
        this.supervisor = supervisor;
        this.statistics = statistics;
        this.logger = LoggerFactory.getLogger("com.wardensystems.service." + serviceName);
    }

    @Override
    public String serviceName() {
        return serviceName;
    }

    @Override
    public Map<String, Object> call(String target, String action, Map<String, Object> payload) {
        return supervisor.dispatchCall(serviceName, target, action, payload);
    }

    @Override
    public Map<String, Object> call(String target, String action, Map<String, Object> payload, Duration timeout) {
        return supervisor.dispatchCall(serviceName, target, action, payload, timeout);
    }

    @Override
    public long increment(String counter) {
        return statistics.increment(serviceName, counter);
    }

    @Override
    public long counter(String counter) {
        return statistics.counter(serviceName, counter);
    }

    @Override
    public Logger getLogger() {
        return logger;
    }
}
