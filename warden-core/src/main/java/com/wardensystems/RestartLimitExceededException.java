package com.wardensystems;

/**
 * Thrown when a restart is refused because the registration already used up its restart budget.
 */
public class RestartLimitExceededException extends OrchestrationException {

    private final int restartCount;
    private final int maxRestarts;

    public RestartLimitExceededException(String serviceName, int restartCount, int maxRestarts) {
        super("Service " + serviceName + " reached its restart limit (" + restartCount + "/" + maxRestarts + ")",
                serviceName);
        this.restartCount = restartCount;
        this.maxRestarts = maxRestarts;
    }

    public int getRestartCount() {
        return restartCount;
    }

    public int getMaxRestarts() {
        return maxRestarts;
    }
}
