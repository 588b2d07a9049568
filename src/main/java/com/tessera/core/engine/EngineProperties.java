package com.tessera.core.engine;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "tessera.engine")
public class EngineProperties {

    /** Upper bound for building an execution's context. */
    private int contextTimeoutSeconds = 30;

    /** How long to wait for the first chunk from the reasoning backend. */
    private int backendConnectTimeoutSeconds = 60;

    /** Events buffered per execution before the producer blocks. */
    private int eventBufferCapacity = 256;

    /** Inputs kept in each session's command history. */
    private int historySize = 100;

    /** Grace period for backend teardown after a cancel. */
    private int teardownTimeoutSeconds = 10;

    public int getContextTimeoutSeconds() { return contextTimeoutSeconds; }
    public void setContextTimeoutSeconds(int contextTimeoutSeconds) { this.contextTimeoutSeconds = contextTimeoutSeconds; }
    public int getBackendConnectTimeoutSeconds() { return backendConnectTimeoutSeconds; }
    public void setBackendConnectTimeoutSeconds(int backendConnectTimeoutSeconds) { this.backendConnectTimeoutSeconds = backendConnectTimeoutSeconds; }
    public int getEventBufferCapacity() { return eventBufferCapacity; }
    public void setEventBufferCapacity(int eventBufferCapacity) { this.eventBufferCapacity = eventBufferCapacity; }
    public int getHistorySize() { return historySize; }
    public void setHistorySize(int historySize) { this.historySize = historySize; }
    public int getTeardownTimeoutSeconds() { return teardownTimeoutSeconds; }
    public void setTeardownTimeoutSeconds(int teardownTimeoutSeconds) { this.teardownTimeoutSeconds = teardownTimeoutSeconds; }
}
