package com.talewright.core.engine;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "talewright.lifecycle")
public class LifecycleProperties {

    /** How long shutdown waits for running runs to reach a checkpoint before snapshotting them. */
    private Duration shutdownTimeout = Duration.ofSeconds(30);

    /** Whether interrupted runs are restored from their snapshots when the application is ready. */
    private boolean restoreOnStartup = true;

    /**
     * How long a completed, failed or cancelled run stays queryable and streamable before its
     * handle and event log are dropped.
     */
    private Duration terminalRetention = Duration.ofMinutes(10);

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    public void setShutdownTimeout(Duration shutdownTimeout) {
        this.shutdownTimeout = shutdownTimeout;
    }

    public boolean isRestoreOnStartup() {
        return restoreOnStartup;
    }

    public void setRestoreOnStartup(boolean restoreOnStartup) {
        this.restoreOnStartup = restoreOnStartup;
    }

    public Duration getTerminalRetention() {
        return terminalRetention;
    }

    public void setTerminalRetention(Duration terminalRetention) {
        this.terminalRetention = terminalRetention;
    }
}
