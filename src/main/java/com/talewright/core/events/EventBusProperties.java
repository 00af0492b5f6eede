package com.talewright.core.events;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "talewright.events")
public class EventBusProperties {

    /** Events retained per run before the oldest are trimmed; 0 keeps everything. */
    private int maxEventsPerRun = 1000;

    /** How long a live stream waits for new events before sending a heartbeat. */
    private Duration heartbeatInterval = Duration.ofSeconds(15);

    public int getMaxEventsPerRun() {
        return maxEventsPerRun;
    }

    public void setMaxEventsPerRun(int maxEventsPerRun) {
        this.maxEventsPerRun = maxEventsPerRun;
    }

    public Duration getHeartbeatInterval() {
        return heartbeatInterval;
    }

    public void setHeartbeatInterval(Duration heartbeatInterval) {
        this.heartbeatInterval = heartbeatInterval;
    }
}
