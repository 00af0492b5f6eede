package com.talewright.core.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.boot.web.context.WebServerApplicationContext;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Ties run recovery to the application lifecycle: interrupted runs are restored (paused) once the
 * server is ready, and active runs are snapshotted when the context closes.
 */
@Component
public class LifecycleHooks {

    private static final Logger log = LoggerFactory.getLogger(LifecycleHooks.class);

    private final RunLifecycleManager lifecycleManager;
    private final LifecycleProperties properties;

    public LifecycleHooks(RunLifecycleManager lifecycleManager, LifecycleProperties properties) {
        this.lifecycleManager = lifecycleManager;
        this.properties = properties;
    }

    /**
     * Restores snapshots only when this process serves the API. CLI commands such as status and
     * watch run in a short-lived context and must leave the snapshots for the server.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void restoreInterruptedRuns(ApplicationReadyEvent event) {
        if (!(event.getApplicationContext() instanceof WebServerApplicationContext)) {
            log.debug("Not serving; leaving interrupted runs for the server to restore");
            return;
        }
        if (!properties.isRestoreOnStartup()) {
            log.info("Run restore on startup is disabled");
            return;
        }
        int restored = lifecycleManager.restoreAllInterruptedRuns();
        if (restored > 0) {
            log.info("{} interrupted run(s) restored in paused state; resume them explicitly", restored);
        }
    }

    @EventListener(ContextClosedEvent.class)
    public void snapshotActiveRuns() {
        if (lifecycleManager.isShuttingDown()) {
            return;
        }
        int saved = lifecycleManager.gracefulShutdown(properties.getShutdownTimeout());
        log.info("Shutdown complete: {} run(s) saved for restore", saved);
    }
}
