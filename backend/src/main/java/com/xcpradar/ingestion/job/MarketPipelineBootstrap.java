package com.xcpradar.ingestion.job;

import com.xcpradar.ingestion.config.MonitorProperties;
import com.xcpradar.ingestion.store.TransactionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Brings the pipeline up once the context is ready: store first (a failure aborts startup), then the monitor
 * when xcpradar.monitor.enabled. Stops the monitor on context close.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MarketPipelineBootstrap {

    private final TransactionStore store;
    private final TransactionMonitor monitor;
    private final MonitorProperties monitorProperties;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady(ApplicationReadyEvent event) {
        store.initialize();
        if (!monitorProperties.isEnabled()) {
            log.info("Transaction monitor disabled (xcpradar.monitor.enabled=false)");
            return;
        }
        monitor.start();
    }

    @EventListener(ContextClosedEvent.class)
    public void onContextClosed(ContextClosedEvent event) {
        monitor.stop();
    }
}
