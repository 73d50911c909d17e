package com.xcpradar.ingestion.job;

import com.xcpradar.ingestion.config.MonitorProperties;
import com.xcpradar.ingestion.store.TransactionStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class MarketPipelineBootstrapTest {

    @Mock
    private TransactionStore store;

    @Mock
    private TransactionMonitor monitor;

    private MonitorProperties properties;
    private MarketPipelineBootstrap bootstrap;

    @BeforeEach
    void setUp() {
        properties = new MonitorProperties();
        bootstrap = new MarketPipelineBootstrap(store, monitor, properties);
    }

    @Test
    @DisplayName("initializes the store before starting the monitor")
    void storeThenMonitor() {
        bootstrap.onApplicationReady(null);

        InOrder order = inOrder(store, monitor);
        order.verify(store).initialize();
        order.verify(monitor).start();
    }

    @Test
    @DisplayName("monitor stays down when disabled")
    void disabled() {
        properties.setEnabled(false);

        bootstrap.onApplicationReady(null);

        verify(store).initialize();
        verify(monitor, never()).start();
    }

    @Test
    @DisplayName("store failure aborts startup and the monitor never starts")
    void storeFailure() {
        doThrow(new IllegalStateException("disk full")).when(store).initialize();

        assertThatThrownBy(() -> bootstrap.onApplicationReady(null)).isInstanceOf(IllegalStateException.class);
        verify(monitor, never()).start();
    }

    @Test
    @DisplayName("context close stops the monitor")
    void stopOnClose() {
        bootstrap.onContextClosed(null);

        verify(monitor).stop();
    }
}
