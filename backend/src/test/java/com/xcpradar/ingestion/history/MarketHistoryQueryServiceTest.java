package com.xcpradar.ingestion.history;

import com.xcpradar.domain.StoreStats;
import com.xcpradar.ingestion.store.TransactionStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MarketHistoryQueryServiceTest {

    @Mock
    private TransactionStore store;

    @InjectMocks
    private MarketHistoryQueryService service;

    @Test
    @DisplayName("limits outside 1..100 are rejected before touching the store")
    void limitBounds() {
        assertThatThrownBy(() -> service.recentSales(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.recentListings(101)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.recent(-1)).isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(store);
    }

    @Test
    @DisplayName("valid limits are passed through")
    void passThrough() {
        service.recentSales(100);
        service.recentListings(1);

        verify(store).querySales(100);
        verify(store).queryListings(1);
    }

    @Test
    @DisplayName("summary combines retention-window totals with store stats")
    void summary() {
        StoreStats stats = new StoreStats(7, 4, 3, 1_700_000_000L);
        when(store.getTotalSales()).thenReturn(2L);
        when(store.getTotalListings()).thenReturn(1L);
        when(store.getStats()).thenReturn(stats);

        MarketHistoryQueryService.MarketSummary summary = service.summary();

        assertThat(summary.salesLast30Days()).isEqualTo(2);
        assertThat(summary.listingsLast30Days()).isEqualTo(1);
        assertThat(summary.stats()).isEqualTo(stats);
    }
}
