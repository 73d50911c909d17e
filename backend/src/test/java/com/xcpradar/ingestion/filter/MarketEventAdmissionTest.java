package com.xcpradar.ingestion.filter;

import com.xcpradar.ingestion.adapter.DispenseEvent;
import com.xcpradar.ingestion.adapter.DispenserEvent;
import com.xcpradar.ingestion.adapter.OrderEvent;
import com.xcpradar.ingestion.adapter.OrderMatchEvent;
import com.xcpradar.ingestion.config.MonitorProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MarketEventAdmissionTest {

    private final MarketEventAdmission acceptAll = new MarketEventAdmission(AssetAdmissionFilter.acceptAll());

    @Test
    @DisplayName("only final or open statuses are admitted")
    void statusGate() {
        assertThat(acceptAll.admits(dispense("valid"))).isTrue();
        assertThat(acceptAll.admits(dispense("invalid: insufficient funds"))).isFalse();
        assertThat(acceptAll.admits(dispenser("open"))).isTrue();
        assertThat(acceptAll.admits(dispenser("closed"))).isFalse();
        assertThat(acceptAll.admits(match("completed"))).isTrue();
        assertThat(acceptAll.admits(match("pending"))).isFalse();
        assertThat(acceptAll.admits(order("open"))).isTrue();
        assertThat(acceptAll.admits(order("filled"))).isFalse();
    }

    @Test
    @DisplayName("events without a tx hash are rejected")
    void blankHash() {
        assertThat(acceptAll.admits(new DispenseEvent(" ", "valid", "A", 1, 1, 1, "d"))).isFalse();
    }

    @Test
    @DisplayName("allow-list admits an event when any touched asset is listed")
    void allowList() {
        MonitorProperties props = new MonitorProperties();
        props.getAssetFilter().setEnabled(true);
        props.getAssetFilter().setAllowedAssets(List.of("fakeasf"));
        MarketEventAdmission admission = new MarketEventAdmission(new AssetAllowListFilter(props));

        assertThat(admission.admits(dispense("valid"))).isTrue();
        assertThat(admission.admits(new DispenseEvent("h", "valid", "OTHER", 1, 1, 1, "d"))).isFalse();
        assertThat(admission.admits(match("completed"))).isTrue();
    }

    @Test
    @DisplayName("disabled allow-list admits every asset")
    void allowListDisabled() {
        MonitorProperties props = new MonitorProperties();
        props.getAssetFilter().setAllowedAssets(List.of("ONLYTHIS"));
        AssetAllowListFilter filter = new AssetAllowListFilter(props);

        assertThat(filter.admits("ANYTHING")).isTrue();
    }

    private static DispenseEvent dispense(String status) {
        return new DispenseEvent("h1", status, "FAKEASF", 1, 100, 1_700_000_000L, "disp");
    }

    private static DispenserEvent dispenser(String status) {
        return new DispenserEvent("h2", status, "FAKEASF", 1, 5, 1000, 100, 1_700_000_000L, "1src", 5);
    }

    private static OrderMatchEvent match(String status) {
        return new OrderMatchEvent("h3", status, "XCP", 100_000_000, "FAKEASF", 1, 100, 1_700_000_000L);
    }

    private static OrderEvent order(String status) {
        return new OrderEvent("h4", status, "FAKEASF", 1, "XCP", 100_000_000, 100, 1_700_000_000L);
    }
}
