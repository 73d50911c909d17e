package com.xcpradar.ingestion.filter;

import com.xcpradar.ingestion.config.MonitorProperties;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Admits every asset unless xcpradar.monitor.asset-filter.enabled is set, in which case only the
 * configured allowed-assets pass (case-insensitive).
 */
@Component
public class AssetAllowListFilter implements AssetAdmissionFilter {

    private final boolean enabled;
    private final Set<String> allowed;

    public AssetAllowListFilter(MonitorProperties properties) {
        MonitorProperties.AssetFilter config = properties.getAssetFilter();
        this.enabled = config.isEnabled();
        this.allowed = config.getAllowedAssets().stream()
                .filter(a -> a != null && !a.isBlank())
                .map(a -> a.strip().toUpperCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    @Override
    public boolean admits(String asset) {
        if (!enabled) {
            return true;
        }
        return asset != null && allowed.contains(asset.strip().toUpperCase(Locale.ROOT));
    }
}
