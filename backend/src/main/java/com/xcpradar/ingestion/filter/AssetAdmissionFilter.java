package com.xcpradar.ingestion.filter;

/**
 * Decides whether market activity for an asset is tracked at all.
 */
@FunctionalInterface
public interface AssetAdmissionFilter {

    boolean admits(String asset);

    static AssetAdmissionFilter acceptAll() {
        return asset -> true;
    }
}
