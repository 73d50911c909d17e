package com.xcpradar.api.dto;

import java.util.List;

public record MarketFeedResponse(List<TransactionResponse> sales, List<TransactionResponse> listings) {
}
