package com.xcpradar.ingestion.store;

import com.xcpradar.domain.Transaction;
import com.xcpradar.domain.TransactionType;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;

class TransactionRowMapper implements RowMapper<Transaction> {

    static final TransactionRowMapper INSTANCE = new TransactionRowMapper();

    @Override
    public Transaction mapRow(ResultSet rs, int rowNum) throws SQLException {
        return Transaction.builder()
                .txHash(rs.getString("tx_hash"))
                .type(TransactionType.valueOf(rs.getString("type")))
                .asset(rs.getString("asset"))
                .amount(rs.getLong("amount"))
                .price(rs.getLong("price"))
                .paymentAsset(rs.getString("payment_asset"))
                .timestamp(rs.getLong("block_time"))
                .blockIndex(rs.getLong("block_index"))
                .notified(rs.getInt("notified") == 1)
                .createdAt(rs.getLong("created_at"))
                .build();
    }
}
