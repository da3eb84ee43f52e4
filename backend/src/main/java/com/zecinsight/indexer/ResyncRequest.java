package com.zecinsight.indexer;

import com.zecinsight.domain.BlockProcessedEvent;

import java.time.Instant;
import java.util.List;

/**
 * Wallet set to rescore after a block. walletIds is distinct and sorted so equal sets share a throttle key.
 */
public record ResyncRequest(String projectId, List<String> walletIds, long blockHeight, Instant receivedAt) {

    public static ResyncRequest from(BlockProcessedEvent event) {
        List<String> ids = event.walletIds() == null ? List.of()
                : event.walletIds().stream().distinct().sorted().toList();
        return new ResyncRequest(event.projectId(), ids, event.blockHeight(), Instant.now());
    }

    public String throttleKey() {
        return projectId + ":" + String.join(",", walletIds);
    }
}
