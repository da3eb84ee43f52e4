package com.zecinsight.domain;

import java.util.List;

/**
 * Application event: the indexer finished a block touching the given wallets of a project.
 * Consumed by {@link com.zecinsight.indexer.BlockProcessedListener}.
 */
public record BlockProcessedEvent(String projectId, List<String> walletIds, long blockHeight) {
}
