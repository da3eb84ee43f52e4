package com.zecinsight.indexer;

import com.zecinsight.domain.BlockProcessedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Turns indexer block notifications into queued resync requests. Fire-and-forget for the publisher.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BlockProcessedListener {

    private final ResyncQueue resyncQueue;

    @EventListener
    public void onBlockProcessed(BlockProcessedEvent event) {
        if (event.projectId() == null || event.walletIds() == null || event.walletIds().isEmpty()) {
            return;
        }
        ResyncRequest request = ResyncRequest.from(event);
        if (!resyncQueue.offer(request)) {
            log.warn("Resync queue full, dropped block {} for project {} ({} wallets)",
                    event.blockHeight(), event.projectId(), request.walletIds().size());
        }
    }
}
