package com.zecinsight.indexer;

import com.zecinsight.domain.BlockProcessedEvent;
import com.zecinsight.indexer.config.IndexerProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class BlockProcessedListenerTest {

    private static ResyncQueue queue(int capacity) {
        IndexerProperties properties = new IndexerProperties();
        properties.setQueueCapacity(capacity);
        return new ResyncQueue(properties);
    }

    @Test
    @DisplayName("event becomes a request with a distinct sorted wallet set")
    void onBlockProcessed_enqueuesNormalizedRequest() throws InterruptedException {
        ResyncQueue queue = queue(10);
        new BlockProcessedListener(queue).onBlockProcessed(
                new BlockProcessedEvent("p1", List.of("w2", "w1", "w2"), 2_500_000L));

        ResyncRequest request = queue.poll(10, TimeUnit.MILLISECONDS);
        assertThat(request).isNotNull();
        assertThat(request.walletIds()).containsExactly("w1", "w2");
        assertThat(request.throttleKey()).isEqualTo("p1:w1,w2");
        assertThat(request.blockHeight()).isEqualTo(2_500_000L);
    }

    @Test
    @DisplayName("events without a project or wallets are ignored")
    void onBlockProcessed_incompleteEvent_ignored() {
        ResyncQueue queue = queue(10);
        BlockProcessedListener listener = new BlockProcessedListener(queue);
        listener.onBlockProcessed(new BlockProcessedEvent(null, List.of("w1"), 1L));
        listener.onBlockProcessed(new BlockProcessedEvent("p1", List.of(), 1L));
        listener.onBlockProcessed(new BlockProcessedEvent("p1", null, 1L));
        assertThat(queue.size()).isZero();
    }

    @Test
    @DisplayName("full queue drops the event without blocking the publisher")
    void onBlockProcessed_fullQueue_drops() {
        ResyncQueue queue = queue(1);
        BlockProcessedListener listener = new BlockProcessedListener(queue);
        listener.onBlockProcessed(new BlockProcessedEvent("p1", List.of("w1"), 1L));
        listener.onBlockProcessed(new BlockProcessedEvent("p1", List.of("w2"), 2L));
        assertThat(queue.size()).isEqualTo(1);
    }
}
