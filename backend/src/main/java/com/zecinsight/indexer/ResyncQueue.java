package com.zecinsight.indexer;

import com.zecinsight.indexer.config.IndexerProperties;
import org.springframework.stereotype.Component;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Bounded hand-off between the event publisher and the resync worker. Producers never block.
 */
@Component
public class ResyncQueue {

    private final BlockingQueue<ResyncRequest> queue;

    public ResyncQueue(IndexerProperties properties) {
        this.queue = new ArrayBlockingQueue<>(Math.max(1, properties.getQueueCapacity()));
    }

    /** Returns false when the queue is full and the request was not accepted. */
    public boolean offer(ResyncRequest request) {
        return queue.offer(request);
    }

    public ResyncRequest poll(long timeout, TimeUnit unit) throws InterruptedException {
        return queue.poll(timeout, unit);
    }

    public int size() {
        return queue.size();
    }
}
