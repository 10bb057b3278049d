package com.fantasy.anomaly.sink;

import com.fantasy.anomaly.config.MonitorProperties;
import com.fantasy.anomaly.model.AnomalyBatch;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Bounded hand-off between the monitoring loop and the downstream sinks.
 *
 * The loop publishes into the queue and blocks while it is full. A single
 * dispatcher thread takes batches in order and delivers each one to every
 * subscribed sink; a failing sink does not stop delivery to the others.
 * Every other {@link AlertSink} bean is subscribed once the application is ready.
 */
@Component
public class AnomalyBatchChannel implements AlertSink {

    private static final Logger log = LoggerFactory.getLogger(AnomalyBatchChannel.class);

    private final BlockingQueue<AnomalyBatch> queue;
    private final ObjectProvider<AlertSink> sinkBeans;
    private final List<AlertSink> subscribers = new CopyOnWriteArrayList<>();

    private volatile Thread dispatcher;

    public AnomalyBatchChannel(MonitorProperties properties, ObjectProvider<AlertSink> sinkBeans) {
        this.queue = new LinkedBlockingQueue<>(Math.max(1, properties.getChannelCapacity()));
        this.sinkBeans = sinkBeans;
    }

    @Override
    public void publish(AnomalyBatch batch) {
        try {
            if (queue.remainingCapacity() == 0) {
                log.warn("Batch channel full, cycle {} waiting for dispatcher", batch.getCycleId());
            }
            queue.put(batch);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while publishing batch " + batch.getCycleId(), e);
        }
    }

    public void subscribe(AlertSink sink) {
        subscribers.add(sink);
    }

    /**
     * Take the oldest batch, waiting up to {@code timeout}. Used by the dispatcher.
     */
    public Optional<AnomalyBatch> poll(Duration timeout) throws InterruptedException {
        return Optional.ofNullable(queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS));
    }

    public int size() {
        return queue.size();
    }

    @EventListener(ApplicationReadyEvent.class)
    public synchronized void startDispatcher() {
        if (dispatcher != null) {
            return;
        }
        sinkBeans.orderedStream()
                .filter(sink -> sink != this)
                .forEach(this::subscribe);
        log.info("Batch channel dispatcher starting, subscribers: {}", subscribers.stream()
                .map(s -> s.getClass().getSimpleName())
                .collect(Collectors.toList()));

        Thread t = new Thread(this::dispatchLoop, "anomaly-batch-dispatch");
        t.setDaemon(true);
        dispatcher = t;
        t.start();
    }

    @PreDestroy
    public synchronized void stopDispatcher() {
        if (dispatcher != null) {
            dispatcher.interrupt();
            dispatcher = null;
        }
    }

    private void dispatchLoop() {
        while (!Thread.currentThread().isInterrupted()) {
            try {
                poll(Duration.ofSeconds(1)).ifPresent(this::deliver);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        log.info("Batch channel dispatcher stopped");
    }

    void deliver(AnomalyBatch batch) {
        for (AlertSink sink : subscribers) {
            try {
                sink.publish(batch);
            } catch (Exception e) {
                log.error("Sink {} failed for cycle {}: {}",
                        sink.getClass().getSimpleName(), batch.getCycleId(), e.getMessage(), e);
            }
        }
    }
}
