/*
 * Copyright 2026 Johan Haleby
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *        http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.eventcore.processor.consumer;

import org.eventcore.eventstore.api.ReadAll;
import org.eventcore.message.Message;
import org.eventcore.message.RecordedMessage;
import org.eventcore.processor.CurrentPosition;
import org.eventcore.processor.MessageHandlerResult;
import org.eventcore.processor.MessageProcessor;
import org.eventcore.processor.internal.ExecutorShutdown;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.PreDestroy;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * Polls the global log of an event store and dispatches each batch to all active processors concurrently, waiting
 * for all of them before polling the next batch. A processor that throws is logged and closed, and a processor that
 * stops is no longer dispatched to, but neither affects the other processors. The consumer stops polling once there
 * are no active processors left.
 */
public class MessageConsumer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(MessageConsumer.class);

    private final ReadAll readAll;
    private final MessageConsumerConfig config;
    private final ExecutorService processorExecutor;
    private final boolean ownsProcessorExecutor;
    private final ExecutorService pollingExecutor;
    // The global position of the last message dispatched to each processor
    private final Map<MessageProcessor<?>, Long> positions = new ConcurrentHashMap<>();

    private volatile boolean running = false;
    private volatile boolean shutdown = false;
    private volatile Future<?> polling;

    public MessageConsumer(ReadAll readAll, MessageConsumerConfig config) {
        requireNonNull(readAll, ReadAll.class.getSimpleName() + " cannot be null");
        requireNonNull(config, MessageConsumerConfig.class.getSimpleName() + " cannot be null");
        this.readAll = readAll;
        this.config = config;
        this.ownsProcessorExecutor = config.executor == null;
        this.processorExecutor = ownsProcessorExecutor ? Executors.newCachedThreadPool() : config.executor;
        this.pollingExecutor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "message-consumer-" + config.consumerId);
            thread.setDaemon(true);
            return thread;
        });
    }

    public String consumerId() {
        return config.consumerId;
    }

    public List<MessageProcessor<?>> processors() {
        return config.processors;
    }

    /**
     * Start all processors and begin polling. Does nothing if the consumer is already running.
     */
    public synchronized void start() {
        if (shutdown) {
            throw new IllegalStateException("Cannot start consumer " + config.consumerId + " when shutdown");
        } else if (running) {
            return;
        } else if (config.processors.isEmpty()) {
            throw new IllegalStateException("Cannot start consumer " + config.consumerId + " without processors");
        }

        for (MessageProcessor<?> processor : config.processors) {
            CurrentPosition position = processor.start();
            positions.put(processor, resolve(position));
        }
        running = true;
        polling = pollingExecutor.submit(this::pollUntilStopped);
        log.info("Started consumer {} with {} processor(s)", config.consumerId, config.processors.size());
    }

    /**
     * Stop polling and close all processors. The consumer can be started again.
     */
    public synchronized void stop() {
        running = false;
        Future<?> currentPolling = polling;
        if (currentPolling != null) {
            awaitPollingStopped(currentPolling);
            polling = null;
        }
        config.processors.forEach(MessageProcessor::close);
        log.info("Stopped consumer {}", config.consumerId);
    }

    public boolean isRunning() {
        return running;
    }

    @PreDestroy
    @Override
    public synchronized void close() {
        stop();
        shutdown = true;
        ExecutorShutdown.shutdownSafely(pollingExecutor, 5, TimeUnit.SECONDS);
        if (ownsProcessorExecutor) {
            ExecutorShutdown.shutdownSafely(processorExecutor, 5, TimeUnit.SECONDS);
        }
    }

    private long resolve(CurrentPosition position) {
        if (position instanceof CurrentPosition.Checkpoint checkpoint) {
            return checkpoint.lastCheckpoint();
        } else if (position instanceof CurrentPosition.End) {
            return readAll.lastGlobalPosition();
        } else {
            return 0;
        }
    }

    private void pollUntilStopped() {
        while (running && !Thread.currentThread().isInterrupted()) {
            List<MessageProcessor<?>> activeProcessors = config.processors.stream().filter(MessageProcessor::isActive).collect(Collectors.toList());
            if (activeProcessors.isEmpty()) {
                log.info("No active processors left in consumer {}, stops polling", config.consumerId);
                running = false;
                return;
            }

            long after = activeProcessors.stream().mapToLong(positions::get).min().orElse(0);
            List<RecordedMessage<Message>> batch;
            try {
                batch = readAll.readAll(after, config.batchSize);
            } catch (RuntimeException e) {
                log.error("Failed to read messages after global position {} in consumer {}, retrying in {}", after, config.consumerId, config.pollInterval, e);
                batch = List.of();
            }

            if (batch.isEmpty()) {
                if (!sleep()) {
                    return;
                }
            } else {
                dispatch(activeProcessors, batch);
            }
        }
    }

    private boolean sleep() {
        try {
            Thread.sleep(config.pollInterval.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void dispatch(List<MessageProcessor<?>> activeProcessors, List<RecordedMessage<Message>> batch) {
        Map<MessageProcessor<?>, Future<MessageHandlerResult>> results = new LinkedHashMap<>();
        Map<MessageProcessor<?>, Long> lastPositions = new LinkedHashMap<>();
        for (MessageProcessor<?> processor : activeProcessors) {
            long position = positions.get(processor);
            List<RecordedMessage<Message>> messages = new ArrayList<>();
            for (RecordedMessage<Message> message : batch) {
                if (message.globalPosition() > position) {
                    messages.add(message);
                }
            }
            if (!messages.isEmpty()) {
                results.put(processor, processorExecutor.submit(() -> processor.handle(messages)));
                lastPositions.put(processor, messages.get(messages.size() - 1).globalPosition());
            }
        }

        results.forEach((processor, result) -> {
            try {
                MessageHandlerResult handlerResult = result.get();
                positions.put(processor, lastPositions.get(processor));
                if (handlerResult instanceof MessageHandlerResult.Stop stop) {
                    log.info("Processor {} in consumer {} stopped: {}", processor.id(), config.consumerId, stop.reason());
                }
            } catch (ExecutionException e) {
                log.error("Processor {} in consumer {} failed, closing it", processor.id(), config.consumerId, e.getCause());
                processor.close();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                result.cancel(true);
            }
        });
    }

    private void awaitPollingStopped(Future<?> currentPolling) {
        try {
            currentPolling.get(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException e) {
            log.error("Polling in consumer {} failed", config.consumerId, e.getCause());
        } catch (TimeoutException e) {
            log.warn("Polling in consumer {} didn't stop within 5 seconds, interrupting it", config.consumerId);
            currentPolling.cancel(true);
        }
    }
}
