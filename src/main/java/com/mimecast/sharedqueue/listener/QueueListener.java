package com.mimecast.sharedqueue.listener;

import com.mimecast.sharedqueue.config.ListenerSettings;
import com.mimecast.sharedqueue.metrics.ListenerMetrics;
import com.mimecast.sharedqueue.queue.QueueMessage;
import com.mimecast.sharedqueue.queue.QueueTransport;
import com.mimecast.sharedqueue.queue.QueueTransportException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.Closeable;
import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Shared queue poll loop.
 * <p>A single poll thread cycles through:
 * <pre>
 *     IDLE -&gt; POLLING -&gt; DISPATCHING -&gt; WAITING -&gt; POLLING ...
 * </pre>
 * <p>Messages are handed to a {@link ThreadPoolExecutor} so a slow handler does not hold up the batch.
 * <br>A new batch is only fetched once in-flight messages drop to the new batch threshold.
 * <p>Between polls the loop waits for the {@link DelayStrategy} interval on the {@link WakeSignal},
 * <br>so a producer signal cuts the wait short.
 * <p>Stopping fetches no further batch and gives in-flight messages the drain timeout to finish.
 *
 * @see QueueMessageProcessor
 */
public class QueueListener implements Closeable {
    private static final Logger log = LogManager.getLogger(QueueListener.class);

    private final QueueTransport sharedQueue;
    private final QueueMessageProcessor processor;
    private final DelayStrategy delayStrategy;
    private final WakeSignal wakeSignal;
    private final ListenerSettings settings;

    /**
     * Worker pool for message processing.
     */
    private final ThreadPoolExecutor workers;

    // Guards inFlight.
    private final Lock capacityLock = new ReentrantLock();
    private final Condition capacityAvailable = capacityLock.newCondition();
    private int inFlight = 0;

    private volatile ListenerState state = ListenerState.IDLE;
    private volatile boolean stopRequested = false;
    private final CountDownLatch stopped = new CountDownLatch(1);
    private Thread pollThread;

    /**
     * Constructs a new QueueListener instance.
     *
     * @param sharedQueue   Shared queue to poll.
     * @param processor     Message processor.
     * @param delayStrategy Delay strategy, owned by this listener.
     * @param wakeSignal    Wake signal.
     * @param settings      Listener settings.
     */
    public QueueListener(QueueTransport sharedQueue, QueueMessageProcessor processor, DelayStrategy delayStrategy,
                         WakeSignal wakeSignal, ListenerSettings settings) {
        this.sharedQueue = Objects.requireNonNull(sharedQueue, "sharedQueue");
        this.processor = Objects.requireNonNull(processor, "processor");
        this.delayStrategy = Objects.requireNonNull(delayStrategy, "delayStrategy");
        this.wakeSignal = Objects.requireNonNull(wakeSignal, "wakeSignal");
        this.settings = Objects.requireNonNull(settings, "settings");

        AtomicInteger threadCount = new AtomicInteger();
        this.workers = new ThreadPoolExecutor(
                settings.getMinimumPoolSize(),
                settings.getMaximumPoolSize(),
                settings.getThreadKeepAliveTime(), TimeUnit.SECONDS,
                new SynchronousQueue<>(),
                r -> {
                    Thread thread = new Thread(r, "SharedQueueWorker-" + sharedQueue.getName() + "-" + threadCount.incrementAndGet());
                    thread.setDaemon(true);
                    return thread;
                },
                (r, executor) -> {
                    // Caller runs while open. Once shut down the caller must release the slot.
                    if (executor.isShutdown()) {
                        throw new RejectedExecutionException("Worker pool is shut down");
                    }
                    r.run();
                }
        );
    }

    /**
     * Starts the poll thread.
     *
     * @throws IllegalStateException If already started or stopped.
     */
    public synchronized void start() {
        if (state != ListenerState.IDLE || pollThread != null || stopRequested) {
            throw new IllegalStateException("Listener cannot be started from state " + state);
        }

        pollThread = new Thread(this::run, "SharedQueueListener-" + sharedQueue.getName());
        pollThread.setDaemon(true);
        pollThread.start();
        log.info("Listener started: queue={}, settings={}", sharedQueue.getName(), settings);
    }

    /**
     * Poll loop.
     */
    void run() {
        while (!stopRequested) {
            try {
                awaitCapacity();
                if (stopRequested) {
                    break;
                }

                transition(ListenerState.POLLING);
                List<QueueMessage> batch = poll();
                boolean hadMessages = !batch.isEmpty();

                if (hadMessages) {
                    transition(ListenerState.DISPATCHING);
                    dispatch(batch);
                }

                if (stopRequested) {
                    break;
                }

                transition(ListenerState.WAITING);
                Duration delay = delayStrategy.next(hadMessages);
                boolean woken = wakeSignal.await(delay);
                log.trace("Wait over: queue={}, delay={}, woken={}", sharedQueue.getName(), delay, woken);

            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.debug("Poll thread interrupted: queue={}", sharedQueue.getName());
                break;

            } catch (Exception e) {
                log.error("Poll cycle error: queue={}, error={}", sharedQueue.getName(), e.getMessage());
            }
        }
        log.debug("Poll loop exited: queue={}", sharedQueue.getName());
    }

    /**
     * Dequeue a batch.
     * <p>A transport error counts as an empty poll so the backoff applies.
     *
     * @return Messages, empty on error.
     */
    List<QueueMessage> poll() {
        try {
            List<QueueMessage> batch = sharedQueue.dequeueBatch(settings.getBatchSize());
            if (!batch.isEmpty()) {
                log.debug("Dequeued batch: queue={}, size={}", sharedQueue.getName(), batch.size());
            }
            return batch;
        } catch (QueueTransportException e) {
            ListenerMetrics.incrementTransportError("dequeue");
            log.error("Dequeue failed: queue={}, error={}", sharedQueue.getName(), e.getMessage());
            return Collections.emptyList();
        }
    }

    /**
     * Hand every message of the batch to the worker pool.
     * <p>Messages rejected by a shut down pool stay on the queue and reappear after their invisibility period.
     *
     * @param batch Messages.
     */
    void dispatch(List<QueueMessage> batch) {
        for (QueueMessage message : batch) {
            acquire();
            try {
                workers.execute(() -> {
                    try {
                        processor.process(message);
                    } catch (Exception e) {
                        log.error("Unexpected processing error: uid={}, error={}", message.getMessageId(), e.getMessage());
                    } finally {
                        releaseCapacity();
                    }
                });
            } catch (RuntimeException e) {
                releaseCapacity();
                log.error("Dispatch rejected: uid={}, error={}", message.getMessageId(), e.getMessage());
            }
        }
    }

    private void transition(ListenerState next) {
        if (state != ListenerState.STOPPED) {
            state = next;
        }
    }

    private void acquire() {
        capacityLock.lock();
        try {
            inFlight++;
        } finally {
            capacityLock.unlock();
        }
    }

    private void releaseCapacity() {
        capacityLock.lock();
        try {
            inFlight--;
            capacityAvailable.signalAll();
        } finally {
            capacityLock.unlock();
        }
    }

    /**
     * Block while in-flight messages exceed the new batch threshold.
     *
     * @throws InterruptedException Poll thread interrupted.
     */
    private void awaitCapacity() throws InterruptedException {
        capacityLock.lock();
        try {
            while (inFlight > settings.getNewBatchThreshold() && !stopRequested) {
                capacityAvailable.await();
            }
        } finally {
            capacityLock.unlock();
        }
    }

    /**
     * Whether stop was requested.
     *
     * @return true once stop was called.
     */
    boolean isStopRequested() {
        return stopRequested;
    }

    /**
     * Stops the listener.
     * <p>No batch is fetched after this call. In-flight messages get the drain timeout
     * <br>to complete after which the worker pool is forced down.
     * <p>Concurrent callers return once the first caller finished draining.
     */
    public void stop() {
        Thread thread;
        boolean alreadyStopping;
        synchronized (this) {
            alreadyStopping = stopRequested;
            stopRequested = true;
            thread = pollThread;
        }
        if (alreadyStopping) {
            awaitStopped();
            return;
        }

        log.info("Listener stopping: queue={}, inFlight={}", sharedQueue.getName(), getInFlightCount());
        wakeSignal.signal();
        capacityLock.lock();
        try {
            capacityAvailable.signalAll();
        } finally {
            capacityLock.unlock();
        }

        long deadline = System.nanoTime() + settings.getDrainTimeout().toNanos();
        try {
            if (thread != null) {
                thread.join(Math.max(1L, settings.getDrainTimeout().toMillis()));
                if (thread.isAlive()) {
                    log.warn("Poll thread still busy after drain timeout, interrupting: queue={}", sharedQueue.getName());
                    thread.interrupt();
                }
            }

            workers.shutdown();
            long remaining = deadline - System.nanoTime();
            if (!workers.awaitTermination(Math.max(remaining, 0L), TimeUnit.NANOSECONDS)) {
                List<Runnable> dropped = workers.shutdownNow();
                log.warn("Drain timeout elapsed, forcing shutdown: queue={}, inFlight={}, queued={}",
                        sharedQueue.getName(), getInFlightCount(), dropped.size());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
            log.warn("Interrupted while draining: queue={}", sharedQueue.getName());
        }

        state = ListenerState.STOPPED;
        stopped.countDown();
        log.info("Listener stopped: queue={}", sharedQueue.getName());
    }

    private void awaitStopped() {
        try {
            stopped.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for listener to stop: queue={}", sharedQueue.getName());
        }
    }

    /**
     * Stops the listener.
     */
    @Override
    public void close() {
        stop();
    }

    /**
     * Gets the current state.
     *
     * @return ListenerState.
     */
    public ListenerState getState() {
        return state;
    }

    /**
     * Gets the number of messages being processed.
     *
     * @return Count.
     */
    public int getInFlightCount() {
        capacityLock.lock();
        try {
            return inFlight;
        } finally {
            capacityLock.unlock();
        }
    }

    /**
     * Gets the number of active worker threads.
     *
     * @return The number of active threads.
     */
    public int getActiveThreads() {
        return workers.getActiveCount();
    }
}
