package hintvote.coordinator.scheduler;

import hintvote.coordinator.util.MonotonicClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Fixed pool of worker threads sharing one earliest-deadline-first queue.
 *
 * <p>
 * Callers register a {@link DeadlineStream} once and then schedule small
 * (stream, payload, deadline) entries. Workers sleep until the earliest
 * deadline, pop the entry and invoke the stream outside the queue lock. An
 * entry whose stream was unregistered in the meantime is dropped. There is no
 * dequeue-by-id: a stream that finds its entry stale simply does nothing, or
 * returns a new deadline to be re-queued.
 *
 * <p>
 * Every {@link #schedule} wakes all workers, since the worker able to act on a
 * new minimum cannot be predicted.
 */
public class DeadlineScheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DeadlineScheduler.class);
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 5;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private final PriorityQueue<ScheduledTask> queue = new PriorityQueue<>(
            Comparator.comparingLong(ScheduledTask::deadlineNanos));
    private final Map<Integer, DeadlineStream> streams = new HashMap<>();
    private final Set<Thread> workers = ConcurrentHashMap.newKeySet();
    private final int threadCount;
    private final String namePrefix;
    private final MonotonicClock clock;

    // Guarded by lock
    private ExecutorService executor;
    private int nextStreamId = 1;
    private boolean stopped = false;
    private volatile boolean running = false;

    /**
     * @param threadCount number of worker threads, at least 1
     * @param namePrefix  prefix for worker thread names
     * @param clock       monotonic time source deadlines are expressed in
     */
    public DeadlineScheduler(int threadCount, String namePrefix, MonotonicClock clock) {
        if (threadCount < 1) {
            throw new IllegalArgumentException("threadCount must be positive");
        }
        this.threadCount = threadCount;
        this.namePrefix = Objects.requireNonNull(namePrefix, "namePrefix");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Start the worker threads. Entries scheduled before start wait in the queue.
     */
    public void start() {
        lock.lock();
        try {
            if (running) {
                log.warn("DeadlineScheduler {} already running", namePrefix);
                return;
            }
            if (stopped) {
                throw new IllegalStateException("DeadlineScheduler " + namePrefix + " was stopped");
            }
            AtomicInteger index = new AtomicInteger();
            executor = Executors.newFixedThreadPool(threadCount, r -> {
                Thread t = new Thread(r, namePrefix + "-" + index.getAndIncrement());
                t.setDaemon(true);
                workers.add(t);
                return t;
            });
            for (int i = 0; i < threadCount; i++) {
                executor.execute(this::workerLoop);
            }
            running = true;
        } finally {
            lock.unlock();
        }
        log.info("DeadlineScheduler {} started with {} worker(s)", namePrefix, threadCount);
    }

    /**
     * Register a callback stream.
     *
     * @return id to pass to {@link #schedule}
     */
    public int register(DeadlineStream stream) {
        Objects.requireNonNull(stream, "stream");
        lock.lock();
        try {
            int id = nextStreamId++;
            streams.put(id, stream);
            return id;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Unregister a stream. Entries still queued for it are dropped when they come due.
     *
     * @return false if the stream was unknown
     */
    public boolean unregister(int streamId) {
        lock.lock();
        try {
            return streams.remove(streamId) != null;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Queue {@code payloadId} for {@code streamId} at {@code deadlineNanos}.
     * A deadline in the past fires as soon as a worker is free.
     */
    public void schedule(int streamId, long payloadId, long deadlineNanos) {
        lock.lock();
        try {
            if (stopped) {
                log.debug("Dropping payload {} for stream {}: scheduler stopped", payloadId, streamId);
                return;
            }
            queue.add(new ScheduledTask(deadlineNanos, streamId, payloadId));
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Number of queued entries, including those for unregistered streams.
     */
    public int pending() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Stop all workers and wait for them to exit. Queued entries are discarded.
     */
    public void stop() {
        ExecutorService pool;
        lock.lock();
        try {
            if (stopped) {
                return;
            }
            stopped = true;
            running = false;
            queue.clear();
            changed.signalAll();
            pool = executor;
        } finally {
            lock.unlock();
        }

        if (pool == null) {
            log.info("DeadlineScheduler {} stopped before start", namePrefix);
            return;
        }
        pool.shutdown();
        // A worker stopping its own scheduler cannot wait for itself
        if (workers.contains(Thread.currentThread())) {
            log.info("DeadlineScheduler {} stopping from worker {}", namePrefix, Thread.currentThread().getName());
            return;
        }
        try {
            if (!pool.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                pool.shutdownNow();
                log.warn("DeadlineScheduler {} forcefully stopped", namePrefix);
            } else {
                log.info("DeadlineScheduler {} stopped", namePrefix);
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    private void workerLoop() {
        while (true) {
            ScheduledTask task;
            DeadlineStream stream;
            lock.lock();
            try {
                task = awaitDue();
                if (task == null) {
                    return;
                }
                stream = streams.get(task.streamId());
            } catch (InterruptedException e) {
                log.debug("Worker {} interrupted", Thread.currentThread().getName());
                return;
            } finally {
                lock.unlock();
            }

            if (stream == null) {
                log.debug("Dropping payload {}: stream {} unregistered", task.payloadId(), task.streamId());
                continue;
            }
            fire(stream, task);
        }
    }

    // Caller holds lock. Returns null once stopped.
    private ScheduledTask awaitDue() throws InterruptedException {
        while (!stopped) {
            ScheduledTask head = queue.peek();
            if (head == null) {
                changed.await();
                continue;
            }
            long waitNanos = head.deadlineNanos() - clock.nowNanos();
            if (waitNanos > 0) {
                changed.awaitNanos(waitNanos);
                continue;
            }
            return queue.poll();
        }
        return null;
    }

    private void fire(DeadlineStream stream, ScheduledTask task) {
        OptionalLong next;
        try {
            next = stream.onDeadline(task.payloadId(), task.deadlineNanos());
        } catch (Exception e) {
            log.error("Stream {} failed on payload {}", task.streamId(), task.payloadId(), e);
            return;
        }
        if (next != null && next.isPresent()) {
            schedule(task.streamId(), task.payloadId(), next.getAsLong());
        }
    }

    /**
     * Convenience for tests and callers that think in relative delays.
     */
    public long deadlineAfter(long delay, TimeUnit unit) {
        return clock.nowNanos() + unit.toNanos(delay);
    }
}
