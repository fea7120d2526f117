package hintvote.coordinator.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Typed timer on top of a shared {@link DeadlineScheduler}.
 * Holds the payloads so the scheduler queue only carries ids.
 *
 * @param <P> payload type
 */
public final class DeadlineTimer<P> implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DeadlineTimer.class);

    /**
     * Handles a payload once its deadline passes.
     */
    @FunctionalInterface
    public interface Handler<P> {
        /**
         * @return a later deadline to fire the same payload again, or empty when done
         */
        OptionalLong onDeadline(P payload, long deadlineNanos);
    }

    private final DeadlineScheduler scheduler;
    private final Handler<P> handler;
    private final int streamId;
    private final Map<Long, P> payloads = new ConcurrentHashMap<>();
    private final AtomicLong nextPayloadId = new AtomicLong();

    public DeadlineTimer(DeadlineScheduler scheduler, Handler<P> handler) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.handler = Objects.requireNonNull(handler, "handler");
        this.streamId = scheduler.register(this::fire);
    }

    /**
     * Fire {@code payload} no earlier than {@code deadlineNanos}.
     */
    public void schedule(P payload, long deadlineNanos) {
        long id = nextPayloadId.incrementAndGet();
        payloads.put(id, payload);
        scheduler.schedule(streamId, id, deadlineNanos);
    }

    /**
     * Payloads waiting to fire.
     */
    public int pending() {
        return payloads.size();
    }

    private OptionalLong fire(long payloadId, long deadlineNanos) {
        P payload = payloads.remove(payloadId);
        if (payload == null) {
            log.debug("Payload {} already consumed", payloadId);
            return OptionalLong.empty();
        }
        OptionalLong next = handler.onDeadline(payload, deadlineNanos);
        if (next.isPresent()) {
            payloads.put(payloadId, payload);
        }
        return next;
    }

    @Override
    public void close() {
        scheduler.unregister(streamId);
        payloads.clear();
    }
}
