package org.ruuvigateway.poll;

import com.google.gson.JsonElement;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import org.ruuvigateway.config.GatewayConfig;
import org.ruuvigateway.decode.HistoryResponseDecoder;
import org.ruuvigateway.interfaces.GatewayClient;
import org.ruuvigateway.interfaces.PollListener;
import org.ruuvigateway.model.BeaconRecord;
import org.ruuvigateway.model.FailureKind;
import org.ruuvigateway.model.GatewayResult;
import org.ruuvigateway.model.HistoryResponse;
import org.ruuvigateway.util.ChangeCache;

/**
 * PollDriver runs the fetch, decode and diff cycle on a fixed schedule and reports each
 * outcome to a {@link PollListener}.
 * <p>
 * <b>Design notes:</b>
 * <ul>
 *   <li>A single scheduler thread runs the cycles; an overdue tick waits for the running cycle, so cycles never overlap.</li>
 *   <li>The change-cache state is only read and replaced under {@code cycleLock}; a cycle's commit happens-before the next cycle's diff.</li>
 *   <li>Failures leave the cache untouched and are retried by the next tick; there is no extra backoff.</li>
 *   <li>{@link #stop()} cancels future ticks and aborts an in-flight request; a cycle that observes the stop does not commit.</li>
 * </ul>
 */
public final class PollDriver {

    /** Where the driver is within a cycle. */
    public enum Phase { IDLE, FETCHING, DECODING, DIFFING }

    static final String MSG_CANCELLED = "Poll cycle cancelled";

    private final GatewayConfig config;
    private final GatewayClient client;
    private final HistoryResponseDecoder decoder;
    private final PollListener listener;
    private final ScheduledExecutorService executor;

    private final Object cycleLock = new Object();
    private ChangeCache.State state = ChangeCache.State.empty(); // guarded by cycleLock

    private volatile Phase phase = Phase.IDLE;
    private volatile boolean stopped;
    private ScheduledFuture<?> ticks; // guarded by this

    public PollDriver(GatewayConfig config, GatewayClient client, PollListener listener) {
        this(config, client, new HistoryResponseDecoder(), listener);
    }

    public PollDriver(GatewayConfig config, GatewayClient client, HistoryResponseDecoder decoder,
                      PollListener listener) {
        this.config = Objects.requireNonNull(config, "config");
        this.client = Objects.requireNonNull(client, "client");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.listener = Objects.requireNonNull(listener, "listener");
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "gateway-poll");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Starts polling; the first cycle runs immediately, then one per poll period.
     *
     * @throws IllegalStateException if the driver was stopped
     */
    public synchronized void start() {
        if (stopped) {
            throw new IllegalStateException("PollDriver has been stopped");
        }
        if (ticks != null) {
            return;
        }
        long periodMs = config.getPollPeriod().toMillis();
        ticks = executor.scheduleAtFixedRate(this::tick, 0L, periodMs, TimeUnit.MILLISECONDS);
        System.out.println("[Poll] polling " + config.getHost() + " every " + periodMs + " ms");
    }

    /**
     * Runs one cycle on the calling thread. Waits for a cycle already running elsewhere.
     *
     * @return the changed records, or the classified failure of this cycle
     */
    public GatewayResult<List<BeaconRecord>> runCycle() {
        synchronized (cycleLock) {
            if (stopped) {
                return cancelled();
            }
            try {
                phase = Phase.FETCHING;
                GatewayResult<JsonElement> fetched = client.fetchHistory(
                        config.getHost(),
                        config.getToken().orElse(null),
                        config.getRequestTimeout().orElse(null));
                if (stopped) {
                    return cancelled();
                }

                phase = Phase.DECODING;
                GatewayResult<HistoryResponse> decoded = fetched.then(decoder::decode);
                if (decoded instanceof GatewayResult.Failed<HistoryResponse> failed) {
                    return fail(failed.kind(), failed.message());
                }
                HistoryResponse response = ((GatewayResult.Ok<HistoryResponse>) decoded).value();

                phase = Phase.DIFFING;
                ChangeCache.Diff diff = ChangeCache.diff(state, response);
                if (stopped) {
                    return cancelled();
                }
                state = diff.updatedState();
                if (!diff.changed().isEmpty()) {
                    System.out.println("[Poll] gateway " + response.getGatewayIdentifierSuffix() + ": "
                            + diff.changed().size() + " of " + response.getRecords().size() + " tags changed");
                }
                listener.onChanges(diff.changed());
                return GatewayResult.ok(diff.changed());
            } finally {
                phase = Phase.IDLE;
            }
        }
    }

    /**
     * Stops the schedule and aborts an in-flight request. Idempotent.
     */
    public void stop() {
        stopped = true;
        synchronized (this) {
            if (ticks != null) {
                ticks.cancel(false);
            }
        }
        client.cancelInFlight();
        executor.shutdown();
    }

    /**
     * Waits for the scheduler thread to finish after {@link #stop()}.
     *
     * @return true if it terminated within {@code timeout}
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public boolean isStopped() {
        return stopped;
    }

    public Phase phase() {
        return phase;
    }

    /** Snapshot of the committed cache. */
    public ChangeCache.State cacheState() {
        synchronized (cycleLock) {
            return state;
        }
    }

    /* ---------------------- internals ---------------------- */

    // A periodic task that throws is silently descheduled, so nothing may escape here.
    private void tick() {
        try {
            runCycle();
        } catch (RuntimeException e) {
            System.err.println("[Poll] cycle aborted: " + e);
        }
    }

    private GatewayResult<List<BeaconRecord>> fail(FailureKind kind, String message) {
        System.err.println("[Poll] cycle failed (" + kind + "): " + message);
        listener.onFailure(kind, message);
        return GatewayResult.failed(kind, message);
    }

    private static GatewayResult<List<BeaconRecord>> cancelled() {
        return GatewayResult.failed(FailureKind.CANNOT_CONNECT, MSG_CANCELLED);
    }
}
