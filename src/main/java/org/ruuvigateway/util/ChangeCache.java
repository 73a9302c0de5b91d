package org.ruuvigateway.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.ruuvigateway.model.BeaconRecord;
import org.ruuvigateway.model.HistoryResponse;

/**
 * Change detection over successive history responses.
 * <p>
 * A record is reported when its identifier has not been seen before or when its payload
 * bytes differ from the last payload seen for that identifier. RSSI, timestamp and age
 * do not count as changes. Identifiers absent from a response keep their cached payload.
 * Records within one response are compared against the payloads already taken from it,
 * so a repeated identifier is only reported when its payload differs from the earlier one.
 * <p>
 * {@link #diff} is a pure function: the previous {@link State} is never modified, the
 * caller decides whether to commit {@link Diff#updatedState()}.
 */
public final class ChangeCache {

    private ChangeCache() {
    }

    public static Diff diff(State previous, HistoryResponse response) {
        Objects.requireNonNull(previous, "previous");
        Objects.requireNonNull(response, "response");

        Map<String, byte[]> next = new HashMap<>(previous.payloads);
        List<BeaconRecord> changed = new ArrayList<>();
        for (BeaconRecord record : response.getRecords()) {
            byte[] cached = next.get(record.getIdentifier());
            if (cached == null || !record.hasPayload(cached)) {
                changed.add(record);
                next.put(record.getIdentifier(), record.getPayload());
            }
        }
        State updated = changed.isEmpty() ? previous : new State(next);
        return new Diff(List.copyOf(changed), updated);
    }

    /**
     * @param changed      records to report, in response order
     * @param updatedState cache to use for the next cycle
     */
    public record Diff(List<BeaconRecord> changed, State updatedState) {
    }

    /**
     * Immutable last-seen payload per beacon identifier.
     * Payload arrays are owned by the state and never handed out.
     */
    public static final class State {
        private static final State EMPTY = new State(Collections.emptyMap());

        private final Map<String, byte[]> payloads;

        private State(Map<String, byte[]> payloads) {
            this.payloads = Collections.unmodifiableMap(payloads);
        }

        public static State empty() {
            return EMPTY;
        }

        public int size() {
            return payloads.size();
        }

        public boolean contains(String identifier) {
            return payloads.containsKey(MacAddresses.normalize(identifier));
        }

        /** Copy of the cached payload, or null when the identifier was never seen. */
        public byte[] payloadFor(String identifier) {
            byte[] p = payloads.get(MacAddresses.normalize(identifier));
            return p == null ? null : p.clone();
        }

        @Override
        public String toString() {
            return "ChangeCache.State{size=" + payloads.size() + '}';
        }
    }
}
