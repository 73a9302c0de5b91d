package org.ruuvigateway.model;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Decoded body of the gateway's {@code /history} endpoint.
 */
public final class HistoryResponse {
    private final long timestamp;
    private final String gatewayIdentifier;
    private final List<BeaconRecord> records;
    private final String coordinates;

    public HistoryResponse(long timestamp, String gatewayIdentifier, List<BeaconRecord> records, String coordinates) {
        this.timestamp = timestamp;
        this.gatewayIdentifier = Objects.requireNonNull(gatewayIdentifier, "gatewayIdentifier");
        this.records = List.copyOf(records);
        this.coordinates = (coordinates == null) ? "" : coordinates;
    }

    public long getTimestamp() { return timestamp; }
    public String getGatewayIdentifier() { return gatewayIdentifier; }
    public List<BeaconRecord> getRecords() { return records; }
    public String getCoordinates() { return coordinates; }

    public Instant getInstant() {
        return Instant.ofEpochSecond(timestamp);
    }

    /** Last five characters of the gateway MAC, upper-cased. Display only. */
    public String getGatewayIdentifierSuffix() {
        int from = Math.max(0, gatewayIdentifier.length() - 5);
        return gatewayIdentifier.substring(from).toUpperCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return "HistoryResponse{" +
                "timestamp=" + timestamp +
                ", gatewayIdentifier='" + gatewayIdentifier + '\'' +
                ", records=" + records.size() +
                ", coordinates='" + coordinates + '\'' +
                '}';
    }
}
