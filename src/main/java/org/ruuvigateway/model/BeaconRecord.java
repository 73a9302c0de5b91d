package org.ruuvigateway.model;

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;
import java.util.OptionalLong;
import org.ruuvigateway.decode.HexCodec;
import org.ruuvigateway.interfaces.AdvertisementDecoder;
import org.ruuvigateway.util.MacAddresses;

/**
 * One beacon sighting reported by the gateway.
 * Immutable; the payload array is copied on the way in and on the way out.
 */
public final class BeaconRecord {
    private final String identifier;
    private final int signalStrength;
    private final long timestamp;
    private final byte[] payload;
    private final Long ageSeconds;

    /**
     * @param identifier     beacon hardware address, normalized to upper case here
     * @param signalStrength RSSI in dBm
     * @param timestamp      epoch seconds reported by the gateway for this sighting
     * @param payload        raw advertisement bytes, must not be empty
     * @param ageSeconds     response timestamp minus {@code timestamp}, or null when unknown
     */
    public BeaconRecord(String identifier, int signalStrength, long timestamp, byte[] payload, Long ageSeconds) {
        Objects.requireNonNull(identifier, "identifier");
        Objects.requireNonNull(payload, "payload");
        if (payload.length == 0) {
            throw new IllegalArgumentException("payload must not be empty");
        }
        this.identifier = MacAddresses.normalize(identifier);
        this.signalStrength = signalStrength;
        this.timestamp = timestamp;
        this.payload = payload.clone();
        this.ageSeconds = ageSeconds;
    }

    public String getIdentifier() { return identifier; }
    public int getSignalStrength() { return signalStrength; }
    public long getTimestamp() { return timestamp; }
    public byte[] getPayload() { return payload.clone(); }

    public OptionalLong getAgeSeconds() {
        return ageSeconds == null ? OptionalLong.empty() : OptionalLong.of(ageSeconds);
    }

    /** UTC instant of the sighting. */
    public Instant getInstant() {
        return Instant.ofEpochSecond(timestamp);
    }

    /** Byte-exact payload comparison without exposing a copy. */
    public boolean hasPayload(byte[] other) {
        return Arrays.equals(payload, other);
    }

    /**
     * Decodes the advertisement payload with the given decoder.
     *
     * @throws AdvertisementDecodeException if the payload is not a valid advertisement
     */
    public Advertisement parseAnnouncement(AdvertisementDecoder decoder) throws AdvertisementDecodeException {
        return decoder.decode(payload.clone());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof BeaconRecord)) {
            return false;
        }
        BeaconRecord that = (BeaconRecord) o;
        return signalStrength == that.signalStrength
                && timestamp == that.timestamp
                && identifier.equals(that.identifier)
                && Arrays.equals(payload, that.payload)
                && Objects.equals(ageSeconds, that.ageSeconds);
    }

    @Override
    public int hashCode() {
        int h = Objects.hash(identifier, signalStrength, timestamp, ageSeconds);
        return 31 * h + Arrays.hashCode(payload);
    }

    @Override
    public String toString() {
        return "BeaconRecord{" +
                "identifier='" + identifier + '\'' +
                ", signalStrength=" + signalStrength +
                ", timestamp=" + timestamp +
                ", payload=" + HexCodec.encode(payload) +
                ", ageSeconds=" + ageSeconds +
                '}';
    }
}
