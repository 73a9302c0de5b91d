package org.ruuvigateway.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Structured view of a Bluetooth LE advertisement (GAP AD structures).
 * Manufacturer and service payloads are kept raw.
 */
public final class Advertisement {
    private final Integer flags;
    private final String localName;
    private final List<String> serviceUuids;
    private final Map<String, byte[]> serviceData;
    private final Map<Integer, byte[]> manufacturerData;
    private final Integer txPower;

    public Advertisement(Integer flags,
                         String localName,
                         List<String> serviceUuids,
                         Map<String, byte[]> serviceData,
                         Map<Integer, byte[]> manufacturerData,
                         Integer txPower) {
        this.flags = flags;
        this.localName = localName;
        this.serviceUuids = List.copyOf(serviceUuids);
        this.serviceData = Collections.unmodifiableMap(new LinkedHashMap<>(serviceData));
        this.manufacturerData = Collections.unmodifiableMap(new LinkedHashMap<>(manufacturerData));
        this.txPower = txPower;
    }

    public OptionalInt getFlags() {
        return flags == null ? OptionalInt.empty() : OptionalInt.of(flags);
    }

    public Optional<String> getLocalName() { return Optional.ofNullable(localName); }
    public List<String> getServiceUuids() { return serviceUuids; }

    /** Service data keyed by full 128-bit UUID string. */
    public Map<String, byte[]> getServiceData() { return serviceData; }

    /** Manufacturer data keyed by Bluetooth SIG company identifier. */
    public Map<Integer, byte[]> getManufacturerData() { return manufacturerData; }

    public OptionalInt getTxPower() {
        return txPower == null ? OptionalInt.empty() : OptionalInt.of(txPower);
    }

    @Override
    public String toString() {
        return "Advertisement{" +
                "flags=" + flags +
                ", localName='" + localName + '\'' +
                ", serviceUuids=" + serviceUuids +
                ", serviceData=" + serviceData.keySet() +
                ", manufacturerData=" + manufacturerData.keySet() +
                ", txPower=" + txPower +
                '}';
    }
}
