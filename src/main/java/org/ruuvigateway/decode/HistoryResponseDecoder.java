package org.ruuvigateway.decode;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.ruuvigateway.model.BeaconRecord;
import org.ruuvigateway.model.FailureKind;
import org.ruuvigateway.model.GatewayResult;
import org.ruuvigateway.model.HistoryResponse;

/**
 * Converts the gateway's {@code /history} JSON document into a {@link HistoryResponse}.
 * <p>
 * Expected shape:
 * <pre>
 * { "data": {
 *     "timestamp": int, "gw_mac": string, "coordinates": string?,
 *     "tags": { mac: { "rssi": int, "timestamp": int, "data": hex } }?
 * } }
 * </pre>
 * Any schema violation fails the whole document; no partial response is produced.
 * A response timestamp of {@code 0} means the gateway has no clock, so record ages are left empty.
 */
public final class HistoryResponseDecoder {

    public GatewayResult<HistoryResponse> decode(JsonElement body) {
        try {
            return GatewayResult.ok(decodeOrThrow(body));
        } catch (GatewayDecodeException e) {
            return GatewayResult.failed(FailureKind.DECODE_ERROR, e.getMessage());
        }
    }

    public HistoryResponse decodeOrThrow(JsonElement body) throws GatewayDecodeException {
        if (body == null || !body.isJsonObject()) {
            throw new GatewayDecodeException("Response is not a JSON object");
        }
        JsonObject data = requireObject(body.getAsJsonObject(), "data", "response");

        long responseTimestamp = requireLong(data, "timestamp", "data");
        String gatewayMac = requireString(data, "gw_mac", "data");
        String coordinates = optionalString(data, "coordinates", "data");

        List<BeaconRecord> records = new ArrayList<>();
        JsonElement tags = data.get("tags");
        if (tags != null && !tags.isJsonNull()) {
            if (!tags.isJsonObject()) {
                throw new GatewayDecodeException("Field 'data.tags' must be an object");
            }
            for (Map.Entry<String, JsonElement> e : tags.getAsJsonObject().entrySet()) {
                records.add(decodeTag(e.getKey(), e.getValue(), responseTimestamp));
            }
        }
        return new HistoryResponse(responseTimestamp, gatewayMac, records, coordinates);
    }

    private static BeaconRecord decodeTag(String mac, JsonElement element, long responseTimestamp)
            throws GatewayDecodeException {
        String ctx = "tags[" + mac + "]";
        if (!element.isJsonObject()) {
            throw new GatewayDecodeException("Entry '" + ctx + "' must be an object");
        }
        JsonObject tag = element.getAsJsonObject();

        long timestamp = requireLong(tag, "timestamp", ctx);
        long rssi = requireLong(tag, "rssi", ctx);
        if (rssi < Integer.MIN_VALUE || rssi > Integer.MAX_VALUE) {
            throw new GatewayDecodeException("Field '" + ctx + ".rssi' is out of range: " + rssi);
        }
        String hex = requireString(tag, "data", ctx);

        byte[] payload;
        try {
            payload = HexCodec.decode(hex);
        } catch (IllegalArgumentException e) {
            throw new GatewayDecodeException("Field '" + ctx + ".data' is not valid hex: " + e.getMessage(), e);
        }
        if (payload.length == 0) {
            throw new GatewayDecodeException("Field '" + ctx + ".data' is empty");
        }

        Long age = (responseTimestamp != 0) ? responseTimestamp - timestamp : null;
        return new BeaconRecord(mac, (int) rssi, timestamp, payload, age);
    }

    /* ---------------------- field helpers ---------------------- */

    private static JsonObject requireObject(JsonObject parent, String name, String ctx)
            throws GatewayDecodeException {
        JsonElement e = parent.get(name);
        if (e == null || e.isJsonNull()) {
            throw new GatewayDecodeException("Missing field '" + name + "' in " + ctx);
        }
        if (!e.isJsonObject()) {
            throw new GatewayDecodeException("Field '" + ctx + "." + name + "' must be an object");
        }
        return e.getAsJsonObject();
    }

    /** Accepts JSON integers and integer-valued strings; fractions and booleans are rejected. */
    private static long requireLong(JsonObject parent, String name, String ctx) throws GatewayDecodeException {
        JsonPrimitive p = requirePrimitive(parent, name, ctx);
        if (p.isBoolean()) {
            throw new GatewayDecodeException("Field '" + ctx + "." + name + "' must be an integer");
        }
        try {
            return new BigDecimal(p.getAsString().trim()).longValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            throw new GatewayDecodeException(
                    "Field '" + ctx + "." + name + "' must be an integer, got '" + p.getAsString() + "'", e);
        }
    }

    private static String requireString(JsonObject parent, String name, String ctx) throws GatewayDecodeException {
        JsonPrimitive p = requirePrimitive(parent, name, ctx);
        if (!p.isString()) {
            throw new GatewayDecodeException("Field '" + ctx + "." + name + "' must be a string");
        }
        return p.getAsString();
    }

    private static String optionalString(JsonObject parent, String name, String ctx) throws GatewayDecodeException {
        JsonElement e = parent.get(name);
        if (e == null || e.isJsonNull()) {
            return "";
        }
        if (!e.isJsonPrimitive() || !e.getAsJsonPrimitive().isString()) {
            throw new GatewayDecodeException("Field '" + ctx + "." + name + "' must be a string");
        }
        return e.getAsString();
    }

    private static JsonPrimitive requirePrimitive(JsonObject parent, String name, String ctx)
            throws GatewayDecodeException {
        JsonElement e = parent.get(name);
        if (e == null || e.isJsonNull()) {
            throw new GatewayDecodeException("Missing field '" + name + "' in " + ctx);
        }
        if (!e.isJsonPrimitive()) {
            throw new GatewayDecodeException("Field '" + ctx + "." + name + "' must be a scalar");
        }
        return e.getAsJsonPrimitive();
    }
}
