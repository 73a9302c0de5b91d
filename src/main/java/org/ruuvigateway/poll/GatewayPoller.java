package org.ruuvigateway.poll;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.ruuvigateway.client.GatewayHistoryClient;
import org.ruuvigateway.config.GatewayConfig;
import org.ruuvigateway.decode.GapAdvertisementDecoder;
import org.ruuvigateway.decode.HexCodec;
import org.ruuvigateway.interfaces.AdvertisementDecoder;
import org.ruuvigateway.interfaces.PollListener;
import org.ruuvigateway.model.Advertisement;
import org.ruuvigateway.model.AdvertisementDecodeException;
import org.ruuvigateway.model.BeaconRecord;
import org.ruuvigateway.model.FailureKind;
import org.ruuvigateway.model.GatewayIdentity;
import org.ruuvigateway.model.GatewayResult;

/**
 * Command-line poller: probes the gateway once, then prints every changed beacon as JSON
 * until the process is interrupted.
 * Example: {@code java -cp target/classes org.ruuvigateway.poll.GatewayPoller 192.168.1.20 - 5 3}
 */
public final class GatewayPoller implements PollListener {

    private static final Gson PRETTY = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();
    private static final Duration JOIN_SLICE = Duration.ofMinutes(1);

    private final AdvertisementDecoder advertisements;

    public GatewayPoller(AdvertisementDecoder advertisements) {
        this.advertisements = advertisements;
    }

    public static void main(String[] args) throws Exception {
        GatewayConfig config;
        try {
            config = GatewayConfig.fromArgs(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println("Usage: GatewayPoller <host[:port]> [token|-] [pollSeconds] [timeoutSeconds]");
            System.exit(2);
            return;
        }

        GatewayHistoryClient client = new GatewayHistoryClient();
        GatewayResult<GatewayIdentity> probed = new GatewayProbe(client).probe(config);
        if (probed instanceof GatewayResult.Failed<GatewayIdentity> failed) {
            System.err.println("[Poll] cannot start (" + failed.kind() + "): " + failed.message());
            System.exit(1);
            return;
        }
        GatewayIdentity identity = ((GatewayResult.Ok<GatewayIdentity>) probed).value();
        System.out.println("[Poll] connected to " + identity.title() + " (" + identity.uniqueId() + ")");

        PollDriver driver = new PollDriver(config, client, new GatewayPoller(new GapAdvertisementDecoder()));
        Runtime.getRuntime().addShutdownHook(new Thread(driver::stop, "gateway-poll-shutdown"));
        driver.start();
        while (!driver.awaitTermination(JOIN_SLICE)) {
            // keep the main thread alive while the daemon poll thread runs
        }
    }

    @Override
    public void onChanges(List<BeaconRecord> changed) {
        for (BeaconRecord record : changed) {
            System.out.println(PRETTY.toJson(toJson(record)));
        }
    }

    @Override
    public void onFailure(FailureKind kind, String message) {
        System.err.println("[Poll] " + kind + ": " + message);
    }

    /** JSON view of a record plus a summary of its decoded advertisement. */
    public JsonObject toJson(BeaconRecord record) {
        JsonObject o = new JsonObject();
        o.addProperty("mac", record.getIdentifier());
        o.addProperty("rssi", record.getSignalStrength());
        o.addProperty("timestamp", record.getTimestamp());
        if (record.getAgeSeconds().isPresent()) {
            o.addProperty("age_seconds", record.getAgeSeconds().getAsLong());
        }
        o.addProperty("data", HexCodec.encode(record.getPayload()));
        try {
            o.add("advertisement", summarize(record.parseAnnouncement(advertisements)));
        } catch (AdvertisementDecodeException e) {
            o.addProperty("advertisement_error", e.getMessage());
        }
        return o;
    }

    private static JsonObject summarize(Advertisement ad) {
        JsonObject o = new JsonObject();
        ad.getLocalName().ifPresent(n -> o.addProperty("name", n));
        ad.getTxPower().ifPresent(p -> o.addProperty("tx_power", p));
        if (!ad.getServiceUuids().isEmpty()) {
            JsonArray uuids = new JsonArray();
            ad.getServiceUuids().forEach(uuids::add);
            o.add("service_uuids", uuids);
        }
        if (!ad.getManufacturerData().isEmpty()) {
            JsonObject m = new JsonObject();
            for (Map.Entry<Integer, byte[]> e : ad.getManufacturerData().entrySet()) {
                m.addProperty(String.format("0x%04X", e.getKey()), HexCodec.encode(e.getValue()));
            }
            o.add("manufacturer_data", m);
        }
        if (!ad.getServiceData().isEmpty()) {
            JsonObject s = new JsonObject();
            for (Map.Entry<String, byte[]> e : ad.getServiceData().entrySet()) {
                s.addProperty(e.getKey(), HexCodec.encode(e.getValue()));
            }
            o.add("service_data", s);
        }
        return o;
    }
}
