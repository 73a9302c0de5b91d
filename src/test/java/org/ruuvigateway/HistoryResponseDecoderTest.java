package org.ruuvigateway;

import com.google.gson.JsonParser;
import org.ruuvigateway.decode.HistoryResponseDecoder;
import org.ruuvigateway.model.BeaconRecord;
import org.ruuvigateway.model.FailureKind;
import org.ruuvigateway.model.GatewayResult;
import org.ruuvigateway.model.HistoryResponse;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class HistoryResponseDecoderTest {

    private final HistoryResponseDecoder decoder = new HistoryResponseDecoder();

    private GatewayResult<HistoryResponse> decode(String json) {
        return decoder.decode(JsonParser.parseString(json));
    }

    private HistoryResponse ok(String json) {
        GatewayResult<HistoryResponse> r = decode(json);
        assertTrue(r.isOk(), "Got: " + r);
        return ((GatewayResult.Ok<HistoryResponse>) r).value();
    }

    private String decodeError(String json) {
        GatewayResult<HistoryResponse> r = decode(json);
        GatewayResult.Failed<HistoryResponse> f = assertInstanceOf(GatewayResult.Failed.class, r);
        assertEquals(FailureKind.DECODE_ERROR, f.kind());
        return f.message();
    }

    @Test
    void exampleDocumentYieldsOneRecordAgedFiveSeconds() {
        HistoryResponse resp = ok(GatewayFixtures.ONE_TAG);

        assertEquals(100, resp.getTimestamp());
        assertEquals("AA:BB:CC:DD:EE:FF", resp.getGatewayIdentifier());
        assertEquals("EE:FF", resp.getGatewayIdentifierSuffix());
        assertEquals("", resp.getCoordinates());
        assertEquals(1, resp.getRecords().size());

        BeaconRecord rec = resp.getRecords().get(0);
        assertEquals(GatewayFixtures.TAG, rec.getIdentifier());
        assertEquals(-70, rec.getSignalStrength());
        assertEquals(95, rec.getTimestamp());
        assertEquals(Instant.ofEpochSecond(95), rec.getInstant());
        assertArrayEquals(new byte[]{0x02, 0x01, 0x06, 0x03, 0x03, (byte) 0xAA, (byte) 0xFE}, rec.getPayload());
        assertEquals(5, rec.getAgeSeconds().getAsLong());
    }

    @Test
    void decodingIsDeterministic() {
        HistoryResponse a = ok(GatewayFixtures.TWO_TAGS);
        HistoryResponse b = ok(GatewayFixtures.TWO_TAGS);
        assertEquals(a.getRecords(), b.getRecords());
    }

    @Test
    void tagsKeepDocumentOrderAndCoordinates() {
        HistoryResponse resp = ok(GatewayFixtures.TWO_TAGS);
        assertEquals("60.17,24.94", resp.getCoordinates());
        assertEquals("EE:FF", resp.getGatewayIdentifierSuffix());
        assertEquals(GatewayFixtures.TAG, resp.getRecords().get(0).getIdentifier());
        assertEquals(GatewayFixtures.OTHER_TAG, resp.getRecords().get(1).getIdentifier());
        assertEquals(1, resp.getRecords().get(1).getAgeSeconds().getAsLong());
    }

    @Test
    void zeroResponseTimestampMeansNoAge() {
        HistoryResponse resp = ok("{\"data\":{\"timestamp\":0,\"gw_mac\":\"AA:BB:CC:DD:EE:FF\",\"tags\":{"
                + "\"11:22:33:44:55:66\":{\"rssi\":-70,\"timestamp\":95,\"data\":\"0201\"}}}}");
        assertTrue(resp.getRecords().get(0).getAgeSeconds().isEmpty());
    }

    @Test
    void missingOrNullTagsMeansNoRecords() {
        assertTrue(ok("{\"data\":{\"timestamp\":1,\"gw_mac\":\"AA:BB:CC:DD:EE:FF\"}}").getRecords().isEmpty());
        assertTrue(ok("{\"data\":{\"timestamp\":1,\"gw_mac\":\"x\",\"tags\":null}}").getRecords().isEmpty());
    }

    @Test
    void lowerCaseIdentifiersAreNormalized() {
        HistoryResponse resp = ok("{\"data\":{\"timestamp\":1,\"gw_mac\":\"x\",\"tags\":{"
                + "\"aa:bb:cc:00:11:22\":{\"rssi\":-1,\"timestamp\":1,\"data\":\"00\"}}}}");
        assertEquals("AA:BB:CC:00:11:22", resp.getRecords().get(0).getIdentifier());
    }

    @Test
    void integerValuedStringsAreAccepted() {
        HistoryResponse resp = ok(GatewayFixtures.ONE_TAG.replace("\"rssi\":-70", "\"rssi\":\"-70\""));
        assertEquals(-70, resp.getRecords().get(0).getSignalStrength());
    }

    @Test
    void nonHexPayloadFailsWholeDocument() {
        String json = "{\"data\":{\"timestamp\":100,\"gw_mac\":\"AA:BB:CC:DD:EE:FF\",\"tags\":{"
                + "\"11:22:33:44:55:66\":{\"rssi\":-70,\"timestamp\":95,\"data\":\"0201\"},"
                + "\"11:22:33:44:55:77\":{\"rssi\":-70,\"timestamp\":95,\"data\":\"zz01\"}}}}";
        String msg = decodeError(json);
        assertTrue(msg.contains("11:22:33:44:55:77"), msg);
    }

    @Test
    void oddLengthAndEmptyPayloadsAreRejected() {
        decodeError(GatewayFixtures.oneTag(-70, 95, "020"));
        decodeError(GatewayFixtures.oneTag(-70, 95, ""));
        decodeError(GatewayFixtures.oneTag(-70, 95, "02  01"));
    }

    @Test
    void missingRequiredFieldsAreRejected() {
        decodeError("{}");
        decodeError("[]");
        decodeError("{\"data\":{\"gw_mac\":\"x\"}}");
        decodeError("{\"data\":{\"timestamp\":1}}");
        decodeError(GatewayFixtures.ONE_TAG.replace("\"rssi\":-70,", ""));
        decodeError(GatewayFixtures.ONE_TAG.replace("\"timestamp\":95,", ""));
        decodeError(GatewayFixtures.ONE_TAG.replace(",\"data\":\"0201060303aafe\"", ""));
    }

    @Test
    void mistypedFieldsAreRejected() {
        decodeError(GatewayFixtures.ONE_TAG.replace("\"rssi\":-70", "\"rssi\":\"loud\""));
        decodeError(GatewayFixtures.ONE_TAG.replace("\"rssi\":-70", "\"rssi\":-70.5"));
        decodeError(GatewayFixtures.ONE_TAG.replace("\"timestamp\":95", "\"timestamp\":true"));
        decodeError(GatewayFixtures.ONE_TAG.replace("\"timestamp\":100", "\"timestamp\":{}"));
        decodeError("{\"data\":{\"timestamp\":1,\"gw_mac\":5}}");
        decodeError("{\"data\":{\"timestamp\":1,\"gw_mac\":\"x\",\"tags\":[]}}");
        decodeError("{\"data\":{\"timestamp\":1,\"gw_mac\":\"x\",\"coordinates\":[1,2]}}");
        decodeError("{\"data\":\"nope\"}");
    }
}
