package org.ruuvigateway;

import org.ruuvigateway.client.GatewayHistoryClient;
import org.ruuvigateway.config.GatewayConfig;
import org.ruuvigateway.model.FailureKind;
import org.ruuvigateway.model.GatewayIdentity;
import org.ruuvigateway.model.GatewayResult;
import org.ruuvigateway.poll.GatewayProbe;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class GatewayProbeTest {

    @Test
    void reachableGatewayYieldsIdentity() throws Exception {
        try (StubGateway gw = new StubGateway().enqueue(StubGateway.json(GatewayFixtures.ONE_TAG))) {
            GatewayConfig cfg = GatewayConfig.builder(gw.host()).requestTimeout(Duration.ofSeconds(2)).build();
            GatewayResult<GatewayIdentity> r = new GatewayProbe(new GatewayHistoryClient()).probe(cfg);

            assertTrue(r.isOk(), "Got: " + r);
            GatewayIdentity id = ((GatewayResult.Ok<GatewayIdentity>) r).value();
            assertEquals("aa:bb:cc:dd:ee:ff", id.uniqueId());
            assertEquals("Ruuvi Gateway EE:FF", id.title());
        }
    }

    @Test
    void rejectedTokenIsInvalidAuth() throws Exception {
        try (StubGateway gw = new StubGateway().enqueue(StubGateway.status(401, ""))) {
            GatewayConfig cfg = GatewayConfig.builder(gw.host()).token("bad").build();
            GatewayResult<GatewayIdentity> r = new GatewayProbe(new GatewayHistoryClient()).probe(cfg);
            assertEquals(FailureKind.INVALID_AUTH, ((GatewayResult.Failed<GatewayIdentity>) r).kind());
        }
    }

    @Test
    void malformedDocumentIsDecodeError() {
        FakeGatewayClient client = new FakeGatewayClient().body("{\"data\":{\"timestamp\":1}}");
        GatewayResult<GatewayIdentity> r = new GatewayProbe(client).probe(GatewayConfig.builder("h").build());
        GatewayResult.Failed<GatewayIdentity> f = assertInstanceOf(GatewayResult.Failed.class, r);
        assertEquals(FailureKind.DECODE_ERROR, f.kind());
        assertTrue(f.message().contains("gw_mac"), f.message());
    }
}
