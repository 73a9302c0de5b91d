package org.ruuvigateway.poll;

import org.ruuvigateway.config.GatewayConfig;
import org.ruuvigateway.decode.HistoryResponseDecoder;
import org.ruuvigateway.interfaces.GatewayClient;
import org.ruuvigateway.model.GatewayIdentity;
import org.ruuvigateway.model.GatewayResult;
import org.ruuvigateway.model.HistoryResponse;
import org.ruuvigateway.util.MacAddresses;

/**
 * One-shot connectivity check: fetches and decodes a single history document and
 * derives the gateway's identity from it. Does not touch any change cache.
 */
public final class GatewayProbe {

    static final String TITLE_PREFIX = "Ruuvi Gateway ";

    private final GatewayClient client;
    private final HistoryResponseDecoder decoder;

    public GatewayProbe(GatewayClient client) {
        this(client, new HistoryResponseDecoder());
    }

    public GatewayProbe(GatewayClient client, HistoryResponseDecoder decoder) {
        this.client = client;
        this.decoder = decoder;
    }

    public GatewayResult<GatewayIdentity> probe(GatewayConfig config) {
        return client.fetchHistory(config.getHost(), config.getToken().orElse(null),
                        config.getRequestTimeout().orElse(null))
                .then(decoder::decode)
                .then(resp -> GatewayResult.ok(identityOf(resp)));
    }

    static GatewayIdentity identityOf(HistoryResponse response) {
        return new GatewayIdentity(
                MacAddresses.format(response.getGatewayIdentifier()),
                TITLE_PREFIX + response.getGatewayIdentifierSuffix());
    }
}
