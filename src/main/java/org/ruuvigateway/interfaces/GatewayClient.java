package org.ruuvigateway.interfaces;

import com.google.gson.JsonElement;
import java.time.Duration;
import org.ruuvigateway.model.GatewayResult;

/** Contract for fetching the raw history document from a gateway. */
public interface GatewayClient {
    /**
     * Issues one {@code GET http://{host}/history}.
     *
     * @param host        gateway host, optionally with {@code :port}
     * @param bearerToken token for the Authorization header; null or blank sends none
     * @param timeout     bound on the whole request/response cycle; null for none
     * @return parsed JSON body, or an {@code INVALID_AUTH} / {@code CANNOT_CONNECT} failure
     */
    GatewayResult<JsonElement> fetchHistory(String host, String bearerToken, Duration timeout);

    /**
     * Aborts every request currently in flight, including one that has not opened its socket yet.
     * Aborted and later requests fail with {@code CANNOT_CONNECT}.
     */
    void cancelInFlight();
}
