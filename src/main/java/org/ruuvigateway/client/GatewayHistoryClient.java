package org.ruuvigateway.client;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import org.ruuvigateway.http.DefaultHttpHandler;
import org.ruuvigateway.http.RawHttpResponse;
import org.ruuvigateway.interfaces.GatewayClient;
import org.ruuvigateway.interfaces.HttpHandler;
import org.ruuvigateway.model.FailureKind;
import org.ruuvigateway.model.GatewayResult;

/**
 * GatewayHistoryClient fetches {@code http://{host}/history} over a plain socket.
 * <p>
 * Notes:
 * <ul>
 *     <li>One connection per request ({@code Connection: close}); nothing is shared between requests.</li>
 *     <li>The timeout bounds connect, send and the full read; it is re-applied before every read.</li>
 *     <li>{@link #cancelInFlight()} closes open sockets and fails every later call; a client is not reused after it.</li>
 *     <li>The body is parsed as JSON whatever {@code Content-Type} the gateway declares.</li>
 * </ul>
 */
public final class GatewayHistoryClient implements GatewayClient {

    static final String HISTORY_PATH = "/history";
    static final String MSG_INVALID_AUTH = "Invalid authentication for gateway";
    static final String MSG_TIMEOUT = "Timeout communicating with gateway";
    static final String MSG_IO = "Error communicating with gateway";
    static final String MSG_INVALID_BODY = "Invalid response from gateway";

    private static final int DEFAULT_PORT = 80;
    private static final int ZERO_CONTENT_LENGTH = 0; // GET requests have no body
    private static final int READ_CHUNK = 8192;
    private static final long NO_DEADLINE = 0L;

    private static final TypeAdapter<JsonElement> JSON = new Gson().getAdapter(JsonElement.class);

    private final HttpHandler http;
    private final Set<Socket> inFlight = ConcurrentHashMap.newKeySet();
    private volatile boolean cancelled;

    public GatewayHistoryClient() {
        this(new DefaultHttpHandler());
    }

    public GatewayHistoryClient(HttpHandler http) {
        this.http = http;
    }

    @Override
    public GatewayResult<JsonElement> fetchHistory(String host, String bearerToken, Duration timeout) {
        String authority = authorityOf(host);
        long deadline = (timeout == null) ? NO_DEADLINE : System.nanoTime() + timeout.toNanos();

        Map<String, String> extra = new LinkedHashMap<>();
        extra.put("Accept", "application/json");
        String token = (bearerToken == null) ? "" : bearerToken.trim();
        if (!token.isEmpty()) {
            extra.put("Authorization", "Bearer " + token);
        }
        extra.put("Connection", "close");
        String req = http.buildRequest("GET", HISTORY_PATH, authority, extra, ZERO_CONTENT_LENGTH);

        RawHttpResponse resp;
        Socket socket = new Socket();
        inFlight.add(socket);
        try (socket) {
            if (cancelled) {
                throw new SocketException("request cancelled");
            }
            socket.connect(new InetSocketAddress(parseHost(authority), parsePort(authority, DEFAULT_PORT)),
                    remainingMillis(deadline));
            socket.setSoTimeout(remainingMillis(deadline));
            http.send(socket.getOutputStream(), req, new byte[0]);
            resp = http.parseResponse(readUntilClosed(socket, deadline));
        } catch (SocketTimeoutException e) {
            System.err.println("[Gateway] " + authority + ": timed out (" + e.getMessage() + ")");
            return GatewayResult.failed(FailureKind.CANNOT_CONNECT, MSG_TIMEOUT);
        } catch (IOException e) {
            System.err.println("[Gateway] " + authority + ": " + e.getClass().getSimpleName() + ": " + e.getMessage());
            return GatewayResult.failed(FailureKind.CANNOT_CONNECT, MSG_IO);
        } finally {
            inFlight.remove(socket);
        }
        return classify(resp);
    }

    @Override
    public void cancelInFlight() {
        cancelled = true;
        for (Socket s : inFlight) {
            try {
                s.close();
            } catch (IOException e) {
                System.err.println("[Gateway] close on cancel failed: " + e.getMessage());
            }
        }
    }

    /** Maps status and body to a result: 401 is auth, other non-200 and bad JSON are connectivity. */
    GatewayResult<JsonElement> classify(RawHttpResponse resp) {
        int status = resp.status();
        if (status == HttpHandler.UNAUTHORIZED) {
            return GatewayResult.failed(FailureKind.INVALID_AUTH, MSG_INVALID_AUTH);
        }
        if (status != HttpHandler.OK) {
            return GatewayResult.failed(FailureKind.CANNOT_CONNECT,
                    "Unexpected response from gateway: HTTP " + status);
        }
        if (resp.body().isBlank()) {
            return GatewayResult.failed(FailureKind.CANNOT_CONNECT, MSG_INVALID_BODY);
        }
        try {
            return GatewayResult.ok(parseStrict(resp.body()));
        } catch (IOException | JsonParseException | IllegalStateException e) {
            return GatewayResult.failed(FailureKind.CANNOT_CONNECT, MSG_INVALID_BODY);
        }
    }

    /** Parses exactly one RFC 8259 document; bare words, unquoted names and trailing data fail. */
    static JsonElement parseStrict(String body) throws IOException {
        JsonReader reader = new JsonReader(new StringReader(body));
        reader.setLenient(false);
        JsonElement root = JSON.read(reader);
        if (reader.peek() != JsonToken.END_DOCUMENT) {
            throw new JsonParseException("Trailing data after JSON document");
        }
        return root;
    }

    /* ---------------------- Helper methods ---------------------- */

    private static byte[] readUntilClosed(Socket socket, long deadline) throws IOException {
        InputStream in = socket.getInputStream();
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        byte[] chunk = new byte[READ_CHUNK];
        while (true) {
            socket.setSoTimeout(remainingMillis(deadline));
            int n = in.read(chunk);
            if (n < 0) {
                return buf.toByteArray();
            }
            buf.write(chunk, 0, n);
        }
    }

    /** Milliseconds left before the deadline; 0 means unbounded. */
    private static int remainingMillis(long deadline) throws SocketTimeoutException {
        if (deadline == NO_DEADLINE) {
            return 0;
        }
        long left = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
        if (left <= 0) {
            throw new SocketTimeoutException("request deadline exceeded");
        }
        return (int) Math.min(Integer.MAX_VALUE, left);
    }

    /** Strips an optional scheme and path, leaving {@code host[:port]}. */
    static String authorityOf(String host) {
        String hp = host.trim().replaceFirst("^https?://", "");
        int slash = hp.indexOf('/');
        return (slash >= 0) ? hp.substring(0, slash) : hp;
    }

    /** Extracts host from {@code host[:port]}, including bracketed IPv6 literals. */
    static String parseHost(String hp) {
        if (hp.startsWith("[")) {
            int close = hp.indexOf(']');
            return (close > 0) ? hp.substring(1, close) : hp;
        }
        int i = hp.lastIndexOf(':');
        return (i >= 0) ? hp.substring(0, i) : hp;
    }

    /** Extracts port from {@code host:port} or returns {@code def}. */
    static int parsePort(String hp, int def) {
        int i = hp.lastIndexOf(':');
        if (i >= 0 && i > hp.lastIndexOf(']')) {
            try {
                return Integer.parseInt(hp.substring(i + 1));
            } catch (NumberFormatException ignored) {
                // malformed port: use the default
            }
        }
        return def;
    }
}
