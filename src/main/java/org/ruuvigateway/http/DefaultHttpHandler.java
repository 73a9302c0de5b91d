package org.ruuvigateway.http;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import org.ruuvigateway.interfaces.HttpHandler;

/**
 * DefaultHttpHandler implements low-level HTTP/1.1 formatting of requests and parsing of responses.
 * <p>
 * Notes:
 * <ul>
 *   <li>Responses are expected to be read until the peer closes (requests carry {@code Connection: close}).</li>
 *   <li>{@code Transfer-Encoding: chunked} bodies are de-chunked; everything else is taken as-is.</li>
 *   <li>The body is decoded as UTF-8 regardless of the declared {@code Content-Type}.</li>
 * </ul>
 */
public class DefaultHttpHandler implements HttpHandler {

    private static final byte[] HEADER_END = {'\r', '\n', '\r', '\n'};

    /**
     * Builds a raw HTTP/1.1 request string with headers.
     *
     * @param method        HTTP method (e.g. "GET").
     * @param path          resource path (must start with '/').
     * @param authority     {@code host} or {@code host:port} for the Host header.
     * @param extraHeaders  optional map of additional headers (can be null).
     * @param contentLength payload size in bytes.
     * @return complete HTTP request head ready to send.
     */
    @Override
    public String buildRequest(String method, String path, String authority,
                               Map<String, String> extraHeaders, int contentLength) {
        StringBuilder sb = new StringBuilder();
        sb.append(method).append(" ").append(path).append(" HTTP/1.1\r\n");
        sb.append("Host: ").append(authority).append("\r\n");

        if (extraHeaders != null) {
            for (Map.Entry<String, String> e : extraHeaders.entrySet()) {
                sb.append(e.getKey()).append(": ").append(e.getValue()).append("\r\n");
            }
        }

        sb.append("Content-Length: ").append(contentLength).append("\r\n\r\n");
        return sb.toString();
    }

    /**
     * Writes the full request (headers + body) to the output stream.
     */
    @Override
    public void send(OutputStream out, String headers, byte[] body) throws IOException {
        out.write(headers.getBytes(StandardCharsets.UTF_8));
        if (body != null && body.length > 0) {
            out.write(body);
        }
        out.flush();
    }

    @Override
    public RawHttpResponse parseResponse(byte[] raw) throws IOException {
        int headEnd = indexOf(raw, HEADER_END, 0);
        String head = new String(raw, 0, headEnd >= 0 ? headEnd : raw.length, StandardCharsets.ISO_8859_1);
        String[] lines = head.split("\r\n");

        int status = statusCodeOf(lines.length > 0 ? lines[0] : "");
        Map<String, String> headers = new LinkedHashMap<>();
        for (int i = 1; i < lines.length; i++) {
            int colon = lines[i].indexOf(':');
            if (colon > 0) {
                headers.put(lines[i].substring(0, colon).trim().toLowerCase(Locale.ROOT),
                        lines[i].substring(colon + 1).trim());
            }
        }

        if (headEnd < 0) {
            return new RawHttpResponse(status, headers, "");
        }
        int bodyStart = headEnd + HEADER_END.length;
        byte[] body;
        String te = headers.get("transfer-encoding");
        if (te != null && te.toLowerCase(Locale.ROOT).contains("chunked")) {
            body = dechunk(raw, bodyStart);
        } else {
            body = Arrays.copyOfRange(raw, bodyStart, raw.length);
        }
        return new RawHttpResponse(status, headers, new String(body, StandardCharsets.UTF_8));
    }

    /** Parses the numeric code out of {@code HTTP/1.1 200 OK}, or -1 if malformed. */
    static int statusCodeOf(String statusLine) {
        String[] parts = statusLine.split(" ");
        if (parts.length >= 2 && parts[0].startsWith("HTTP/")) {
            try {
                return Integer.parseInt(parts[1]);
            } catch (NumberFormatException ignored) {
                // falls through to unknown
            }
        }
        return STATUS_UNKNOWN;
    }

    private static byte[] dechunk(byte[] raw, int from) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        int pos = from;
        while (true) {
            int lineEnd = indexOf(raw, new byte[]{'\r', '\n'}, pos);
            if (lineEnd < 0) {
                throw new IOException("Malformed chunked body: missing chunk size");
            }
            String sizeLine = new String(raw, pos, lineEnd - pos, StandardCharsets.ISO_8859_1);
            int semi = sizeLine.indexOf(';');
            if (semi >= 0) {
                sizeLine = sizeLine.substring(0, semi); // chunk extensions are ignored
            }
            int size;
            try {
                size = Integer.parseInt(sizeLine.trim(), 16);
            } catch (NumberFormatException e) {
                throw new IOException("Malformed chunked body: bad chunk size '" + sizeLine + "'", e);
            }
            pos = lineEnd + 2;
            if (size == 0) {
                return out.toByteArray();
            }
            if (size < 0 || size > raw.length - pos) {
                throw new IOException("Malformed chunked body: truncated chunk");
            }
            out.write(raw, pos, size);
            pos += size;
            if (raw.length - pos < 2 || raw[pos] != '\r' || raw[pos + 1] != '\n') {
                throw new IOException("Malformed chunked body: missing CRLF after chunk");
            }
            pos += 2;
        }
    }

    private static int indexOf(byte[] haystack, byte[] needle, int from) {
        outer:
        for (int i = from; i <= haystack.length - needle.length; i++) {
            for (int j = 0; j < needle.length; j++) {
                if (haystack[i + j] != needle[j]) {
                    continue outer;
                }
            }
            return i;
        }
        return -1;
    }
}
