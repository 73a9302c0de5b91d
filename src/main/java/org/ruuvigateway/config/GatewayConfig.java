package org.ruuvigateway.config;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Poller configuration: where the gateway lives, how to authenticate and how often to poll.
 * <p>
 * The token is trimmed; a blank token means "no Authorization header".
 */
public final class GatewayConfig {

    /** Default poll period. */
    public static final Duration DEFAULT_POLL_PERIOD = Duration.ofSeconds(5);

    /** Placeholder accepted on the command line for "no token". */
    static final String NO_TOKEN_ARG = "-";

    private final String host;
    private final String token;
    private final Duration pollPeriod;
    private final Duration requestTimeout;

    private GatewayConfig(Builder b) {
        if (b.host == null || b.host.isBlank()) {
            throw new IllegalArgumentException("host is required");
        }
        Duration period = (b.pollPeriod == null) ? DEFAULT_POLL_PERIOD : b.pollPeriod;
        if (period.isZero() || period.isNegative()) {
            throw new IllegalArgumentException("poll period must be positive: " + period);
        }
        if (b.requestTimeout != null && (b.requestTimeout.isZero() || b.requestTimeout.isNegative())) {
            throw new IllegalArgumentException("request timeout must be positive: " + b.requestTimeout);
        }
        this.host = b.host.trim();
        this.token = normalizeToken(b.token);
        this.pollPeriod = period;
        this.requestTimeout = b.requestTimeout;
    }

    public static Builder builder(String host) {
        return new Builder().host(host);
    }

    /**
     * Parses {@code <host> [token] [pollSeconds] [timeoutSeconds]}; {@code -} as token means none.
     *
     * @throws IllegalArgumentException on a missing host or a malformed number
     */
    public static GatewayConfig fromArgs(String[] args) {
        if (args == null || args.length < 1) {
            throw new IllegalArgumentException("host is required");
        }
        Builder b = builder(args[0]);
        if (args.length >= 2 && !NO_TOKEN_ARG.equals(args[1])) {
            b.token(args[1]);
        }
        if (args.length >= 3) {
            b.pollPeriod(Duration.ofSeconds(parseSeconds(args[2], "pollSeconds")));
        }
        if (args.length >= 4) {
            b.requestTimeout(Duration.ofSeconds(parseSeconds(args[3], "timeoutSeconds")));
        }
        return b.build();
    }

    /** Trims; returns null for null or blank input. */
    public static String normalizeToken(String token) {
        if (token == null) {
            return null;
        }
        String t = token.trim();
        return t.isEmpty() ? null : t;
    }

    private static long parseSeconds(String value, String name) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be a whole number of seconds: " + value, e);
        }
    }

    public String getHost() { return host; }
    public Optional<String> getToken() { return Optional.ofNullable(token); }
    public Duration getPollPeriod() { return pollPeriod; }
    public Optional<Duration> getRequestTimeout() { return Optional.ofNullable(requestTimeout); }

    @Override
    public String toString() {
        // token value deliberately omitted
        return "GatewayConfig{" +
                "host='" + host + '\'' +
                ", token=" + (token == null ? "none" : "set") +
                ", pollPeriod=" + pollPeriod +
                ", requestTimeout=" + requestTimeout +
                '}';
    }

    public static final class Builder {
        private String host;
        private String token;
        private Duration pollPeriod;
        private Duration requestTimeout;

        private Builder() {
        }

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder token(String token) {
            this.token = token;
            return this;
        }

        public Builder pollPeriod(Duration pollPeriod) {
            this.pollPeriod = Objects.requireNonNull(pollPeriod, "pollPeriod");
            return this;
        }

        public Builder requestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
            return this;
        }

        public GatewayConfig build() {
            return new GatewayConfig(this);
        }
    }
}
