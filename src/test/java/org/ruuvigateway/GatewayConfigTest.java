package org.ruuvigateway;

import org.ruuvigateway.config.GatewayConfig;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class GatewayConfigTest {

    @Test
    void defaults() {
        GatewayConfig c = GatewayConfig.builder(" gw.local ").build();
        assertEquals("gw.local", c.getHost());
        assertTrue(c.getToken().isEmpty());
        assertEquals(Duration.ofSeconds(5), c.getPollPeriod());
        assertTrue(c.getRequestTimeout().isEmpty());
    }

    @Test
    void tokenIsTrimmedAndBlankMeansAbsent() {
        assertEquals("abc", GatewayConfig.builder("h").token("  abc ").build().getToken().orElseThrow());
        assertTrue(GatewayConfig.builder("h").token("  ").build().getToken().isEmpty());
        assertTrue(GatewayConfig.builder("h").token("").build().getToken().isEmpty());
        assertNull(GatewayConfig.normalizeToken("\t\n"));
    }

    @Test
    void fromArgsParsesPositionals() {
        GatewayConfig c = GatewayConfig.fromArgs(new String[]{"10.0.0.2:8080", "tok", "10", "3"});
        assertEquals("10.0.0.2:8080", c.getHost());
        assertEquals("tok", c.getToken().orElseThrow());
        assertEquals(Duration.ofSeconds(10), c.getPollPeriod());
        assertEquals(Duration.ofSeconds(3), c.getRequestTimeout().orElseThrow());

        assertTrue(GatewayConfig.fromArgs(new String[]{"h", "-"}).getToken().isEmpty());
    }

    @Test
    void invalidValuesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> GatewayConfig.fromArgs(new String[]{}));
        assertThrows(IllegalArgumentException.class, () -> GatewayConfig.builder("  ").build());
        assertThrows(IllegalArgumentException.class, () -> GatewayConfig.fromArgs(new String[]{"h", "-", "five"}));
        assertThrows(IllegalArgumentException.class, () -> GatewayConfig.fromArgs(new String[]{"h", "-", "0"}));
        assertThrows(IllegalArgumentException.class,
                () -> GatewayConfig.builder("h").requestTimeout(Duration.ofSeconds(-1)).build());
    }

    @Test
    void toStringHidesToken() {
        String s = GatewayConfig.builder("h").token("s3cret").build().toString();
        assertFalse(s.contains("s3cret"), s);
    }
}
