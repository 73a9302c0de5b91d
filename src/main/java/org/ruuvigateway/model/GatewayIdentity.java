package org.ruuvigateway.model;

/**
 * Identity of a reachable gateway, as established by a probe.
 *
 * @param uniqueId lower-case colon-separated gateway MAC
 * @param title    human-facing label, e.g. {@code Ruuvi Gateway EE:FF}
 */
public record GatewayIdentity(String uniqueId, String title) {
}
