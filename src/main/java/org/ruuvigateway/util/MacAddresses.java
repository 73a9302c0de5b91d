package org.ruuvigateway.util;

import java.util.Locale;

/**
 * Helpers for hardware-address strings.
 */
public final class MacAddresses {

    private static final int MAC_HEX_DIGITS = 12;

    private MacAddresses() {
    }

    /** Canonical form used for comparing beacon identifiers: trimmed, upper case. */
    public static String normalize(String mac) {
        return mac.trim().toUpperCase(Locale.ROOT);
    }

    /**
     * Formats a MAC as lower-case colon-separated octets ({@code aa:bb:cc:dd:ee:ff}).
     * Accepts colon, dash, dot (Cisco) or no separators; anything that is not
     * twelve hex digits is returned unchanged.
     */
    public static String format(String mac) {
        String digits = mac.trim().replaceAll("[:.\\-]", "");
        if (digits.length() != MAC_HEX_DIGITS || !digits.matches("[0-9A-Fa-f]+")) {
            return mac;
        }
        StringBuilder sb = new StringBuilder(17);
        for (int i = 0; i < MAC_HEX_DIGITS; i += 2) {
            if (i > 0) {
                sb.append(':');
            }
            sb.append(digits, i, i + 2);
        }
        return sb.toString().toLowerCase(Locale.ROOT);
    }
}
