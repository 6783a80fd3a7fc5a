package com.streamfirst.feedrelay.domain;

import java.math.BigInteger;
import java.util.Comparator;

/**
 * Ordering of externally issued message, thread and channel identifiers.
 *
 * <p>Numeric identifiers compare numerically. Non-numeric identifiers rank as zero, so they sort
 * before any positive numeric identifier, and ties fall back to lexicographic order.
 */
public final class MessageIds {

    public static final Comparator<String> ORDER = Comparator
            .comparing(MessageIds::numericKey)
            .thenComparing(Comparator.naturalOrder());

    private MessageIds() {
    }

    public static boolean isNumeric(String id) {
        if (id == null || id.isEmpty()) {
            return false;
        }
        for (int i = 0; i < id.length(); i++) {
            char ch = id.charAt(i);
            if (ch < '0' || ch > '9') {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns true if {@code candidate} sorts strictly after {@code marker}; a null marker is older than everything.
     */
    public static boolean isNewer(String candidate, String marker) {
        if (marker == null || marker.isEmpty()) {
            return true;
        }
        return ORDER.compare(candidate, marker) > 0;
    }

    /**
     * Returns true if the identifier is numeric and at or before the given snowflake marker.
     */
    public static boolean isAtOrBefore(String id, long marker) {
        return isNumeric(id) && new BigInteger(id).compareTo(BigInteger.valueOf(marker)) <= 0;
    }

    private static BigInteger numericKey(String id) {
        return isNumeric(id) ? new BigInteger(id) : BigInteger.ZERO;
    }
}
