package com.qqsuccubus.egress.core.util;

import java.security.SecureRandom;

/**
 * Generates egress and request identifiers.
 */
public final class EgressIds {
    private EgressIds() {
    }

    public static final String EGRESS_PREFIX = "EG_";
    public static final String REQUEST_PREFIX = "RQ_";

    private static final char[] ALPHABET =
        "0123456789ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz".toCharArray();
    private static final int SUFFIX_LENGTH = 12;
    private static final SecureRandom RANDOM = new SecureRandom();

    public static String newEgressId() {
        return EGRESS_PREFIX + randomSuffix();
    }

    public static String newRequestId() {
        return REQUEST_PREFIX + randomSuffix();
    }

    private static String randomSuffix() {
        char[] chars = new char[SUFFIX_LENGTH];
        for (int i = 0; i < SUFFIX_LENGTH; i++) {
            chars[i] = ALPHABET[RANDOM.nextInt(ALPHABET.length)];
        }
        return new String(chars);
    }
}
