package com.iksanov.checkpoint.common.util;

import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;

public final class IdGenerator {

    private static final String ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz";
    private static final int SUFFIX_LENGTH = 5;

    private IdGenerator() {}

    /**
     * Snapshot ids sort roughly by creation time: {@code snap-<base36 millis>-<5 random chars>}.
     */
    public static String snapshotId(long timestampMillis) {
        if (timestampMillis < 0) throw new IllegalArgumentException("timestamp must be >= 0");
        return "snap-" + Long.toString(timestampMillis, 36) + "-" + randomSuffix(SUFFIX_LENGTH);
    }

    public static String documentId() {
        return UUID.randomUUID().toString();
    }

    static String randomSuffix(int length) {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return sb.toString();
    }
}
