package com.phillippitts.routineengine.util;

import java.time.Clock;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Produces opaque identifiers of the form {@code <prefix>_<epochMillis>_<random9>}, where the
 * random part is nine lowercase base-36 characters.
 */
@FunctionalInterface
public interface IdGenerator {

    String nextId();

    static IdGenerator timestamped(String prefix, Clock clock) {
        return () -> prefix + "_" + clock.millis() + "_" + randomSuffix();
    }

    private static String randomSuffix() {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        StringBuilder sb = new StringBuilder(9);
        for (int i = 0; i < 9; i++) {
            sb.append(Character.forDigit(random.nextInt(36), 36));
        }
        return sb.toString();
    }
}
