package com.phillippitts.routineengine.util;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class IdGeneratorTest {

    private final Clock clock = Clock.fixed(Instant.ofEpochMilli(1_700_000_000_000L), ZoneOffset.UTC);

    @Test
    void timestampedIdsHavePrefixMillisAndRandomSuffix() {
        String id = IdGenerator.timestamped("exec", clock).nextId();

        assertThat(id).matches("exec_1700000000000_[0-9a-z]{9}");
    }

    @Test
    void idsAreDistinctAtTheSameInstant() {
        IdGenerator ids = IdGenerator.timestamped("routine", clock);
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < 500; i++) {
            seen.add(ids.nextId());
        }

        assertThat(seen).hasSize(500);
    }
}
