package com.phillippitts.routineengine.domain;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PayloadValuesTest {

    @Test
    void wholeNumbersBecomeLongs() {
        assertThat(PayloadValues.normalizeValue(7)).isEqualTo(7L);
        assertThat(PayloadValues.normalizeValue((short) 7)).isEqualTo(7L);
        assertThat(PayloadValues.normalizeValue(7.0)).isEqualTo(7L);
        assertThat(PayloadValues.normalizeValue(7.0f)).isEqualTo(7L);
        assertThat(PayloadValues.normalizeValue(new BigDecimal("7.000"))).isEqualTo(7L);
        assertThat(PayloadValues.normalizeValue(BigInteger.valueOf(Long.MAX_VALUE))).isEqualTo(Long.MAX_VALUE);
    }

    @Test
    void fractionsAndOutOfRangeValuesBecomeDoubles() {
        assertThat(PayloadValues.normalizeValue(0.35)).isEqualTo(0.35);
        assertThat(PayloadValues.normalizeValue(new BigDecimal("21.5"))).isEqualTo(21.5);
        assertThat(PayloadValues.normalizeValue(BigInteger.TWO.pow(70))).isEqualTo(Math.pow(2, 70));
        assertThat(PayloadValues.normalizeValue(1e300)).isEqualTo(1e300);
        assertThat(PayloadValues.normalizeValue(Double.NaN)).isEqualTo(Double.NaN);
    }

    @Test
    void nestedStructuresAreNormalisedAndCopied() {
        List<Object> steps = new ArrayList<>(List.of(1, 2.5));
        Map<String, Object> data = new HashMap<>();
        data.put("steps", steps);
        data.put("note", null);

        Map<String, Object> normalized = PayloadValues.normalize(Map.of("data", data));
        steps.add(3);

        Map<?, ?> copy = (Map<?, ?>) normalized.get("data");
        assertThat(copy.get("steps")).isEqualTo(List.of(1L, 2.5));
        assertThat(copy.containsKey("note")).isTrue();
        assertThatThrownBy(() -> normalized.put("x", 1)).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void nullPayloadIsEmpty() {
        assertThat(PayloadValues.normalize(null)).isEmpty();
    }

    @Test
    void equalRegardlessOfInputNumberType() {
        assertThat(RoutineAction.connectorCall("homeassistant", "call_service", Map.of("brightness", 80)))
                .isEqualTo(RoutineAction.connectorCall("homeassistant", "call_service", Map.of("brightness", 80L)));
        assertThat(RoutineCondition.timeRange(8, 17).config()).containsEntry("startHour", 8L);
    }
}
