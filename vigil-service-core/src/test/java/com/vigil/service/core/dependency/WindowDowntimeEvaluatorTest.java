package com.vigil.service.core.dependency;

import static org.assertj.core.api.Assertions.assertThat;

import com.vigil.model.DowntimeRecord;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class WindowDowntimeEvaluatorTest {

    private static final Instant START = Instant.parse("2025-03-01T00:00:00Z");
    private static final Instant END = Instant.parse("2025-03-01T06:00:00Z");

    private final WindowDowntimeEvaluator evaluator = new WindowDowntimeEvaluator();

    @Test
    void fixedDowntimeCoversHalfOpenWindow() {
        DowntimeRecord downtime = DowntimeRecord.builder().id("d").start(START).end(END).build();

        assertThat(evaluator.isActive(downtime, START.minusSeconds(1))).isFalse();
        assertThat(evaluator.isActive(downtime, START)).isTrue();
        assertThat(evaluator.isActive(downtime, END.minusSeconds(1))).isTrue();
        assertThat(evaluator.isActive(downtime, END)).isFalse();
    }

    @Test
    void flexibleDowntimeNeedsTrigger() {
        DowntimeRecord pending = DowntimeRecord.builder()
                .id("d")
                .start(START)
                .end(END)
                .fixed(false)
                .duration(Duration.ofHours(1))
                .build();
        assertThat(evaluator.isActive(pending, START.plusSeconds(60))).isFalse();

        Instant trigger = START.plus(Duration.ofHours(2));
        DowntimeRecord triggered = pending.toBuilder().triggerTime(trigger).build();
        assertThat(evaluator.isActive(triggered, trigger.minusSeconds(1))).isFalse();
        assertThat(evaluator.isActive(triggered, trigger)).isTrue();
        assertThat(evaluator.isActive(triggered, trigger.plus(Duration.ofHours(1)))).isFalse();
    }

    @Test
    void flexibleDowntimeNeverOutlivesWindowEnd() {
        DowntimeRecord downtime = DowntimeRecord.builder()
                .id("d")
                .start(START)
                .end(END)
                .fixed(false)
                .duration(Duration.ofHours(4))
                .triggerTime(END.minus(Duration.ofHours(1)))
                .build();

        assertThat(evaluator.isActive(downtime, END.minusSeconds(1))).isTrue();
        assertThat(evaluator.isActive(downtime, END)).isFalse();
    }
}
