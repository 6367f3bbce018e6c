package com.example.attsync.service;

import com.example.attsync.model.NormalizedRecord;
import com.example.attsync.model.RawAttendanceEvent;
import net.jqwik.api.ForAll;
import net.jqwik.api.Label;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.AlphaChars;
import net.jqwik.api.constraints.IntRange;
import net.jqwik.api.constraints.NumericChars;
import net.jqwik.api.constraints.StringLength;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class EventTransformerPropertyTest {
    private static final LocalDateTime BASE = LocalDateTime.of(2025, 1, 10, 0, 0);

    @Property(tries = 200)
    @Label("a badge is forwarded exactly when its trimmed length is between 1 and 4")
    void forwardsOnlyShortBadges(@ForAll @NumericChars @AlphaChars @StringLength(max = 8) String badge,
                                 @ForAll @IntRange(min = 0, max = 3) int padding) {
        String padded = " ".repeat(padding) + badge + " ".repeat(padding);
        EventTransformer transformer = new EventTransformer(Duration.ofMinutes(10), "SRC-ZKT-");

        Optional<NormalizedRecord> record = transformer.normalize(
            new RawAttendanceEvent(BASE.plusHours(8), padded, "A1", Collections.emptyMap()));

        boolean expected = !badge.isEmpty() && badge.length() <= EventTransformer.MAX_BADGE_LENGTH;
        assertThat(record.isPresent()).isEqualTo(expected);
        record.ifPresent(r -> assertThat(r.getBadgeId()).isEqualTo(badge));
    }

    @Property(tries = 200)
    @Label("normalizing the same punch twice gives the same record")
    void normalizationIsDeterministic(@ForAll @IntRange(min = 0, max = 60 * 24 * 30) int minuteOffset,
                                      @ForAll @IntRange(min = 0, max = 120) int skewMinutes) {
        EventTransformer transformer = new EventTransformer(Duration.ofMinutes(skewMinutes), "SRC-ZKT-");
        RawAttendanceEvent raw = new RawAttendanceEvent(BASE.plusMinutes(minuteOffset), "12", "A1",
            Collections.emptyMap());

        Optional<NormalizedRecord> first = transformer.normalize(raw);
        Optional<NormalizedRecord> second = transformer.normalize(raw);

        assertThat(first).isPresent().isEqualTo(second);
        LocalDateTime corrected = first.get().getLogDate().atTime(first.get().getLogTime());
        assertThat(corrected).isEqualTo(raw.getEventTime().minusMinutes(skewMinutes));
    }
}
