package com.licitia.etl.scheduler;

import com.licitia.etl.config.LicitiaProperties;
import com.licitia.etl.domain.enums.Frequency;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalTime;
import java.time.YearMonth;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Objects;

/**
 * Maps a frequency and the last successful run onto anchor instants.
 * <p>
 * Anchors are the first day of a month (every month, every quarter starting in January,
 * or every January) at a fixed local time in the scheduler zone. Local anchors are
 * resolved with {@link ZonedDateTime#of}, so a time falling in a DST gap moves forward and
 * one falling in an overlap takes the earlier offset.
 * <p>
 * Callers pass the same {@code referenceNow} to {@link #isDue} and {@link #nextDueAt};
 * nothing in here reads the clock.
 */
@Component
public class ScheduleCalculator {

    private final ZoneId zone;
    private final LocalTime anchorTime;

    @Autowired
    public ScheduleCalculator(LicitiaProperties properties) {
        this(properties.getScheduler().zoneId(), LocalTime.of(properties.getScheduler().getAnchorHour(), 0));
    }

    public ScheduleCalculator(ZoneId zone, LocalTime anchorTime) {
        this.zone = Objects.requireNonNull(zone, "zone");
        this.anchorTime = Objects.requireNonNull(anchorTime, "anchorTime");
    }

    public ZoneId getZone() {
        return zone;
    }

    /**
     * A task that never succeeded is due at {@code referenceNow}; otherwise the first
     * anchor strictly after the last success.
     */
    public ZonedDateTime nextDueAt(Frequency frequency, Instant lastOkRunAt, Instant referenceNow) {
        Objects.requireNonNull(referenceNow, "referenceNow");
        if (lastOkRunAt == null) {
            return referenceNow.atZone(zone);
        }
        return nextAnchorAfter(frequency, lastOkRunAt);
    }

    public boolean isDue(Frequency frequency, Instant lastOkRunAt, Instant referenceNow) {
        return !nextDueAt(frequency, lastOkRunAt, referenceNow).toInstant().isAfter(referenceNow);
    }

    public ZonedDateTime nextAnchorAfter(Frequency frequency, Instant instant) {
        Objects.requireNonNull(frequency, "frequency");
        int step = frequency.getMonthsBetweenAnchors();

        YearMonth month = YearMonth.from(instant.atZone(zone));
        int firstMonthOfPeriod = ((month.getMonthValue() - 1) / step) * step + 1;
        YearMonth candidateMonth = YearMonth.of(month.getYear(), firstMonthOfPeriod);

        ZonedDateTime candidate = anchorOf(candidateMonth);
        while (!candidate.toInstant().isAfter(instant)) {
            candidateMonth = candidateMonth.plusMonths(step);
            candidate = anchorOf(candidateMonth);
        }
        return candidate;
    }

    private ZonedDateTime anchorOf(YearMonth month) {
        return ZonedDateTime.of(month.atDay(1), anchorTime, zone);
    }
}
