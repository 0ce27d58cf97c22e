package com.sandy.aiot.automation.engine.service;

import com.sandy.aiot.automation.engine.exception.ConfigurationException;
import com.sandy.aiot.automation.engine.model.ScheduleType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Component;

import java.time.*;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Computes the next fire instant of a time trigger. Pure: the result depends only on the
 * schedule, its config and {@code now}; the zone comes from the injected clock.
 * <p>
 * Config keys: {@code cronExpression} (cron), {@code minutes} (interval, default 60),
 * {@code datetime} (once), {@code time} HH:MM (daily/weekly, default 00:00), {@code day} (weekly, default monday).
 */
@Component
@Slf4j
public class TimeTriggerCalculator {

    public static final String CRON_EXPRESSION = "cronExpression";
    public static final String MINUTES = "minutes";
    public static final String DATETIME = "datetime";
    public static final String TIME = "time";
    public static final String DAY = "day";

    /** One hundred years. */
    static final long MAX_INTERVAL_MINUTES = 525_600L * 100;

    private static final DateTimeFormatter HH_MM = DateTimeFormatter.ofPattern("H:mm");

    private final ZoneId zone;

    @Autowired
    public TimeTriggerCalculator(Clock clock) {
        this(clock.getZone());
    }

    public TimeTriggerCalculator(ZoneId zone) {
        this.zone = zone;
    }

    /**
     * @return next fire instant, empty when the trigger will never fire again or its config is invalid
     */
    public Optional<Instant> computeNextRun(ScheduleType type, Map<String, Object> config, Instant now) {
        if (type == null) return Optional.empty();
        Map<String, Object> cfg = config == null ? Map.of() : config;
        try {
            return Optional.ofNullable(switch (type) {
                case CRON -> nextCron(cfg, now);
                case INTERVAL -> now.plus(Duration.ofMinutes(intervalMinutes(cfg)));
                case ONCE -> {
                    Instant at = onceInstant(cfg);
                    yield at.isAfter(now) ? at : null;
                }
                case DAILY -> nextDaily(timeOfDay(cfg), now);
                case WEEKLY -> nextWeekly(dayOfWeek(cfg), timeOfDay(cfg), now);
            });
        } catch (ConfigurationException | DateTimeException | ArithmeticException e) {
            log.debug("Cannot compute next run type={} config={} error={}", type, cfg, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Checks that the config can be parsed for the given schedule type.
     *
     * @throws ConfigurationException when a key is missing or malformed
     */
    public void validate(ScheduleType type, Map<String, Object> config) {
        if (type == null) throw new ConfigurationException("Schedule type is required");
        Map<String, Object> cfg = config == null ? Map.of() : config;
        switch (type) {
            case CRON -> cron(cfg);
            case INTERVAL -> intervalMinutes(cfg);
            case ONCE -> onceInstant(cfg);
            case DAILY -> timeOfDay(cfg);
            case WEEKLY -> {
                dayOfWeek(cfg);
                timeOfDay(cfg);
            }
        }
    }

    private Instant nextCron(Map<String, Object> cfg, Instant now) {
        ZonedDateTime next = cron(cfg).next(now.atZone(zone));
        return next == null ? null : next.toInstant();
    }

    private Instant nextDaily(LocalTime time, Instant now) {
        LocalDate today = now.atZone(zone).toLocalDate();
        Instant candidate = ZonedDateTime.of(today, time, zone).toInstant();
        if (candidate.isAfter(now)) return candidate;
        return ZonedDateTime.of(today.plusDays(1), time, zone).toInstant();
    }

    private Instant nextWeekly(DayOfWeek day, LocalTime time, Instant now) {
        LocalDate today = now.atZone(zone).toLocalDate();
        int daysAhead = (day.getValue() - today.getDayOfWeek().getValue() + 7) % 7;
        Instant candidate = ZonedDateTime.of(today.plusDays(daysAhead), time, zone).toInstant();
        if (daysAhead == 0 && !candidate.isAfter(now)) {
            candidate = ZonedDateTime.of(today.plusDays(7), time, zone).toInstant();
        }
        return candidate;
    }

    static CronExpression cron(Map<String, Object> cfg) {
        String expr = string(cfg, CRON_EXPRESSION, null);
        if (expr == null || expr.isBlank()) throw new ConfigurationException("cronExpression is required");
        String trimmed = expr.trim();
        try {
            if (trimmed.startsWith("@")) {
                return CronExpression.parse(trimmed);
            }
            if (trimmed.split("\\s+").length != 5) {
                throw new ConfigurationException("cron expression must have 5 fields: " + trimmed);
            }
            // seconds are pinned to zero
            return CronExpression.parse("0 " + trimmed);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid cron expression: " + trimmed, e);
        }
    }

    static long intervalMinutes(Map<String, Object> cfg) {
        Object raw = cfg.get(MINUTES);
        long minutes;
        if (raw == null) {
            minutes = 60;
        } else if (raw instanceof Number n) {
            minutes = n.longValue();
        } else {
            try {
                minutes = Long.parseLong(raw.toString().trim());
            } catch (NumberFormatException e) {
                throw new ConfigurationException("minutes must be a whole number: " + raw, e);
            }
        }
        if (minutes <= 0) throw new ConfigurationException("minutes must be positive: " + minutes);
        if (minutes > MAX_INTERVAL_MINUTES) {
            throw new ConfigurationException("minutes must not exceed " + MAX_INTERVAL_MINUTES + ": " + minutes);
        }
        return minutes;
    }

    private Instant onceInstant(Map<String, Object> cfg) {
        String raw = string(cfg, DATETIME, null);
        if (raw == null || raw.isBlank()) throw new ConfigurationException("datetime is required");
        String s = raw.trim().replace(' ', 'T');
        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(s, OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime odt) return odt.toInstant();
            return ((LocalDateTime) parsed).atZone(zone).toInstant();
        } catch (DateTimeParseException e) {
            throw new ConfigurationException("Invalid datetime: " + raw, e);
        }
    }

    static LocalTime timeOfDay(Map<String, Object> cfg) {
        String raw = string(cfg, TIME, "00:00");
        try {
            return LocalTime.parse(raw.trim(), HH_MM);
        } catch (DateTimeParseException e) {
            throw new ConfigurationException("time must be HH:MM: " + raw, e);
        }
    }

    static DayOfWeek dayOfWeek(Map<String, Object> cfg) {
        String raw = string(cfg, DAY, "monday");
        try {
            return DayOfWeek.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown day: " + raw, e);
        }
    }

    private static String string(Map<String, Object> cfg, String key, String fallback) {
        Object v = cfg.get(key);
        return v == null ? fallback : v.toString();
    }
}
