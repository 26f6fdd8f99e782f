/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.fireflyframework.watcher.schedule;

import org.fireflyframework.watcher.exception.InvalidRecurrenceException;
import org.fireflyframework.watcher.model.RecurrenceSpec;
import org.springframework.scheduling.support.CronExpression;

import java.time.Duration;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a human-readable recurrence phrase into a {@link RecurrenceSpec}.
 * <p>
 * Supported forms:
 * <ul>
 *   <li>cron expressions: Spring six-field ({@code 0 *&#47;5 * * * *}), classic five-field
 *       ({@code *&#47;5 * * * *}) and macros ({@code @hourly})</li>
 *   <li>{@code every [N] second|minute|hour|day[s]}, with the usual abbreviations
 *       ({@code secs}, {@code mins}, {@code hrs})</li>
 *   <li>{@code [every day] at HH:MM [am|pm]}</li>
 * </ul>
 * "every" phrases are aligned to the clock the way cron steps are: {@code every 5 minutes}
 * fires at minute 0, 5, 10, ... of each hour. Steps that cannot be expressed as a clock
 * step (for example {@code every 90 seconds}) fall back to a fixed period.
 */
public class RecurrenceParser {

    private static final Pattern EVERY = Pattern.compile(
            "^every\\s+(?:(\\d+)\\s+)?(s|secs?|seconds?|m|mins?|minutes?|h|hrs?|hours?|d|days?)$");

    private static final Pattern AT_TIME = Pattern.compile(
            "^(?:every\\s+day\\s+)?at\\s+(\\d{1,2})(?::(\\d{2}))?\\s*(am|pm)?$");

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public RecurrenceSpec parse(String phrase) {
        if (phrase == null || phrase.isBlank()) {
            throw new InvalidRecurrenceException(String.valueOf(phrase), "empty phrase");
        }

        String trimmed = phrase.trim();
        String cron = toCron(trimmed);
        if (cron != null) {
            return RecurrenceSpec.cron(trimmed, cron);
        }

        String normalized = WHITESPACE.matcher(trimmed.toLowerCase(Locale.ROOT)).replaceAll(" ");

        Matcher every = EVERY.matcher(normalized);
        if (every.matches()) {
            return every(trimmed, parseStep(trimmed, every.group(1)), unitOf(every.group(2)));
        }

        Matcher at = AT_TIME.matcher(normalized);
        if (at.matches()) {
            return daily(trimmed, at);
        }

        throw new InvalidRecurrenceException(trimmed);
    }

    private String toCron(String phrase) {
        if (CronExpression.isValidExpression(phrase)) {
            return phrase;
        }
        String withSeconds = "0 " + phrase;
        if (phrase.split("\\s+").length == 5 && CronExpression.isValidExpression(withSeconds)) {
            return withSeconds;
        }
        return null;
    }

    private long parseStep(String phrase, String digits) {
        if (digits == null) {
            return 1;
        }
        try {
            return Long.parseLong(digits);
        } catch (NumberFormatException e) {
            throw new InvalidRecurrenceException(phrase, "step out of range");
        }
    }

    private RecurrenceSpec every(String phrase, long step, Unit unit) {
        if (step <= 0) {
            throw new InvalidRecurrenceException(phrase, "step must be positive");
        }
        if (step == 1) {
            return RecurrenceSpec.cron(phrase, unit.cronEvery);
        }
        if (step < unit.wrap && unit.wrap % step == 0) {
            return RecurrenceSpec.cron(phrase, unit.cronStep.formatted(step));
        }
        Duration period;
        try {
            period = unit.duration.multipliedBy(step);
        } catch (ArithmeticException e) {
            throw new InvalidRecurrenceException(phrase, "period out of range");
        }
        if (period.compareTo(RecurrenceSpec.MAX_PERIOD) > 0) {
            throw new InvalidRecurrenceException(phrase, "period longer than " + RecurrenceSpec.MAX_PERIOD.toDays() + " days");
        }
        return RecurrenceSpec.every(phrase, period);
    }

    private RecurrenceSpec daily(String phrase, Matcher at) {
        int hour = Integer.parseInt(at.group(1));
        int minute = at.group(2) != null ? Integer.parseInt(at.group(2)) : 0;
        String meridiem = at.group(3);

        if (meridiem != null) {
            if (hour < 1 || hour > 12) {
                throw new InvalidRecurrenceException(phrase, "hour out of range");
            }
            hour = hour % 12 + ("pm".equals(meridiem) ? 12 : 0);
        }
        if (hour > 23 || minute > 59) {
            throw new InvalidRecurrenceException(phrase, "time out of range");
        }
        return RecurrenceSpec.cron(phrase, "0 " + minute + " " + hour + " * * *");
    }

    private Unit unitOf(String token) {
        return switch (token.charAt(0)) {
            case 's' -> Unit.SECOND;
            case 'm' -> Unit.MINUTE;
            case 'h' -> Unit.HOUR;
            default -> Unit.DAY;
        };
    }

    private enum Unit {
        SECOND(Duration.ofSeconds(1), 60, "* * * * * *", "*/%d * * * * *"),
        MINUTE(Duration.ofMinutes(1), 60, "0 * * * * *", "0 */%d * * * *"),
        HOUR(Duration.ofHours(1), 24, "0 0 * * * *", "0 0 */%d * * *"),
        DAY(Duration.ofDays(1), 1, "0 0 0 * * *", "0 0 0 */%d * *");

        private final Duration duration;
        private final long wrap;
        private final String cronEvery;
        private final String cronStep;

        Unit(Duration duration, long wrap, String cronEvery, String cronStep) {
            this.duration = duration;
            this.wrap = wrap;
            this.cronEvery = cronEvery;
            this.cronStep = cronStep;
        }
    }
}
