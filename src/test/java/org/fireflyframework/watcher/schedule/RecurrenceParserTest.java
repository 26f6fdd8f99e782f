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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.scheduling.support.PeriodicTrigger;

import java.time.Duration;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link RecurrenceParser}.
 */
class RecurrenceParserTest {

    private RecurrenceParser parser;

    @BeforeEach
    void setUp() {
        parser = new RecurrenceParser();
    }

    @Nested
    @DisplayName("every phrases")
    class EveryPhraseTests {

        @Test
        void shouldAlignMinuteStepsToTheClock() {
            RecurrenceSpec spec = parser.parse("every 5 minutes");

            assertThat(spec.cronExpression()).isEqualTo("0 */5 * * * *");
            assertThat(spec.description()).isEqualTo("every 5 minutes");
        }

        @Test
        void shouldAcceptAbbreviationsAndCase() {
            assertThat(parser.parse("Every 10  mins").cronExpression()).isEqualTo("0 */10 * * * *");
            assertThat(parser.parse("every 2 hrs").cronExpression()).isEqualTo("0 0 */2 * * *");
            assertThat(parser.parse("every 15 secs").cronExpression()).isEqualTo("*/15 * * * * *");
        }

        @Test
        void shouldTreatMissingStepAsOne() {
            assertThat(parser.parse("every minute").cronExpression()).isEqualTo("0 * * * * *");
            assertThat(parser.parse("every hour").cronExpression()).isEqualTo("0 0 * * * *");
            assertThat(parser.parse("every day").cronExpression()).isEqualTo("0 0 0 * * *");
        }

        @Test
        void shouldFallBackToFixedPeriodForUnalignedSteps() {
            RecurrenceSpec spec = parser.parse("every 90 seconds");

            assertThat(spec.isCron()).isFalse();
            assertThat(spec.period()).isEqualTo(Duration.ofSeconds(90));
        }

        @Test
        void shouldUseFixedPeriodForMultiDaySteps() {
            assertThat(parser.parse("every 3 days").period()).isEqualTo(Duration.ofDays(3));
        }

        @Test
        void shouldRejectZeroStep() {
            assertThatThrownBy(() -> parser.parse("every 0 minutes"))
                    .isInstanceOf(InvalidRecurrenceException.class);
        }

        @Test
        @DisplayName("should reject steps that do not fit a long")
        void shouldRejectOversizedStep() {
            assertThatThrownBy(() -> parser.parse("every 99999999999999999999 seconds"))
                    .isInstanceOf(InvalidRecurrenceException.class);
        }

        @Test
        @DisplayName("should reject periods that overflow or exceed the longest allowed period")
        void shouldRejectOverlongPeriod() {
            assertThatThrownBy(() -> parser.parse("every 9223372036854775807 days"))
                    .isInstanceOf(InvalidRecurrenceException.class);
            assertThatThrownBy(() -> parser.parse("every 5000 days"))
                    .isInstanceOf(InvalidRecurrenceException.class);
            assertThat(parser.parse("every 3650 days").period()).isEqualTo(RecurrenceSpec.MAX_PERIOD);
        }
    }

    @Nested
    @DisplayName("time of day phrases")
    class AtTimeTests {

        @Test
        void shouldParse24HourTime() {
            assertThat(parser.parse("at 14:30").cronExpression()).isEqualTo("0 30 14 * * *");
        }

        @Test
        void shouldParseMeridiem() {
            assertThat(parser.parse("every day at 9 am").cronExpression()).isEqualTo("0 0 9 * * *");
            assertThat(parser.parse("at 12pm").cronExpression()).isEqualTo("0 0 12 * * *");
            assertThat(parser.parse("at 12 am").cronExpression()).isEqualTo("0 0 0 * * *");
        }

        @Test
        void shouldRejectOutOfRangeTimes() {
            assertThatThrownBy(() -> parser.parse("at 25:00")).isInstanceOf(InvalidRecurrenceException.class);
            assertThatThrownBy(() -> parser.parse("at 13 pm")).isInstanceOf(InvalidRecurrenceException.class);
        }
    }

    @Nested
    @DisplayName("cron expressions")
    class CronTests {

        @Test
        void shouldKeepSixFieldCron() {
            assertThat(parser.parse("0 0/15 * * * MON-FRI").cronExpression()).isEqualTo("0 0/15 * * * MON-FRI");
        }

        @Test
        void shouldPrefixFiveFieldCronWithSeconds() {
            assertThat(parser.parse("*/5 * * * *").cronExpression()).isEqualTo("0 */5 * * * *");
        }

        @Test
        void shouldAcceptMacros() {
            assertThat(parser.parse("@hourly").cronExpression()).isEqualTo("@hourly");
        }
    }

    @Test
    @DisplayName("should reject unparseable phrases with the phrase in the exception")
    void shouldRejectUnparseablePhrases() {
        assertThatThrownBy(() -> parser.parse("whenever it feels right"))
                .isInstanceOf(InvalidRecurrenceException.class)
                .satisfies(e -> assertThat(((InvalidRecurrenceException) e).getPhrase())
                        .isEqualTo("whenever it feels right"));
        assertThatThrownBy(() -> parser.parse("  ")).isInstanceOf(InvalidRecurrenceException.class);
        assertThatThrownBy(() -> parser.parse(null)).isInstanceOf(InvalidRecurrenceException.class);
    }

    @Test
    @DisplayName("should build the matching Spring trigger")
    void shouldBuildMatchingTrigger() {
        ZoneId utc = ZoneId.of("UTC");

        assertThat(parser.parse("every 5 minutes").toTrigger(utc)).isInstanceOf(CronTrigger.class);

        PeriodicTrigger periodic = (PeriodicTrigger) parser.parse("every 90 seconds").toTrigger(utc);
        assertThat(periodic.getPeriodDuration()).isEqualTo(Duration.ofSeconds(90));
        assertThat(periodic.isFixedRate()).isTrue();
        assertThat(periodic.getInitialDelayDuration()).isEqualTo(Duration.ofSeconds(90));
    }
}
