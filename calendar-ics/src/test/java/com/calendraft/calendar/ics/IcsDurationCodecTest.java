/********************************************************************
 *  As a subpart of Twake Mail, this file is edited by Linagora.    *
 *                                                                  *
 *  https://twake-mail.com/                                         *
 *  https://linagora.com                                            *
 *                                                                  *
 *  This file is subject to The Affero Gnu Public License           *
 *  version 3.                                                      *
 *                                                                  *
 *  https://www.gnu.org/licenses/agpl-3.0.en.html                   *
 *                                                                  *
 *  This program is distributed in the hope that it will be         *
 *  useful, but WITHOUT ANY WARRANTY; without even the implied      *
 *  warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR         *
 *  PURPOSE. See the GNU Affero General Public License for          *
 *  more details.                                                   *
 ********************************************************************/

package com.calendraft.calendar.ics;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import java.time.ZoneOffset;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import com.calendraft.calendar.api.DurationUnit;
import com.calendraft.calendar.api.ParsedDuration;

class IcsDurationCodecTest {

    @Test
    void parseDurationShouldKeepLargestUnitOnly() {
        assertThat(IcsDurationCodec.parseDuration("P1DT2H30M"))
            .contains(ParsedDuration.of(1, DurationUnit.DAYS));
    }

    @ParameterizedTest
    @CsvSource({
        "PT15M, 15, MINUTES",
        "-PT1H, 1, HOURS",
        "PT1H30M, 1, HOURS",
        "P2D, 2, DAYS",
        "PT90S, 90, SECONDS",
        "T45M, 45, MINUTES"
    })
    void parseDurationShouldReadSingleUnit(String duration, long value, DurationUnit unit) {
        assertThat(IcsDurationCodec.parseDuration(duration))
            .contains(ParsedDuration.of(value, unit));
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"P", "P0D", "PT0M", "soon", "  "})
    void parseDurationShouldRejectEmptyDurations(String duration) {
        assertThat(IcsDurationCodec.parseDuration(duration)).isEmpty();
        assertThat(IcsDurationCodec.isValidDuration(duration)).isFalse();
    }

    @ParameterizedTest
    @CsvSource({
        "P1D, 1440",
        "PT2H, 120",
        "PT15M, 15",
        "PT60S, 1",
        "PT61S, 2",
        "PT1S, 1"
    })
    void durationToMinutesShouldRoundSecondsUp(String duration, long minutes) {
        assertThat(IcsDurationCodec.durationToMinutes(duration)).contains(minutes);
    }

    @Test
    void formatDurationShouldWriteOneUnit() {
        assertThat(IcsDurationCodec.formatDuration(2, DurationUnit.DAYS)).isEqualTo("P2D");
        assertThat(IcsDurationCodec.formatDuration(3, DurationUnit.HOURS)).isEqualTo("PT3H");
        assertThat(IcsDurationCodec.formatDuration(15, DurationUnit.MINUTES)).isEqualTo("PT15M");
        assertThat(IcsDurationCodec.formatDuration(30, DurationUnit.SECONDS)).isEqualTo("PT30S");
    }

    @Test
    void formatDurationShouldReturnEmptyStringWhenNotPositive() {
        assertThat(IcsDurationCodec.formatDuration(0, DurationUnit.MINUTES)).isEmpty();
        assertThat(IcsDurationCodec.formatDuration(-5, DurationUnit.HOURS)).isEmpty();
        assertThat(IcsDurationCodec.formatNegativeDuration(0, DurationUnit.MINUTES)).isEmpty();
    }

    @Test
    void formatNegativeDurationShouldPrefixMinus() {
        assertThat(IcsDurationCodec.formatNegativeDuration(15, DurationUnit.MINUTES)).isEqualTo("-PT15M");
    }

    @Test
    void parseExactDurationShouldKeepEveryComponent() {
        Instant start = Instant.parse("2024-01-15T10:00:00Z");

        assertThat(IcsDurationCodec.parseExactDuration("P1DT2H30M")
                .map(amount -> start.atZone(ZoneOffset.UTC).plus(amount).toInstant()))
            .contains(Instant.parse("2024-01-16T12:30:00Z"));
    }

    @Test
    void parseExactDurationShouldSupportWeeks() {
        Instant start = Instant.parse("2024-01-15T10:00:00Z");

        assertThat(IcsDurationCodec.parseExactDuration("P1W")
                .map(amount -> start.atZone(ZoneOffset.UTC).plus(amount).toInstant()))
            .contains(Instant.parse("2024-01-22T10:00:00Z"));
    }

    @Test
    void parseExactDurationShouldRejectGarbage() {
        assertThat(IcsDurationCodec.parseExactDuration("soon")).isEmpty();
        assertThat(IcsDurationCodec.parseExactDuration("")).isEmpty();
    }
}
