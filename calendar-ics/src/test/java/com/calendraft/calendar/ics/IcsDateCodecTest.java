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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

class IcsDateCodecTest {

    @Test
    void parseInstantShouldReadUtcDateTime() {
        assertThat(IcsDateCodec.parseInstant("20240115T103000Z"))
            .contains(Instant.parse("2024-01-15T10:30:00Z"));
    }

    @Test
    void parseInstantShouldReadDateAsMidnightUtc() {
        assertThat(IcsDateCodec.parseInstant("20240115"))
            .contains(Instant.parse("2024-01-15T00:00:00Z"));
    }

    @Test
    void parseInstantShouldTrimInput() {
        assertThat(IcsDateCodec.parseInstant("  20240115T103000Z "))
            .contains(Instant.parse("2024-01-15T10:30:00Z"));
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"2024-01-15", "20240115T1030Z", "20240115T103000", "20241315T000000Z", "20240230", "2024011", "tomorrow"})
    void parseInstantShouldRejectInvalidValues(String value) {
        assertThat(IcsDateCodec.parseInstant(value)).isEmpty();
        assertThat(IcsDateCodec.isValidIcsDate(value)).isFalse();
    }

    @Test
    void formatInstantShouldTruncateSubSecondPrecision() {
        assertThat(IcsDateCodec.formatInstant(Instant.parse("2024-01-15T10:30:45.987Z")))
            .isEqualTo("20240115T103045Z");
    }

    @Test
    void formatDateOnlyShouldUseUtcFields() {
        assertThat(IcsDateCodec.formatDateOnly(Instant.parse("2024-01-15T23:00:00Z")))
            .isEqualTo("20240115");
    }

    @ParameterizedTest
    @ValueSource(strings = {"2024-01-15T10:30:00Z", "1969-07-20T20:17:40Z", "2024-02-29T23:59:59Z", "2000-01-01T00:00:00Z"})
    void parseInstantShouldInvertFormatInstant(String value) {
        Instant instant = Instant.parse(value);

        assertThat(IcsDateCodec.parseInstant(IcsDateCodec.formatInstant(instant))).contains(instant);
    }

    @Test
    void parseFloatingDateTimeShouldReadValueAsUtc() {
        assertThat(IcsDateCodec.parseFloatingDateTime("20240115T103000"))
            .contains(Instant.parse("2024-01-15T10:30:00Z"));
    }

    @Test
    void parseFloatingDateTimeShouldRejectUtcForm() {
        assertThat(IcsDateCodec.parseFloatingDateTime("20240115T103000Z")).isEmpty();
    }
}
