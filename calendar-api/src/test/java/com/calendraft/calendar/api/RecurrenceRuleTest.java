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

package com.calendraft.calendar.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.DayOfWeek;
import java.time.Instant;

import org.junit.jupiter.api.Test;

import com.calendraft.calendar.api.RecurrenceRule.Frequency;
import com.calendraft.calendar.api.RecurrenceRule.WeekdayNum;

class RecurrenceRuleTest {

    @Test
    void builderShouldRejectCountAndUntilTogether() {
        assertThatThrownBy(() -> RecurrenceRule.builder(Frequency.DAILY)
                .count(3)
                .until(Instant.parse("2024-12-31T23:59:59Z"))
                .build())
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void builderShouldLeaveUnsetPartsEmpty() {
        RecurrenceRule rule = RecurrenceRule.builder(Frequency.WEEKLY)
            .byDay(WeekdayNum.every(DayOfWeek.MONDAY))
            .build();

        assertThat(rule.interval()).isEmpty();
        assertThat(rule.count()).isEmpty();
        assertThat(rule.until()).isEmpty();
        assertThat(rule.bySetPos()).isEmpty();
        assertThat(rule.byDay()).containsExactly(new WeekdayNum(0, DayOfWeek.MONDAY));
    }

    @Test
    void weekdayNumShouldRejectOutOfRangeOffset() {
        assertThatThrownBy(() -> new WeekdayNum(54, DayOfWeek.FRIDAY))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
