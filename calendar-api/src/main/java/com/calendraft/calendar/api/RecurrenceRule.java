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

import java.time.DayOfWeek;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Ints;

/**
 * Structured view of an {@code RRULE} value restricted to the parts the
 * recurrence editor understands: FREQ, INTERVAL, COUNT, UNTIL, BYDAY, BYMONTH,
 * BYMONTHDAY and BYSETPOS.
 */
public record RecurrenceRule(Frequency frequency,
                             Optional<Integer> interval,
                             Optional<Integer> count,
                             Optional<Instant> until,
                             ImmutableList<WeekdayNum> byDay,
                             ImmutableList<Integer> byMonth,
                             ImmutableList<Integer> byMonthDay,
                             ImmutableList<Integer> bySetPos) {

    public enum Frequency {
        SECONDLY,
        MINUTELY,
        HOURLY,
        DAILY,
        WEEKLY,
        MONTHLY,
        YEARLY
    }

    /**
     * A BYDAY entry such as {@code MO}, {@code 1MO} or {@code -1FR}. An offset of zero means "every".
     */
    public record WeekdayNum(int offset, DayOfWeek dayOfWeek) {

        public static WeekdayNum every(DayOfWeek dayOfWeek) {
            return new WeekdayNum(0, dayOfWeek);
        }

        public WeekdayNum {
            Preconditions.checkNotNull(dayOfWeek, "'dayOfWeek' must not be null");
            Preconditions.checkArgument(offset >= -53 && offset <= 53, "'offset' must be within [-53, 53]");
        }
    }

    public RecurrenceRule {
        Preconditions.checkNotNull(frequency, "'frequency' must not be null");
        Preconditions.checkNotNull(interval, "'interval' must not be null");
        Preconditions.checkNotNull(count, "'count' must not be null");
        Preconditions.checkNotNull(until, "'until' must not be null");
        Preconditions.checkArgument(count.isEmpty() || until.isEmpty(), "COUNT and UNTIL must not both be set");
        byDay = ImmutableList.copyOf(byDay);
        byMonth = ImmutableList.copyOf(byMonth);
        byMonthDay = ImmutableList.copyOf(byMonthDay);
        bySetPos = ImmutableList.copyOf(bySetPos);
    }

    public static Builder builder(Frequency frequency) {
        return new Builder(frequency);
    }

    public static class Builder {
        private final Frequency frequency;
        private Integer interval;
        private Integer count;
        private Instant until;
        private final List<WeekdayNum> byDay = new ArrayList<>();
        private final List<Integer> byMonth = new ArrayList<>();
        private final List<Integer> byMonthDay = new ArrayList<>();
        private final List<Integer> bySetPos = new ArrayList<>();

        private Builder(Frequency frequency) {
            this.frequency = frequency;
        }

        public Builder interval(int interval) {
            this.interval = interval;
            return this;
        }

        public Builder count(int count) {
            this.count = count;
            return this;
        }

        public Builder until(Instant until) {
            this.until = until;
            return this;
        }

        public Builder byDay(WeekdayNum... weekdays) {
            this.byDay.addAll(List.of(weekdays));
            return this;
        }

        public Builder byDay(List<WeekdayNum> weekdays) {
            this.byDay.addAll(weekdays);
            return this;
        }

        public Builder byMonth(List<Integer> months) {
            this.byMonth.addAll(months);
            return this;
        }

        public Builder byMonthDay(List<Integer> monthDays) {
            this.byMonthDay.addAll(monthDays);
            return this;
        }

        public Builder bySetPos(int... positions) {
            this.bySetPos.addAll(Ints.asList(positions));
            return this;
        }

        public Builder bySetPos(List<Integer> positions) {
            this.bySetPos.addAll(positions);
            return this;
        }

        public RecurrenceRule build() {
            return new RecurrenceRule(frequency,
                Optional.ofNullable(interval),
                Optional.ofNullable(count),
                Optional.ofNullable(until),
                ImmutableList.copyOf(byDay),
                ImmutableList.copyOf(byMonth),
                ImmutableList.copyOf(byMonthDay),
                ImmutableList.copyOf(bySetPos));
        }
    }
}
