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

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoField;
import java.time.temporal.Temporal;
import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Strings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.calendraft.calendar.api.RecurrenceRule;
import com.calendraft.calendar.api.RecurrenceRule.Frequency;
import com.calendraft.calendar.api.RecurrenceRule.WeekdayNum;
import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import net.fortuna.ical4j.model.Month;
import net.fortuna.ical4j.model.Recur;
import net.fortuna.ical4j.model.WeekDay;

/**
 * Structured view of {@code RRULE} values. Events keep their rule verbatim;
 * this codec is for callers that edit rules.
 */
public class RecurrenceRuleCodec {
    private static final Logger LOGGER = LoggerFactory.getLogger(RecurrenceRuleCodec.class);

    private static final String RRULE_PREFIX = "RRULE:";
    private static final String FREQ = "FREQ";
    private static final String INTERVAL = "INTERVAL";
    private static final String COUNT = "COUNT";
    private static final String UNTIL = "UNTIL";
    private static final String BYDAY = "BYDAY";
    private static final String BYMONTH = "BYMONTH";
    private static final String BYMONTHDAY = "BYMONTHDAY";
    private static final String BYSETPOS = "BYSETPOS";
    public static final Set<String> SUPPORTED_PARTS = ImmutableSet.of(FREQ, INTERVAL, COUNT, UNTIL, BYDAY, BYMONTH, BYMONTHDAY, BYSETPOS);

    private static final LocalTime END_OF_DAY = LocalTime.of(23, 59, 59);
    private static final Splitter PART_SPLITTER = Splitter.on(';').trimResults().omitEmptyStrings();
    private static final Joiner PART_JOINER = Joiner.on(';');
    private static final Joiner VALUE_JOINER = Joiner.on(',');

    private RecurrenceRuleCodec() {
    }

    /**
     * Unsupported parts are ignored. A rule without a recognized FREQ, or with a
     * malformed or unmodelled value in a supported part, yields empty.
     */
    public static Optional<RecurrenceRule> parse(String rrule) {
        if (StringUtils.isBlank(rrule)) {
            return Optional.empty();
        }
        try {
            Recur<Temporal> recur = new Recur<>(normalize(rrule), true);
            if (recur.getFrequency() == null) {
                LOGGER.debug("Recurrence rule '{}' has no FREQ", rrule);
                return Optional.empty();
            }
            return Optional.of(toRecurrenceRule(recur));
        } catch (Exception e) {
            LOGGER.debug("Invalid recurrence rule '{}': {}", rrule, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Writes FREQ, INTERVAL (only when greater than one), COUNT, UNTIL, BYDAY,
     * BYMONTH, BYMONTHDAY and BYSETPOS in that order.
     */
    public static String format(RecurrenceRule rule) {
        ImmutableList.Builder<String> parts = ImmutableList.builder();
        parts.add(FREQ + "=" + rule.frequency().name());
        rule.interval()
            .filter(interval -> interval > 1)
            .ifPresent(interval -> parts.add(INTERVAL + "=" + interval));
        rule.count().ifPresent(count -> parts.add(COUNT + "=" + count));
        rule.until().ifPresent(until -> parts.add(UNTIL + "=" + IcsDateCodec.formatInstant(until)));
        if (!rule.byDay().isEmpty()) {
            parts.add(BYDAY + "=" + VALUE_JOINER.join(rule.byDay().stream().map(RecurrenceRuleCodec::formatWeekdayNum).iterator()));
        }
        if (!rule.byMonth().isEmpty()) {
            parts.add(BYMONTH + "=" + VALUE_JOINER.join(rule.byMonth()));
        }
        if (!rule.byMonthDay().isEmpty()) {
            parts.add(BYMONTHDAY + "=" + VALUE_JOINER.join(rule.byMonthDay()));
        }
        if (!rule.bySetPos().isEmpty()) {
            parts.add(BYSETPOS + "=" + VALUE_JOINER.join(rule.bySetPos()));
        }
        return PART_JOINER.join(parts.build());
    }

    /**
     * @return true when the rule parses, only uses the supported parts and
     * survives a format then parse cycle unchanged
     */
    public static boolean isFullyRepresentable(String rrule) {
        Optional<RecurrenceRule> rule = parse(rrule);
        if (rule.isEmpty()) {
            return false;
        }
        boolean supportedPartsOnly = PART_SPLITTER.splitToStream(normalize(rrule))
            .map(part -> StringUtils.substringBefore(part, "=").trim())
            .allMatch(SUPPORTED_PARTS::contains);
        return supportedPartsOnly && parse(format(rule.get())).equals(rule);
    }

    private static String normalize(String rrule) {
        return Strings.CI.removeStart(rrule.trim(), RRULE_PREFIX).toUpperCase(Locale.US);
    }

    private static RecurrenceRule toRecurrenceRule(Recur<Temporal> recur) {
        RecurrenceRule.Builder builder = RecurrenceRule.builder(Frequency.valueOf(recur.getFrequency().name()));
        if (recur.getInterval() >= 1) {
            builder.interval(recur.getInterval());
        }
        if (recur.getCount() >= 0) {
            builder.count(recur.getCount());
        }
        if (recur.getUntil() != null) {
            builder.until(toUntilInstant(recur.getUntil()));
        }
        return builder
            .byDay(recur.getDayList().stream()
                .map(RecurrenceRuleCodec::toWeekdayNum)
                .toList())
            .byMonth(recur.getMonthList().stream()
                .map(RecurrenceRuleCodec::toMonthOfYear)
                .toList())
            .byMonthDay(recur.getMonthDayList())
            .bySetPos(recur.getSetPosList())
            .build();
    }

    private static Instant toUntilInstant(Temporal until) {
        if (until instanceof LocalDate date) {
            return date.atTime(END_OF_DAY).toInstant(ZoneOffset.UTC);
        }
        if (until instanceof LocalDateTime floating) {
            return floating.toInstant(ZoneOffset.UTC);
        }
        return Instant.ofEpochSecond(until.getLong(ChronoField.INSTANT_SECONDS));
    }

    private static WeekdayNum toWeekdayNum(WeekDay weekDay) {
        return new WeekdayNum(weekDay.getOffset(), toDayOfWeek(weekDay.getDay().name()));
    }

    private static int toMonthOfYear(Month month) {
        if (month.isLeapMonth()) {
            throw new IllegalArgumentException("Leap month " + month + " is not supported");
        }
        return month.getMonthOfYear();
    }

    private static DayOfWeek toDayOfWeek(String code) {
        return Arrays.stream(DayOfWeek.values())
            .filter(day -> day.name().startsWith(code))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown weekday " + code));
    }

    private static String formatWeekdayNum(WeekdayNum weekdayNum) {
        String code = weekdayNum.dayOfWeek().name().substring(0, 2);
        return weekdayNum.offset() == 0 ? code : weekdayNum.offset() + code;
    }
}
