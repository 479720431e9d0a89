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

import java.math.RoundingMode;
import java.time.temporal.TemporalAmount;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Strings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.calendraft.calendar.api.DurationUnit;
import com.calendraft.calendar.api.ParsedDuration;
import com.google.common.math.LongMath;

import net.fortuna.ical4j.model.TemporalAmountAdapter;

/**
 * ISO 8601 / RFC 5545 durations reduced to a single unit.
 *
 * <p>{@link #parseDuration(String)} keeps only the largest non-zero unit:
 * {@code P1DT2H30M} reads as one day. {@link #formatDuration(long, DurationUnit)}
 * mirrors this and only ever writes one unit. Use
 * {@link #parseExactDuration(String)} when the elapsed time matters.
 */
public class IcsDurationCodec {
    private static final Logger LOGGER = LoggerFactory.getLogger(IcsDurationCodec.class);

    private static final Pattern DAYS_PATTERN = Pattern.compile("(\\d+)D");
    private static final Pattern TIME_PART_PATTERN = Pattern.compile("T(.+)");
    private static final Pattern HOURS_PATTERN = Pattern.compile("(\\d+)H");
    private static final Pattern MINUTES_PATTERN = Pattern.compile("(\\d+)M");
    private static final Pattern SECONDS_PATTERN = Pattern.compile("(\\d+)S");

    private static final long MINUTES_PER_DAY = 24 * 60;
    private static final long MINUTES_PER_HOUR = 60;
    private static final long SECONDS_PER_MINUTE = 60;

    record DurationComponents(boolean negative, long days, long hours, long minutes, long seconds) {
    }

    private IcsDurationCodec() {
    }

    public static Optional<ParsedDuration> parseDuration(String duration) {
        return components(duration)
            .flatMap(components -> largestUnit(components.days(), components.hours(), components.minutes(), components.seconds()));
    }

    public static boolean isValidDuration(String duration) {
        return parseDuration(duration).isPresent();
    }

    /**
     * @return the duration in minutes, seconds being rounded up to the next whole minute
     */
    public static Optional<Long> durationToMinutes(String duration) {
        return parseDuration(duration)
            .map(parsed -> switch (parsed.unit()) {
                case DAYS -> parsed.value() * MINUTES_PER_DAY;
                case HOURS -> parsed.value() * MINUTES_PER_HOUR;
                case MINUTES -> parsed.value();
                case SECONDS -> LongMath.divide(parsed.value(), SECONDS_PER_MINUTE, RoundingMode.CEILING);
            });
    }

    /**
     * @return {@code P{n}D}, {@code PT{n}H}, {@code PT{n}M} or {@code PT{n}S}, or an empty string when {@code value <= 0}
     */
    public static String formatDuration(long value, DurationUnit unit) {
        if (value <= 0) {
            return StringUtils.EMPTY;
        }
        return switch (unit) {
            case DAYS -> "P" + value + "D";
            case HOURS -> "PT" + value + "H";
            case SECONDS -> "PT" + value + "S";
            case MINUTES -> "PT" + value + "M";
        };
    }

    public static String formatNegativeDuration(long value, DurationUnit unit) {
        String positive = formatDuration(value, unit);
        return positive.isEmpty() ? positive : "-" + positive;
    }

    /**
     * Full multi-unit duration (weeks, days, hours, minutes, seconds and sign), as used by {@code DURATION}.
     */
    public static Optional<TemporalAmount> parseExactDuration(String duration) {
        if (StringUtils.isBlank(duration)) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(TemporalAmountAdapter.parse(duration.trim()).getDuration());
        } catch (RuntimeException e) {
            LOGGER.debug("Invalid ICS duration '{}': {}", duration, e.getMessage());
            return Optional.empty();
        }
    }

    static Optional<DurationComponents> components(String duration) {
        if (StringUtils.isBlank(duration)) {
            return Optional.empty();
        }
        String trimmed = duration.trim();
        boolean negative = trimmed.startsWith("-");
        String unsigned = Strings.CS.removeStart(Strings.CS.removeStart(trimmed, "-"), "+");
        String withoutP = Strings.CS.removeStart(unsigned, "P");

        try {
            long days = extract(DAYS_PATTERN, withoutP);
            Matcher timePart = TIME_PART_PATTERN.matcher(withoutP);
            boolean hasTimePart = timePart.find();
            if (!hasTimePart && days == 0) {
                return Optional.empty();
            }
            if (!hasTimePart) {
                return Optional.of(new DurationComponents(negative, days, 0, 0, 0));
            }
            String time = timePart.group(1);
            return Optional.of(new DurationComponents(negative, days,
                extract(HOURS_PATTERN, time),
                extract(MINUTES_PATTERN, time),
                extract(SECONDS_PATTERN, time)));
        } catch (NumberFormatException e) {
            LOGGER.debug("Duration component out of range in '{}'", duration);
            return Optional.empty();
        }
    }

    static Optional<ParsedDuration> largestUnit(long days, long hours, long minutes, long seconds) {
        if (days > 0) {
            return Optional.of(ParsedDuration.of(days, DurationUnit.DAYS));
        }
        if (hours > 0) {
            return Optional.of(ParsedDuration.of(hours, DurationUnit.HOURS));
        }
        if (minutes > 0) {
            return Optional.of(ParsedDuration.of(minutes, DurationUnit.MINUTES));
        }
        if (seconds > 0) {
            return Optional.of(ParsedDuration.of(seconds, DurationUnit.SECONDS));
        }
        return Optional.empty();
    }

    private static long extract(Pattern pattern, String value) {
        Matcher matcher = pattern.matcher(value);
        if (matcher.find()) {
            return Long.parseLong(matcher.group(1));
        }
        return 0;
    }
}
