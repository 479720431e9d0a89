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

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Optional;
import java.util.regex.Pattern;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Conversions between {@link Instant} and the two ICS date encodings:
 * {@code YYYYMMDDTHHMMSSZ} (UTC date-time) and {@code YYYYMMDD} (date, midnight UTC).
 *
 * <p>ICS has second resolution: formatting truncates any sub-second part.
 */
public class IcsDateCodec {
    private static final Logger LOGGER = LoggerFactory.getLogger(IcsDateCodec.class);

    public static final DateTimeFormatter UTC_DATE_TIME_FORMATTER = new DateTimeFormatterBuilder()
        .appendPattern("uuuuMMdd'T'HHmmss'Z'")
        .toFormatter()
        .withResolverStyle(ResolverStyle.STRICT);
    public static final DateTimeFormatter FLOATING_DATE_TIME_FORMATTER = new DateTimeFormatterBuilder()
        .appendPattern("uuuuMMdd'T'HHmmss")
        .toFormatter()
        .withResolverStyle(ResolverStyle.STRICT);
    public static final DateTimeFormatter DATE_FORMATTER = new DateTimeFormatterBuilder()
        .appendPattern("uuuuMMdd")
        .toFormatter()
        .withResolverStyle(ResolverStyle.STRICT);

    private static final int DATE_TIME_LENGTH = 16;
    private static final Pattern DATE_ONLY_PATTERN = Pattern.compile("\\d{8}");
    private static final Pattern FLOATING_DATE_TIME_PATTERN = Pattern.compile("\\d{8}T\\d{6}");

    private IcsDateCodec() {
    }

    /**
     * Lookup rather than a throwing parse: any value that is neither a
     * 16-character {@code ...T...Z} date-time nor an 8-digit date yields empty.
     */
    public static Optional<Instant> parseInstant(String value) {
        if (StringUtils.isBlank(value)) {
            return Optional.empty();
        }
        String clean = value.trim();
        try {
            if (clean.length() == DATE_TIME_LENGTH && clean.contains("T") && clean.endsWith("Z")) {
                return Optional.of(LocalDateTime.parse(clean, UTC_DATE_TIME_FORMATTER).toInstant(ZoneOffset.UTC));
            }
            if (DATE_ONLY_PATTERN.matcher(clean).matches()) {
                return Optional.of(LocalDate.parse(clean, DATE_FORMATTER).atStartOfDay(ZoneOffset.UTC).toInstant());
            }
        } catch (DateTimeParseException e) {
            LOGGER.debug("Invalid ICS date '{}': {}", clean, e.getMessage());
        }
        return Optional.empty();
    }

    /**
     * Reads a floating {@code YYYYMMDDTHHMMSS} value (no {@code Z}) as if it were UTC.
     */
    public static Optional<Instant> parseFloatingDateTime(String value) {
        if (StringUtils.isBlank(value) || !FLOATING_DATE_TIME_PATTERN.matcher(value.trim()).matches()) {
            return Optional.empty();
        }
        try {
            return Optional.of(LocalDateTime.parse(value.trim(), FLOATING_DATE_TIME_FORMATTER).toInstant(ZoneOffset.UTC));
        } catch (DateTimeParseException e) {
            LOGGER.debug("Invalid floating ICS date-time '{}': {}", value, e.getMessage());
            return Optional.empty();
        }
    }

    public static boolean isValidIcsDate(String value) {
        return parseInstant(value).isPresent();
    }

    public static boolean isDateOnly(String value) {
        return value != null && DATE_ONLY_PATTERN.matcher(value.trim()).matches();
    }

    public static String formatInstant(Instant instant) {
        return instant.atOffset(ZoneOffset.UTC).format(UTC_DATE_TIME_FORMATTER);
    }

    public static String formatDateOnly(Instant instant) {
        return instant.atOffset(ZoneOffset.UTC).format(DATE_FORMATTER);
    }
}
