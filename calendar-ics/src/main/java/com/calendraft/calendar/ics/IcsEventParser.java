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

import static com.calendraft.calendar.ics.IcsComponent.VALARM;
import static com.calendraft.calendar.ics.IcsComponent.VEVENT;

import java.io.IOException;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Strings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.calendraft.calendar.api.Alarm;
import com.calendraft.calendar.api.AlarmAction;
import com.calendraft.calendar.api.Attendee;
import com.calendraft.calendar.api.AttendeeRole;
import com.calendraft.calendar.api.CalendarEvent;
import com.calendraft.calendar.api.EventClass;
import com.calendraft.calendar.api.EventStatus;
import com.calendraft.calendar.api.GeoPosition;
import com.calendraft.calendar.api.Organizer;
import com.calendraft.calendar.api.ParseResult;
import com.calendraft.calendar.api.ParticipationStatus;
import com.calendraft.calendar.api.Transparency;
import com.google.common.collect.ImmutableList;

import jakarta.inject.Inject;
import net.fortuna.ical4j.data.ParserException;

/**
 * Decodes an ICS document into {@link CalendarEvent}s.
 *
 * <p>Never throws: a document that cannot be tokenized yields one error and no
 * event, a VEVENT that cannot be decoded yields one error and is skipped.
 * Values that are dropped or reinterpreted while their event is kept are
 * reported as warnings.
 */
public class IcsEventParser {
    private static final Logger LOGGER = LoggerFactory.getLogger(IcsEventParser.class);

    public static final String NO_EVENTS_FOUND = "No events found in the ICS file.";
    public static final String PARSE_FAILURE_PREFIX = "Failed to parse ICS file: ";
    public static final String EVENT_FAILURE_PREFIX = "Failed to parse event: ";

    private static final Pattern CN_MAILTO_PATTERN = Pattern.compile("CN=([^:]+):mailto:(.+)", Pattern.CASE_INSENSITIVE);
    private static final String MAILTO = "mailto:";
    private static final String VALUE_PARAMETER = "VALUE";
    private static final String TZID_PARAMETER = "TZID";

    @Inject
    public IcsEventParser() {
    }

    public ParseResult parse(String document) {
        if (StringUtils.isBlank(document)) {
            LOGGER.info("Rejecting blank ICS document");
            return ParseResult.failure(PARSE_FAILURE_PREFIX + "document is empty");
        }

        List<IcsComponent> calendars;
        try {
            calendars = IcsDocumentReader.read(document);
        } catch (ParserException | IOException | RuntimeException e) {
            LOGGER.info("Failed to tokenize ICS document: {}", e.getMessage());
            return ParseResult.failure(PARSE_FAILURE_PREFIX + describe(e));
        }

        List<IcsComponent> vevents = calendars.stream()
            .flatMap(calendar -> calendar.getComponents(VEVENT).stream())
            .toList();
        Optional<String> calendarName = calendars.stream()
            .map(calendar -> calendar.getPropertyValue("X-WR-CALNAME"))
            .flatMap(Optional::stream)
            .map(IcsText::unescape)
            .findFirst();

        if (vevents.isEmpty()) {
            return new ParseResult(ImmutableList.of(), ImmutableList.of(NO_EVENTS_FOUND), ImmutableList.of(), calendarName);
        }

        ImmutableList.Builder<CalendarEvent> events = ImmutableList.builder();
        ImmutableList.Builder<String> errors = ImmutableList.builder();
        ImmutableList.Builder<String> warnings = ImmutableList.builder();
        for (IcsComponent vevent : vevents) {
            EventDecoder decoder = new EventDecoder(vevent);
            try {
                events.add(decoder.decode());
                warnings.addAll(decoder.warnings);
            } catch (InvalidEventException e) {
                LOGGER.info("Skipping event: {}", e.getMessage());
                errors.add(e.getMessage());
            } catch (RuntimeException e) {
                LOGGER.info("Skipping event \"{}\"", decoder.summary, e);
                errors.add(EVENT_FAILURE_PREFIX + describe(e));
            }
        }
        return new ParseResult(events.build(), errors.build(), warnings.build(), calendarName);
    }

    static String describe(Exception e) {
        return StringUtils.defaultIfBlank(e.getMessage(), e.getClass().getSimpleName());
    }

    record CalendarAddress(Optional<String> name, String email) {

        static CalendarAddress parse(IcsProperty property) {
            String value = property.value().trim();
            Optional<String> cnParameter = property.getParameter("CN")
                .map(String::trim)
                .filter(StringUtils::isNotEmpty);

            Matcher matcher = CN_MAILTO_PATTERN.matcher(value);
            if (matcher.find()) {
                return new CalendarAddress(Optional.of(matcher.group(1).trim()).filter(StringUtils::isNotEmpty).or(() -> cnParameter),
                    matcher.group(2).trim());
            }
            return new CalendarAddress(cnParameter, Strings.CI.removeStart(value, MAILTO).trim());
        }
    }

    static class EventDecoder {
        private final IcsComponent vevent;
        private final String summary;
        private final List<String> warnings = new ArrayList<>();

        EventDecoder(IcsComponent vevent) {
            this.vevent = vevent;
            this.summary = vevent.getPropertyValue("SUMMARY")
                .map(IcsText::unescape)
                .orElse(CalendarEvent.UNTITLED);
        }

        CalendarEvent decode() {
            CalendarEvent.Builder builder = CalendarEvent.builder()
                .title(summary);
            decodeSpan(builder);
            decodeTimestamps(builder);
            decodeDescriptive(builder);
            decodeRecurrence(builder);
            decodeExtensions(builder);
            decodeOrganizer().ifPresent(builder::organizer);
            builder.attendees(decodeAttendees());
            builder.alarms(decodeAlarms());
            return builder.build();
        }

        private void decodeSpan(CalendarEvent.Builder builder) {
            Optional<IcsProperty> dtStart = vevent.getProperty("DTSTART");
            Optional<Instant> start = dtStart.flatMap(this::parseDateTime);
            Optional<Instant> end = vevent.getProperty("DTEND")
                .flatMap(this::parseDateTime)
                .or(() -> start.flatMap(this::endFromDuration));

            if (start.isEmpty() || end.isEmpty()) {
                throw new InvalidEventException("Event \"" + summary + "\" is missing start or end date, skipping.");
            }
            builder.startDate(start.get())
                .endDate(end.get())
                .allDay(dtStart.map(EventDecoder::isDateValue).orElse(false));
        }

        private Optional<Instant> endFromDuration(Instant start) {
            return vevent.getPropertyValue("DURATION")
                .flatMap(IcsDurationCodec::parseExactDuration)
                .map(amount -> start.atZone(ZoneOffset.UTC).plus(amount).toInstant());
        }

        private void decodeTimestamps(CalendarEvent.Builder builder) {
            vevent.getPropertyValue("UID").map(IcsText::unescape).ifPresent(builder::uid);
            vevent.getProperty("DTSTAMP").flatMap(this::parseDateTime).ifPresent(builder::dtstamp);
            vevent.getProperty("CREATED").flatMap(this::parseDateTime).ifPresent(builder::created);
            vevent.getProperty("LAST-MODIFIED").flatMap(this::parseDateTime).ifPresent(builder::lastModified);
            vevent.getPropertyValue("RECURRENCE-ID").map(String::trim).ifPresent(builder::recurrenceId);
            vevent.getPropertyValue("RELATED-TO").map(IcsText::unescape).ifPresent(builder::relatedTo);
        }

        private void decodeDescriptive(CalendarEvent.Builder builder) {
            text("DESCRIPTION").ifPresent(builder::description);
            text("LOCATION").ifPresent(builder::location);
            text("URL").ifPresent(builder::url);
            text("COMMENT").ifPresent(builder::comment);
            text("CONTACT").ifPresent(builder::contact);

            enumeration("STATUS", EventStatus::fromString).ifPresent(builder::status);
            enumeration("CLASS", EventClass::fromString).ifPresent(builder::classification);
            enumeration("TRANSP", Transparency::fromString).ifPresent(builder::transparency);
            integer(vevent, "PRIORITY").ifPresent(builder::priority);
            integer(vevent, "SEQUENCE").ifPresent(builder::sequence);

            builder.categories(textList("CATEGORIES"));
            builder.resources(textList("RESOURCES"));
        }

        private void decodeRecurrence(CalendarEvent.Builder builder) {
            vevent.getPropertyValue("RRULE").map(String::trim).ifPresent(builder::rrule);
            builder.rdate(dateList("RDATE"));
            builder.exdate(dateList("EXDATE"));
        }

        private void decodeExtensions(CalendarEvent.Builder builder) {
            vevent.getPropertyValue("GEO").flatMap(this::parseGeo).ifPresent(builder::geo);
            vevent.getPropertyValue("COLOR").map(String::trim).ifPresent(builder::color);
        }

        private Optional<Organizer> decodeOrganizer() {
            return vevent.getProperty("ORGANIZER")
                .flatMap(property -> {
                    CalendarAddress address = CalendarAddress.parse(property);
                    if (address.email().isEmpty()) {
                        warn("ORGANIZER without email dropped");
                        return Optional.empty();
                    }
                    return Optional.of(new Organizer(address.name(), address.email()));
                });
        }

        private List<Attendee> decodeAttendees() {
            ImmutableList.Builder<Attendee> attendees = ImmutableList.builder();
            for (IcsProperty property : vevent.getProperties("ATTENDEE")) {
                CalendarAddress address = CalendarAddress.parse(property);
                if (address.email().isEmpty()) {
                    warn("ATTENDEE without email dropped");
                    continue;
                }
                Optional<AttendeeRole> role = property.getParameter("ROLE")
                    .map(value -> {
                        if (AttendeeRole.fromString(value).isEmpty()) {
                            warn("unknown ROLE '" + value + "' read as " + AttendeeRole.DEFAULT.getValue());
                        }
                        return AttendeeRole.fromWireValue(value);
                    });
                Optional<ParticipationStatus> status = property.getParameter("PARTSTAT")
                    .map(value -> {
                        if (ParticipationStatus.fromString(value).isEmpty()) {
                            warn("unknown PARTSTAT '" + value + "' read as " + ParticipationStatus.DEFAULT.getValue());
                        }
                        return ParticipationStatus.fromWireValue(value);
                    });
                boolean rsvp = property.getParameter("RSVP")
                    .map(value -> "TRUE".equalsIgnoreCase(value.trim()))
                    .orElse(false);
                attendees.add(new Attendee(address.name(), address.email(), role, status, rsvp));
            }
            return attendees.build();
        }

        private List<Alarm> decodeAlarms() {
            ImmutableList.Builder<Alarm> alarms = ImmutableList.builder();
            for (IcsComponent valarm : vevent.getComponents(VALARM)) {
                Optional<String> trigger = valarm.getPropertyValue("TRIGGER").map(String::trim);
                Optional<String> action = valarm.getPropertyValue("ACTION").map(String::trim);
                if (trigger.isEmpty() || action.isEmpty()) {
                    warn("VALARM without TRIGGER or ACTION dropped");
                    continue;
                }
                if (AlarmAction.fromString(action.get()).isEmpty()) {
                    warn("unknown alarm ACTION '" + action.get() + "' read as " + AlarmAction.DEFAULT.getValue());
                }
                alarms.add(new Alarm(trigger.get(),
                    AlarmAction.fromWireValue(action.get()),
                    valarm.getPropertyValue("SUMMARY").map(IcsText::unescape),
                    valarm.getPropertyValue("DESCRIPTION").map(IcsText::unescape),
                    valarm.getPropertyValue("DURATION").map(String::trim),
                    integer(valarm, "REPEAT")));
            }
            return alarms.build();
        }

        private Optional<Instant> parseDateTime(IcsProperty property) {
            String value = property.value().trim();
            Optional<Instant> instant = IcsDateCodec.parseInstant(value);
            if (instant.isPresent()) {
                return instant;
            }
            Optional<Instant> floating = IcsDateCodec.parseFloatingDateTime(value);
            if (floating.isPresent()) {
                warn(property.getParameter(TZID_PARAMETER)
                    .map(tzid -> property.name() + " TZID " + tzid + " ignored, read as UTC")
                    .orElse(property.name() + " floating date-time read as UTC"));
                return floating;
            }
            if (StringUtils.isNotEmpty(value)) {
                warn("unparsable " + property.name() + " '" + value + "' ignored");
            }
            return Optional.empty();
        }

        private List<Instant> dateList(String propertyName) {
            ImmutableList.Builder<Instant> instants = ImmutableList.builder();
            for (IcsProperty property : vevent.getProperties(propertyName)) {
                for (String value : StringUtils.split(property.value(), ',')) {
                    IcsProperty single = new IcsProperty(property.name(), property.parameters(), value);
                    parseDateTime(single).ifPresent(instants::add);
                }
            }
            return instants.build();
        }

        private Optional<GeoPosition> parseGeo(String value) {
            String[] parts = value.split(";");
            if (parts.length == 2) {
                try {
                    double latitude = Double.parseDouble(parts[0].trim());
                    double longitude = Double.parseDouble(parts[1].trim());
                    if (Double.isFinite(latitude) && Double.isFinite(longitude)) {
                        return Optional.of(new GeoPosition(latitude, longitude));
                    }
                } catch (NumberFormatException e) {
                    LOGGER.debug("Invalid GEO coordinates '{}'", value);
                }
            }
            warn("unrecognized GEO '" + value + "' ignored");
            return Optional.empty();
        }

        private Optional<String> text(String propertyName) {
            return vevent.getPropertyValue(propertyName).map(IcsText::unescape);
        }

        private List<String> textList(String propertyName) {
            return vevent.getProperties(propertyName).stream()
                .flatMap(property -> IcsText.splitList(property.value()).stream())
                .toList();
        }

        private <T> Optional<T> enumeration(String propertyName, Function<String, Optional<T>> parser) {
            return vevent.getPropertyValue(propertyName)
                .flatMap(value -> {
                    Optional<T> parsed = parser.apply(value);
                    if (parsed.isEmpty()) {
                        warn("unknown " + propertyName + " '" + value.trim() + "' ignored");
                    }
                    return parsed;
                });
        }

        private Optional<Integer> integer(IcsComponent component, String propertyName) {
            return component.getPropertyValue(propertyName)
                .flatMap(value -> {
                    try {
                        return Optional.of(Integer.parseInt(value.trim()));
                    } catch (NumberFormatException e) {
                        warn("unparsable " + propertyName + " '" + value.trim() + "' ignored");
                        return Optional.empty();
                    }
                });
        }

        private static boolean isDateValue(IcsProperty property) {
            return property.getParameter(VALUE_PARAMETER)
                .map(value -> value.equalsIgnoreCase("DATE"))
                .orElse(false)
                || IcsDateCodec.isDateOnly(property.value());
        }

        private void warn(String message) {
            LOGGER.debug("Event \"{}\": {}", summary, message);
            warnings.add("Event \"" + summary + "\": " + message);
        }
    }
}
