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
import static com.calendraft.calendar.ics.IcsComponent.VCALENDAR;
import static com.calendraft.calendar.ics.IcsComponent.VEVENT;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.apache.commons.lang3.StringUtils;

import com.calendraft.calendar.api.Alarm;
import com.calendraft.calendar.api.Attendee;
import com.calendraft.calendar.api.CalendarEvent;
import com.calendraft.calendar.api.Organizer;
import com.calendraft.calendar.api.StoredEvent;
import com.google.common.collect.ImmutableList;

import jakarta.inject.Inject;

/**
 * Writes events as an ICS document.
 *
 * <p>Total: every event is written, nothing is validated. Properties come in a
 * fixed order (identity and timestamps, descriptive metadata, recurrence,
 * extensions, organizer, attendees, alarms), optional ones only when set.
 */
public class IcsEventGenerator {
    private static final List<String> DATE_VALUE = ImmutableList.of("VALUE=DATE");
    private static final List<String> DATE_TIME_VALUE = ImmutableList.of("VALUE=DATE-TIME");

    private final IcsCodecConfiguration configuration;
    private final Clock clock;

    @Inject
    public IcsEventGenerator(IcsCodecConfiguration configuration, Clock clock) {
        this.configuration = configuration;
        this.clock = clock;
    }

    public String generate(String calendarName, List<StoredEvent> events) {
        ContentLines lines = ContentLines.create()
            .begin(VCALENDAR)
            .add("VERSION", "2.0")
            .add("PRODID", configuration.prodId())
            .add("CALSCALE", "GREGORIAN")
            .add("METHOD", "PUBLISH")
            .add("X-WR-CALNAME", IcsText.escape(StringUtils.defaultString(calendarName)));
        events.forEach(event -> writeEvent(event, lines));
        return lines.end(VCALENDAR)
            .serialize();
    }

    /**
     * Writes events that were never stored: each gets a random id and the current time as fallback timestamps.
     */
    public String generateEvents(String calendarName, List<CalendarEvent> events) {
        Instant now = clock.instant();
        return generate(calendarName, events.stream()
            .map(event -> new StoredEvent(UUID.randomUUID().toString(), event, now, now))
            .toList());
    }

    private void writeEvent(StoredEvent storedEvent, ContentLines lines) {
        CalendarEvent event = storedEvent.event();
        lines.begin(VEVENT);
        writeIdentity(storedEvent, lines);
        writeMetadata(event, lines);
        writeRecurrence(event, lines);
        writeExtensions(event, lines);
        Optional.ofNullable(event.organizer()).ifPresent(organizer -> writeOrganizer(organizer, lines));
        event.attendees().forEach(attendee -> writeAttendee(attendee, lines));
        event.alarms().forEach(alarm -> writeAlarm(alarm, lines));
        lines.end(VEVENT);
    }

    private void writeIdentity(StoredEvent storedEvent, ContentLines lines) {
        CalendarEvent event = storedEvent.event();
        String uid = StringUtils.isNotBlank(event.uid()) ? event.uid() : storedEvent.id() + "@" + configuration.uidDomain();
        lines.add("UID", IcsText.escape(uid))
            .add("DTSTAMP", IcsDateCodec.formatInstant(Optional.ofNullable(event.dtstamp()).orElse(storedEvent.createdAt())));
        if (event.allDay()) {
            lines.add("DTSTART", DATE_VALUE, IcsDateCodec.formatDateOnly(event.startDate()))
                .add("DTEND", DATE_VALUE, IcsDateCodec.formatDateOnly(event.endDate()));
        } else {
            lines.add("DTSTART", IcsDateCodec.formatInstant(event.startDate()))
                .add("DTEND", IcsDateCodec.formatInstant(event.endDate()));
        }
        lines.addIfPresent("SUMMARY", IcsText.escape(event.title()))
            .addIfPresent("DESCRIPTION", IcsText.escape(event.description()))
            .addIfPresent("LOCATION", IcsText.escape(event.location()))
            .add("CREATED", IcsDateCodec.formatInstant(Optional.ofNullable(event.created()).orElse(storedEvent.createdAt())))
            .add("LAST-MODIFIED", IcsDateCodec.formatInstant(Optional.ofNullable(event.lastModified()).orElse(storedEvent.updatedAt())));
    }

    private void writeMetadata(CalendarEvent event, ContentLines lines) {
        Optional.ofNullable(event.status()).ifPresent(status -> lines.add("STATUS", status.getValue()));
        Optional.ofNullable(event.priority()).ifPresent(priority -> lines.add("PRIORITY", String.valueOf(priority)));
        lines.addIfPresent("CATEGORIES", textList(event.categories()))
            .addIfPresent("URL", IcsText.escape(event.url()));
        Optional.ofNullable(event.classification()).ifPresent(classification -> lines.add("CLASS", classification.getValue()));
        lines.addIfPresent("COMMENT", IcsText.escape(event.comment()))
            .addIfPresent("CONTACT", IcsText.escape(event.contact()))
            .addIfPresent("RESOURCES", textList(event.resources()));
        Optional.ofNullable(event.sequence()).ifPresent(sequence -> lines.add("SEQUENCE", String.valueOf(sequence)));
        Optional.ofNullable(event.transparency()).ifPresent(transparency -> lines.add("TRANSP", transparency.getValue()));
    }

    private void writeRecurrence(CalendarEvent event, ContentLines lines) {
        lines.addIfPresent("RRULE", event.rrule());
        writeDateList("RDATE", event.rdate(), event.allDay(), lines);
        writeDateList("EXDATE", event.exdate(), event.allDay(), lines);
    }

    private void writeDateList(String name, List<Instant> instants, boolean allDay, ContentLines lines) {
        if (instants.isEmpty()) {
            return;
        }
        if (allDay) {
            lines.add(name, DATE_VALUE, dateList(instants, IcsDateCodec::formatDateOnly));
        } else {
            lines.add(name, dateList(instants, IcsDateCodec::formatInstant));
        }
    }

    private void writeExtensions(CalendarEvent event, ContentLines lines) {
        Optional.ofNullable(event.geo())
            .ifPresent(geo -> lines.add("GEO", formatFloat(geo.latitude()) + ";" + formatFloat(geo.longitude())));
        lines.addIfPresent("RECURRENCE-ID", event.recurrenceId())
            .addIfPresent("RELATED-TO", IcsText.escape(event.relatedTo()))
            .addIfPresent("COLOR", event.color());
    }

    private void writeOrganizer(Organizer organizer, ContentLines lines) {
        List<String> parameters = organizer.name()
            .map(name -> ImmutableList.of(ContentLines.parameter("CN", name)))
            .orElse(ImmutableList.of());
        lines.add("ORGANIZER", parameters, "mailto:" + organizer.email());
    }

    private void writeAttendee(Attendee attendee, ContentLines lines) {
        ImmutableList.Builder<String> parameters = ImmutableList.builder();
        attendee.name().ifPresent(name -> parameters.add(ContentLines.parameter("CN", name)));
        attendee.role().ifPresent(role -> parameters.add("ROLE=" + role.getValue()));
        attendee.status().ifPresent(status -> parameters.add("PARTSTAT=" + status.getValue()));
        if (attendee.rsvp()) {
            parameters.add("RSVP=TRUE");
        }
        lines.add("ATTENDEE", parameters.build(), "mailto:" + attendee.email());
    }

    private void writeAlarm(Alarm alarm, ContentLines lines) {
        lines.begin(VALARM);
        if (AlarmTriggerCodec.isAbsoluteTrigger(alarm.trigger())) {
            lines.add("TRIGGER", DATE_TIME_VALUE, alarm.trigger());
        } else {
            lines.add("TRIGGER", alarm.trigger());
        }
        lines.add("ACTION", alarm.action().getValue());
        alarm.summary().ifPresent(summary -> lines.addIfPresent("SUMMARY", IcsText.escape(summary)));
        alarm.description().ifPresent(description -> lines.addIfPresent("DESCRIPTION", IcsText.escape(description)));
        alarm.duration().ifPresent(duration -> lines.addIfPresent("DURATION", duration));
        alarm.repeat().ifPresent(repeat -> lines.add("REPEAT", String.valueOf(repeat)));
        lines.end(VALARM);
    }

    private static String textList(Collection<String> values) {
        return values.stream()
            .map(IcsText::escape)
            .collect(Collectors.joining(","));
    }

    private static String dateList(List<Instant> instants, Function<Instant, String> formatter) {
        return instants.stream()
            .map(formatter)
            .collect(Collectors.joining(","));
    }

    private static String formatFloat(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
