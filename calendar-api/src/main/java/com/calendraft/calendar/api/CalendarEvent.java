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

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

/**
 * One VEVENT. Nullable components are absent properties; collections are
 * empty rather than null.
 */
public record CalendarEvent(String uid,
                            String title,
                            Instant startDate,
                            Instant endDate,
                            boolean allDay,
                            String description,
                            String location,
                            EventStatus status,
                            Integer priority,
                            ImmutableSet<String> categories,
                            String url,
                            EventClass classification,
                            String comment,
                            String contact,
                            ImmutableSet<String> resources,
                            Integer sequence,
                            Transparency transparency,
                            String rrule,
                            ImmutableList<Instant> rdate,
                            ImmutableList<Instant> exdate,
                            GeoPosition geo,
                            String color,
                            Organizer organizer,
                            ImmutableList<Attendee> attendees,
                            ImmutableList<Alarm> alarms,
                            Instant dtstamp,
                            Instant created,
                            Instant lastModified,
                            String recurrenceId,
                            String relatedTo) {

    public static final String UNTITLED = "Untitled Event";

    public CalendarEvent {
        Preconditions.checkNotNull(title, "'title' must not be null");
        Preconditions.checkNotNull(startDate, "'startDate' must not be null");
        Preconditions.checkNotNull(endDate, "'endDate' must not be null");
        categories = ImmutableSet.copyOf(categories);
        resources = ImmutableSet.copyOf(resources);
        rdate = ImmutableList.copyOf(rdate);
        exdate = ImmutableList.copyOf(exdate);
        attendees = ImmutableList.copyOf(attendees);
        alarms = ImmutableList.copyOf(alarms);
    }

    public Optional<Double> geoLatitude() {
        return Optional.ofNullable(geo).map(GeoPosition::latitude);
    }

    public Optional<Double> geoLongitude() {
        return Optional.ofNullable(geo).map(GeoPosition::longitude);
    }

    public boolean isRecurring() {
        return rrule != null || !rdate.isEmpty();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String uid;
        private String title = "";
        private Instant startDate;
        private Instant endDate;
        private boolean allDay = false;
        private String description;
        private String location;
        private EventStatus status;
        private Integer priority;
        private final Set<String> categories = new LinkedHashSet<>();
        private String url;
        private EventClass classification;
        private String comment;
        private String contact;
        private final Set<String> resources = new LinkedHashSet<>();
        private Integer sequence;
        private Transparency transparency;
        private String rrule;
        private final List<Instant> rdate = new ArrayList<>();
        private final List<Instant> exdate = new ArrayList<>();
        private GeoPosition geo;
        private String color;
        private Organizer organizer;
        private final List<Attendee> attendees = new ArrayList<>();
        private final List<Alarm> alarms = new ArrayList<>();
        private Instant dtstamp;
        private Instant created;
        private Instant lastModified;
        private String recurrenceId;
        private String relatedTo;

        public Builder uid(String uid) {
            this.uid = uid;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder startDate(Instant startDate) {
            this.startDate = startDate;
            return this;
        }

        public Builder endDate(Instant endDate) {
            this.endDate = endDate;
            return this;
        }

        public Builder allDay(boolean allDay) {
            this.allDay = allDay;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder location(String location) {
            this.location = location;
            return this;
        }

        public Builder status(EventStatus status) {
            this.status = status;
            return this;
        }

        public Builder priority(Integer priority) {
            this.priority = priority;
            return this;
        }

        public Builder categories(Collection<String> categories) {
            this.categories.addAll(categories);
            return this;
        }

        public Builder addCategory(String category) {
            this.categories.add(category);
            return this;
        }

        public Builder url(String url) {
            this.url = url;
            return this;
        }

        public Builder classification(EventClass classification) {
            this.classification = classification;
            return this;
        }

        public Builder comment(String comment) {
            this.comment = comment;
            return this;
        }

        public Builder contact(String contact) {
            this.contact = contact;
            return this;
        }

        public Builder resources(Collection<String> resources) {
            this.resources.addAll(resources);
            return this;
        }

        public Builder addResource(String resource) {
            this.resources.add(resource);
            return this;
        }

        public Builder sequence(Integer sequence) {
            this.sequence = sequence;
            return this;
        }

        public Builder transparency(Transparency transparency) {
            this.transparency = transparency;
            return this;
        }

        public Builder rrule(String rrule) {
            this.rrule = rrule;
            return this;
        }

        public Builder rdate(Collection<Instant> rdate) {
            this.rdate.addAll(rdate);
            return this;
        }

        public Builder addRdate(Instant rdate) {
            this.rdate.add(rdate);
            return this;
        }

        public Builder exdate(Collection<Instant> exdate) {
            this.exdate.addAll(exdate);
            return this;
        }

        public Builder addExdate(Instant exdate) {
            this.exdate.add(exdate);
            return this;
        }

        public Builder geo(GeoPosition geo) {
            this.geo = geo;
            return this;
        }

        public Builder geo(double latitude, double longitude) {
            return geo(new GeoPosition(latitude, longitude));
        }

        public Builder color(String color) {
            this.color = color;
            return this;
        }

        public Builder organizer(Organizer organizer) {
            this.organizer = organizer;
            return this;
        }

        public Builder attendees(Collection<Attendee> attendees) {
            this.attendees.addAll(attendees);
            return this;
        }

        public Builder addAttendee(Attendee attendee) {
            this.attendees.add(attendee);
            return this;
        }

        public Builder alarms(Collection<Alarm> alarms) {
            this.alarms.addAll(alarms);
            return this;
        }

        public Builder addAlarm(Alarm alarm) {
            this.alarms.add(alarm);
            return this;
        }

        public Builder dtstamp(Instant dtstamp) {
            this.dtstamp = dtstamp;
            return this;
        }

        public Builder created(Instant created) {
            this.created = created;
            return this;
        }

        public Builder lastModified(Instant lastModified) {
            this.lastModified = lastModified;
            return this;
        }

        public Builder recurrenceId(String recurrenceId) {
            this.recurrenceId = recurrenceId;
            return this;
        }

        public Builder relatedTo(String relatedTo) {
            this.relatedTo = relatedTo;
            return this;
        }

        public CalendarEvent build() {
            return new CalendarEvent(
                uid,
                title,
                startDate,
                endDate,
                allDay,
                description,
                location,
                status,
                priority,
                ImmutableSet.copyOf(categories),
                url,
                classification,
                comment,
                contact,
                ImmutableSet.copyOf(resources),
                sequence,
                transparency,
                rrule,
                ImmutableList.copyOf(rdate),
                ImmutableList.copyOf(exdate),
                geo,
                color,
                organizer,
                ImmutableList.copyOf(attendees),
                ImmutableList.copyOf(alarms),
                dtstamp,
                created,
                lastModified,
                recurrenceId,
                relatedTo);
        }
    }
}
