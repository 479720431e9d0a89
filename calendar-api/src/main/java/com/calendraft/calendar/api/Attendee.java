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

import java.util.Optional;

import com.google.common.base.Preconditions;

public record Attendee(Optional<String> name,
                       String email,
                       Optional<AttendeeRole> role,
                       Optional<ParticipationStatus> status,
                       boolean rsvp) {

    public static Attendee of(String email) {
        return new Attendee(Optional.empty(), email, Optional.empty(), Optional.empty(), false);
    }

    public Attendee {
        Preconditions.checkNotNull(name, "'name' must not be null");
        Preconditions.checkArgument(email != null && !email.isBlank(), "'email' must not be blank");
        Preconditions.checkNotNull(role, "'role' must not be null");
        Preconditions.checkNotNull(status, "'status' must not be null");
    }

    public Attendee withName(String name) {
        return new Attendee(Optional.ofNullable(name), email, role, status, rsvp);
    }

    public Attendee withRole(AttendeeRole role) {
        return new Attendee(name, email, Optional.ofNullable(role), status, rsvp);
    }

    public Attendee withStatus(ParticipationStatus status) {
        return new Attendee(name, email, role, Optional.ofNullable(status), rsvp);
    }

    public Attendee withRsvp(boolean rsvp) {
        return new Attendee(name, email, role, status, rsvp);
    }
}
