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

import com.google.common.base.Preconditions;

/**
 * An event as handed over by the storage layer for export: the storage
 * identifier and timestamps provide the fallbacks for {@code UID},
 * {@code DTSTAMP}, {@code CREATED} and {@code LAST-MODIFIED}.
 */
public record StoredEvent(String id, CalendarEvent event, Instant createdAt, Instant updatedAt) {

    public StoredEvent {
        Preconditions.checkArgument(id != null && !id.isBlank(), "'id' must not be blank");
        Preconditions.checkNotNull(event, "'event' must not be null");
        Preconditions.checkNotNull(createdAt, "'createdAt' must not be null");
        Preconditions.checkNotNull(updatedAt, "'updatedAt' must not be null");
    }
}
