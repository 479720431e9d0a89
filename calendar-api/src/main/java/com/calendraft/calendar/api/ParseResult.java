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
import com.google.common.collect.ImmutableList;

/**
 * Outcome of decoding an ICS document.
 *
 * <p>{@code errors} lists the structural failures and the skipped events, in
 * order of discovery. {@code warnings} lists values that were dropped or
 * reinterpreted while the enclosing event was kept.
 */
public record ParseResult(ImmutableList<CalendarEvent> events,
                          ImmutableList<String> errors,
                          ImmutableList<String> warnings,
                          Optional<String> calendarName) {

    public static ParseResult failure(String error) {
        return new ParseResult(ImmutableList.of(), ImmutableList.of(error), ImmutableList.of(), Optional.empty());
    }

    public ParseResult {
        Preconditions.checkNotNull(events, "'events' must not be null");
        Preconditions.checkNotNull(errors, "'errors' must not be null");
        Preconditions.checkNotNull(warnings, "'warnings' must not be null");
        Preconditions.checkNotNull(calendarName, "'calendarName' must not be null");
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
