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

import com.google.common.base.Preconditions;

/**
 * A duration reduced to a single unit, e.g. {@code PT15M} is {@code (15, MINUTES)}.
 */
public record ParsedDuration(long value, DurationUnit unit) {

    public static ParsedDuration of(long value, DurationUnit unit) {
        return new ParsedDuration(value, unit);
    }

    public ParsedDuration {
        Preconditions.checkArgument(value >= 0, "'value' must not be negative");
        Preconditions.checkNotNull(unit, "'unit' must not be null");
    }
}
