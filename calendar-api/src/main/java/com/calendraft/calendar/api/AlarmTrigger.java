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
 * Reminder-oriented view of a VALARM {@code TRIGGER}.
 *
 * <p>Absolute triggers are reported as {@code (AT, 0, MINUTES)}: the actual
 * instant is not carried, callers derive it from the event start.
 */
public record AlarmTrigger(When when, long value, DurationUnit unit) {

    public enum When {
        BEFORE,
        AT,
        AFTER
    }

    public static final AlarmTrigger AT_EVENT_START = new AlarmTrigger(When.AT, 0, DurationUnit.MINUTES);

    public static AlarmTrigger before(long value, DurationUnit unit) {
        return new AlarmTrigger(When.BEFORE, value, unit);
    }

    public static AlarmTrigger after(long value, DurationUnit unit) {
        return new AlarmTrigger(When.AFTER, value, unit);
    }

    public AlarmTrigger {
        Preconditions.checkNotNull(when, "'when' must not be null");
        Preconditions.checkNotNull(unit, "'unit' must not be null");
        Preconditions.checkArgument(value >= 0, "'value' must not be negative");
        Preconditions.checkArgument(unit != DurationUnit.SECONDS, "Alarm triggers are expressed in days, hours or minutes");
    }
}
