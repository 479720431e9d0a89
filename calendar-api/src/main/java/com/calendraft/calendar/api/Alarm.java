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

/**
 * A VALARM block. {@code trigger} is kept in its wire form: either a relative
 * duration such as {@code -PT15M} or an absolute {@code 20241225T090000Z}.
 */
public record Alarm(String trigger,
                    AlarmAction action,
                    Optional<String> summary,
                    Optional<String> description,
                    Optional<String> duration,
                    Optional<Integer> repeat) {

    public static Alarm of(String trigger, AlarmAction action) {
        return new Alarm(trigger, action, Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty());
    }

    public Alarm {
        Preconditions.checkArgument(trigger != null && !trigger.isBlank(), "'trigger' must not be blank");
        Preconditions.checkNotNull(action, "'action' must not be null");
        Preconditions.checkNotNull(summary, "'summary' must not be null");
        Preconditions.checkNotNull(description, "'description' must not be null");
        Preconditions.checkNotNull(duration, "'duration' must not be null");
        Preconditions.checkNotNull(repeat, "'repeat' must not be null");
    }

    public Alarm withSummary(String summary) {
        return new Alarm(trigger, action, Optional.ofNullable(summary), description, duration, repeat);
    }

    public Alarm withDescription(String description) {
        return new Alarm(trigger, action, summary, Optional.ofNullable(description), duration, repeat);
    }

    public Alarm withRepetition(String duration, Integer repeat) {
        return new Alarm(trigger, action, summary, description, Optional.ofNullable(duration), Optional.ofNullable(repeat));
    }
}
