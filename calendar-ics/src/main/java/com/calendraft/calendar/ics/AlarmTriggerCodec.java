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
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.regex.Pattern;

import org.apache.commons.lang3.StringUtils;

import com.calendraft.calendar.api.AlarmTrigger;
import com.calendraft.calendar.api.DurationUnit;
import com.google.common.base.Preconditions;

public class AlarmTriggerCodec {

    public static final Pattern ABSOLUTE_TRIGGER_PATTERN = Pattern.compile("^\\d{8}T\\d{6}(Z)?$");

    private AlarmTriggerCodec() {
    }

    public static boolean isAbsoluteTrigger(String trigger) {
        return trigger != null && ABSOLUTE_TRIGGER_PATTERN.matcher(trigger.trim()).matches();
    }

    /**
     * Seconds are ignored: a reminder is set in days, hours or minutes.
     */
    public static Optional<AlarmTrigger> parseTrigger(String trigger) {
        if (StringUtils.isBlank(trigger)) {
            return Optional.empty();
        }
        if (isAbsoluteTrigger(trigger)) {
            return Optional.of(AlarmTrigger.AT_EVENT_START);
        }
        return IcsDurationCodec.components(trigger)
            .flatMap(components -> IcsDurationCodec.largestUnit(components.days(), components.hours(), components.minutes(), 0)
                .map(duration -> new AlarmTrigger(components.negative() ? AlarmTrigger.When.BEFORE : AlarmTrigger.When.AFTER,
                    duration.value(), duration.unit())));
    }

    /**
     * @return the relative trigger, or an empty string for {@link AlarmTrigger.When#AT}
     */
    public static String formatTrigger(AlarmTrigger.When when, long value, DurationUnit unit) {
        Preconditions.checkArgument(unit != DurationUnit.SECONDS, "Alarm triggers are expressed in days, hours or minutes");
        Preconditions.checkArgument(value >= 0, "'value' must not be negative");
        if (when == AlarmTrigger.When.AT) {
            return StringUtils.EMPTY;
        }
        String prefix = when == AlarmTrigger.When.BEFORE ? "-" : StringUtils.EMPTY;
        return switch (unit) {
            case DAYS -> prefix + "P" + value + "D";
            case HOURS -> prefix + "PT" + value + "H";
            default -> prefix + "PT" + value + "M";
        };
    }

    public static String formatTrigger(AlarmTrigger trigger) {
        return formatTrigger(trigger.when(), trigger.value(), trigger.unit());
    }

    /**
     * Resolves a wire trigger to the instant the alarm fires. Relative triggers
     * are added to {@code eventStart} with their exact duration; absolute ones
     * stand on their own (a value without {@code Z} is read as UTC).
     */
    public static Optional<Instant> computeAlarmInstant(String trigger, Instant eventStart) {
        if (StringUtils.isBlank(trigger)) {
            return Optional.empty();
        }
        if (isAbsoluteTrigger(trigger)) {
            return IcsDateCodec.parseInstant(trigger)
                .or(() -> IcsDateCodec.parseFloatingDateTime(trigger));
        }
        return IcsDurationCodec.parseExactDuration(trigger)
            .map(amount -> eventStart.atZone(ZoneOffset.UTC).plus(amount).toInstant());
    }
}
