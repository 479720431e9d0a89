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

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import org.apache.commons.lang3.StringUtils;

public enum AlarmAction {
    DISPLAY,
    EMAIL,
    AUDIO;

    public static final AlarmAction DEFAULT = DISPLAY;
    public static final Set<String> SUPPORTED_VALUES = Arrays.stream(AlarmAction.values()).map(AlarmAction::getValue).collect(Collectors.toSet());

    public static Optional<AlarmAction> fromString(String value) {
        return Arrays.stream(values())
            .filter(action -> action.name().equalsIgnoreCase(StringUtils.trim(value)))
            .findFirst();
    }

    /**
     * Lenient variant used when decoding a VALARM: x-name and unknown actions
     * are read as {@link #DISPLAY}.
     */
    public static AlarmAction fromWireValue(String value) {
        return fromString(value).orElse(DEFAULT);
    }

    public String getValue() {
        return name().toUpperCase(Locale.US);
    }
}
