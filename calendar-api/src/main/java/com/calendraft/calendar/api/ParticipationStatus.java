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
import java.util.Optional;

import org.apache.commons.lang3.StringUtils;

/**
 * Attendee participation status for a VEVENT ({@code PARTSTAT} parameter).
 */
public enum ParticipationStatus {
    NEEDS_ACTION("NEEDS-ACTION"),
    ACCEPTED("ACCEPTED"),
    DECLINED("DECLINED"),
    TENTATIVE("TENTATIVE"),
    DELEGATED("DELEGATED");

    public static final ParticipationStatus DEFAULT = NEEDS_ACTION;

    public static Optional<ParticipationStatus> fromString(String value) {
        return Arrays.stream(values())
            .filter(status -> status.value.equalsIgnoreCase(StringUtils.trim(value)))
            .findFirst();
    }

    /**
     * Unrecognized statuses fall back to {@code NEEDS-ACTION}, the RFC 5545 default.
     */
    public static ParticipationStatus fromWireValue(String value) {
        return fromString(value).orElse(DEFAULT);
    }

    private final String value;

    ParticipationStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
