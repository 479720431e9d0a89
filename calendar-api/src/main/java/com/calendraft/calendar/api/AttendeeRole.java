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
 * Participation role of an attendee ({@code ROLE} parameter, RFC 5545 3.2.16).
 */
public enum AttendeeRole {
    CHAIR("CHAIR"),
    REQ_PARTICIPANT("REQ-PARTICIPANT"),
    OPT_PARTICIPANT("OPT-PARTICIPANT"),
    NON_PARTICIPANT("NON-PARTICIPANT");

    public static final AttendeeRole DEFAULT = REQ_PARTICIPANT;

    public static Optional<AttendeeRole> fromString(String value) {
        return Arrays.stream(values())
            .filter(role -> role.value.equalsIgnoreCase(StringUtils.trim(value)))
            .findFirst();
    }

    /**
     * Unrecognized roles fall back to {@code REQ-PARTICIPANT}, the RFC 5545 default.
     */
    public static AttendeeRole fromWireValue(String value) {
        return fromString(value).orElse(DEFAULT);
    }

    private final String value;

    AttendeeRole(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
