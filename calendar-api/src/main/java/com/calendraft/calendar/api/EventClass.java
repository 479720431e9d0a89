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

import org.apache.commons.lang3.StringUtils;

/**
 * Access classification of an event ({@code CLASS} property).
 */
public enum EventClass {
    PUBLIC,
    PRIVATE,
    CONFIDENTIAL;

    public static Optional<EventClass> fromString(String value) {
        return Arrays.stream(values())
            .filter(clazz -> clazz.name().equalsIgnoreCase(StringUtils.trim(value)))
            .findFirst();
    }

    public String getValue() {
        return name().toUpperCase(Locale.US);
    }
}
