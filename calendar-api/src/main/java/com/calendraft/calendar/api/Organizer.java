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

public record Organizer(Optional<String> name, String email) {

    public static Organizer of(String email) {
        return new Organizer(Optional.empty(), email);
    }

    public static Organizer of(String name, String email) {
        return new Organizer(Optional.ofNullable(name), email);
    }

    public Organizer {
        Preconditions.checkNotNull(name, "'name' must not be null");
        Preconditions.checkArgument(email != null && !email.isBlank(), "'email' must not be blank");
    }
}
