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

import java.util.Optional;

import org.apache.commons.configuration2.Configuration;
import org.apache.commons.lang3.StringUtils;

import com.google.common.base.Preconditions;

public record IcsCodecConfiguration(String prodId, String uidDomain) {
    public static final String PROD_ID = "ics.prodId";
    public static final String UID_DOMAIN = "ics.uid.domain";
    public static final String DEFAULT_PROD_ID = "-//Calendraft//Calendraft//EN";
    public static final String DEFAULT_UID_DOMAIN = "calendraft";
    public static final IcsCodecConfiguration DEFAULT = new IcsCodecConfiguration(DEFAULT_PROD_ID, DEFAULT_UID_DOMAIN);

    public static IcsCodecConfiguration parse(Configuration configuration) {
        return new IcsCodecConfiguration(
            Optional.ofNullable(configuration.getString(PROD_ID))
                .filter(StringUtils::isNotBlank)
                .map(String::trim)
                .orElse(DEFAULT_PROD_ID),
            Optional.ofNullable(configuration.getString(UID_DOMAIN))
                .filter(StringUtils::isNotBlank)
                .map(String::trim)
                .orElse(DEFAULT_UID_DOMAIN));
    }

    public IcsCodecConfiguration {
        Preconditions.checkArgument(StringUtils.isNotBlank(prodId), "'%s' must not be blank", PROD_ID);
        Preconditions.checkArgument(StringUtils.isNotBlank(uidDomain), "'%s' must not be blank", UID_DOMAIN);
        Preconditions.checkArgument(!uidDomain.contains("@"), "'%s' must not contain '@'", UID_DOMAIN);
    }
}
