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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.apache.commons.configuration2.PropertiesConfiguration;
import org.junit.jupiter.api.Test;

class IcsCodecConfigurationTest {

    @Test
    void parseShouldReturnDefaultWhenNothingIsConfigured() {
        assertThat(IcsCodecConfiguration.parse(new PropertiesConfiguration()))
            .isEqualTo(IcsCodecConfiguration.DEFAULT);
    }

    @Test
    void parseShouldReadConfiguredValues() {
        PropertiesConfiguration configuration = new PropertiesConfiguration();
        configuration.addProperty("ics.prodId", "-//Acme//Planner//EN");
        configuration.addProperty("ics.uid.domain", "acme.org");

        assertThat(IcsCodecConfiguration.parse(configuration))
            .isEqualTo(new IcsCodecConfiguration("-//Acme//Planner//EN", "acme.org"));
    }

    @Test
    void parseShouldFallBackWhenValuesAreBlank() {
        PropertiesConfiguration configuration = new PropertiesConfiguration();
        configuration.addProperty("ics.prodId", " ");

        assertThat(IcsCodecConfiguration.parse(configuration).prodId())
            .isEqualTo(IcsCodecConfiguration.DEFAULT_PROD_ID);
    }

    @Test
    void uidDomainShouldNotContainAtSign() {
        assertThatThrownBy(() -> new IcsCodecConfiguration(IcsCodecConfiguration.DEFAULT_PROD_ID, "@acme.org"))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
