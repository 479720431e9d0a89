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

import java.io.FileNotFoundException;
import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.calendraft.calendar.api.CalendarEvent;
import com.google.inject.Guice;
import com.google.inject.Injector;

class IcsCodecModuleTest {

    @Test
    void moduleShouldLoadConfigurationFromClasspath() {
        Injector injector = Guice.createInjector(new IcsCodecModule());

        assertThat(injector.getInstance(IcsCodecConfiguration.class))
            .isEqualTo(new IcsCodecConfiguration("-//Calendraft//Test//EN", "test.calendraft"));
    }

    @Test
    void moduleShouldProvideSingletons() {
        Injector injector = Guice.createInjector(new IcsCodecModule());

        assertThat(injector.getInstance(IcsEventParser.class)).isSameAs(injector.getInstance(IcsEventParser.class));
        assertThat(injector.getInstance(IcsEventGenerator.class)).isSameAs(injector.getInstance(IcsEventGenerator.class));
    }

    @Test
    void injectedGeneratorShouldUseConfiguredProductIdentifier() {
        IcsEventGenerator generator = Guice.createInjector(new IcsCodecModule()).getInstance(IcsEventGenerator.class);

        String ics = generator.generateEvents("Injected", List.of(CalendarEvent.builder()
            .title("Check")
            .startDate(Instant.parse("2024-01-15T10:00:00Z"))
            .endDate(Instant.parse("2024-01-15T11:00:00Z"))
            .build()));

        assertThat(ics)
            .contains("PRODID:-//Calendraft//Test//EN\r\n")
            .containsPattern("UID:[0-9a-f-]{36}@test\\.calendraft\r\n");
    }

    @Test
    void loadConfigurationShouldFailWhenResourceIsMissing() {
        assertThatThrownBy(() -> IcsCodecModule.loadConfiguration("missing-ics-codec.properties"))
            .isInstanceOf(FileNotFoundException.class);
    }
}
