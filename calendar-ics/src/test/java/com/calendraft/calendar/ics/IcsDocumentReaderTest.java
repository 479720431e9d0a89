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

import java.util.List;

import org.junit.jupiter.api.Test;

import net.fortuna.ical4j.data.ParserException;

class IcsDocumentReaderTest {

    @Test
    void readShouldBuildNestedComponentTree() throws Exception {
        String ics = """
            BEGIN:VCALENDAR
            VERSION:2.0
            BEGIN:VEVENT
            UID:event-1
            BEGIN:VALARM
            TRIGGER:-PT15M
            ACTION:DISPLAY
            END:VALARM
            END:VEVENT
            END:VCALENDAR
            """;

        List<IcsComponent> calendars = IcsDocumentReader.read(ics);

        assertThat(calendars).hasSize(1);
        IcsComponent vevent = calendars.get(0).getComponents(IcsComponent.VEVENT).get(0);
        assertThat(vevent.getPropertyValue("UID")).contains("event-1");
        assertThat(vevent.getComponents(IcsComponent.VALARM).get(0).getPropertyValue("TRIGGER"))
            .contains("-PT15M");
    }

    @Test
    void readShouldUpperCaseNamesAndUnquoteParameters() throws Exception {
        String ics = """
            BEGIN:VCALENDAR
            BEGIN:VEVENT
            attendee;cn="Doe, John";partstat=ACCEPTED:mailto:john@example.com
            END:VEVENT
            END:VCALENDAR
            """;

        IcsProperty attendee = IcsDocumentReader.read(ics).get(0)
            .getComponents(IcsComponent.VEVENT).get(0)
            .getProperty("ATTENDEE").get();

        assertThat(attendee.name()).isEqualTo("ATTENDEE");
        assertThat(attendee.getParameter("CN")).contains("Doe, John");
        assertThat(attendee.getParameter("partstat")).contains("ACCEPTED");
        assertThat(attendee.value()).isEqualTo("mailto:john@example.com");
    }

    @Test
    void readShouldKeepValuesRawAndUnfoldLines() throws Exception {
        String ics = """
            BEGIN:VCALENDAR
            BEGIN:VEVENT
            DESCRIPTION:Part one\\, still
              part two
            DTSTART;TZID=Europe/Paris:20240115T100000
            END:VEVENT
            END:VCALENDAR
            """;

        IcsComponent vevent = IcsDocumentReader.read(ics).get(0)
            .getComponents(IcsComponent.VEVENT).get(0);

        assertThat(vevent.getPropertyValue("DESCRIPTION")).contains("Part one\\, still part two");
        assertThat(vevent.getProperty("DTSTART").get().value()).isEqualTo("20240115T100000");
        assertThat(vevent.getProperty("DTSTART").get().getParameter("TZID")).contains("Europe/Paris");
    }

    @Test
    void readShouldFailOnTruncatedDocument() {
        String ics = """
            BEGIN:VCALENDAR
            BEGIN:VEVENT
            DTSTART:20240115T100000Z
            """;

        assertThatThrownBy(() -> IcsDocumentReader.read(ics))
            .isInstanceOf(ParserException.class);
    }
}
