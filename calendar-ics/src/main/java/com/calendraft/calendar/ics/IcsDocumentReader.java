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

import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import net.fortuna.ical4j.data.CalendarParserFactory;
import net.fortuna.ical4j.data.ContentHandler;
import net.fortuna.ical4j.data.ParserException;
import net.fortuna.ical4j.data.UnfoldingReader;
import net.fortuna.ical4j.util.CompatibilityHints;

/**
 * Tokenizes an ICS document into a tree of {@link IcsComponent}s.
 *
 * <p>ical4j handles unfolding and the content-line grammar. Values are kept as
 * raw strings so that non-conformant dates survive until the event decoder
 * decides what to do with them.
 */
public class IcsDocumentReader {

    static {
        CompatibilityHints.setHintEnabled(CompatibilityHints.KEY_RELAXED_PARSING, true);
        CompatibilityHints.setHintEnabled(CompatibilityHints.KEY_RELAXED_UNFOLDING, true);
        CompatibilityHints.setHintEnabled(CompatibilityHints.KEY_OUTLOOK_COMPATIBILITY, true);
        CompatibilityHints.setHintEnabled(CompatibilityHints.KEY_NOTES_COMPATIBILITY, true);
    }

    static class ComponentTreeHandler implements ContentHandler {
        private final Deque<IcsComponent.Builder> openComponents = new ArrayDeque<>();
        private final ImmutableList.Builder<IcsComponent> calendars = ImmutableList.builder();
        private IcsProperty.Builder currentProperty;

        @Override
        public void startCalendar() {
            openComponents.push(IcsComponent.builder(IcsComponent.VCALENDAR));
        }

        @Override
        public void endCalendar() {
            Preconditions.checkState(openComponents.size() == 1, "Unbalanced components in calendar");
            calendars.add(openComponents.pop().build());
        }

        @Override
        public void startComponent(String name) {
            openComponents.push(IcsComponent.builder(name));
        }

        @Override
        public void endComponent(String name) {
            Preconditions.checkState(openComponents.size() > 1, "END:%s without matching BEGIN", name);
            IcsComponent component = openComponents.pop().build();
            openComponents.peek().addComponent(component);
        }

        @Override
        public void startProperty(String name) {
            currentProperty = IcsProperty.builder(name);
        }

        @Override
        public void propertyValue(String value) {
            currentProperty.value(value);
        }

        @Override
        public void parameter(String name, String value) {
            currentProperty.parameter(name, value);
        }

        @Override
        public void endProperty(String name) {
            Preconditions.checkState(!openComponents.isEmpty(), "Property %s outside of any component", name);
            openComponents.peek().addProperty(currentProperty.build());
            currentProperty = null;
        }

        List<IcsComponent> calendars() {
            return calendars.build();
        }
    }

    private IcsDocumentReader() {
    }

    /**
     * @return the VCALENDAR blocks of the document, in order
     */
    public static List<IcsComponent> read(String icsContent) throws ParserException, IOException {
        ComponentTreeHandler handler = new ComponentTreeHandler();
        CalendarParserFactory.getInstance().get()
            .parse(new UnfoldingReader(new StringReader(icsContent)), handler);
        return handler.calendars();
    }
}
