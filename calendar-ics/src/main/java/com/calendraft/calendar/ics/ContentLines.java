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

import java.util.List;
import java.util.regex.Pattern;

import org.apache.commons.lang3.StringUtils;

import com.google.common.base.CharMatcher;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

/**
 * Accumulates content lines of an ICS document. Values are written as given:
 * callers escape TEXT values beforehand. Lines are not folded.
 */
public class ContentLines {
    public static final String CRLF = "\r\n";

    private static final Joiner LINE_JOINER = Joiner.on(CRLF);
    private static final Pattern NEEDS_QUOTING = Pattern.compile("[;:,]");
    private static final CharMatcher LINE_BREAKS = CharMatcher.anyOf("\r\n");
    private static final CharMatcher CONTROL_CHARACTERS = CharMatcher.javaIsoControl().and(CharMatcher.isNot('\t'));

    public static ContentLines create() {
        return new ContentLines();
    }

    /**
     * Double-quotes a parameter value holding {@code ;}, {@code :} or {@code ,}. Double quotes cannot be escaped and are dropped.
     * Line breaks become a single space and other control characters are dropped.
     */
    public static String parameterValue(String value) {
        String singleLine = CONTROL_CHARACTERS.removeFrom(LINE_BREAKS.trimAndCollapseFrom(value, ' '));
        String unquoted = StringUtils.remove(singleLine, '"');
        if (NEEDS_QUOTING.matcher(unquoted).find()) {
            return "\"" + unquoted + "\"";
        }
        return unquoted;
    }

    public static String parameter(String name, String value) {
        return name + "=" + parameterValue(value);
    }

    private final ImmutableList.Builder<String> lines = ImmutableList.builder();

    private ContentLines() {
    }

    public ContentLines begin(String component) {
        return add("BEGIN", component);
    }

    public ContentLines end(String component) {
        return add("END", component);
    }

    public ContentLines add(String name, String value) {
        lines.add(name + ":" + value);
        return this;
    }

    public ContentLines add(String name, List<String> parameters, String value) {
        if (parameters.isEmpty()) {
            return add(name, value);
        }
        lines.add(name + ";" + String.join(";", parameters) + ":" + value);
        return this;
    }

    /**
     * Nothing is written for a null or empty value.
     */
    public ContentLines addIfPresent(String name, String value) {
        if (StringUtils.isNotEmpty(value)) {
            add(name, value);
        }
        return this;
    }

    public String serialize() {
        return LINE_JOINER.join(lines.build());
    }
}
