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

import org.apache.commons.lang3.StringUtils;

import com.google.common.collect.ImmutableList;

/**
 * TEXT value escaping (RFC 5545 3.3.11).
 */
public class IcsText {
    private static final String[] SPECIALS = {"\\", ";", ",", "\n", "\r"};
    private static final String[] ESCAPED = {"\\\\", "\\;", "\\,", "\\n", ""};

    private IcsText() {
    }

    /**
     * Backslash, semicolon, comma and line feed are escaped; carriage returns are dropped.
     */
    public static String escape(String text) {
        return StringUtils.replaceEach(text, SPECIALS, ESCAPED);
    }

    public static String unescape(String text) {
        if (text == null || text.indexOf('\\') < 0) {
            return text;
        }
        StringBuilder result = new StringBuilder(text.length());
        int index = 0;
        while (index < text.length()) {
            char current = text.charAt(index);
            if (current == '\\' && index + 1 < text.length()) {
                char next = text.charAt(index + 1);
                switch (next) {
                    case 'n', 'N' -> {
                        result.append('\n');
                        index += 2;
                    }
                    case '\\', ';', ',' -> {
                        result.append(next);
                        index += 2;
                    }
                    default -> {
                        result.append(current);
                        index++;
                    }
                }
            } else {
                result.append(current);
                index++;
            }
        }
        return result.toString();
    }

    /**
     * Splits a multi-valued TEXT property on unescaped commas, then unescapes,
     * trims and drops blank items.
     */
    public static List<String> splitList(String value) {
        if (StringUtils.isBlank(value)) {
            return ImmutableList.of();
        }
        ImmutableList.Builder<String> items = ImmutableList.builder();
        StringBuilder current = new StringBuilder();
        int index = 0;
        while (index < value.length()) {
            char c = value.charAt(index);
            if (c == '\\' && index + 1 < value.length()) {
                current.append(c).append(value.charAt(index + 1));
                index += 2;
                continue;
            }
            if (c == ',') {
                addItem(items, current.toString());
                current.setLength(0);
            } else {
                current.append(c);
            }
            index++;
        }
        addItem(items, current.toString());
        return items.build();
    }

    private static void addItem(ImmutableList.Builder<String> items, String rawItem) {
        String item = StringUtils.trim(unescape(rawItem));
        if (StringUtils.isNotEmpty(item)) {
            items.add(item);
        }
    }
}
