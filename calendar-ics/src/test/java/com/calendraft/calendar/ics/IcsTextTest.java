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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class IcsTextTest {

    @Test
    void escapeShouldEscapeSpecialCharactersAndDropCarriageReturns() {
        assertThat(IcsText.escape("a\\b;c,d\ne\r\nf"))
            .isEqualTo("a\\\\b\\;c\\,d\\ne\\nf");
    }

    @Test
    void escapeShouldNotDoubleEscapeBackslashesItIntroduces() {
        assertThat(IcsText.escape(";")).isEqualTo("\\;");
    }

    @Test
    void unescapeShouldAcceptUpperCaseNewline() {
        assertThat(IcsText.unescape("Line1\\nLine2\\NLine3"))
            .isEqualTo("Line1\nLine2\nLine3");
    }

    @Test
    void unescapeShouldReadEscapedBackslashBeforeLetterN() {
        assertThat(IcsText.unescape("C:\\\\new")).isEqualTo("C:\\new");
    }

    @Test
    void unescapeShouldKeepUnknownEscapesAndTrailingBackslash() {
        assertThat(IcsText.unescape("a\\xb")).isEqualTo("a\\xb");
        assertThat(IcsText.unescape("abc\\")).isEqualTo("abc\\");
    }

    @ParameterizedTest
    @ValueSource(strings = {"plain", "semi;colon", "comma,here", "back\\slash", "multi\nline", "\\n is not a newline", "mixed \\;,\n end", ""})
    void unescapeShouldInvertEscape(String text) {
        assertThat(IcsText.unescape(IcsText.escape(text))).isEqualTo(text);
    }

    @Test
    void splitListShouldSplitOnUnescapedCommasOnly() {
        assertThat(IcsText.splitList("Work,Team\\, Core, ,Personal"))
            .containsExactly("Work", "Team, Core", "Personal");
    }

    @Test
    void splitListShouldReturnEmptyForBlankValue() {
        assertThat(IcsText.splitList("")).isEmpty();
        assertThat(IcsText.splitList(null)).isEmpty();
    }
}
