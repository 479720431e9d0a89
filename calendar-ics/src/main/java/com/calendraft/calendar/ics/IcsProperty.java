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

import java.util.Locale;
import java.util.Optional;

import org.apache.commons.lang3.StringUtils;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableListMultimap;

/**
 * One content line as tokenized: name and parameter names upper-cased,
 * parameter values unquoted, value raw (still escaped).
 */
public record IcsProperty(String name, ImmutableListMultimap<String, String> parameters, String value) {

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public IcsProperty {
        Preconditions.checkArgument(StringUtils.isNotBlank(name), "'name' must not be blank");
        Preconditions.checkNotNull(parameters, "'parameters' must not be null");
        Preconditions.checkNotNull(value, "'value' must not be null");
    }

    public Optional<String> getParameter(String parameterName) {
        return parameters.get(parameterName.toUpperCase(Locale.US)).stream()
            .findFirst();
    }

    public static class Builder {
        private final String name;
        private final ImmutableListMultimap.Builder<String, String> parameters = ImmutableListMultimap.builder();
        private String value = StringUtils.EMPTY;

        private Builder(String name) {
            this.name = name.toUpperCase(Locale.US);
        }

        public Builder parameter(String name, String value) {
            parameters.put(name.toUpperCase(Locale.US), StringUtils.strip(StringUtils.defaultString(value), "\""));
            return this;
        }

        public Builder value(String value) {
            this.value = StringUtils.defaultString(value);
            return this;
        }

        public IcsProperty build() {
            return new IcsProperty(name, parameters.build(), value);
        }
    }
}
