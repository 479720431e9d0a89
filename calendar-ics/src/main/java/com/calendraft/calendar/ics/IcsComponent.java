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
import java.util.Locale;
import java.util.Optional;

import org.apache.commons.lang3.StringUtils;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * A {@code BEGIN:<name>} ... {@code END:<name>} block with its properties and nested blocks, in document order.
 */
public record IcsComponent(String name, ImmutableList<IcsProperty> properties, ImmutableList<IcsComponent> components) {

    public static final String VCALENDAR = "VCALENDAR";
    public static final String VEVENT = "VEVENT";
    public static final String VALARM = "VALARM";

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public IcsComponent {
        Preconditions.checkArgument(StringUtils.isNotBlank(name), "'name' must not be blank");
        Preconditions.checkNotNull(properties, "'properties' must not be null");
        Preconditions.checkNotNull(components, "'components' must not be null");
    }

    public Optional<IcsProperty> getProperty(String propertyName) {
        return properties.stream()
            .filter(property -> property.name().equalsIgnoreCase(propertyName))
            .findFirst();
    }

    public List<IcsProperty> getProperties(String propertyName) {
        return properties.stream()
            .filter(property -> property.name().equalsIgnoreCase(propertyName))
            .toList();
    }

    /**
     * @return the raw value of the first occurrence, when not blank
     */
    public Optional<String> getPropertyValue(String propertyName) {
        return getProperty(propertyName)
            .map(IcsProperty::value)
            .filter(StringUtils::isNotBlank);
    }

    public List<IcsComponent> getComponents(String componentName) {
        return components.stream()
            .filter(component -> component.name().equalsIgnoreCase(componentName))
            .toList();
    }

    public static class Builder {
        private final String name;
        private final ImmutableList.Builder<IcsProperty> properties = ImmutableList.builder();
        private final ImmutableList.Builder<IcsComponent> components = ImmutableList.builder();

        private Builder(String name) {
            this.name = name.toUpperCase(Locale.US);
        }

        public Builder addProperty(IcsProperty property) {
            properties.add(property);
            return this;
        }

        public Builder addComponent(IcsComponent component) {
            components.add(component);
            return this;
        }

        public IcsComponent build() {
            return new IcsComponent(name, properties.build(), components.build());
        }
    }
}
