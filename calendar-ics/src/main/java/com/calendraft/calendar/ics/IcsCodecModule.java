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

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.time.Clock;

import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.PropertiesConfiguration;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Scopes;
import com.google.inject.Singleton;

public class IcsCodecModule extends AbstractModule {
    private static final Logger LOGGER = LoggerFactory.getLogger(IcsCodecModule.class);

    public static final String CONFIGURATION_FILE = "ics-codec.properties";

    @Override
    protected void configure() {
        bind(IcsEventParser.class).in(Scopes.SINGLETON);
        bind(IcsEventGenerator.class).in(Scopes.SINGLETON);
    }

    @Provides
    @Singleton
    Clock clock() {
        return Clock.systemUTC();
    }

    @Provides
    @Singleton
    IcsCodecConfiguration icsCodecConfiguration() throws ConfigurationException {
        try {
            return IcsCodecConfiguration.parse(loadConfiguration(CONFIGURATION_FILE));
        } catch (FileNotFoundException e) {
            LOGGER.info("{} not found, using default ICS codec configuration", CONFIGURATION_FILE);
            return IcsCodecConfiguration.DEFAULT;
        }
    }

    static Configuration loadConfiguration(String resourceName) throws ConfigurationException, FileNotFoundException {
        URL resource = IcsCodecModule.class.getClassLoader().getResource(resourceName);
        if (resource == null) {
            throw new FileNotFoundException(resourceName + " not found on the classpath");
        }
        PropertiesConfiguration configuration = new PropertiesConfiguration();
        try (Reader reader = new InputStreamReader(resource.openStream(), StandardCharsets.UTF_8)) {
            configuration.read(reader);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read " + resourceName, e);
        }
        return configuration;
    }
}
