/*
 * HuffPackConfigurationTest.java
 * Copyright (C) 2026 Chris Burdess
 *
 * This file is part of huffpack, a static Huffman coding library.
 *
 * huffpack is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * huffpack is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Lesser General Public License for more details.
 *
 * You should have received a copy of the GNU Lesser General Public License
 * along with huffpack.  If not, see <http://www.gnu.org/licenses/>.
 */

package org.bluezoo.huffpack;

import java.nio.charset.StandardCharsets;
import java.util.logging.Level;

import org.junit.After;
import org.junit.Test;

import static org.junit.Assert.*;

/**
 * Unit tests for {@link HuffPackConfiguration}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class HuffPackConfigurationTest {

    @After
    public void clearProperties() {
        System.clearProperty(HuffPackConfiguration.CHARSET_PROPERTY);
        System.clearProperty(HuffPackConfiguration.TRIM_PROPERTY);
        System.clearProperty(HuffPackConfiguration.LOG_LEVEL_PROPERTY);
    }

    @Test
    public void testDefaults() {
        HuffPackConfiguration configuration = HuffPackConfiguration.defaults();
        assertEquals(StandardCharsets.UTF_8, configuration.getCharset());
        assertFalse(configuration.isTrim());
        assertEquals(Level.INFO, configuration.getLogLevel());
    }

    @Test
    public void testUnsetPropertiesGiveDefaults() {
        HuffPackConfiguration configuration = HuffPackConfiguration.fromSystemProperties();
        assertEquals(StandardCharsets.UTF_8, configuration.getCharset());
        assertFalse(configuration.isTrim());
        assertEquals(Level.INFO, configuration.getLogLevel());
    }

    @Test
    public void testSystemProperties() {
        System.setProperty(HuffPackConfiguration.CHARSET_PROPERTY, "ISO-8859-1");
        System.setProperty(HuffPackConfiguration.TRIM_PROPERTY, "true");
        System.setProperty(HuffPackConfiguration.LOG_LEVEL_PROPERTY, "FINE");
        HuffPackConfiguration configuration = HuffPackConfiguration.fromSystemProperties();
        assertEquals(StandardCharsets.ISO_8859_1, configuration.getCharset());
        assertTrue(configuration.isTrim());
        assertEquals(Level.FINE, configuration.getLogLevel());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownCharset() {
        System.setProperty(HuffPackConfiguration.CHARSET_PROPERTY, "no-such-charset");
        HuffPackConfiguration.fromSystemProperties();
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownLevel() {
        System.setProperty(HuffPackConfiguration.LOG_LEVEL_PROPERTY, "LOUD");
        HuffPackConfiguration.fromSystemProperties();
    }

    @Test(expected = NullPointerException.class)
    public void testCharsetRequired() {
        new HuffPackConfiguration(null, false, Level.INFO);
    }

}
