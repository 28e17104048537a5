/*
 * HuffPackConfiguration.java
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

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.logging.Level;

/**
 * Settings for the command-line tool.
 *
 * <p>The following system properties are recognised:
 * <dl>
 * <dt>{@code huffpack.charset}</dt>
 * <dd>charset of the text files read and written (default UTF-8)</dd>
 * <dt>{@code huffpack.trim}</dt>
 * <dd>if true, trailing whitespace is removed from text before
 * compression (default false)</dd>
 * <dt>{@code huffpack.logLevel}</dt>
 * <dd>name of the {@link Level} for console logging (default INFO)</dd>
 * </dl>
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class HuffPackConfiguration {

    public static final String CHARSET_PROPERTY = "huffpack.charset";
    public static final String TRIM_PROPERTY = "huffpack.trim";
    public static final String LOG_LEVEL_PROPERTY = "huffpack.logLevel";

    private final Charset charset;
    private final boolean trim;
    private final Level logLevel;

    public HuffPackConfiguration(Charset charset, boolean trim, Level logLevel) {
        if (charset == null || logLevel == null) {
            throw new NullPointerException();
        }
        this.charset = charset;
        this.trim = trim;
        this.logLevel = logLevel;
    }

    /**
     * Returns the default configuration: UTF-8, no trimming, INFO logging.
     */
    public static HuffPackConfiguration defaults() {
        return new HuffPackConfiguration(StandardCharsets.UTF_8, false, Level.INFO);
    }

    /**
     * Reads the configuration from system properties.
     *
     * @return the configuration
     * @throws IllegalArgumentException if the charset or level is not
     * recognised
     */
    public static HuffPackConfiguration fromSystemProperties() {
        String charsetName = System.getProperty(CHARSET_PROPERTY, StandardCharsets.UTF_8.name());
        Charset charset = Charset.forName(charsetName);
        boolean trim = Boolean.getBoolean(TRIM_PROPERTY);
        Level logLevel = Level.parse(System.getProperty(LOG_LEVEL_PROPERTY, Level.INFO.getName()));
        return new HuffPackConfiguration(charset, trim, logLevel);
    }

    public Charset getCharset() {
        return charset;
    }

    /**
     * Indicates whether trailing whitespace is removed before compression.
     * This makes compression lossy for such whitespace.
     */
    public boolean isTrim() {
        return trim;
    }

    public Level getLogLevel() {
        return logLevel;
    }

}
