/*
 * LaconicFormatter.java
 * Copyright (C) 2005, 2026 Chris Burdess
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

package org.bluezoo.huffpack.util;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.logging.Formatter;
import java.util.logging.Level;
import java.util.logging.LogRecord;

/**
 * A logging formatter for command-line output that prints the minimum of
 * information: the level (for warnings and errors only) and the message.
 * Stack traces are printed only if requested, otherwise the message of
 * the thrown exception is appended.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class LaconicFormatter extends Formatter {

    static final String EOL = System.getProperty("line.separator");

    private final boolean stackTraces;

    public LaconicFormatter() {
        this(false);
    }

    /**
     * @param stackTraces whether to print the stack trace of a thrown
     * exception
     */
    public LaconicFormatter(boolean stackTraces) {
        this.stackTraces = stackTraces;
    }

    @Override
    public String format(LogRecord record) {
        StringBuilder buf = new StringBuilder();
        Level level = record.getLevel();
        if (level.intValue() >= Level.WARNING.intValue()) {
            buf.append(level.getLocalizedName());
            buf.append(": ");
        }
        String message = formatMessage(record);
        if (message != null) {
            buf.append(message);
        }
        Throwable t = record.getThrown();
        if (t != null && !stackTraces && t.getMessage() != null) {
            buf.append(": ");
            buf.append(t.getMessage());
        }
        buf.append(EOL);
        if (t != null && stackTraces) {
            StringWriter sink = new StringWriter();
            PrintWriter filter = new PrintWriter(sink);
            t.printStackTrace(filter);
            filter.flush();
            buf.append(sink.toString());
        }
        return buf.toString();
    }

}
