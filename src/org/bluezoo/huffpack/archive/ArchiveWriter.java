/*
 * ArchiveWriter.java
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

package org.bluezoo.huffpack.archive;

import java.io.DataOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.text.MessageFormat;
import java.util.Map;
import java.util.ResourceBundle;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.bluezoo.huffpack.codec.Compressed;
import org.bluezoo.huffpack.codec.FrequencyTable;

/**
 * Writes a compressed payload preceded by the frequency table it was
 * encoded with.
 *
 * <pre>
 * magic "HUFP" | version | symbol format | entry count (int32)
 * entry count x (symbol | count (int32))
 * payload
 * </pre>
 *
 * <p>Entries are written in the order of the frequency table, so that the
 * reader reconstructs the same table and therefore the same code.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class ArchiveWriter<S> {

    static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.huffpack.archive.L10N");
    private static final Logger LOGGER = Logger.getLogger(ArchiveWriter.class.getName());

    private final SymbolFormat<S> format;

    /**
     * Creates a new archive writer.
     *
     * @param format the format of the symbols
     */
    public ArchiveWriter(SymbolFormat<S> format) {
        if (format == null) {
            throw new NullPointerException("format");
        }
        this.format = format;
    }

    /**
     * Writes an archive. The stream is flushed but not closed.
     *
     * @param out the output stream
     * @param compressed the compression result to store
     * @throws ArchiveException if a count does not fit the archive format
     * @throws IOException if an I/O error occurs
     */
    public void write(OutputStream out, Compressed<S> compressed) throws IOException {
        write(out, compressed.getFrequencies(), compressed.getPayload());
    }

    /**
     * Writes an archive. The stream is flushed but not closed.
     *
     * @param out the output stream
     * @param frequencies the frequencies the payload was encoded with
     * @param payload the encoded payload
     * @throws ArchiveException if a count does not fit the archive format
     * @throws IOException if an I/O error occurs
     */
    public void write(OutputStream out, FrequencyTable<S> frequencies, byte[] payload)
            throws IOException {
        // Nothing is written unless every count fits
        for (Map.Entry<S, Long> entry : frequencies.asMap().entrySet()) {
            long count = entry.getValue();
            if (count > Integer.MAX_VALUE) {
                String msg = MessageFormat.format(L10N.getString("err.count_too_large"),
                        entry.getKey(), count);
                throw new ArchiveException(msg);
            }
        }
        DataOutputStream data = new DataOutputStream(out);
        data.write(Archive.MAGIC);
        data.writeByte(Archive.VERSION);
        data.writeByte(format.getId());
        data.writeInt(frequencies.size());
        for (Map.Entry<S, Long> entry : frequencies.asMap().entrySet()) {
            format.write(data, entry.getKey());
            data.writeInt(entry.getValue().intValue());
        }
        data.write(payload);
        data.flush();
        if (LOGGER.isLoggable(Level.FINE)) {
            String msg = MessageFormat.format(L10N.getString("debug.written"),
                    frequencies.size(), payload.length, format);
            LOGGER.fine(msg);
        }
    }

}
