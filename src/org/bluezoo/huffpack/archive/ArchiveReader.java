/*
 * ArchiveReader.java
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

import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.text.MessageFormat;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.bluezoo.huffpack.codec.FrequencyTable;

/**
 * Reads archives written by {@link ArchiveWriter}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class ArchiveReader<S> {

    private static final Logger LOGGER = Logger.getLogger(ArchiveReader.class.getName());

    private final SymbolFormat<S> format;

    /**
     * Creates a new archive reader.
     *
     * @param format the expected format of the symbols
     */
    public ArchiveReader(SymbolFormat<S> format) {
        if (format == null) {
            throw new NullPointerException("format");
        }
        this.format = format;
    }

    /**
     * Reads an archive to the end of the stream. The stream is not closed.
     *
     * @param in the input stream
     * @return the archive
     * @throws ArchiveException if the header is malformed or truncated
     * @throws IOException if an I/O error occurs
     */
    public Archive<S> read(InputStream in) throws IOException {
        DataInputStream data = new DataInputStream(in);
        try {
            byte[] magic = new byte[Archive.MAGIC.length];
            data.readFully(magic);
            for (int i = 0; i < magic.length; i++) {
                if (magic[i] != Archive.MAGIC[i]) {
                    throw new ArchiveException(ArchiveWriter.L10N.getString("err.bad_magic"));
                }
            }
            int version = data.readUnsignedByte();
            if (version != Archive.VERSION) {
                String msg = MessageFormat.format(ArchiveWriter.L10N.getString("err.bad_version"), version);
                throw new ArchiveException(msg);
            }
            int formatId = data.readUnsignedByte();
            if (formatId != format.getId()) {
                String msg = MessageFormat.format(ArchiveWriter.L10N.getString("err.bad_format"),
                        formatId, format.getId());
                throw new ArchiveException(msg);
            }
            int entries = data.readInt();
            if (entries < 0) {
                String msg = MessageFormat.format(ArchiveWriter.L10N.getString("err.bad_entries"), entries);
                throw new ArchiveException(msg);
            }
            FrequencyTable.Builder<S> builder = new FrequencyTable.Builder<>();
            for (int i = 0; i < entries; i++) {
                S symbol = format.read(data);
                int count = data.readInt();
                if (count <= 0) {
                    String msg = MessageFormat.format(ArchiveWriter.L10N.getString("err.bad_count"),
                            symbol, count);
                    throw new ArchiveException(msg);
                }
                if (builder.contains(symbol)) {
                    String msg = MessageFormat.format(ArchiveWriter.L10N.getString("err.duplicate_symbol"),
                            symbol);
                    throw new ArchiveException(msg);
                }
                builder.add(symbol, count);
            }
            FrequencyTable<S> frequencies = builder.build();
            byte[] payload = data.readAllBytes();
            if (LOGGER.isLoggable(Level.FINE)) {
                String msg = MessageFormat.format(ArchiveWriter.L10N.getString("debug.read"),
                        entries, payload.length, format);
                LOGGER.fine(msg);
            }
            return new Archive<>(frequencies, payload);
        } catch (EOFException e) {
            throw new ArchiveException(ArchiveWriter.L10N.getString("err.truncated"), e);
        }
    }

}
