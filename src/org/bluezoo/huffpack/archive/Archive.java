/*
 * Archive.java
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

import java.text.MessageFormat;
import java.util.List;

import org.bluezoo.huffpack.codec.FrequencyTable;
import org.bluezoo.huffpack.codec.HuffmanCodec;
import org.bluezoo.huffpack.codec.HuffmanException;

/**
 * A payload read from an archive, with the frequency table needed to
 * decode it.
 *
 * @param <S> the symbol type
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class Archive<S> {

    /**
     * Archive signature: ASCII "HUFP".
     */
    public static final byte[] MAGIC = { 'H', 'U', 'F', 'P' };

    /**
     * Current archive format version.
     */
    public static final int VERSION = 1;

    private final FrequencyTable<S> frequencies;
    private final byte[] payload;

    Archive(FrequencyTable<S> frequencies, byte[] payload) {
        this.frequencies = frequencies;
        this.payload = payload;
    }

    public FrequencyTable<S> getFrequencies() {
        return frequencies;
    }

    /**
     * Returns a copy of the encoded payload.
     */
    public byte[] getPayload() {
        return payload.clone();
    }

    /**
     * Decodes the payload with the code table rebuilt from the frequencies.
     *
     * @return the decoded symbols
     * @throws HuffmanException if the payload does not match the
     * frequencies, or decodes to a different number of symbols than the
     * frequencies record
     */
    public List<S> decode() throws HuffmanException {
        List<S> symbols = HuffmanCodec.decompress(payload, frequencies);
        if (symbols.size() != frequencies.getTotal()) {
            String msg = MessageFormat.format(ArchiveWriter.L10N.getString("err.symbol_count"),
                    symbols.size(), frequencies.getTotal());
            throw new HuffmanException(HuffmanException.Kind.CORRUPT_PAYLOAD, msg);
        }
        return symbols;
    }

}
