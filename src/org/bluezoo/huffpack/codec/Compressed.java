/*
 * Compressed.java
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

package org.bluezoo.huffpack.codec;

/**
 * The result of one compression: the payload together with the frequency
 * table and code table it was produced from. Either table is sufficient to
 * decode the payload.
 *
 * @param <S> the symbol type
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class Compressed<S> {

    private final FrequencyTable<S> frequencies;
    private final CodeTable<S> codeTable;
    private final byte[] payload;

    Compressed(FrequencyTable<S> frequencies, CodeTable<S> codeTable, byte[] payload) {
        this.frequencies = frequencies;
        this.codeTable = codeTable;
        this.payload = payload;
    }

    public FrequencyTable<S> getFrequencies() {
        return frequencies;
    }

    public CodeTable<S> getCodeTable() {
        return codeTable;
    }

    /**
     * Returns a copy of the encoded payload.
     */
    public byte[] getPayload() {
        return payload.clone();
    }

    /**
     * Returns the padding count recorded in the payload header.
     */
    public int getPadding() {
        return payload[0] & 0xff;
    }

    /**
     * Returns the number of code bits in the payload, excluding the header
     * and the padding.
     */
    public long getBitLength() {
        return (payload.length - 1) * 8L - getPadding();
    }

}
