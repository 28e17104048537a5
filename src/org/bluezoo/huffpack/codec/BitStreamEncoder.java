/*
 * BitStreamEncoder.java
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

import java.io.ByteArrayOutputStream;
import java.text.MessageFormat;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Encodes a symbol sequence into a padded, byte-packed payload.
 *
 * <p>The payload consists of a single header byte holding the number of
 * zero bits (0 to 7) appended to reach a byte boundary, followed by the
 * concatenated codes of every symbol and then the padding bits. Bits are
 * packed most significant first.
 *
 * <pre>
 * +--------+--------+--------+-----+--------+
 * |  pad   | code bits ...            |0..0 |
 * +--------+--------+--------+-----+--------+
 * </pre>
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class BitStreamEncoder {

    private static final Logger LOGGER = Logger.getLogger(BitStreamEncoder.class.getName());

    /**
     * Number of bits in the padding header.
     */
    public static final int HEADER_BITS = 8;

    private BitStreamEncoder() {
    }

    /**
     * Returns the number of zero bits needed to pad a bit sequence of the
     * given length to a byte boundary.
     *
     * @param bitLength the unpadded length in bits
     * @return a value between 0 and 7
     */
    public static int padding(long bitLength) {
        return (int) ((8 - (bitLength % 8)) % 8);
    }

    /**
     * Encodes a symbol sequence.
     *
     * @param symbols the symbols to encode
     * @param table the code table, which must contain every symbol
     * @param <S> the symbol type
     * @return the encoded payload, header byte first
     * @throws HuffmanException with kind {@code UNKNOWN_SYMBOL} if a symbol
     * has no code
     */
    public static <S> byte[] encode(Iterable<? extends S> symbols, CodeTable<S> table)
            throws HuffmanException {
        // Resolve every code before writing anything. The symbols are
        // iterated only once.
        List<HuffmanCode> codes = new ArrayList<>();
        long bitLength = 0L;
        for (S symbol : symbols) {
            HuffmanCode code = table.getCode(symbol);
            if (code == null) {
                String msg = MessageFormat.format(HuffmanCodec.L10N.getString("err.unknown_symbol"), symbol);
                throw new HuffmanException(HuffmanException.Kind.UNKNOWN_SYMBOL, msg, symbol);
            }
            codes.add(code);
            bitLength += code.getLength();
        }
        int pad = padding(bitLength);
        long totalBits = HEADER_BITS + bitLength + pad;
        if (totalBits / 8 > Integer.MAX_VALUE - 8) {
            throw new IllegalArgumentException("Payload too large: " + totalBits + " bits");
        }

        BitBuffer buffer = new BitBuffer((int) (totalBits / 8));
        buffer.appendBits(pad, HEADER_BITS);
        for (HuffmanCode code : codes) {
            buffer.appendBits(code.getBits(), code.getLength());
        }
        buffer.appendBits(0L, pad);
        if (!buffer.isAligned()) {
            String msg = MessageFormat.format(HuffmanCodec.L10N.getString("err.misaligned"),
                    buffer.getBitCount());
            throw new HuffmanException(HuffmanException.Kind.MISALIGNED_PAYLOAD, msg);
        }
        byte[] payload = buffer.toByteArray();
        if (LOGGER.isLoggable(Level.FINEST)) {
            String msg = MessageFormat.format(HuffmanCodec.L10N.getString("debug.encoded"),
                    bitLength, pad, payload.length);
            LOGGER.finest(msg);
        }
        return payload;
    }

    /**
     * Accumulates bits and packs them into bytes, most significant bit
     * first.
     */
    static final class BitBuffer {

        private final ByteArrayOutputStream byteStream;
        private int currentByte = 0;
        private int bitsInCurrentByte = 0;
        private long bitCount = 0L;

        BitBuffer(int expectedBytes) {
            byteStream = new ByteArrayOutputStream(Math.max(expectedBytes, 1));
        }

        /**
         * Appends the low-order numBits of value, most significant first.
         *
         * @param value the bits to append, right-aligned
         * @param numBits the number of bits to append, 0 to 64
         */
        void appendBits(long value, int numBits) {
            for (int i = numBits - 1; i >= 0; i--) {
                appendBit((int) ((value >>> i) & 1L));
            }
        }

        private void appendBit(int bit) {
            currentByte = (currentByte << 1) | bit;
            bitsInCurrentByte++;
            bitCount++;
            if (bitsInCurrentByte == 8) {
                byteStream.write(currentByte);
                currentByte = 0;
                bitsInCurrentByte = 0;
            }
        }

        boolean isAligned() {
            return bitsInCurrentByte == 0;
        }

        long getBitCount() {
            return bitCount;
        }

        /**
         * Returns the packed bytes. Bits of an incomplete final byte are
         * not included.
         */
        byte[] toByteArray() {
            return byteStream.toByteArray();
        }

    }

}
