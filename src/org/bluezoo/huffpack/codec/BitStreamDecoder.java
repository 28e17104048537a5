/*
 * BitStreamDecoder.java
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

import java.text.MessageFormat;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Decodes a payload produced by {@link BitStreamEncoder}.
 *
 * <p>The padding header is read from the first byte and the trailing
 * padding bits are discarded. The remaining bits are accumulated one at a
 * time and looked up in the reverse code table; each time the accumulated
 * bits equal a code, its symbol is emitted and accumulation restarts.
 * Because the code is prefix-free, no backtracking is needed.
 *
 * <p>The code table must be the one used to encode the payload.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class BitStreamDecoder {

    private static final Logger LOGGER = Logger.getLogger(BitStreamDecoder.class.getName());

    private BitStreamDecoder() {
    }

    /**
     * Returns the padding count recorded in a payload header.
     *
     * @param payload the encoded payload
     * @return the padding count, 0 to 7
     * @throws HuffmanException with kind {@code CORRUPT_PAYLOAD} if the
     * header is missing or out of range, or describes more padding than
     * the payload contains
     */
    public static int readPadding(byte[] payload) throws HuffmanException {
        if (payload.length == 0) {
            throw corrupt(HuffmanCodec.L10N.getString("err.no_header"));
        }
        int pad = payload[0] & 0xff;
        if (pad > 7) {
            String msg = MessageFormat.format(HuffmanCodec.L10N.getString("err.bad_padding"), pad);
            throw corrupt(msg);
        }
        long bodyBits = (payload.length - 1) * 8L;
        if (pad > bodyBits) {
            String msg = MessageFormat.format(HuffmanCodec.L10N.getString("err.padding_exceeds"),
                    pad, bodyBits);
            throw corrupt(msg);
        }
        return pad;
    }

    /**
     * Decodes a payload.
     *
     * @param payload the encoded payload, header byte first
     * @param table the code table used to encode the payload
     * @param <S> the symbol type
     * @return the decoded symbols
     * @throws HuffmanException with kind {@code CORRUPT_PAYLOAD} if the
     * payload is truncated or does not match the table
     */
    public static <S> List<S> decode(byte[] payload, CodeTable<S> table) throws HuffmanException {
        int pad = readPadding(payload);
        long codeBits = (payload.length - 1) * 8L - pad;
        int maxCodeLength = table.getMaxCodeLength();
        List<S> symbols = new ArrayList<>();
        HuffmanCode accumulator = HuffmanCode.EMPTY;
        for (long i = 0L; i < codeBits; i++) {
            int b = payload[1 + (int) (i >>> 3)] & 0xff;
            int bit = (b >>> (7 - (int) (i & 7L))) & 1;
            accumulator = accumulator.append(bit);
            S symbol = table.getSymbol(accumulator);
            if (symbol != null) {
                symbols.add(symbol);
                accumulator = HuffmanCode.EMPTY;
            } else if (accumulator.getLength() >= maxCodeLength) {
                // No code in the table can match any more
                String msg = MessageFormat.format(HuffmanCodec.L10N.getString("err.no_match"),
                        accumulator, i + 1 - accumulator.getLength());
                throw corrupt(msg);
            }
        }
        if (accumulator.getLength() > 0) {
            String msg = MessageFormat.format(HuffmanCodec.L10N.getString("err.truncated"),
                    accumulator);
            throw corrupt(msg);
        }
        if (LOGGER.isLoggable(Level.FINEST)) {
            String msg = MessageFormat.format(HuffmanCodec.L10N.getString("debug.decoded"),
                    payload.length, pad, symbols.size());
            LOGGER.finest(msg);
        }
        return symbols;
    }

    private static HuffmanException corrupt(String message) {
        return new HuffmanException(HuffmanException.Kind.CORRUPT_PAYLOAD, message);
    }

}
