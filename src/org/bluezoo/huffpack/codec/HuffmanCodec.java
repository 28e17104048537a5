/*
 * HuffmanCodec.java
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
import java.util.Map;
import java.util.ResourceBundle;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry points for static Huffman compression and decompression.
 *
 * <h4>Usage</h4>
 * <pre>{@code
 * List<Character> text = HuffmanCodec.toSymbols("aaabbc");
 * Compressed<Character> compressed = HuffmanCodec.compress(text);
 * byte[] payload = compressed.getPayload();
 *
 * // Same process: decode with the code table
 * List<Character> decoded = HuffmanCodec.decompress(payload, compressed.getCodeTable());
 *
 * // Elsewhere: rebuild the code table from the frequencies
 * decoded = HuffmanCodec.decompress(payload, compressed.getFrequencies());
 * String s = HuffmanCodec.toText(decoded);
 * }</pre>
 *
 * <p>The payload does not carry the code table. Callers that need to
 * decode in another process must transport the frequency table themselves,
 * for example using {@link org.bluezoo.huffpack.archive.ArchiveWriter}.
 *
 * <p>All methods are stateless and thread-safe.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class HuffmanCodec {

    static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.huffpack.codec.L10N");
    private static final Logger LOGGER = Logger.getLogger(HuffmanCodec.class.getName());

    private HuffmanCodec() {
    }

    /**
     * Builds the code table for a frequency table.
     *
     * @param frequencies the symbol frequencies
     * @param <S> the symbol type
     * @return the code table, empty if frequencies is empty
     */
    public static <S> CodeTable<S> buildCodeTable(FrequencyTable<S> frequencies) {
        HuffmanNode<S> root = HuffmanTreeBuilder.build(frequencies);
        return CodeTableGenerator.generate(root);
    }

    /**
     * Compresses a symbol sequence using a code built from its own
     * frequencies.
     *
     * @param symbols the symbols, none null
     * @param <S> the symbol type
     * @return the payload with the tables used to produce it
     * @throws HuffmanException if encoding fails
     */
    public static <S> Compressed<S> compress(List<? extends S> symbols) throws HuffmanException {
        FrequencyTable<S> frequencies = FrequencyAnalyzer.analyze(symbols);
        if (LOGGER.isLoggable(Level.FINE)) {
            String msg = MessageFormat.format(L10N.getString("debug.frequencies_counted"),
                    frequencies.getTotal(), frequencies.size());
            LOGGER.fine(msg);
        }
        HuffmanNode<S> root = HuffmanTreeBuilder.build(frequencies);
        CodeTable<S> table = CodeTableGenerator.generate(root);
        if (LOGGER.isLoggable(Level.FINE)) {
            String msg = MessageFormat.format(L10N.getString("debug.codes_generated"),
                    table.size(), table.getMaxCodeLength());
            LOGGER.fine(msg);
        }
        byte[] payload = BitStreamEncoder.encode(symbols, table);
        if (LOGGER.isLoggable(Level.FINE)) {
            String msg = MessageFormat.format(L10N.getString("debug.compressed"),
                    symbols.size(), payload.length);
            LOGGER.fine(msg);
        }
        return new Compressed<>(frequencies, table, payload);
    }

    /**
     * Decompresses a payload using the code table it was encoded with.
     *
     * @param payload the encoded payload
     * @param table the code table
     * @param <S> the symbol type
     * @return the decoded symbols
     * @throws HuffmanException if the payload is corrupt or does not match
     * the table
     */
    public static <S> List<S> decompress(byte[] payload, CodeTable<S> table) throws HuffmanException {
        List<S> symbols = BitStreamDecoder.decode(payload, table);
        if (LOGGER.isLoggable(Level.FINE)) {
            String msg = MessageFormat.format(L10N.getString("debug.decompressed"),
                    payload.length, symbols.size());
            LOGGER.fine(msg);
        }
        return symbols;
    }

    /**
     * Decompresses a payload, rebuilding its code table from the frequency
     * table the payload was compressed with.
     *
     * @param payload the encoded payload
     * @param frequencies the frequencies of the original symbols, in their
     * original order
     * @param <S> the symbol type
     * @return the decoded symbols
     * @throws HuffmanException if the payload is corrupt or does not match
     * the table
     */
    public static <S> List<S> decompress(byte[] payload, FrequencyTable<S> frequencies)
            throws HuffmanException {
        return decompress(payload, buildCodeTable(frequencies));
    }

    /**
     * Returns the sum over all symbols of frequency multiplied by code
     * length, i.e. the number of code bits needed to encode the input the
     * frequencies were counted from.
     *
     * @param frequencies the symbol frequencies
     * @param table a code table containing every symbol in frequencies
     * @param <S> the symbol type
     * @return the weighted path length
     * @throws IllegalArgumentException if a symbol has no code
     */
    public static <S> long weightedPathLength(FrequencyTable<S> frequencies, CodeTable<S> table) {
        long sum = 0L;
        for (Map.Entry<S, Long> entry : frequencies.asMap().entrySet()) {
            HuffmanCode code = table.getCode(entry.getKey());
            if (code == null) {
                throw new IllegalArgumentException("No code for symbol " + entry.getKey());
            }
            sum += entry.getValue() * code.getLength();
        }
        return sum;
    }

    /**
     * Converts text to a list of character symbols.
     *
     * @param text the text
     * @return one symbol per UTF-16 code unit
     */
    public static List<Character> toSymbols(CharSequence text) {
        int len = text.length();
        List<Character> symbols = new ArrayList<>(len);
        for (int i = 0; i < len; i++) {
            symbols.add(text.charAt(i));
        }
        return symbols;
    }

    /**
     * Converts character symbols back to text.
     *
     * @param symbols the symbols
     * @return the text
     */
    public static String toText(List<Character> symbols) {
        StringBuilder buf = new StringBuilder(symbols.size());
        for (Character c : symbols) {
            buf.append(c.charValue());
        }
        return buf.toString();
    }

    /**
     * Converts a byte array to a list of byte symbols.
     *
     * @param data the bytes
     * @return one symbol per byte
     */
    public static List<Byte> toSymbols(byte[] data) {
        List<Byte> symbols = new ArrayList<>(data.length);
        for (byte b : data) {
            symbols.add(b);
        }
        return symbols;
    }

    /**
     * Converts byte symbols back to a byte array.
     *
     * @param symbols the symbols
     * @return the bytes
     */
    public static byte[] toBytes(List<Byte> symbols) {
        byte[] data = new byte[symbols.size()];
        int i = 0;
        for (Byte b : symbols) {
            data[i++] = b.byteValue();
        }
        return data;
    }

}
