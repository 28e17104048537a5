/*
 * FrequencyAnalyzer.java
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
 * Counts symbol occurrences.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class FrequencyAnalyzer {

    private FrequencyAnalyzer() {
    }

    /**
     * Counts the occurrences of each distinct symbol in a sequence.
     *
     * @param symbols the symbols, none of which may be null
     * @param <S> the symbol type
     * @return the frequency table, empty if the sequence is empty
     */
    public static <S> FrequencyTable<S> analyze(Iterable<? extends S> symbols) {
        FrequencyTable.Builder<S> builder = new FrequencyTable.Builder<>();
        for (S symbol : symbols) {
            builder.increment(symbol);
        }
        return builder.build();
    }

    /**
     * Counts the characters of a text.
     *
     * @param text the text
     * @return the frequency table keyed by UTF-16 code unit
     */
    public static FrequencyTable<Character> analyze(CharSequence text) {
        FrequencyTable.Builder<Character> builder = new FrequencyTable.Builder<>();
        int len = text.length();
        for (int i = 0; i < len; i++) {
            builder.increment(text.charAt(i));
        }
        return builder.build();
    }

    /**
     * Counts the bytes of a binary buffer.
     *
     * @param data the bytes
     * @return the frequency table keyed by byte value
     */
    public static FrequencyTable<Byte> analyze(byte[] data) {
        FrequencyTable.Builder<Byte> builder = new FrequencyTable.Builder<>();
        for (byte b : data) {
            builder.increment(b);
        }
        return builder.build();
    }

}
