/*
 * HuffmanCode.java
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
 * An immutable bit string of between 1 and {@value #MAX_LENGTH} bits.
 *
 * <p>The bits are held right-aligned in a long, the first bit of the code
 * being the most significant of the {@code length} low-order bits. The
 * empty code (length 0) exists only as the starting point for
 * {@link #append(int)}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class HuffmanCode {

    /**
     * Longest code that can be represented.
     */
    public static final int MAX_LENGTH = 64;

    /**
     * The empty code.
     */
    public static final HuffmanCode EMPTY = new HuffmanCode(0L, 0);

    private final long bits;
    private final int length;

    private HuffmanCode(long bits, int length) {
        this.bits = bits;
        this.length = length;
    }

    /**
     * Returns the code with the given bits.
     *
     * @param bits the code value, right-aligned
     * @param length the number of bits, 0 to 64
     * @return the code
     * @throws IllegalArgumentException if length is out of range or bits
     * has set bits above length
     */
    public static HuffmanCode of(long bits, int length) {
        if (length < 0 || length > MAX_LENGTH) {
            throw new IllegalArgumentException("Illegal code length: " + length);
        }
        if (length < MAX_LENGTH && (bits >>> length) != 0L) {
            throw new IllegalArgumentException("Code value exceeds " + length + " bits");
        }
        return (length == 0) ? EMPTY : new HuffmanCode(bits, length);
    }

    /**
     * Parses a code from a string of '0' and '1' characters.
     *
     * @param s the bit string
     * @return the code
     * @throws IllegalArgumentException if s contains other characters or
     * is longer than 64
     */
    public static HuffmanCode parse(String s) {
        HuffmanCode code = EMPTY;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c != '0' && c != '1') {
                throw new IllegalArgumentException("Not a bit string: " + s);
            }
            code = code.append(c - '0');
        }
        return code;
    }

    /**
     * Returns a new code with one bit appended.
     *
     * @param bit 0 or 1
     * @return the extended code
     * @throws IllegalStateException if this code is already 64 bits long
     */
    public HuffmanCode append(int bit) {
        if (length == MAX_LENGTH) {
            throw new IllegalStateException("Code exceeds " + MAX_LENGTH + " bits");
        }
        return new HuffmanCode((bits << 1) | (bit & 1), length + 1);
    }

    public long getBits() {
        return bits;
    }

    public int getLength() {
        return length;
    }

    /**
     * Returns the bit at the given position, 0 being the first bit.
     *
     * @param index the bit index
     * @return 0 or 1
     */
    public int bitAt(int index) {
        if (index < 0 || index >= length) {
            throw new IndexOutOfBoundsException(Integer.toString(index));
        }
        return (int) ((bits >>> (length - 1 - index)) & 1L);
    }

    /**
     * Indicates whether this code is a prefix of (or equal to) another.
     *
     * @param other the other code
     * @return true if the first {@code getLength()} bits of other equal
     * this code
     */
    public boolean isPrefixOf(HuffmanCode other) {
        if (length == 0) {
            return true;
        }
        if (length > other.length) {
            return false;
        }
        return (other.bits >>> (other.length - length)) == bits;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof HuffmanCode)) {
            return false;
        }
        HuffmanCode code = (HuffmanCode) other;
        return code.bits == bits && code.length == length;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(bits) * 31 + length;
    }

    /**
     * Returns the code as a string of '0' and '1' characters.
     */
    @Override
    public String toString() {
        char[] buf = new char[length];
        for (int i = 0; i < length; i++) {
            buf[i] = (char) ('0' + bitAt(i));
        }
        return new String(buf);
    }

}
