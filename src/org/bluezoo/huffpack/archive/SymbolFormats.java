/*
 * SymbolFormats.java
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

import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;

/**
 * The built-in symbol formats.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class SymbolFormats {

    /**
     * UTF-16 code units, two bytes each, big-endian.
     */
    public static final SymbolFormat<Character> CHARACTER = new SymbolFormat<Character>() {

        @Override
        public int getId() {
            return 1;
        }

        @Override
        public void write(DataOutput out, Character symbol) throws IOException {
            out.writeChar(symbol.charValue());
        }

        @Override
        public Character read(DataInput in) throws IOException {
            return in.readChar();
        }

        @Override
        public String toString() {
            return "CHARACTER";
        }

    };

    /**
     * Bytes, one byte each.
     */
    public static final SymbolFormat<Byte> BYTE = new SymbolFormat<Byte>() {

        @Override
        public int getId() {
            return 2;
        }

        @Override
        public void write(DataOutput out, Byte symbol) throws IOException {
            out.writeByte(symbol.byteValue());
        }

        @Override
        public Byte read(DataInput in) throws IOException {
            return in.readByte();
        }

        @Override
        public String toString() {
            return "BYTE";
        }

    };

    private SymbolFormats() {
    }

}
