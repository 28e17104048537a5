/*
 * SymbolFormat.java
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
 * Serializes the symbols of a frequency table in an archive header.
 *
 * @param <S> the symbol type
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 * @see SymbolFormats
 */
public interface SymbolFormat<S> {

    /**
     * Returns the identifier of this format recorded in the archive header.
     *
     * @return a value between 1 and 255
     */
    int getId();

    /**
     * Writes a symbol.
     *
     * @param out the output
     * @param symbol the symbol
     * @throws IOException if an I/O error occurs
     */
    void write(DataOutput out, S symbol) throws IOException;

    /**
     * Reads a symbol.
     *
     * @param in the input
     * @return the symbol
     * @throws IOException if an I/O error occurs
     */
    S read(DataInput in) throws IOException;

}
