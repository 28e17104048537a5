/*
 * package-info.java
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

/**
 * Static Huffman coding of symbol sequences.
 *
 * <p>This package builds a prefix-free code from observed symbol
 * frequencies, encodes a symbol sequence into a packed bit stream, and
 * decodes it again.
 *
 * <h2>Payload Format</h2>
 *
 * <table border="1" cellpadding="5">
 *   <caption>Encoded payload</caption>
 *   <tr><th>Byte</th><th>Content</th></tr>
 *   <tr><td>0</td><td>number of zero padding bits at the end (0-7)</td></tr>
 *   <tr><td>1..N</td><td>concatenated symbol codes, most significant bit
 *     first, followed by the padding bits</td></tr>
 * </table>
 *
 * <p>The code table is not part of the payload.
 *
 * <h2>Key Components</h2>
 *
 * <ul>
 *   <li>{@link org.bluezoo.huffpack.codec.FrequencyAnalyzer} - counts symbols</li>
 *   <li>{@link org.bluezoo.huffpack.codec.HuffmanTreeBuilder} - merges nodes into a tree</li>
 *   <li>{@link org.bluezoo.huffpack.codec.CodeTableGenerator} - derives codes from the tree</li>
 *   <li>{@link org.bluezoo.huffpack.codec.BitStreamEncoder} - packs codes into bytes</li>
 *   <li>{@link org.bluezoo.huffpack.codec.BitStreamDecoder} - unpacks bytes into symbols</li>
 *   <li>{@link org.bluezoo.huffpack.codec.HuffmanCodec} - compress and decompress entry points</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 *
 * <p>The codec classes hold no state. Frequency tables and code tables are
 * immutable.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
package org.bluezoo.huffpack.codec;
