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
 * Self-describing archive files.
 *
 * <p>An encoded payload does not carry its code table. An archive prefixes
 * the payload with the frequency table it was compressed with, from which
 * a reader in another process rebuilds the identical code table.
 *
 * <table border="1" cellpadding="5">
 *   <caption>Archive layout</caption>
 *   <tr><th>Size</th><th>Field</th></tr>
 *   <tr><td>4</td><td>magic {@code HUFP}</td></tr>
 *   <tr><td>1</td><td>version (1)</td></tr>
 *   <tr><td>1</td><td>symbol format (1 = char, 2 = byte)</td></tr>
 *   <tr><td>4</td><td>number of table entries</td></tr>
 *   <tr><td>n</td><td>entries: symbol, then count as int32</td></tr>
 *   <tr><td>rest</td><td>encoded payload</td></tr>
 * </table>
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
package org.bluezoo.huffpack.archive;
