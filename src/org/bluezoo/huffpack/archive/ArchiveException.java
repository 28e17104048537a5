/*
 * ArchiveException.java
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

import java.io.IOException;

/**
 * Exception thrown when an archive header is malformed.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class ArchiveException extends IOException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates a new archive exception.
     *
     * @param message the error message
     */
    public ArchiveException(String message) {
        super(message);
    }

    /**
     * Creates a new archive exception with a cause.
     *
     * @param message the error message
     * @param cause the underlying cause
     */
    public ArchiveException(String message, Throwable cause) {
        super(message, cause);
    }

}
