/*
 * HuffPack.java
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

package org.bluezoo.huffpack;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.text.MessageFormat;
import java.util.List;
import java.util.ResourceBundle;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.bluezoo.huffpack.archive.Archive;
import org.bluezoo.huffpack.archive.ArchiveReader;
import org.bluezoo.huffpack.archive.ArchiveWriter;
import org.bluezoo.huffpack.archive.SymbolFormats;
import org.bluezoo.huffpack.codec.Compressed;
import org.bluezoo.huffpack.codec.HuffmanCodec;
import org.bluezoo.huffpack.codec.HuffmanException;
import org.bluezoo.huffpack.util.LaconicFormatter;

/**
 * Command-line tool that compresses a text file into an archive and
 * decompresses it again.
 *
 * <pre>
 * huffpack compress notes.txt          writes notes_huffman.huffman
 * huffpack decompress notes_huffman.huffman   writes notes_decompressed.txt
 * </pre>
 *
 * Output files are written next to their input.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 * @see HuffPackConfiguration
 */
public class HuffPack {

    static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.huffpack.L10N");
    static final Logger LOGGER = Logger.getLogger(HuffPack.class.getName());

    static final String COMPRESSED_SUFFIX = "_huffman";
    static final String COMPRESSED_EXTENSION = ".huffman";
    static final String DECOMPRESSED_SUFFIX = "_decompressed";
    static final String DECOMPRESSED_EXTENSION = ".txt";

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_FAILURE = 2;

    private final HuffPackConfiguration configuration;

    public HuffPack(HuffPackConfiguration configuration) {
        this.configuration = configuration;
    }

    /**
     * Compresses a text file.
     *
     * @param input the text file
     * @return the path of the archive written
     * @throws CharacterCodingException if the file is not valid text in
     * the configured charset
     * @throws IOException if the file cannot be read or written
     * @throws HuffmanException if the text cannot be encoded
     */
    public Path compress(Path input) throws IOException, HuffmanException {
        String text = decodeText(Files.readAllBytes(input));
        if (configuration.isTrim()) {
            text = text.stripTrailing();
        }
        Compressed<Character> compressed = HuffmanCodec.compress(HuffmanCodec.toSymbols(text));
        Path output = compressedPath(input);
        OutputStream out = new BufferedOutputStream(Files.newOutputStream(output));
        try {
            new ArchiveWriter<>(SymbolFormats.CHARACTER).write(out, compressed);
            out.close();
        } catch (IOException | RuntimeException e) {
            discard(out, output, e);
            throw e;
        }
        if (LOGGER.isLoggable(Level.INFO)) {
            String msg = MessageFormat.format(L10N.getString("info.compressed"),
                    input, output, text.length(), Files.size(output));
            LOGGER.info(msg);
        }
        return output;
    }

    /**
     * Decompresses an archive into a text file.
     *
     * @param input the archive
     * @return the path of the text file written
     * @throws IOException if the archive cannot be read or is malformed,
     * or the text file cannot be written
     * @throws CharacterCodingException if the text cannot be represented
     * in the configured charset
     * @throws HuffmanException if the payload is corrupt
     */
    public Path decompress(Path input) throws IOException, HuffmanException {
        Archive<Character> archive;
        try (InputStream in = new BufferedInputStream(Files.newInputStream(input))) {
            archive = new ArchiveReader<>(SymbolFormats.CHARACTER).read(in);
        }
        List<Character> symbols = archive.decode();
        String text = HuffmanCodec.toText(symbols);
        Path output = decompressedPath(input);
        Files.write(output, encodeText(text));
        if (LOGGER.isLoggable(Level.INFO)) {
            String msg = MessageFormat.format(L10N.getString("info.decompressed"),
                    input, output, text.length());
            LOGGER.info(msg);
        }
        return output;
    }

    /**
     * Closes and deletes a partially written file. Failures are added to
     * the cause as suppressed exceptions.
     */
    static void discard(OutputStream out, Path path, Exception cause) {
        try {
            out.close();
        } catch (IOException e) {
            cause.addSuppressed(e);
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            cause.addSuppressed(e);
        }
    }

    // Malformed or unmappable input is reported, never replaced
    private String decodeText(byte[] bytes) throws CharacterCodingException {
        return configuration.getCharset().newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(bytes))
                .toString();
    }

    private byte[] encodeText(String text) throws CharacterCodingException {
        ByteBuffer buf = configuration.getCharset().newEncoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .encode(CharBuffer.wrap(text));
        byte[] bytes = new byte[buf.remaining()];
        buf.get(bytes);
        return bytes;
    }

    /**
     * Returns the archive path for a text file: the file name without its
     * extension, followed by {@code _huffman.huffman}.
     *
     * @param input the text file
     * @return the archive path, in the same directory
     */
    static Path compressedPath(Path input) {
        String base = baseName(input);
        return input.resolveSibling(base + COMPRESSED_SUFFIX + COMPRESSED_EXTENSION);
    }

    /**
     * Returns the text path for an archive: the file name without its
     * extension or {@code _huffman} suffix, followed by
     * {@code _decompressed.txt}.
     *
     * @param input the archive
     * @return the text path, in the same directory
     */
    static Path decompressedPath(Path input) {
        String base = baseName(input);
        if (base.endsWith(COMPRESSED_SUFFIX) && base.length() > COMPRESSED_SUFFIX.length()) {
            base = base.substring(0, base.length() - COMPRESSED_SUFFIX.length());
        }
        return input.resolveSibling(base + DECOMPRESSED_SUFFIX + DECOMPRESSED_EXTENSION);
    }

    // File name minus extension. A leading dot does not start an extension.
    private static String baseName(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return (dot > 0) ? name.substring(0, dot) : name;
    }

    /**
     * Installs a {@link LaconicFormatter} on the root logger's handlers and
     * sets the configured level.
     */
    static void configureLogging(HuffPackConfiguration configuration) {
        Level level = configuration.getLogLevel();
        boolean stackTraces = level.intValue() <= Level.FINE.intValue();
        Logger root = Logger.getLogger("");
        root.setLevel(level);
        for (Handler handler : root.getHandlers()) {
            handler.setLevel(level);
            handler.setFormatter(new LaconicFormatter(stackTraces));
        }
    }

    /**
     * Runs the tool.
     *
     * @param args the command and file
     * @param configuration the configuration
     * @return the process exit code
     */
    static int run(String[] args, HuffPackConfiguration configuration) {
        if (args.length != 2) {
            System.err.println(L10N.getString("usage"));
            return EXIT_USAGE;
        }
        HuffPack huffPack = new HuffPack(configuration);
        Path input = Paths.get(args[1]);
        try {
            if ("compress".equals(args[0])) {
                huffPack.compress(input);
            } else if ("decompress".equals(args[0])) {
                huffPack.decompress(input);
            } else {
                System.err.println(L10N.getString("usage"));
                return EXIT_USAGE;
            }
        } catch (IOException | HuffmanException e) {
            String msg = MessageFormat.format(L10N.getString("err." + args[0]), input);
            LOGGER.log(Level.SEVERE, msg, e);
            return EXIT_FAILURE;
        }
        return EXIT_OK;
    }

    public static void main(String[] args) {
        HuffPackConfiguration configuration;
        try {
            configuration = HuffPackConfiguration.fromSystemProperties();
        } catch (IllegalArgumentException e) {
            LOGGER.log(Level.SEVERE, L10N.getString("err.configuration"), e);
            System.exit(EXIT_USAGE);
            return;
        }
        configureLogging(configuration);
        System.exit(run(args, configuration));
    }

}
