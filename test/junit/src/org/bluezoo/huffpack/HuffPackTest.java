/*
 * HuffPackTest.java
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

import java.io.File;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.logging.Level;

import org.bluezoo.huffpack.codec.HuffmanException;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import static org.junit.Assert.*;

/**
 * Unit tests for the {@link HuffPack} command-line tool.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class HuffPackTest {

    private static final String TEXT = "The quick brown fox jumps over the lazy dog.\n"
            + "Pack my box with five dozen liquor jugs.\n";

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private Path writeFile(String name, String text) throws IOException {
        File file = folder.newFile(name);
        Files.write(file.toPath(), text.getBytes(StandardCharsets.UTF_8));
        return file.toPath();
    }

    private static String readFile(Path path) throws IOException {
        return new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
    }

    @Test
    public void testCompressDecompress() throws IOException, HuffmanException {
        Path input = writeFile("notes.txt", TEXT);
        HuffPack huffPack = new HuffPack(HuffPackConfiguration.defaults());

        Path archive = huffPack.compress(input);
        assertEquals("notes_huffman.huffman", archive.getFileName().toString());
        assertTrue(Files.exists(archive));

        Path output = huffPack.decompress(archive);
        assertEquals("notes_decompressed.txt", output.getFileName().toString());
        assertEquals(TEXT, readFile(output));
    }

    @Test
    public void testNonAsciiText() throws IOException, HuffmanException {
        String text = "Grüße aus Köln, ça va? 東京\n";
        Path input = writeFile("greeting.txt", text);
        HuffPack huffPack = new HuffPack(HuffPackConfiguration.defaults());
        assertEquals(text, readFile(huffPack.decompress(huffPack.compress(input))));
    }

    @Test
    public void testEmptyFile() throws IOException, HuffmanException {
        Path input = writeFile("empty.txt", "");
        HuffPack huffPack = new HuffPack(HuffPackConfiguration.defaults());
        Path output = huffPack.decompress(huffPack.compress(input));
        assertEquals(0L, Files.size(output));
    }

    @Test
    public void testTrim() throws IOException, HuffmanException {
        Path input = writeFile("padded.txt", "  leading kept\ttrailing removed \n\n ");
        HuffPackConfiguration trim = new HuffPackConfiguration(StandardCharsets.UTF_8, true, Level.INFO);
        HuffPack huffPack = new HuffPack(trim);
        assertEquals("  leading kept\ttrailing removed", readFile(huffPack.decompress(huffPack.compress(input))));
    }

    @Test
    public void testMalformedInputRejected() throws IOException, HuffmanException {
        // "caf" followed by a Latin-1 e-acute, not valid UTF-8
        File file = folder.newFile("latin1.txt");
        Files.write(file.toPath(), new byte[] { 0x63, 0x61, 0x66, (byte) 0xe9 });
        HuffPack huffPack = new HuffPack(HuffPackConfiguration.defaults());
        try {
            huffPack.compress(file.toPath());
            fail("Invalid UTF-8 should not be compressed");
        } catch (CharacterCodingException e) {
            // expected
        }
        assertFalse(Files.exists(file.toPath().resolveSibling("latin1_huffman.huffman")));
        assertEquals(HuffPack.EXIT_FAILURE,
                HuffPack.run(new String[] { "compress", file.toString() }, HuffPackConfiguration.defaults()));
    }

    @Test
    public void testLatin1Charset() throws IOException, HuffmanException {
        File file = folder.newFile("latin1.txt");
        byte[] data = new byte[] { 0x63, 0x61, 0x66, (byte) 0xe9 };
        Files.write(file.toPath(), data);
        HuffPackConfiguration latin1 = new HuffPackConfiguration(StandardCharsets.ISO_8859_1, false, Level.INFO);
        HuffPack huffPack = new HuffPack(latin1);
        Path output = huffPack.decompress(huffPack.compress(file.toPath()));
        assertArrayEquals(data, Files.readAllBytes(output));
    }

    @Test
    public void testUnmappableOutputRejected() throws IOException, HuffmanException {
        Path input = writeFile("tokyo.txt", "東京");
        Path archive = new HuffPack(HuffPackConfiguration.defaults()).compress(input);
        HuffPackConfiguration latin1 = new HuffPackConfiguration(StandardCharsets.ISO_8859_1, false, Level.INFO);
        try {
            new HuffPack(latin1).decompress(archive);
            fail("Characters outside ISO-8859-1 should not be written");
        } catch (CharacterCodingException e) {
            // expected
        }
        assertFalse(Files.exists(input.resolveSibling("tokyo_decompressed.txt")));
    }

    @Test
    public void testDiscardPartialFile() throws IOException {
        Path partial = folder.newFile("partial_huffman.huffman").toPath();
        OutputStream out = Files.newOutputStream(partial);
        out.write(new byte[] { 'H', 'U' });
        IOException cause = new IOException("write failed");
        HuffPack.discard(out, partial, cause);
        assertFalse(Files.exists(partial));
        assertEquals(0, cause.getSuppressed().length);
    }

    @Test
    public void testCompressedPath() {
        assertEquals(Paths.get("dir", "notes_huffman.huffman"), HuffPack.compressedPath(Paths.get("dir", "notes.txt")));
        assertEquals(Paths.get("archive.tar_huffman.huffman"), HuffPack.compressedPath(Paths.get("archive.tar.gz")));
        assertEquals(Paths.get("README_huffman.huffman"), HuffPack.compressedPath(Paths.get("README")));
        assertEquals(Paths.get(".profile_huffman.huffman"), HuffPack.compressedPath(Paths.get(".profile")));
    }

    @Test
    public void testDecompressedPath() {
        assertEquals(Paths.get("dir", "notes_decompressed.txt"),
                HuffPack.decompressedPath(Paths.get("dir", "notes_huffman.huffman")));
        assertEquals(Paths.get("data_decompressed.txt"), HuffPack.decompressedPath(Paths.get("data.bin")));
        assertEquals(Paths.get("_huffman_decompressed.txt"), HuffPack.decompressedPath(Paths.get("_huffman.huffman")));
    }

    @Test
    public void testRunUsage() {
        HuffPackConfiguration configuration = HuffPackConfiguration.defaults();
        assertEquals(HuffPack.EXIT_USAGE, HuffPack.run(new String[0], configuration));
        assertEquals(HuffPack.EXIT_USAGE, HuffPack.run(new String[] { "compress" }, configuration));
        assertEquals(HuffPack.EXIT_USAGE, HuffPack.run(new String[] { "explode", "file.txt" }, configuration));
    }

    @Test
    public void testRun() throws IOException {
        Path input = writeFile("run.txt", TEXT);
        HuffPackConfiguration configuration = HuffPackConfiguration.defaults();
        assertEquals(HuffPack.EXIT_OK, HuffPack.run(new String[] { "compress", input.toString() }, configuration));
        Path archive = input.resolveSibling("run_huffman.huffman");
        assertEquals(HuffPack.EXIT_OK, HuffPack.run(new String[] { "decompress", archive.toString() }, configuration));
        assertEquals(TEXT, readFile(input.resolveSibling("run_decompressed.txt")));
    }

    @Test
    public void testRunFailure() throws IOException {
        Path notArchive = writeFile("plain.huffman", TEXT);
        HuffPackConfiguration configuration = HuffPackConfiguration.defaults();
        assertEquals(HuffPack.EXIT_FAILURE,
                HuffPack.run(new String[] { "decompress", notArchive.toString() }, configuration));
        Path missing = notArchive.resolveSibling("missing.txt");
        assertEquals(HuffPack.EXIT_FAILURE,
                HuffPack.run(new String[] { "compress", missing.toString() }, configuration));
    }

}
