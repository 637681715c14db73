/*
 * (c) Copyright 2025 Multiversio LLC. All rights reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *          http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.tileverse.datamap.access.file;

import io.tileverse.datamap.FormatMismatchException;
import io.tileverse.datamap.PersistenceException;
import io.tileverse.datamap.access.AccessFormat;
import io.tileverse.datamap.region.BufferLayout;
import io.tileverse.datamap.region.RegionBuffer;
import io.tileverse.datamap.region.RegionKey;
import java.io.IOException;
import java.net.URI;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileSystemNotFoundException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An {@link AccessFormat} storing each region as a flat binary file in a directory.
 * <p>
 * A region file is named {@code <prefix>_<column>_<row>.region} and holds a 20 byte header
 * (magic number, region width, region height, channels, bytes per channel, all big-endian
 * {@code int}s) followed by the raw region bytes. Reading a file whose header does not match the
 * requested layout fails with a {@link FormatMismatchException}; an unreadable file fails with a
 * {@link PersistenceException}.
 * <p>
 * Writes go to a temporary file in the same directory which then replaces the region file, so a
 * reader never observes a partially written region.
 *
 * <pre>{@code
 * FileAccessFormat store = FileAccessFormat.builder().directory(Path.of("data/elevation")).build();
 * }</pre>
 */
public class FileAccessFormat implements AccessFormat {

    private static final Logger logger = LoggerFactory.getLogger(FileAccessFormat.class);

    /** "DMRG" */
    static final int MAGIC = 0x444D5247;

    static final int HEADER_SIZE = 5 * Integer.BYTES;

    /** Extension of region files. */
    public static final String EXTENSION = ".region";

    /** Default file name prefix. */
    public static final String DEFAULT_PREFIX = "region";

    private final Path directory;
    private final String prefix;

    /**
     * @param directory the directory holding the region files, created if missing
     * @param prefix the file name prefix of region files
     * @throws IOException if the directory can't be created
     */
    public FileAccessFormat(Path directory, String prefix) throws IOException {
        this.directory = Objects.requireNonNull(directory, "Directory cannot be null");
        this.prefix = Objects.requireNonNull(prefix, "Prefix cannot be null");
        if (prefix.isBlank() || prefix.contains("/") || prefix.contains("\\")) {
            throw new IllegalArgumentException("Invalid region file prefix: '" + prefix + "'");
        }
        Files.createDirectories(directory);
        logger.info("Storing regions as {}_<column>_<row>{} files in {}", prefix, EXTENSION, directory.toAbsolutePath());
    }

    public Path directory() {
        return directory;
    }

    public String prefix() {
        return prefix;
    }

    /**
     * @return the file holding the content of {@code key}
     */
    public Path pathOf(RegionKey key) {
        return directory.resolve(resourceId(key));
    }

    @Override
    public String resourceId(RegionKey key) {
        return prefix + "_" + key.column() + "_" + key.row() + EXTENSION;
    }

    @Override
    public Optional<RegionBuffer> read(RegionKey key, BufferLayout layout) throws IOException {
        Path path = pathOf(key);
        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ)) {
            ByteBuffer header = readFully(channel, ByteBuffer.allocate(HEADER_SIZE), 0, path);
            BufferLayout stored = parseHeader(header, path);
            if (!stored.equals(layout)) {
                throw new FormatMismatchException("Region file " + resourceId(key) + " has another layout", layout, stored);
            }
            ByteBuffer data = readFully(channel, ByteBuffer.allocate(layout.byteSize()), HEADER_SIZE, path);
            return Optional.of(RegionBuffer.wrap(layout, data));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        }
    }

    @Override
    public void write(RegionKey key, RegionBuffer buffer) throws PersistenceException {
        Objects.requireNonNull(buffer, "buffer cannot be null");
        Path target = pathOf(key);
        Path temp = null;
        try {
            temp = Files.createTempFile(directory, "." + prefix, ".tmp");
            try (FileChannel channel = FileChannel.open(temp, StandardOpenOption.WRITE)) {
                writeFully(channel, header(buffer.layout()));
                writeFully(channel, buffer.bytes());
                channel.force(false);
            }
            replace(temp, target);
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new PersistenceException(resourceId(key), "Failed to write region file", e);
        }
    }

    @Override
    public boolean exists(RegionKey key) {
        return Files.isRegularFile(pathOf(key));
    }

    /**
     * Deletes the file of a region.
     *
     * @return whether the file existed
     */
    public boolean delete(RegionKey key) throws IOException {
        return Files.deleteIfExists(pathOf(key));
    }

    /**
     * Moves {@code source} over {@code target}, atomically when the file system supports it.
     */
    public static void replace(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            logger.debug("Atomic move not supported for {}, replacing it non atomically", target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    /**
     * Deletes a temporary file left behind by a failed write, logging failures.
     */
    public static void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            logger.warn("Unable to delete temporary region file {}", temp, e);
        }
    }

    static ByteBuffer header(BufferLayout layout) {
        return ByteBuffer.allocate(HEADER_SIZE)
                .putInt(MAGIC)
                .putInt(layout.width())
                .putInt(layout.height())
                .putInt(layout.channels())
                .putInt(layout.bytesPerChannel())
                .flip();
    }

    private BufferLayout parseHeader(ByteBuffer header, Path path) throws PersistenceException {
        int magic = header.getInt();
        if (magic != MAGIC) {
            throw new PersistenceException(
                    path.getFileName().toString(), "Not a region file, bad magic 0x" + Integer.toHexString(magic));
        }
        try {
            return new BufferLayout(header.getInt(), header.getInt(), header.getInt(), header.getInt());
        } catch (IllegalArgumentException e) {
            throw new PersistenceException(path.getFileName().toString(), "Corrupt region file header", e);
        }
    }

    private static ByteBuffer readFully(FileChannel channel, ByteBuffer target, long position, Path path)
            throws IOException {
        long current = position;
        while (target.hasRemaining()) {
            int read = channel.read(target, current);
            if (read == -1) {
                throw new PersistenceException(
                        path.getFileName().toString(),
                        "Region file is truncated, missing " + target.remaining() + " bytes");
            }
            current += read;
        }
        return target.flip();
    }

    private static void writeFully(FileChannel channel, ByteBuffer source) throws IOException {
        while (source.hasRemaining()) {
            channel.write(source);
        }
    }

    @Override
    public String toString() {
        return "FileAccessFormat[" + directory + ", prefix=" + prefix + "]";
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for FileAccessFormat.
     */
    public static class Builder {
        private Path directory;
        private String prefix = DEFAULT_PREFIX;

        private Builder() {}

        public Builder directory(Path directory) {
            this.directory = Objects.requireNonNull(directory, "Directory cannot be null");
            return this;
        }

        /**
         * Sets the directory from a URI, a {@code file:} URI or a URI without scheme.
         */
        public Builder uri(URI uri) {
            this.directory = toPath(uri);
            return this;
        }

        public Builder prefix(String prefix) {
            this.prefix = Objects.requireNonNull(prefix, "Prefix cannot be null");
            return this;
        }

        /**
         * @throws IOException if the directory can't be created
         */
        public FileAccessFormat build() throws IOException {
            if (directory == null) {
                throw new IllegalStateException("Directory must be set");
            }
            return new FileAccessFormat(directory, prefix);
        }
    }

    /**
     * Resolves a {@code file:} URI, or a URI without scheme, to a path.
     *
     * @throws IllegalArgumentException if the URI does not denote a local path
     */
    public static Path toPath(URI uri) {
        Objects.requireNonNull(uri, "URI cannot be null");
        if (null == uri.getScheme()) {
            return Paths.get(uri.getPath());
        }
        try {
            return Paths.get(uri);
        } catch (IllegalArgumentException | FileSystemNotFoundException ex) {
            throw new IllegalArgumentException(
                    "Unable to resolve region directory for URI %s: %s".formatted(uri, ex.getMessage()), ex);
        }
    }
}
