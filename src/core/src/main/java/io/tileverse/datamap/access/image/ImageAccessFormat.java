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
package io.tileverse.datamap.access.image;

import io.tileverse.datamap.FormatMismatchException;
import io.tileverse.datamap.PersistenceException;
import io.tileverse.datamap.access.AccessFormat;
import io.tileverse.datamap.access.file.FileAccessFormat;
import io.tileverse.datamap.format.ChannelTuple;
import io.tileverse.datamap.region.BufferLayout;
import io.tileverse.datamap.region.RegionBuffer;
import io.tileverse.datamap.region.RegionKey;
import java.awt.image.BufferedImage;
import java.awt.image.Raster;
import java.awt.image.WritableRaster;
import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Iterator;
import java.util.Objects;
import java.util.Optional;
import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * An {@link AccessFormat} storing each region as a PNG image, {@code <prefix>_<column>_<row>.png},
 * so the content of a map can be inspected with any image viewer.
 * <p>
 * Channel {@code i} of a tuple is stored in band {@code i} of the image. Only the layouts a PNG
 * file holds without loss are supported:
 * <ul>
 * <li>one 8 bit channel, stored as 8 bit gray
 * <li>three 8 bit channels, stored as 8 bit RGB
 * <li>four 8 bit channels, stored as 8 bit RGBA, the last channel being alpha
 * <li>one 16 bit channel, stored as 16 bit gray
 * </ul>
 * {@link #checkLayout(BufferLayout)} rejects any other layout with a
 * {@link FormatMismatchException} when the access manager is built. Reading an image whose size,
 * bands or sample depth differ from the requested layout fails the same way.
 */
@Slf4j
public class ImageAccessFormat implements AccessFormat {

    /** Extension of region images. */
    public static final String EXTENSION = ".png";

    /** Default file name prefix. */
    public static final String DEFAULT_PREFIX = "region";

    private static final String FORMAT_NAME = "png";

    private final Path directory;
    private final String prefix;

    /**
     * @param directory the directory holding the region images, created if missing
     * @param prefix the file name prefix of region images
     * @throws IOException if the directory can't be created
     */
    public ImageAccessFormat(@NonNull Path directory, @NonNull String prefix) throws IOException {
        if (prefix.isBlank() || prefix.contains("/") || prefix.contains("\\")) {
            throw new IllegalArgumentException("Invalid region image prefix: '" + prefix + "'");
        }
        this.directory = directory;
        this.prefix = prefix;
        Files.createDirectories(directory);
        log.info("Storing regions as {}_<column>_<row>{} images in {}", prefix, EXTENSION, directory.toAbsolutePath());
    }

    public static ImageAccessFormat of(Path directory) throws IOException {
        return new ImageAccessFormat(directory, DEFAULT_PREFIX);
    }

    public Path directory() {
        return directory;
    }

    public String prefix() {
        return prefix;
    }

    public Path pathOf(RegionKey key) {
        return directory.resolve(resourceId(key));
    }

    @Override
    public String resourceId(RegionKey key) {
        return prefix + "_" + key.column() + "_" + key.row() + EXTENSION;
    }

    @Override
    public void checkLayout(BufferLayout layout) {
        imageType(layout);
    }

    @Override
    public Optional<RegionBuffer> read(RegionKey key, BufferLayout layout) throws IOException {
        Path path = pathOf(key);
        BufferedImage image;
        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ);
                ImageInputStream stream = ChannelImageInputStream.of(channel)) {
            image = decode(stream, key);
        } catch (NoSuchFileException e) {
            return Optional.empty();
        }
        return Optional.of(toBuffer(key, image, layout));
    }

    @Override
    public void write(RegionKey key, RegionBuffer buffer) throws PersistenceException {
        Objects.requireNonNull(buffer, "buffer cannot be null");
        BufferedImage image = toImage(buffer);
        Path temp = null;
        try {
            temp = Files.createTempFile(directory, "." + prefix, ".tmp");
            if (!ImageIO.write(image, FORMAT_NAME, temp.toFile())) {
                throw new PersistenceException(resourceId(key), "No PNG writer available");
            }
            FileAccessFormat.replace(temp, pathOf(key));
        } catch (IOException e) {
            FileAccessFormat.deleteQuietly(temp);
            if (e instanceof PersistenceException pe) {
                throw pe;
            }
            throw new PersistenceException(resourceId(key), "Failed to write region image", e);
        }
        log.trace("Wrote {}", pathOf(key));
    }

    @Override
    public boolean exists(RegionKey key) {
        return Files.isRegularFile(pathOf(key));
    }

    private BufferedImage decode(ImageInputStream stream, RegionKey key) throws IOException {
        Iterator<ImageReader> readers = ImageIO.getImageReaders(stream);
        if (!readers.hasNext()) {
            throw new PersistenceException(resourceId(key), "Not a readable image");
        }
        ImageReader reader = readers.next();
        try {
            reader.setInput(stream, true, true);
            return reader.read(0);
        } finally {
            reader.dispose();
        }
    }

    private RegionBuffer toBuffer(RegionKey key, BufferedImage image, BufferLayout layout) {
        Raster raster = image.getRaster();
        int bits = raster.getSampleModel().getSampleSize(0);
        BufferLayout stored =
                new BufferLayout(image.getWidth(), image.getHeight(), raster.getNumBands(), BufferLayout.bytesFor(bits));
        if (!stored.equals(layout)) {
            throw new FormatMismatchException("Region image " + resourceId(key) + " has another layout", layout, stored);
        }
        RegionBuffer buffer = RegionBuffer.allocate(layout, ChannelTuple.filled(layout.channels(), 0));
        long[] channels = new long[layout.channels()];
        for (int y = 0; y < layout.height(); y++) {
            for (int x = 0; x < layout.width(); x++) {
                for (int b = 0; b < channels.length; b++) {
                    channels[b] = raster.getSample(x, y, b);
                }
                buffer.set(x, y, ChannelTuple.of(channels));
            }
        }
        return buffer;
    }

    private static BufferedImage toImage(RegionBuffer buffer) {
        BufferLayout layout = buffer.layout();
        BufferedImage image = new BufferedImage(layout.width(), layout.height(), imageType(layout));
        WritableRaster raster = image.getRaster();
        for (int y = 0; y < layout.height(); y++) {
            for (int x = 0; x < layout.width(); x++) {
                for (int b = 0; b < layout.channels(); b++) {
                    raster.setSample(x, y, b, (int) buffer.getChannel(x, y, b));
                }
            }
        }
        return image;
    }

    /**
     * @return the {@link BufferedImage} type holding regions of {@code layout}
     * @throws FormatMismatchException if no PNG image type holds it
     */
    static int imageType(BufferLayout layout) {
        if (layout.bytesPerChannel() == 1) {
            switch (layout.channels()) {
                case 1:
                    return BufferedImage.TYPE_BYTE_GRAY;
                case 3:
                    return BufferedImage.TYPE_3BYTE_BGR;
                case 4:
                    return BufferedImage.TYPE_4BYTE_ABGR;
                default:
                    break;
            }
        } else if (layout.bytesPerChannel() == 2 && layout.channels() == 1) {
            return BufferedImage.TYPE_USHORT_GRAY;
        }
        throw new FormatMismatchException(
                "PNG regions hold 1, 3 or 4 channels of 8 bits or 1 channel of 16 bits",
                "8 bit gray, RGB, RGBA or 16 bit gray",
                layout.channels() + " channels of " + (8 * layout.bytesPerChannel()) + " bits");
    }

    @Override
    public String toString() {
        return "ImageAccessFormat[" + directory + ", prefix=" + prefix + "]";
    }
}
