package org.janelia.noise.io;

import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageInputStream;
import javax.imageio.stream.ImageOutputStream;
import javax.imageio.stream.MemoryCacheImageOutputStream;

import org.janelia.noise.image.CanonicalImage;
import org.janelia.noise.image.DataType;
import org.janelia.noise.image.LoadedImage;
import org.janelia.noise.image.MetadataEnvelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Codec for PNG and JPEG files using the standard Image I/O plug-ins.
 * Neither format carries passthrough metadata.
 */
public class StandardImageCodec
        implements ImageCodec {

    public static final float DEFAULT_JPEG_QUALITY = 0.95f;

    public static StandardImageCodec png() {
        return new StandardImageCodec(ImageFormat.PNG, null);
    }

    public static StandardImageCodec jpeg(final float quality) {
        return new StandardImageCodec(ImageFormat.JPEG, quality);
    }

    private final ImageFormat format;
    private final Float jpegQuality;

    private StandardImageCodec(final ImageFormat format,
                               final Float jpegQuality) {
        this.format = format;
        this.jpegQuality = jpegQuality;
    }

    @Override
    public LoadedImage decode(final File file)
            throws IOException, CorruptDataException, UnsupportedFormatException {

        final String path = file.getAbsolutePath();
        final BufferedImage bufferedImage;

        try (final ImageInputStream inputStream = ImageIO.createImageInputStream(file)) {

            if (inputStream == null) {
                throw new IOException("failed to open input stream for '" + path + "'");
            }

            final ImageReader reader = getReader(format);
            try {
                reader.setInput(inputStream, true, true);
                bufferedImage = reader.read(0);
            } catch (final IOException | RuntimeException e) {
                throw new CorruptDataException("failed to decode " + format + " pixels for '" + path + "'", e);
            } finally {
                reader.dispose();
            }
        }

        final CanonicalImage image = CanonicalRasters.toCanonicalImage(bufferedImage, path);

        final Map<String, String> properties = new LinkedHashMap<>();
        properties.put(MetadataEnvelope.SOURCE_BAND_LAYOUT, "interleaved");

        return new LoadedImage(image, new MetadataEnvelope(properties, Collections.emptyList()));
    }

    @Override
    public void encode(final CanonicalImage image,
                       final MetadataEnvelope metadata,
                       final File file)
            throws IOException, UnsupportedFormatException {

        validateStorable(image, file);

        final BufferedImage bufferedImage = CanonicalRasters.toBufferedImage(image);
        try (final ImageOutputStream outputStream = ImageIO.createImageOutputStream(file)) {
            if (outputStream == null) {
                throw new IOException("failed to open output stream for '" + file.getAbsolutePath() + "'");
            }
            writeImage(bufferedImage, format, jpegQuality, outputStream);
        }

        LOG.debug("encode: wrote {} {} to {}", format, image, file.getAbsolutePath());
    }

    /**
     * @throws UnsupportedFormatException
     *   if this codec's format cannot store the specified image.
     */
    void validateStorable(final CanonicalImage image,
                          final File file)
            throws UnsupportedFormatException {

        final DataType dataType = image.getDataType();
        final int numberOfBands = image.getBandCount();

        final boolean storable;
        if (format == ImageFormat.JPEG) {
            storable = (dataType == DataType.UINT8) && ((numberOfBands == 1) || (numberOfBands == 3));
        } else {
            storable = (dataType != DataType.FLOAT32) && (numberOfBands <= 4);
        }

        if (! storable) {
            throw new UnsupportedFormatException(
                    format + " cannot store " + numberOfBands + " band " + dataType + " image " +
                    image.getShapeString() + " as '" + file.getAbsolutePath() + "', use TIFF instead");
        }
    }

    /**
     * Encodes the specified 8-bit image as an in-memory JPEG and decodes it again.
     *
     * @param  image    image to degrade (gray or RGB).
     * @param  quality  JPEG quality between 0 and 1.
     *
     * @return decoded JPEG image.
     */
    public static BufferedImage jpegRoundTrip(final BufferedImage image,
                                              final float quality)
            throws IOException {

        final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (final ImageOutputStream outputStream = new MemoryCacheImageOutputStream(bytes)) {
            writeImage(image, ImageFormat.JPEG, quality, outputStream);
        }

        final BufferedImage decoded = ImageIO.read(new ByteArrayInputStream(bytes.toByteArray()));
        if (decoded == null) {
            throw new IOException("failed to decode in-memory JPEG");
        }
        return decoded;
    }

    private static void writeImage(final BufferedImage image,
                                   final ImageFormat format,
                                   final Float quality,
                                   final ImageOutputStream outputStream)
            throws IOException {

        final Iterator<ImageWriter> writersForFormat = ImageIO.getImageWritersByFormatName(format.getImageIOFormatName());
        if ((writersForFormat == null) || (! writersForFormat.hasNext())) {
            throw new UnsupportedFormatException("no Image I/O writer available for " + format);
        }

        final ImageWriter writer = writersForFormat.next();
        try {
            writer.setOutput(outputStream);
            ImageWriteParam param = null;
            if ((format == ImageFormat.JPEG) && (quality != null)) {
                param = writer.getDefaultWriteParam();
                param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
                param.setCompressionQuality(quality);
            }
            writer.write(null, new IIOImage(image, null, null), param);
        } finally {
            writer.dispose();
        }
    }

    static ImageReader getReader(final ImageFormat format)
            throws UnsupportedFormatException {
        final Iterator<ImageReader> readers = ImageIO.getImageReadersByFormatName(format.getImageIOFormatName());
        if (! readers.hasNext()) {
            throw new UnsupportedFormatException("no Image I/O reader available for " + format);
        }
        return readers.next();
    }

    private static final Logger LOG = LoggerFactory.getLogger(StandardImageCodec.class);
}
