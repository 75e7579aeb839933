package org.janelia.noise.io;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import org.janelia.noise.image.CanonicalImage;
import org.janelia.noise.image.LoadedImage;
import org.janelia.noise.image.MetadataEnvelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads image files into canonical (bands, height, width) form and saves canonical images back to disk.
 *
 * Source formats are identified by content, so a TIFF named "x.png" is still read as a TIFF.
 * Target formats are identified by the target file's extension.
 * Instances are immutable and can be shared across threads.
 */
public class CanonicalImageIO {

    private final boolean tiffLzwCompression;
    private final float jpegQuality;

    /**
     * Constructs an adapter that writes LZW compressed TIFFs and 95% quality JPEGs.
     */
    public CanonicalImageIO() {
        this(true, StandardImageCodec.DEFAULT_JPEG_QUALITY);
    }

    public CanonicalImageIO(final boolean tiffLzwCompression,
                            final float jpegQuality) {
        if ((jpegQuality < 0f) || (jpegQuality > 1f)) {
            throw new IllegalArgumentException("JPEG quality must be between 0 and 1");
        }
        this.tiffLzwCompression = tiffLzwCompression;
        this.jpegQuality = jpegQuality;
    }

    /**
     * @return the image in the specified file along with its passthrough metadata.
     *
     * @throws IOException
     *   if the file cannot be read.
     *
     * @throws UnsupportedFormatException
     *   if the file type or its sample layout is not supported.
     *
     * @throws CorruptDataException
     *   if the file looks like a supported format but cannot be decoded.
     */
    public LoadedImage load(final Path path)
            throws IOException, UnsupportedFormatException, CorruptDataException {

        final File file = path.toFile();
        final ImageFormat format = detectFormat(path);
        final ImageCodec codec = ImageCodec.build(format, tiffLzwCompression, jpegQuality);

        final LoadedImage decoded = codec.decode(file);
        final CanonicalImage image = decoded.getImage();
        final MetadataEnvelope metadata = decoded.getMetadata()
                .withProperty(MetadataEnvelope.SOURCE_PATH, file.getAbsolutePath())
                .withProperty(MetadataEnvelope.SOURCE_FORMAT, format.name())
                .withProperty(MetadataEnvelope.SOURCE_MEDIA_TYPE, format.getMediaType().toString())
                .withProperty(MetadataEnvelope.SOURCE_DATA_TYPE, image.getDataType().name());

        LOG.debug("load: decoded {} from {}", image, file.getAbsolutePath());

        return new LoadedImage(image, metadata);
    }

    /**
     * Saves the specified image in the format implied by the target path's extension,
     * creating missing parent directories and replacing any existing file.
     *
     * @param  image     image to save.
     * @param  metadata  passthrough metadata (may be null).
     * @param  path      target path.
     *
     * @throws IOException
     *   if the file cannot be written.
     *
     * @throws UnsupportedFormatException
     *   if the extension is unknown or the format cannot store the image.
     */
    public void save(final CanonicalImage image,
                     final MetadataEnvelope metadata,
                     final Path path)
            throws IOException, UnsupportedFormatException {

        final File file = path.toFile();
        final ImageFormat format = ImageFormat.forFileName(file.getName());
        if (format == null) {
            throw new UnsupportedFormatException("cannot determine output format for '" + file.getAbsolutePath() +
                                                 "', supported extensions are tif, tiff, png, jpg and jpeg");
        }

        final ImageCodec codec = ImageCodec.build(format, tiffLzwCompression, jpegQuality);
        if (codec instanceof StandardImageCodec) {
            ((StandardImageCodec) codec).validateStorable(image, file);
        }

        prepareFileForWrite(file);

        codec.encode(image, metadata == null ? MetadataEnvelope.empty() : metadata, file);

        LOG.debug("save: wrote {} to {}", image, file.getAbsolutePath());
    }

    /**
     * @return format of the specified file based upon its content
     *         (the file name is only consulted to classify unrecognized content).
     *
     * @throws IOException
     *   if the file cannot be read.
     *
     * @throws UnsupportedFormatException
     *   if neither the content nor the file name identify a supported format.
     *
     * @throws CorruptDataException
     *   if the file name identifies a supported format but the content does not match it.
     */
    public static ImageFormat detectFormat(final Path path)
            throws IOException, UnsupportedFormatException, CorruptDataException {

        final byte[] header = new byte[ImageFormat.SIGNATURE_LENGTH];
        int length = 0;
        try (final InputStream in = Files.newInputStream(path)) {
            int count;
            while ((length < header.length) && ((count = in.read(header, length, header.length - length)) > 0)) {
                length += count;
            }
        }

        ImageFormat format = ImageFormat.sniff(header, length);

        if (format == null) {
            final ImageFormat formatForName = ImageFormat.forFileName(path.getFileName().toString());
            if (formatForName == null) {
                throw new UnsupportedFormatException("unsupported file type for '" + path.toAbsolutePath() + "'");
            } else {
                throw new CorruptDataException("content of '" + path.toAbsolutePath() +
                                               "' is not a valid " + formatForName + " container");
            }
        }

        return format;
    }

    /**
     * Creates any missing parent directories for the specified file and removes any existing copy of it.
     *
     * @throws IOException
     *   if the directories cannot be created or the existing file cannot be removed.
     */
    public static void prepareFileForWrite(final File file)
            throws IOException {

        final File parentDirectory = file.getAbsoluteFile().getParentFile();
        if (parentDirectory != null) {
            Files.createDirectories(parentDirectory.toPath());
        }

        Files.deleteIfExists(file.toPath());
    }

    private static final Logger LOG = LoggerFactory.getLogger(CanonicalImageIO.class);
}
