package org.janelia.noise.io;

import java.io.File;
import java.io.IOException;

import org.janelia.noise.image.CanonicalImage;
import org.janelia.noise.image.LoadedImage;
import org.janelia.noise.image.MetadataEnvelope;

/**
 * Describes methods required for all format specific codecs and
 * provides convenience {@link #build} method to construct codec instances.
 */
public interface ImageCodec {

    /**
     * @return decoded image along with any metadata that should be written back with derived images.
     *
     * @throws IOException
     *   if the file cannot be read.
     *
     * @throws CorruptDataException
     *   if the pixel payload cannot be decoded.
     *
     * @throws UnsupportedFormatException
     *   if the sample layout cannot be represented canonically.
     */
    LoadedImage decode(final File file)
            throws IOException, CorruptDataException, UnsupportedFormatException;

    /**
     * Writes the specified image to the specified file (which must already have an existing parent directory).
     *
     * @throws IOException
     *   if the file cannot be written.
     *
     * @throws UnsupportedFormatException
     *   if this codec's format cannot store the image.
     */
    void encode(final CanonicalImage image,
                final MetadataEnvelope metadata,
                final File file)
            throws IOException, UnsupportedFormatException;

    /**
     * @return codec instance for the specified format.
     */
    static ImageCodec build(final ImageFormat format,
                            final boolean tiffLzwCompression,
                            final float jpegQuality) {

        final ImageCodec codec;
        switch (format) {
            case TIFF:
                codec = new TiffCodec(tiffLzwCompression);
                break;
            case PNG:
                codec = StandardImageCodec.png();
                break;
            case JPEG:
                codec = StandardImageCodec.jpeg(jpegQuality);
                break;
            default:
                throw new UnsupportedFormatException("no codec available for " + format);
        }
        return codec;
    }

}
