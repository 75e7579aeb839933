package org.janelia.noise.io;

import ij.ImageStack;

import java.awt.image.BufferedImage;
import java.awt.image.Raster;
import java.awt.image.RenderedImage;
import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.ImageTypeSpecifier;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.metadata.IIOInvalidTreeException;
import javax.imageio.metadata.IIOMetadata;
import javax.imageio.plugins.tiff.BaselineTIFFTagSet;
import javax.imageio.plugins.tiff.TIFFDirectory;
import javax.imageio.plugins.tiff.TIFFField;
import javax.imageio.plugins.tiff.TIFFImageReadParam;
import javax.imageio.stream.ImageInputStream;
import javax.imageio.stream.ImageOutputStream;

import org.janelia.noise.image.CanonicalImage;
import org.janelia.noise.image.LoadedImage;
import org.janelia.noise.image.MetadataEnvelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Codec for multiband TIFF files.
 *
 * Multi-sample images (chunky or planar) are decoded band by band from the first page.
 * Multi-page files whose pages all hold a single band with the same size and type are
 * decoded as one band per page.  Images are always written as a single multi-sample IFD.
 *
 * Geo referencing, GDAL and description fields listed in {@link #PASSTHROUGH_TAG_NUMBERS}
 * are captured on decode and written back unchanged on encode.
 */
public class TiffCodec
        implements ImageCodec {

    public static final int TAG_MODEL_PIXEL_SCALE = 33550;
    public static final int TAG_MODEL_TIEPOINT = 33922;
    public static final int TAG_MODEL_TRANSFORMATION = 34264;
    public static final int TAG_GEO_KEY_DIRECTORY = 34735;
    public static final int TAG_GEO_DOUBLE_PARAMS = 34736;
    public static final int TAG_GEO_ASCII_PARAMS = 34737;
    public static final int TAG_GDAL_METADATA = 42112;
    public static final int TAG_GDAL_NODATA = 42113;

    public static final Set<Integer> PASSTHROUGH_TAG_NUMBERS = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
            BaselineTIFFTagSet.TAG_IMAGE_DESCRIPTION,
            TAG_MODEL_PIXEL_SCALE,
            TAG_MODEL_TIEPOINT,
            TAG_MODEL_TRANSFORMATION,
            TAG_GEO_KEY_DIRECTORY,
            TAG_GEO_DOUBLE_PARAMS,
            TAG_GEO_ASCII_PARAMS,
            TAG_GDAL_METADATA,
            TAG_GDAL_NODATA)));

    public static final String LZW_COMPRESSION = "LZW";

    private final boolean lzwCompression;

    public TiffCodec() {
        this(true);
    }

    /**
     * @param  lzwCompression  indicates whether written files should be LZW compressed (true)
     *                         or uncompressed (false).
     */
    public TiffCodec(final boolean lzwCompression) {
        this.lzwCompression = lzwCompression;
    }

    @Override
    public LoadedImage decode(final File file)
            throws IOException, CorruptDataException, UnsupportedFormatException {

        final String path = file.getAbsolutePath();

        final CanonicalImage image;
        final List<TIFFField> passthroughFields;
        final String bandLayout;

        try (final ImageInputStream inputStream = ImageIO.createImageInputStream(file)) {

            if (inputStream == null) {
                throw new IOException("failed to open input stream for '" + path + "'");
            }

            final ImageReader reader = StandardImageCodec.getReader(ImageFormat.TIFF);
            try {
                reader.setInput(inputStream, false, false);

                final TIFFImageReadParam readParam = new TIFFImageReadParam();
                readParam.setReadUnknownTags(true);

                final List<IIOImage> pages = new ArrayList<>();
                final IIOImage firstPage = reader.readAll(0, readParam);
                pages.add(firstPage);

                final int numberOfPages = reader.getNumImages(true);
                final RenderedImage firstRendered = firstPage.getRenderedImage();
                if ((numberOfPages > 1) && (firstRendered.getSampleModel().getNumBands() == 1)) {
                    for (int pageIndex = 1; pageIndex < numberOfPages; pageIndex++) {
                        pages.add(reader.readAll(pageIndex, readParam));
                    }
                }

                passthroughFields = getPassthroughFields(firstPage.getMetadata());

                final CanonicalImage stackImage = pages.size() > 1 ? buildPageStack(pages, path) : null;
                if (stackImage != null) {
                    image = stackImage;
                    bandLayout = "pages";
                } else {
                    if (numberOfPages > 1) {
                        LOG.debug("decode: using first of {} pages in {}", numberOfPages, path);
                    }
                    image = CanonicalRasters.toCanonicalImage(toBufferedImage(firstRendered), path);
                    bandLayout = "samples";
                }

            } catch (final UnsupportedFormatException e) {
                throw e;
            } catch (final IOException | RuntimeException e) {
                throw new CorruptDataException("failed to decode TIFF pixels for '" + path + "'", e);
            } finally {
                reader.dispose();
            }
        }

        final Map<String, String> properties = new LinkedHashMap<>();
        properties.put(MetadataEnvelope.SOURCE_BAND_LAYOUT, bandLayout);

        LOG.debug("decode: read {} with {} passthrough fields from {}", image, passthroughFields.size(), path);

        return new LoadedImage(image, new MetadataEnvelope(properties, passthroughFields));
    }

    @Override
    public void encode(final CanonicalImage image,
                       final MetadataEnvelope metadata,
                       final File file)
            throws IOException, UnsupportedFormatException {

        final BufferedImage bufferedImage = CanonicalRasters.toBufferedImage(image);

        final ImageWriter writer = ImageIO.getImageWritersByFormatName(ImageFormat.TIFF.getImageIOFormatName()).next();
        try (final ImageOutputStream outputStream = ImageIO.createImageOutputStream(file)) {

            if (outputStream == null) {
                throw new IOException("failed to open output stream for '" + file.getAbsolutePath() + "'");
            }

            writer.setOutput(outputStream);

            final ImageWriteParam writeParam = writer.getDefaultWriteParam();
            if (lzwCompression) {
                writeParam.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
                writeParam.setCompressionType(LZW_COMPRESSION);
            } else {
                writeParam.setCompressionMode(ImageWriteParam.MODE_DISABLED);
            }

            IIOMetadata imageMetadata = null;
            if ((metadata != null) && metadata.hasTiffFields()) {
                imageMetadata = buildImageMetadata(writer, bufferedImage, writeParam, metadata.getTiffFields());
            }

            writer.write(null, new IIOImage(bufferedImage, null, imageMetadata), writeParam);

        } finally {
            writer.dispose();
        }

        LOG.debug("encode: wrote {} to {}", image, file.getAbsolutePath());
    }

    /**
     * @return passthrough fields found in the specified TIFF image metadata.
     */
    static List<TIFFField> getPassthroughFields(final IIOMetadata imageMetadata)
            throws IIOInvalidTreeException {

        final List<TIFFField> fields = new ArrayList<>();
        if (imageMetadata != null) {
            final TIFFDirectory directory = TIFFDirectory.createFromMetadata(imageMetadata);
            for (final TIFFField field : directory.getTIFFFields()) {
                if (PASSTHROUGH_TAG_NUMBERS.contains(field.getTagNumber())) {
                    fields.add(field);
                }
            }
        }
        return fields;
    }

    private static IIOMetadata buildImageMetadata(final ImageWriter writer,
                                                  final BufferedImage bufferedImage,
                                                  final ImageWriteParam writeParam,
                                                  final List<TIFFField> fields)
            throws IIOInvalidTreeException {

        final IIOMetadata defaultMetadata =
                writer.getDefaultImageMetadata(ImageTypeSpecifier.createFromRenderedImage(bufferedImage),
                                               writeParam);
        final TIFFDirectory directory = TIFFDirectory.createFromMetadata(defaultMetadata);
        for (final TIFFField field : fields) {
            directory.addTIFFField(field);
        }
        return directory.getAsMetadata();
    }

    /**
     * @return image with one band per page, or null if the pages cannot be stacked.
     */
    private static CanonicalImage buildPageStack(final List<IIOImage> pages,
                                                 final String path)
            throws UnsupportedFormatException {

        ImageStack stack = null;
        CanonicalImage firstPageImage = null;
        for (final IIOImage page : pages) {
            final CanonicalImage pageImage =
                    CanonicalRasters.toCanonicalImage(toBufferedImage(page.getRenderedImage()), path);
            if (firstPageImage == null) {
                firstPageImage = pageImage;
                stack = new ImageStack(pageImage.getWidth(), pageImage.getHeight());
            } else if ((pageImage.getBandCount() != 1) ||
                       (pageImage.getWidth() != firstPageImage.getWidth()) ||
                       (pageImage.getHeight() != firstPageImage.getHeight()) ||
                       (pageImage.getDataType() != firstPageImage.getDataType())) {
                return null;
            }
            stack.addSlice("page_" + (stack.getSize() + 1), pageImage.getBand(0));
        }
        return (firstPageImage.getBandCount() == 1) ? CanonicalImage.fromStack(stack) : null;
    }

    private static BufferedImage toBufferedImage(final RenderedImage renderedImage) {
        final BufferedImage bufferedImage;
        if (renderedImage instanceof BufferedImage) {
            bufferedImage = (BufferedImage) renderedImage;
        } else {
            final Raster data = renderedImage.getData();
            bufferedImage = new BufferedImage(renderedImage.getColorModel(),
                                              data.createCompatibleWritableRaster(),
                                              renderedImage.getColorModel().isAlphaPremultiplied(),
                                              null);
            bufferedImage.getRaster().setRect(data);
        }
        return bufferedImage;
    }

    private static final Logger LOG = LoggerFactory.getLogger(TiffCodec.class);
}
