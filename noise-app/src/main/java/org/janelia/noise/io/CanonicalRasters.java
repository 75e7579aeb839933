package org.janelia.noise.io;

import ij.process.ByteProcessor;
import ij.process.FloatProcessor;
import ij.process.ImageProcessor;
import ij.process.ShortProcessor;

import java.awt.Transparency;
import java.awt.color.ColorSpace;
import java.awt.image.BufferedImage;
import java.awt.image.ColorModel;
import java.awt.image.ComponentColorModel;
import java.awt.image.DataBuffer;
import java.awt.image.IndexColorModel;
import java.awt.image.Raster;
import java.awt.image.SampleModel;
import java.awt.image.WritableRaster;
import java.util.ArrayList;
import java.util.List;

import org.janelia.noise.image.CanonicalImage;
import org.janelia.noise.image.DataType;

/**
 * Converts between Java2D rasters and {@link CanonicalImage} instances.
 *
 * {@link #toCanonicalImage} and {@link #toBufferedImage} are exact inverses for every supported
 * data type and band count, so every codec shares one conversion in each direction.
 * Band order always follows raster band order, which puts colour components before alpha.
 */
public class CanonicalRasters {

    /**
     * @param  image        decoded image.
     * @param  description  source description for error messages (usually the file path).
     *
     * @return canonical (bands, height, width) form of the specified image.
     *
     * @throws UnsupportedFormatException
     *   if the image's sample type cannot be represented.
     */
    public static CanonicalImage toCanonicalImage(final BufferedImage image,
                                                  final String description)
            throws UnsupportedFormatException {

        BufferedImage source = image;
        final ColorModel colorModel = image.getColorModel();
        if (colorModel instanceof IndexColorModel) {
            final IndexColorModel indexColorModel = (IndexColorModel) colorModel;
            if (isGrayPalette(indexColorModel)) {
                return toGrayCanonicalImage(image.getRaster(), indexColorModel);
            }
            // colour palettes become 8-bit RGB(A) bands
            source = indexColorModel.convertToIntDiscrete(image.getRaster(), false);
        }

        return toCanonicalImage(source.getRaster(), description);
    }

    /**
     * @return true if every palette entry is an opaque gray (packed 1, 2 and 4-bit gray images use such palettes).
     */
    public static boolean isGrayPalette(final IndexColorModel colorModel) {
        for (int i = 0; i < colorModel.getMapSize(); i++) {
            final int red = colorModel.getRed(i);
            if ((red != colorModel.getGreen(i)) || (red != colorModel.getBlue(i)) || (colorModel.getAlpha(i) != 255)) {
                return false;
            }
        }
        return true;
    }

    private static CanonicalImage toGrayCanonicalImage(final Raster raster,
                                                       final IndexColorModel colorModel) {
        final int width = raster.getWidth();
        final int height = raster.getHeight();
        final int[] indexes = raster.getSamples(raster.getMinX(), raster.getMinY(), width, height, 0, (int[]) null);
        final byte[] grays = new byte[indexes.length];
        for (int i = 0; i < indexes.length; i++) {
            grays[i] = (byte) colorModel.getRed(indexes[i]);
        }
        return CanonicalImage.fromSingleBand(new ByteProcessor(width, height, grays));
    }

    /**
     * @return canonical form of the specified raster.
     *
     * @throws UnsupportedFormatException
     *   if the raster's sample type cannot be represented.
     */
    public static CanonicalImage toCanonicalImage(final Raster raster,
                                                  final String description)
            throws UnsupportedFormatException {

        final DataType dataType = getDataType(raster.getSampleModel(), description);

        final int width = raster.getWidth();
        final int height = raster.getHeight();
        final int minX = raster.getMinX();
        final int minY = raster.getMinY();
        final int numberOfBands = raster.getNumBands();

        final List<ImageProcessor> bands = new ArrayList<>(numberOfBands);
        int[] intSamples = null;
        for (int b = 0; b < numberOfBands; b++) {
            switch (dataType) {
                case UINT8:
                    intSamples = raster.getSamples(minX, minY, width, height, b, intSamples);
                    final byte[] bytePixels = new byte[intSamples.length];
                    for (int i = 0; i < intSamples.length; i++) {
                        bytePixels[i] = (byte) intSamples[i];
                    }
                    bands.add(new ByteProcessor(width, height, bytePixels, null));
                    break;
                case UINT16:
                    intSamples = raster.getSamples(minX, minY, width, height, b, intSamples);
                    final short[] shortPixels = new short[intSamples.length];
                    for (int i = 0; i < intSamples.length; i++) {
                        shortPixels[i] = (short) intSamples[i];
                    }
                    bands.add(new ShortProcessor(width, height, shortPixels, null));
                    break;
                default:
                    final float[] floatPixels = raster.getSamples(minX, minY, width, height, b, (float[]) null);
                    bands.add(new FloatProcessor(width, height, floatPixels, null));
                    break;
            }
        }

        return new CanonicalImage(bands);
    }

    /**
     * @return image whose raster holds exactly the samples of the specified canonical image.
     */
    public static BufferedImage toBufferedImage(final CanonicalImage image) {

        final int numberOfBands = image.getBandCount();
        final ColorSpace colorSpace;
        final boolean hasAlpha;
        switch (numberOfBands) {
            case 1:
                colorSpace = ColorSpace.getInstance(ColorSpace.CS_GRAY);
                hasAlpha = false;
                break;
            case 2:
                colorSpace = ColorSpace.getInstance(ColorSpace.CS_GRAY);
                hasAlpha = true;
                break;
            case 3:
                colorSpace = ColorSpace.getInstance(ColorSpace.CS_sRGB);
                hasAlpha = false;
                break;
            case 4:
                colorSpace = ColorSpace.getInstance(ColorSpace.CS_sRGB);
                hasAlpha = true;
                break;
            default:
                colorSpace = new MultibandColorSpace(numberOfBands);
                hasAlpha = false;
                break;
        }

        final ColorModel colorModel = new ComponentColorModel(colorSpace,
                                                              hasAlpha,
                                                              false,
                                                              hasAlpha ? Transparency.TRANSLUCENT : Transparency.OPAQUE,
                                                              image.getDataType().getDataBufferType());
        final int width = image.getWidth();
        final int height = image.getHeight();
        final WritableRaster raster = colorModel.createCompatibleWritableRaster(width, height);

        final int n = image.getPixelsPerBand();
        final int[] intSamples = image.getDataType().isIntegral() ? new int[n] : null;
        for (int b = 0; b < numberOfBands; b++) {
            final ImageProcessor band = image.getBand(b);
            if (intSamples == null) {
                raster.setSamples(0, 0, width, height, b, (float[]) band.getPixels());
            } else {
                for (int i = 0; i < n; i++) {
                    intSamples[i] = band.get(i);
                }
                raster.setSamples(0, 0, width, height, b, intSamples);
            }
        }

        return new BufferedImage(colorModel, raster, false, null);
    }

    /**
     * @return canonical data type for the specified sample model.
     *
     * @throws UnsupportedFormatException
     *   for signed integer, 32-bit integer and 64-bit floating point samples.
     */
    public static DataType getDataType(final SampleModel sampleModel,
                                       final String description)
            throws UnsupportedFormatException {

        int maxSampleSize = 0;
        for (final int sampleSize : sampleModel.getSampleSize()) {
            maxSampleSize = Math.max(maxSampleSize, sampleSize);
        }

        final int transferType = sampleModel.getDataType();
        final DataType dataType;
        switch (transferType) {
            case DataBuffer.TYPE_BYTE:
            case DataBuffer.TYPE_USHORT:
            case DataBuffer.TYPE_INT:
                if (maxSampleSize <= 8) {
                    dataType = DataType.UINT8;
                } else if (maxSampleSize <= 16) {
                    dataType = DataType.UINT16;
                } else {
                    throw new UnsupportedFormatException(
                            maxSampleSize + "-bit integer samples are not supported for '" + description + "'");
                }
                break;
            case DataBuffer.TYPE_FLOAT:
                dataType = DataType.FLOAT32;
                break;
            case DataBuffer.TYPE_SHORT:
                throw new UnsupportedFormatException(
                        "signed 16-bit samples are not supported for '" + description + "'");
            case DataBuffer.TYPE_DOUBLE:
                throw new UnsupportedFormatException(
                        "64-bit floating point samples are not supported for '" + description + "'");
            default:
                throw new UnsupportedFormatException(
                        "sample data type " + transferType + " is not supported for '" + description + "'");
        }
        return dataType;
    }

}
