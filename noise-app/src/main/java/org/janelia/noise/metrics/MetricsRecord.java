package org.janelia.noise.metrics;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.janelia.noise.image.DataType;
import org.janelia.noise.json.JsonUtils;

/**
 * Quality metrics for one (image, noise type, level) comparison.
 *
 * Aggregate values are arithmetic means over bands.  Bands with infinite PSNR or SNR are left
 * out of those means unless every band is identical, in which case the record is flagged as
 * identical and the aggregate PSNR and SNR are positive infinity.
 */
public class MetricsRecord
        implements Serializable {

    private final String imageId;
    private final String noiseType;
    private final Integer level;

    private final int bandCount;
    private final int height;
    private final int width;
    private final DataType dataType;

    private final double psnr;
    private final double ssim;
    private final double mse;
    private final double snr;
    private final boolean identical;
    private final QualityTier qualityTier;
    private final boolean ssimDownsampled;

    private final List<BandMetrics> bands;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private MetricsRecord() {
        this.imageId = null;
        this.noiseType = null;
        this.level = null;
        this.bandCount = 0;
        this.height = 0;
        this.width = 0;
        this.dataType = null;
        this.psnr = 0;
        this.ssim = 0;
        this.mse = 0;
        this.snr = 0;
        this.identical = false;
        this.qualityTier = null;
        this.ssimDownsampled = false;
        this.bands = new ArrayList<>();
    }

    public MetricsRecord(final String imageId,
                         final String noiseType,
                         final Integer level,
                         final int bandCount,
                         final int height,
                         final int width,
                         final DataType dataType,
                         final List<BandMetrics> bands,
                         final boolean ssimDownsampled) {
        this.imageId = imageId;
        this.noiseType = noiseType;
        this.level = level;
        this.bandCount = bandCount;
        this.height = height;
        this.width = width;
        this.dataType = dataType;
        this.bands = Collections.unmodifiableList(new ArrayList<>(bands));
        this.ssimDownsampled = ssimDownsampled;

        double psnrSum = 0;
        double snrSum = 0;
        double ssimSum = 0;
        double mseSum = 0;
        int differingBandCount = 0;
        for (final BandMetrics bandMetrics : bands) {
            ssimSum += bandMetrics.getSsim();
            mseSum += bandMetrics.getMse();
            if (! bandMetrics.isIdentical()) {
                psnrSum += bandMetrics.getPsnr();
                snrSum += bandMetrics.getSnr();
                differingBandCount++;
            }
        }

        final int n = bands.size();
        this.identical = (differingBandCount == 0);
        this.psnr = identical ? Double.POSITIVE_INFINITY : psnrSum / differingBandCount;
        this.snr = identical ? Double.POSITIVE_INFINITY : snrSum / differingBandCount;
        this.ssim = n == 0 ? 1.0 : ssimSum / n;
        this.mse = n == 0 ? 0.0 : mseSum / n;
        this.qualityTier = QualityTier.classify(this.psnr, this.ssim);
    }

    public String getImageId() {
        return imageId;
    }

    public String getNoiseType() {
        return noiseType;
    }

    public Integer getLevel() {
        return level;
    }

    public int getBandCount() {
        return bandCount;
    }

    public int getHeight() {
        return height;
    }

    public int getWidth() {
        return width;
    }

    /**
     * @return shape formatted as "(bands, height, width)".
     */
    public String getShapeString() {
        return "(" + bandCount + ", " + height + ", " + width + ")";
    }

    public DataType getDataType() {
        return dataType;
    }

    public double getPsnr() {
        return psnr;
    }

    public double getSsim() {
        return ssim;
    }

    public double getMse() {
        return mse;
    }

    public double getSnr() {
        return snr;
    }

    public boolean isIdentical() {
        return identical;
    }

    public QualityTier getQualityTier() {
        return qualityTier;
    }

    public boolean isSsimDownsampled() {
        return ssimDownsampled;
    }

    public List<BandMetrics> getBands() {
        return bands;
    }

    public String toJson() {
        return JSON_HELPER.toJson(this);
    }

    @Override
    public String toString() {
        return "MetricsRecord{imageId='" + imageId + "', noiseType='" + noiseType + "', level=" + level +
               ", shape=" + getShapeString() + ", psnr=" + psnr + ", ssim=" + ssim + ", mse=" + mse +
               ", snr=" + snr + ", qualityTier=" + qualityTier + '}';
    }

    public static MetricsRecord fromJson(final String json) {
        return JSON_HELPER.fromJson(json);
    }

    private static final JsonUtils.Helper<MetricsRecord> JSON_HELPER =
            new JsonUtils.Helper<>(MetricsRecord.class);
}
