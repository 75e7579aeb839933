package org.janelia.noise.metrics;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Coarse quality classification derived from PSNR and SSIM.
 * Tiers are declared from best to worst.
 */
public enum QualityTier {

    EXCELLENT(35.0, 0.95),
    GOOD(25.0, 0.85),
    MODERATE(15.0, 0.70),
    POOR(Double.NEGATIVE_INFINITY, Double.NEGATIVE_INFINITY);

    private final double minPsnr;
    private final double minSsim;

    QualityTier(final double minPsnr,
                final double minSsim) {
        this.minPsnr = minPsnr;
        this.minSsim = minSsim;
    }

    public double getMinPsnr() {
        return minPsnr;
    }

    public double getMinSsim() {
        return minSsim;
    }

    @JsonValue
    public String getName() {
        return name().toLowerCase(Locale.US);
    }

    public static QualityTier forPsnr(final double psnr) {
        QualityTier tier = POOR;
        for (final QualityTier candidate : values()) {
            if (psnr >= candidate.minPsnr) {
                tier = candidate;
                break;
            }
        }
        return tier;
    }

    public static QualityTier forSsim(final double ssim) {
        QualityTier tier = POOR;
        for (final QualityTier candidate : values()) {
            if (ssim >= candidate.minSsim) {
                tier = candidate;
                break;
            }
        }
        return tier;
    }

    /**
     * @return the lower of the tiers implied by the specified PSNR and SSIM values.
     */
    public static QualityTier classify(final double psnr,
                                       final double ssim) {
        final QualityTier psnrTier = forPsnr(psnr);
        final QualityTier ssimTier = forSsim(ssim);
        return psnrTier.ordinal() > ssimTier.ordinal() ? psnrTier : ssimTier;
    }

}
