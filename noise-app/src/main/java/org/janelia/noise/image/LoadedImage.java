package org.janelia.noise.image;

/**
 * Result of loading an image file: the canonical pixels plus the side channel metadata
 * needed to write a derived image back in the same manner.
 */
public class LoadedImage {

    private final CanonicalImage image;
    private final MetadataEnvelope metadata;

    public LoadedImage(final CanonicalImage image,
                       final MetadataEnvelope metadata) {
        this.image = image;
        this.metadata = metadata;
    }

    public CanonicalImage getImage() {
        return image;
    }

    public MetadataEnvelope getMetadata() {
        return metadata;
    }

    @Override
    public String toString() {
        return "LoadedImage{image=" + image + ", metadata=" + metadata + '}';
    }
}
