package org.janelia.noise.image;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import javax.imageio.plugins.tiff.TIFFField;

/**
 * Opaque side channel that travels with a {@link CanonicalImage} from load to save.
 *
 * Holds descriptive properties about the source (path, format, type, band layout) and the raw
 * TIFF fields (geo referencing, GDAL metadata, image description) that must be written back
 * unchanged.  Noise synthesis and metrics never look at this data.
 */
public class MetadataEnvelope {

    public static final String SOURCE_PATH = "source_path";
    public static final String SOURCE_FORMAT = "source_format";
    public static final String SOURCE_MEDIA_TYPE = "source_media_type";
    public static final String SOURCE_DATA_TYPE = "source_data_type";
    public static final String SOURCE_BAND_LAYOUT = "source_band_layout";

    private final Map<String, String> properties;
    private final List<TIFFField> tiffFields;

    public MetadataEnvelope(final Map<String, String> properties,
                            final List<TIFFField> tiffFields) {
        this.properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        this.tiffFields = Collections.unmodifiableList(new ArrayList<>(tiffFields));
    }

    public static MetadataEnvelope empty() {
        return new MetadataEnvelope(Collections.emptyMap(), Collections.emptyList());
    }

    public Map<String, String> getProperties() {
        return properties;
    }

    public String getProperty(final String name) {
        return properties.get(name);
    }

    /**
     * @return raw TIFF fields to write back unchanged (empty for non-TIFF sources).
     */
    public List<TIFFField> getTiffFields() {
        return tiffFields;
    }

    public boolean hasTiffFields() {
        return ! tiffFields.isEmpty();
    }

    /**
     * @return copy of this envelope with the specified property added or replaced.
     */
    public MetadataEnvelope withProperty(final String name,
                                         final String value) {
        final Map<String, String> updatedProperties = new LinkedHashMap<>(properties);
        updatedProperties.put(name, value);
        return new MetadataEnvelope(updatedProperties, tiffFields);
    }

    @Override
    public String toString() {
        return "MetadataEnvelope{properties=" + properties + ", tiffFieldCount=" + tiffFields.size() + '}';
    }
}
