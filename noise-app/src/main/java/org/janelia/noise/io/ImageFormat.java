package org.janelia.noise.io;

import com.google.common.net.MediaType;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * File formats understood by {@link CanonicalImageIO}.
 */
public enum ImageFormat {

    TIFF(MediaType.TIFF, "tiff", "tif", "tiff"),
    PNG(MediaType.PNG, "png", "png"),
    JPEG(MediaType.JPEG, "jpeg", "jpg", "jpeg");

    private static final byte[] PNG_SIGNATURE = {
            (byte) 0x89, 'P', 'N', 'G', '\r', '\n', 0x1A, '\n'
    };

    /** Number of leading bytes needed by {@link #sniff}. */
    public static final int SIGNATURE_LENGTH = PNG_SIGNATURE.length;

    private final MediaType mediaType;
    private final String imageIOFormatName;
    private final List<String> extensions;

    ImageFormat(final MediaType mediaType,
                final String imageIOFormatName,
                final String... extensions) {
        this.mediaType = mediaType;
        this.imageIOFormatName = imageIOFormatName;
        this.extensions = Collections.unmodifiableList(Arrays.asList(extensions));
    }

    /**
     * @return media type recorded in loaded image metadata.
     */
    public MediaType getMediaType() {
        return mediaType;
    }

    public String getImageIOFormatName() {
        return imageIOFormatName;
    }

    /**
     * @return extension (without dot) used when writing files of this format.
     */
    public String getDefaultExtension() {
        return extensions.get(0);
    }

    /**
     * @return format identified by the leading bytes of a file, or null if the content is not recognized.
     */
    public static ImageFormat sniff(final byte[] header,
                                    final int length) {
        ImageFormat format = null;
        if (length >= 4) {
            if ((header[0] == 'I') && (header[1] == 'I') && (header[2] == 42) && (header[3] == 0)) {
                format = TIFF;
            } else if ((header[0] == 'M') && (header[1] == 'M') && (header[2] == 0) && (header[3] == 42)) {
                format = TIFF;
            } else if (((header[0] & 0xFF) == 0xFF) && ((header[1] & 0xFF) == 0xD8) && ((header[2] & 0xFF) == 0xFF)) {
                format = JPEG;
            } else if (length >= PNG_SIGNATURE.length) {
                boolean isPng = true;
                for (int i = 0; i < PNG_SIGNATURE.length; i++) {
                    if (header[i] != PNG_SIGNATURE[i]) {
                        isPng = false;
                        break;
                    }
                }
                if (isPng) {
                    format = PNG;
                }
            }
        }
        return format;
    }

    /**
     * @return format implied by the specified file name's extension, or null if the extension is not recognized.
     */
    public static ImageFormat forFileName(final String fileName) {
        ImageFormat format = null;
        final int dotIndex = fileName.lastIndexOf('.');
        if (dotIndex > -1) {
            final String extension = fileName.substring(dotIndex + 1).toLowerCase(Locale.US);
            for (final ImageFormat candidate : values()) {
                if (candidate.extensions.contains(extension)) {
                    format = candidate;
                    break;
                }
            }
        }
        return format;
    }

}
