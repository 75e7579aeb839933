package org.janelia.noise.json;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Jackson setup shared by configuration, metrics and report classes.
 *
 * Only fields are (de)serialized, so value classes can expose derived getters without
 * those getters leaking into the written files.  Non-finite doubles are written as the
 * strings "Infinity", "-Infinity" and "NaN" and read back from the same strings.
 */
public class JsonUtils {

    public static final ObjectMapper MAPPER = new ObjectMapper().
            setSerializationInclusion(JsonInclude.Include.NON_NULL).
            setVisibility(PropertyAccessor.FIELD, JsonAutoDetect.Visibility.ANY).
            setVisibility(PropertyAccessor.GETTER, JsonAutoDetect.Visibility.NONE).
            setVisibility(PropertyAccessor.IS_GETTER, JsonAutoDetect.Visibility.NONE).
            setVisibility(PropertyAccessor.SETTER, JsonAutoDetect.Visibility.NONE).
            configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false).
            setDefaultPrettyPrinter(new DefaultPrettyPrinter().withArrayIndenter(DefaultIndenter.SYSTEM_LINEFEED_INSTANCE)).
            enable(SerializationFeature.INDENT_OUTPUT);

    /**
     * Writes the specified value to the specified path, creating missing parent directories.
     */
    public static void writeJsonFile(final Object value,
                                     final Path path)
            throws IOException {
        final Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (final Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            MAPPER.writeValue(writer, value);
        }
    }

    /**
     * Typed reader and writer for one value type (simple class or generic collection).
     * Parse failures are reported as {@link IllegalArgumentException}s.
     */
    public static class Helper<T> {

        private final ObjectReader reader;
        private final ObjectWriter writer;

        public Helper(final Class<T> valueType) {
            this.reader = MAPPER.readerFor(valueType);
            this.writer = MAPPER.writerFor(valueType);
        }

        public Helper(final TypeReference<T> typeReference) {
            this.reader = MAPPER.readerFor(typeReference);
            this.writer = MAPPER.writerFor(typeReference);
        }

        public String toJson(final T value)
                throws IllegalArgumentException {
            try {
                return writer.writeValueAsString(value);
            } catch (final IOException e) {
                throw new IllegalArgumentException("failed to serialize " + value.getClass().getName(), e);
            }
        }

        public T fromJson(final String json)
                throws IllegalArgumentException {
            try {
                return reader.readValue(json);
            } catch (final IOException e) {
                throw new IllegalArgumentException("failed to parse json", e);
            }
        }

        public T fromJson(final Reader json)
                throws IllegalArgumentException {
            try {
                return reader.readValue(json);
            } catch (final IOException e) {
                throw new IllegalArgumentException("failed to parse json", e);
            }
        }

        /**
         * @throws IOException
         *   if the file cannot be read.
         *
         * @throws IllegalArgumentException
         *   if the file content cannot be parsed.
         */
        public T readJsonFile(final Path path)
                throws IOException, IllegalArgumentException {
            try (final Reader fileReader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
                return fromJson(fileReader);
            }
        }
    }

}
