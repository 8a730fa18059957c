package com.kapi.util;

import com.fasterxml.jackson.annotation.JsonAutoDetect.Visibility;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.fasterxml.jackson.dataformat.xml.ser.ToXmlGenerator;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.kapi.error.DecodeException;
import com.kapi.error.UnsupportedFormatException;
import com.kapi.model.ResponseFormat;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

/**
 * JSON and XML encoding of results, in both directions.
 *
 * <p>JSON goes through Gson and follows the {@code @SerializedName} keys of the models.
 * XML goes through Jackson and is only meaningful for models carrying Jackson XML
 * annotations.</p>
 */
public final class ResultCodec {

    private ResultCodec() {}

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    private static final XmlMapper XML = XmlMapper.builder()
            .visibility(PropertyAccessor.FIELD, Visibility.ANY)
            .visibility(PropertyAccessor.GETTER, Visibility.NONE)
            .visibility(PropertyAccessor.IS_GETTER, Visibility.NONE)
            .serializationInclusion(JsonInclude.Include.NON_NULL)
            .enable(SerializationFeature.INDENT_OUTPUT)
            .enable(ToXmlGenerator.Feature.WRITE_XML_DECLARATION)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    // ---------------------------------------------------------------
    // Encoding
    // ---------------------------------------------------------------

    /** Pretty JSON, two-space indent. */
    public static String toJson(Object result) {
        return GSON.toJson(result);
    }

    /** Pretty XML, two-space indent, with an XML declaration. */
    public static String toXml(Object result) throws JsonProcessingException {
        return XML.writeValueAsString(result);
    }

    // ---------------------------------------------------------------
    // Decoding
    // ---------------------------------------------------------------

    public static <T> T fromJson(String body, Class<T> type) throws DecodeException {
        T value;
        try {
            value = GSON.fromJson(body, type);
        } catch (JsonParseException e) {
            throw new DecodeException("Malformed JSON for " + type.getSimpleName(), e);
        }
        if (value == null) {
            throw new DecodeException("Empty JSON body for " + type.getSimpleName());
        }
        return value;
    }

    public static <T> T fromXml(String body, Class<T> type) throws DecodeException {
        T value;
        try {
            value = XML.readValue(body, type);
        } catch (JsonProcessingException e) {
            throw new DecodeException("Malformed XML for " + type.getSimpleName(), e);
        }
        if (value == null) {
            throw new DecodeException("Empty XML body for " + type.getSimpleName());
        }
        return value;
    }

    public static <T> T decode(String body, Class<T> type, ResponseFormat format) throws DecodeException {
        return switch (format) {
            case JSON -> fromJson(body, type);
            case XML -> fromXml(body, type);
        };
    }

    // ---------------------------------------------------------------
    // Persistence
    // ---------------------------------------------------------------

    /**
     * Write {@code result} to {@code file}, choosing the encoding from the file extension.
     *
     * @throws UnsupportedFormatException if the extension is not one of {@code supported};
     *                                    nothing is written in that case
     */
    public static void saveAs(Object result, Path file, Set<ResponseFormat> supported)
            throws IOException, UnsupportedFormatException {
        String ext = FileUtils.extension(file);
        ResponseFormat format = ResponseFormat.fromExtension(ext)
                .filter(supported::contains)
                .orElseThrow(() -> new UnsupportedFormatException(ext));

        String text = switch (format) {
            case JSON -> toJson(result);
            case XML -> toXml(result);
        };
        saveToFile(text, file);
    }

    public static void saveToFile(String text, Path file) throws IOException {
        Files.writeString(file, text, StandardCharsets.UTF_8);
    }
}
