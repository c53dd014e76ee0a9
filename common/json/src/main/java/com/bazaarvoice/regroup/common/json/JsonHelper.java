package com.bazaarvoice.regroup.common.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;

public abstract class JsonHelper {

    private static final ObjectMapper JSON = CustomJsonObjectMapperFactory.build()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private static final ObjectWriter DEFAULT_WRITER = JSON.writer();

    public static String asJson(Object value) {
        try {
            return DEFAULT_WRITER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            // Shouldn't get I/O errors writing to a string, only serialization problems with the value itself.
            throw new IllegalArgumentException(e.getOriginalMessage(), e);
        }
    }

    public static <T> T fromJson(String string, Class<T> valueType) {
        try {
            return JSON.readValue(string, valueType);
        } catch (JsonProcessingException e) {
            // Must be malformed JSON.  Other kinds of I/O errors don't get thrown when reading from a string.
            throw new IllegalArgumentException(e.toString(), e);
        }
    }

    public static <T> T fromJson(String string, TypeReference<T> reference) {
        try {
            return JSON.readValue(string, reference);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(e.toString(), e);
        }
    }

    public static <T> T fromJson(String string, JavaType valueType) {
        try {
            return JSON.readValue(string, valueType);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(e.toString(), e);
        }
    }

    /** Generic type with the given type arguments, for reading values whose parameters are only known at runtime. */
    public static JavaType parametricType(Class<?> rawType, Class<?>... parameterTypes) {
        return JSON.getTypeFactory().constructParametricType(rawType, parameterTypes);
    }

    /** Convert from one pojo format to another pojo format. */
    public static <T> T convert(Object source, Class<T> destType) {
        return JSON.convertValue(source, destType);
    }

    /** Convert from one pojo format to another pojo format. */
    public static <T> T convert(Object source, TypeReference<T> destType) {
        return JSON.convertValue(source, destType);
    }
}
