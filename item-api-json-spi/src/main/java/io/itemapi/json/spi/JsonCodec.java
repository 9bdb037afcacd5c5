package io.itemapi.json.spi;

import java.io.InputStream;

/**
 * Minimal JSON codec interface providing serialization and deserialization.
 * Implementations wrap specific JSON libraries (Jackson, Gson, Moshi, etc.).
 *
 * <p>This interface intentionally avoids exposing tree model abstractions.
 * Use strongly-typed POJOs or records for request and response bodies.
 */
public interface JsonCodec {

    /**
     * Serializes an object to a JSON byte array.
     * @param value the object to serialize
     * @return JSON bytes
     * @throws JsonException if serialization fails
     */
    byte[] writeBytes(Object value) throws JsonException;

    /**
     * Deserializes JSON bytes to a typed object.
     * @param data JSON bytes
     * @param type target class
     * @return deserialized object, never null
     * @throws JsonException if the bytes are empty, malformed, a JSON {@code null}, or do not bind to {@code type}
     */
    <T> T readValue(byte[] data, Class<T> type) throws JsonException;

    /**
     * Deserializes a JSON input stream to a typed object.
     * @param input JSON input stream
     * @param type target class
     * @return deserialized object, never null
     * @throws JsonException if the stream is empty, malformed, a JSON {@code null}, or does not bind to {@code type}
     */
    <T> T readValue(InputStream input, Class<T> type) throws JsonException;
}
