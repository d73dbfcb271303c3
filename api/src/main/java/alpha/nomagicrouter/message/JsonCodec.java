package alpha.nomagicrouter.message;

import alpha.nomagicrouter.util.Getters;

import java.io.UncheckedIOException;

/**
 * Reads and writes JSON.<p>
 * 
 * The implementation is located using Java's service-provider mechanism and
 * is provided by the server implementation. It is used by the response
 * pipeline to serialize bodies, and by {@link Getters#JSON} to parse request
 * bodies.<p>
 * 
 * The implementation is thread-safe.
 */
public interface JsonCodec
{
    /**
     * Parses JSON text into plain Java values.<p>
     * 
     * An object becomes a {@code Map<String, Object>}, an array a
     * {@code List<Object>}, and primitives their boxed counterparts or
     * {@code String}. JSON null becomes {@code null}.
     * 
     * @param text to parse
     * @return the value (may be {@code null})
     * @throws InvalidJsonException if the text is not valid JSON
     */
    Object parse(String text);
    
    /**
     * Serializes a value to JSON text.
     * 
     * @param value to serialize (may be {@code null})
     * @return JSON text
     * @throws UncheckedIOException if the value can not be serialized
     */
    String write(Object value);
    
    /**
     * Returns the provided implementation.
     * 
     * @return the provided implementation
     * @throws IllegalStateException if no implementation is found
     */
    static JsonCodec provider() {
        return JsonCodecHolder.INSTANCE;
    }
}
