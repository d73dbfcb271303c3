package alpha.nomagicrouter.message;

import alpha.nomagicrouter.Config;
import alpha.nomagicrouter.util.ByteSizes;

import java.nio.charset.Charset;
import java.util.Optional;
import java.util.OptionalLong;

import static java.util.Objects.requireNonNull;

/**
 * Options for reading a request body.<p>
 * 
 * Unset options fall back on defaults; the limit on
 * {@link Config#bodyLimit()}, the charset on the request's Content-Type, and
 * then on {@link Config#defaultCharset()}.<p>
 * 
 * The implementation is immutable.
 * 
 * <pre>
 *   Object json = Getters.JSON.get(request, BodyOptions.limit("100mb"));
 * </pre>
 */
public final class BodyOptions
{
    /**
     * No options set.
     */
    public static final BodyOptions DEFAULT = new BodyOptions(-1, null);
    
    /**
     * Returns options with the given limit.<p>
     * 
     * The limit is a number of bytes, optionally suffixed with a unit; "b",
     * "kb", "mb", "gb", "tb" or "pb". Units are base 1024. E.g. "1mb",
     * "512kb", "1".
     * 
     * @param limit human-readable size
     * @return options
     * @throws IllegalArgumentException if {@code limit} can not be parsed
     */
    public static BodyOptions limit(String limit) {
        return DEFAULT.withLimit(ByteSizes.parse(limit));
    }
    
    /**
     * Returns options with the given limit.
     * 
     * @param bytes max number of body bytes
     * @return options
     * @throws IllegalArgumentException if {@code bytes} is negative
     */
    public static BodyOptions limit(long bytes) {
        return DEFAULT.withLimit(bytes);
    }
    
    /**
     * Returns options with the given charset.
     * 
     * @param charset of body
     * @return options
     * @throws NullPointerException if {@code charset} is {@code null}
     */
    public static BodyOptions charset(Charset charset) {
        return DEFAULT.withCharset(charset);
    }
    
    private final long limit;
    private final Charset charset;
    
    private BodyOptions(long limit, Charset charset) {
        this.limit = limit;
        this.charset = charset;
    }
    
    /**
     * Returns a copy with the given limit.
     * 
     * @param bytes max number of body bytes
     * @return new options
     * @throws IllegalArgumentException if {@code bytes} is negative
     */
    public BodyOptions withLimit(long bytes) {
        if (bytes < 0) {
            throw new IllegalArgumentException("Negative limit: " + bytes);
        }
        return new BodyOptions(bytes, charset);
    }
    
    /**
     * Returns a copy with the given charset.
     * 
     * @param charset of body
     * @return new options
     * @throws NullPointerException if {@code charset} is {@code null}
     */
    public BodyOptions withCharset(Charset charset) {
        return new BodyOptions(limit, requireNonNull(charset));
    }
    
    /**
     * {@return the limit, if set}
     */
    public OptionalLong limit() {
        return limit < 0 ? OptionalLong.empty() : OptionalLong.of(limit);
    }
    
    /**
     * {@return the charset, if set}
     */
    public Optional<Charset> charset() {
        return Optional.ofNullable(charset);
    }
    
    @Override
    public String toString() {
        return BodyOptions.class.getSimpleName() + "{" +
                "limit=" + (limit < 0 ? "default" : limit) +
                ", charset=" + (charset == null ? "default" : charset) + '}';
    }
}
