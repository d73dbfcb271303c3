package alpha.nomagicrouter.core;

import alpha.nomagicrouter.message.InvalidJsonException;
import alpha.nomagicrouter.message.JsonCodec;
import alpha.nomagicrouter.message.Parameters;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.io.UncheckedIOException;

import static java.util.Objects.requireNonNull;

/**
 * A {@code JsonCodec} backed by a Jackson {@code ObjectMapper}.<p>
 * 
 * The default mapper serializes {@code java.time} values as ISO-8601 text,
 * {@code Optional} as its value or {@code null}, and {@link Parameters} as
 * its {@linkplain Parameters#asMap() map view}. Parsing is strict; trailing
 * tokens are not allowed.
 */
public final class JacksonCodec implements JsonCodec
{
    private final ObjectMapper mapper;
    
    /**
     * Constructs this object using the default mapper.<p>
     * 
     * This constructor is used by the service loader.
     */
    public JacksonCodec() {
        this(defaultMapper());
    }
    
    /**
     * Constructs this object.
     * 
     * @param mapper to use
     */
    public JacksonCodec(ObjectMapper mapper) {
        this.mapper = requireNonNull(mapper);
    }
    
    /**
     * Creates the default mapper.
     * 
     * @return a new mapper
     */
    public static ObjectMapper defaultMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .registerModule(new Jdk8Module())
                .registerModule(new SimpleModule("nomagicrouter")
                        .addSerializer(Parameters.class, new ParametersSerializer()))
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }
    
    @Override
    public Object parse(String text) {
        try {
            return mapper.readValue(text, Object.class);
        } catch (JsonProcessingException e) {
            throw new InvalidJsonException(e);
        }
    }
    
    @Override
    public String write(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }
    
    private static final class ParametersSerializer extends StdSerializer<Parameters> {
        private static final long serialVersionUID = 1L;
        
        ParametersSerializer() {
            super(Parameters.class);
        }
        
        @Override
        public void serialize(Parameters value, JsonGenerator gen, SerializerProvider provider)
                throws IOException {
            provider.defaultSerializeValue(value.asMap(), gen);
        }
    }
}
