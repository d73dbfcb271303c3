package alpha.nomagicrouter.message;

import java.util.ServiceLoader;

/**
 * Lazy holder of the provided {@link JsonCodec}.
 */
final class JsonCodecHolder {
    private JsonCodecHolder() {
        // Empty
    }
    
    static final JsonCodec INSTANCE = ServiceLoader.load(JsonCodec.class)
            .findFirst()
            .orElseThrow(() -> new IllegalStateException(
                    "No " + JsonCodec.class.getSimpleName() + " implementation found."));
}
