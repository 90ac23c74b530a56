package io.contractrpc.json.spi;

import java.util.Objects;
import java.util.ServiceLoader;

/**
 * Resolves the {@link JsonCodec} to use when none is configured explicitly.
 */
public final class JsonCodecs {

    private JsonCodecs() {}

    /**
     * Loads the highest priority {@link JsonCodecProvider} visible to the context class loader.
     *
     * @throws IllegalStateException if no provider is registered
     */
    public static JsonCodec discover() {
        ClassLoader cl = Thread.currentThread().getContextClassLoader();
        return discover(cl != null ? cl : JsonCodecs.class.getClassLoader());
    }

    public static JsonCodec discover(ClassLoader cl) {
        Objects.requireNonNull(cl, "cl");
        JsonCodecProvider best = null;
        for (JsonCodecProvider p : ServiceLoader.load(JsonCodecProvider.class, cl)) {
            if (best == null || p.priority() > best.priority()) {
                best = p;
            }
        }
        if (best == null) {
            throw new IllegalStateException("No JsonCodecProvider found; add contract-rpc-json-jackson to the class path");
        }
        return best.codec();
    }
}
