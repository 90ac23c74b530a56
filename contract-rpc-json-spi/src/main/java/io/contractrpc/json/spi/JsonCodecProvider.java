package io.contractrpc.json.spi;

/**
 * ServiceLoader entry point for {@link JsonCodec} implementations.
 *
 * <p>Implementations are registered in {@code META-INF/services/io.contractrpc.json.spi.JsonCodecProvider}.
 */
public interface JsonCodecProvider {

    /**
     * @return a ready-to-use codec
     */
    JsonCodec codec();

    /**
     * Providers with a higher priority win when several are on the class path.
     */
    default int priority() {
        return 0;
    }
}
