package wasp.spi;

import wasp.core.port.out.CaseRepository;

/**
 * A backend for attack cases and their evidence.
 *
 * <p>Backends are registered in {@code META-INF/services/wasp.spi.CaseStorageProvider}.
 * {@code wasp.storage.provider} picks one by {@link #name()}; when it is unset the
 * available backend with the highest {@link #priority()} wins. The bundled ones are
 * {@code memory} (0) and {@code cassandra} (10).
 */
public interface CaseStorageProvider {

    String name();

    default String description() {
        return name() + " case storage provider";
    }

    default int priority() {
        return 0;
    }

    /**
     * False when the backend's driver is missing from the classpath.
     */
    default boolean isAvailable() {
        return true;
    }

    /**
     * Builds the repository once at startup. It is shared by every ingestion
     * and aggregation thread.
     *
     * @throws StorageProviderException when a required setting is missing or the
     *     backend cannot be reached
     */
    CaseRepository createRepository(StorageAdapterConfig config);

    default void close() {}
}
