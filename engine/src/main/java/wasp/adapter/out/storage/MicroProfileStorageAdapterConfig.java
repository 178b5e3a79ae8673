package wasp.adapter.out.storage;

import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.config.Config;

import wasp.spi.StorageAdapterConfig;

/**
 * Resolves provider settings from MicroProfile Config under {@code wasp.storage}.
 */
@ApplicationScoped
public class MicroProfileStorageAdapterConfig implements StorageAdapterConfig {

    static final String PREFIX = "wasp.storage.";

    private final Config config;

    @Inject
    public MicroProfileStorageAdapterConfig(Config config) {
        this.config = config;
    }

    @Override
    public Optional<String> setting(String provider, String name) {
        return config.getOptionalValue(PREFIX + provider + "." + name, String.class)
                .filter(value -> !value.isBlank());
    }
}
