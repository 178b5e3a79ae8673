package wasp.spi;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Settings of one case storage provider, read from {@code wasp.storage.<provider>.<name>}.
 *
 * <p>Providers see only their own settings by name, so a provider never
 * depends on the configuration framework of the engine.
 */
public interface StorageAdapterConfig {

    /**
     * Look up one setting.
     *
     * @param provider provider name, e.g. {@code cassandra}
     * @param name     setting name, e.g. {@code keyspace}
     * @return the raw value, empty if unset or blank
     */
    Optional<String> setting(String provider, String name);

    default String setting(String provider, String name, String defaultValue) {
        return setting(provider, name).orElse(defaultValue);
    }

    /**
     * @throws StorageProviderException if the setting is unset
     */
    default String requiredSetting(String provider, String name) {
        return setting(provider, name)
                .orElseThrow(() -> new StorageProviderException(
                        provider, "wasp.storage." + provider + "." + name + " is required", null));
    }

    /**
     * A comma-separated setting split into trimmed, non-empty entries.
     */
    default List<String> listSetting(String provider, String name, String defaultValue) {
        return Arrays.stream(setting(provider, name, defaultValue).split(","))
                .map(String::trim)
                .filter(entry -> !entry.isEmpty())
                .toList();
    }
}
