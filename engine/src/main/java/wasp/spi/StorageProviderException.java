package wasp.spi;

import java.util.Optional;

/**
 * No case storage provider could be selected, or the selected one could not start.
 */
public class StorageProviderException extends RuntimeException {

    private final String provider;

    public StorageProviderException(String message) {
        this(null, message, null);
    }

    public StorageProviderException(String provider, String message, Throwable cause) {
        super(provider != null ? provider + " case storage: " + message : message, cause);
        this.provider = provider;
    }

    /**
     * The provider that failed, empty for selection failures.
     */
    public Optional<String> provider() {
        return Optional.ofNullable(provider);
    }
}
