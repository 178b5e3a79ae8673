package wasp.adapter.out.storage;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.ServiceLoader;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import wasp.core.port.out.CaseRepository;
import wasp.spi.CaseStorageProvider;
import wasp.spi.StorageAdapterConfig;
import wasp.spi.StorageProviderException;

/**
 * Discovers case storage providers via ServiceLoader and produces the {@link CaseRepository}.
 *
 * <p>Provider selection:
 * <ol>
 *   <li>If wasp.storage.provider is set, use that provider</li>
 *   <li>Otherwise, select the highest priority available provider</li>
 * </ol>
 */
@ApplicationScoped
public class CaseStorageProviderLoader {

    private static final Logger LOG = Logger.getLogger(CaseStorageProviderLoader.class);

    private final Optional<String> configuredProvider;
    private final StorageAdapterConfig config;

    private CaseStorageProvider provider;

    @Inject
    public CaseStorageProviderLoader(
            @ConfigProperty(name = "wasp.storage.provider") Optional<String> configuredProvider,
            StorageAdapterConfig config) {
        this.configuredProvider = configuredProvider;
        this.config = config;
    }

    @Produces
    @ApplicationScoped
    public CaseRepository repository() {
        final var selected = getProvider();
        LOG.infof("Creating case repository from provider: %s (%s)", selected.name(), selected.description());
        return selected.createRepository(config);
    }

    @PreDestroy
    void shutdown() {
        if (provider != null) {
            provider.close();
        }
    }

    synchronized CaseStorageProvider getProvider() {
        if (provider != null) {
            return provider;
        }

        List<CaseStorageProvider> providers = new ArrayList<>();
        ServiceLoader.load(CaseStorageProvider.class).forEach(providers::add);

        if (providers.isEmpty()) {
            throw new StorageProviderException(
                    "No case storage providers found. Ensure a provider JAR is on the classpath.");
        }

        LOG.infof(
                "Found %d case storage provider(s): %s",
                providers.size(),
                providers.stream().map(CaseStorageProvider::name).toList());

        provider = select(providers, configuredProvider.orElse(null));
        return provider;
    }

    static CaseStorageProvider select(List<CaseStorageProvider> providers, String configured) {
        // Explicit configuration takes precedence
        if (configured != null && !configured.isBlank()) {
            return providers.stream()
                    .filter(p -> p.name().equals(configured))
                    .findFirst()
                    .orElseThrow(() -> new StorageProviderException("Configured case storage provider not found: "
                            + configured + ". Available: "
                            + providers.stream().map(CaseStorageProvider::name).toList()));
        }

        return providers.stream()
                .filter(CaseStorageProvider::isAvailable)
                .max(Comparator.comparingInt(CaseStorageProvider::priority))
                .orElseThrow(() -> new StorageProviderException("No available case storage providers"));
    }
}
