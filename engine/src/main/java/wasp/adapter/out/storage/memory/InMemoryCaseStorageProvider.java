package wasp.adapter.out.storage.memory;

import wasp.core.port.out.CaseRepository;
import wasp.spi.CaseStorageProvider;
import wasp.spi.StorageAdapterConfig;

/**
 * In-memory case storage provider.
 *
 * <p>Always available, with the lowest priority (0) so that a persistent
 * provider is preferred when present.
 */
public class InMemoryCaseStorageProvider implements CaseStorageProvider {

    @Override
    public String name() {
        return "memory";
    }

    @Override
    public String description() {
        return "In-memory case storage (non-persistent)";
    }

    @Override
    public int priority() {
        return 0;
    }

    @Override
    public CaseRepository createRepository(StorageAdapterConfig config) {
        return new InMemoryCaseRepository();
    }
}
