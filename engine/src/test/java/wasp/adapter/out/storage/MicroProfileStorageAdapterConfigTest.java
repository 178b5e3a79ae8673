package wasp.adapter.out.storage;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;

import java.util.List;
import java.util.Optional;

import org.eclipse.microprofile.config.Config;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import wasp.spi.StorageProviderException;

@DisplayName("MicroProfileStorageAdapterConfig")
@ExtendWith(MockitoExtension.class)
class MicroProfileStorageAdapterConfigTest {

    @Mock
    private Config config;

    private MicroProfileStorageAdapterConfig adapterConfig;

    @BeforeEach
    void setUp() {
        lenient().when(config.getOptionalValue(anyString(), eq(String.class))).thenReturn(Optional.empty());
        lenient().when(config.getOptionalValue("wasp.storage.cassandra.keyspace", String.class))
                .thenReturn(Optional.of("defense"));
        lenient().when(config.getOptionalValue("wasp.storage.cassandra.username", String.class))
                .thenReturn(Optional.of(" "));
        lenient().when(config.getOptionalValue("wasp.storage.cassandra.contact-points", String.class))
                .thenReturn(Optional.of("cass-1:9042, cass-2:9043,,"));
        adapterConfig = new MicroProfileStorageAdapterConfig(config);
    }

    @Test
    @DisplayName("should read settings under the provider prefix")
    void shouldReadScopedSetting() {
        assertEquals("defense", adapterConfig.setting("cassandra", "keyspace", "wasp"));
        assertEquals("datacenter1", adapterConfig.setting("cassandra", "datacenter", "datacenter1"));
    }

    @Test
    @DisplayName("should treat blank values as unset")
    void shouldIgnoreBlankValues() {
        assertTrue(adapterConfig.setting("cassandra", "username").isEmpty());
    }

    @Test
    @DisplayName("should split list settings")
    void shouldSplitLists() {
        assertEquals(
                List.of("cass-1:9042", "cass-2:9043"),
                adapterConfig.listSetting("cassandra", "contact-points", "localhost:9042"));
    }

    @Test
    @DisplayName("should name the missing key of a required setting")
    void shouldFailForMissingRequiredSetting() {
        var error = assertThrows(
                StorageProviderException.class, () -> adapterConfig.requiredSetting("cassandra", "password"));

        assertEquals(Optional.of("cassandra"), error.provider());
        assertTrue(error.getMessage().contains("wasp.storage.cassandra.password"));
    }
}
