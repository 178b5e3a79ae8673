package wasp.adapter.out.storage.cassandra;

import java.net.InetSocketAddress;

import com.datastax.oss.driver.api.core.CqlSession;
import com.datastax.oss.driver.api.core.CqlSessionBuilder;
import org.jboss.logging.Logger;

import wasp.core.port.out.CaseRepository;
import wasp.spi.CaseStorageProvider;
import wasp.spi.StorageAdapterConfig;
import wasp.spi.StorageProviderException;

/**
 * Cassandra case storage provider.
 *
 * <p>Settings under {@code wasp.storage.cassandra}: {@code contact-points}
 * (comma-separated {@code host:port}, default {@code localhost:9042}),
 * {@code datacenter} (default {@code datacenter1}), {@code keyspace}
 * (default {@code wasp}), and optionally {@code username} with {@code password}.
 *
 * <p>The schema is managed outside the application:
 * <pre>{@code
 * CREATE TABLE cases (
 *     id text PRIMARY KEY, key text, zone text, ip text, asn bigint, country text,
 *     first_seen bigint, last_seen bigint, status text,
 *     attack_rps double, est_bandwidth_mbps double, system_capacity_rps double,
 *     af double, df double, bof double, evidence_count bigint, mercy double, justice double,
 *     abuse_report text, section504_draft text);
 *
 * CREATE TABLE cases_by_key (key text PRIMARY KEY, case_id text);
 *
 * CREATE TABLE events (
 *     case_id text, ts bigint, event_id timeuuid,
 *     path text, method text, user_agent text, action text, score double, hits int, colo text,
 *     PRIMARY KEY ((case_id), ts, event_id))
 *     WITH CLUSTERING ORDER BY (ts ASC, event_id ASC);
 * }</pre>
 */
public class CassandraCaseStorageProvider implements CaseStorageProvider {

    private static final Logger LOG = Logger.getLogger(CassandraCaseStorageProvider.class);

    static final String NAME = "cassandra";
    private static final int DEFAULT_PORT = 9042;

    private CqlSession session;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Apache Cassandra persistent case storage";
    }

    @Override
    public int priority() {
        return 10; // Higher than memory
    }

    @Override
    public boolean isAvailable() {
        try {
            Class.forName("com.datastax.oss.driver.api.core.CqlSession");
            return true;
        } catch (ClassNotFoundException e) {
            return false;
        }
    }

    @Override
    public CaseRepository createRepository(StorageAdapterConfig config) {
        this.session = buildSession(config);
        LOG.infof("Connected to Cassandra keyspace %s", session.getKeyspace().map(Object::toString).orElse("-"));
        try {
            return new CassandraCaseRepository(session);
        } catch (RuntimeException e) {
            close();
            throw new StorageProviderException(NAME, "cannot prepare statements, is the schema installed?", e);
        }
    }

    @Override
    public void close() {
        if (session != null && !session.isClosed()) {
            session.close();
        }
    }

    private CqlSession buildSession(StorageAdapterConfig config) {
        final var keyspace = config.setting(NAME, "keyspace", "wasp");
        final var datacenter = config.setting(NAME, "datacenter", "datacenter1");

        final CqlSessionBuilder builder =
                CqlSession.builder().withLocalDatacenter(datacenter).withKeyspace(keyspace);

        for (String contactPoint : config.listSetting(NAME, "contact-points", "localhost:9042")) {
            builder.addContactPoint(parseContactPoint(contactPoint));
        }

        config.setting(NAME, "username").ifPresent(username -> {
            final var password = config.requiredSetting(NAME, "password");
            builder.withAuthCredentials(username, password);
        });

        try {
            return builder.build();
        } catch (RuntimeException e) {
            throw new StorageProviderException(NAME, "cannot connect to " + datacenter, e);
        }
    }

    static InetSocketAddress parseContactPoint(String contactPoint) {
        final var separator = contactPoint.lastIndexOf(':');
        if (separator < 0) {
            return new InetSocketAddress(contactPoint, DEFAULT_PORT);
        }
        try {
            final var port = Integer.parseInt(contactPoint.substring(separator + 1));
            return new InetSocketAddress(contactPoint.substring(0, separator), port);
        } catch (NumberFormatException e) {
            throw new StorageProviderException(NAME, "invalid contact point " + contactPoint, e);
        }
    }
}
