package eventsource.jdbc.store;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry for JDBC event stores with auto-detection support.
 *
 * <p>Event stores are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/eventsource.jdbc.store.AbstractJdbcEventStore}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // Auto-detect from DataSource
 * AbstractJdbcEventStore store = JdbcEventStores.detect(dataSource);
 *
 * // Auto-detect from JDBC URL
 * AbstractJdbcEventStore store = JdbcEventStores.detect("jdbc:postgresql://localhost/mydb");
 *
 * // Get by name
 * AbstractJdbcEventStore store = JdbcEventStores.get("h2");
 * }</pre>
 */
public final class JdbcEventStores {

    private static final List<AbstractJdbcEventStore> STORES;
    private static final Map<String, AbstractJdbcEventStore> BY_NAME = new ConcurrentHashMap<>();

    static {
        STORES = ServiceLoader.load(AbstractJdbcEventStore.class)
                .stream()
                .map(ServiceLoader.Provider::get)
                .toList();

        for (AbstractJdbcEventStore store : STORES) {
            BY_NAME.put(store.name().toLowerCase(Locale.ROOT), store);
        }
    }

    private JdbcEventStores() {
    }

    /**
     * Returns all registered event stores.
     */
    public static List<AbstractJdbcEventStore> all() {
        return STORES;
    }

    /**
     * Gets an event store by name.
     *
     * @param name event store name (case-insensitive)
     * @return the event store
     * @throws IllegalArgumentException if no event store is registered under that name
     */
    public static AbstractJdbcEventStore get(String name) {
        Objects.requireNonNull(name, "name");
        AbstractJdbcEventStore store = BY_NAME.get(name.toLowerCase(Locale.ROOT));
        if (store == null) {
            throw new IllegalArgumentException("Unknown event store: " + name +
                    ". Available: " + BY_NAME.keySet());
        }
        return store;
    }

    /**
     * Auto-detects the event store from a DataSource.
     *
     * @throws IllegalStateException if the connection metadata cannot be read
     * @throws IllegalArgumentException if no registered store matches the URL
     */
    public static AbstractJdbcEventStore detect(DataSource dataSource) {
        Objects.requireNonNull(dataSource, "dataSource");
        String url;
        try (Connection conn = dataSource.getConnection()) {
            url = conn.getMetaData().getURL();
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to detect event store from DataSource", e);
        }
        return detect(url);
    }

    /**
     * Auto-detects the event store from a JDBC URL.
     *
     * @throws IllegalArgumentException if no matching event store is found
     */
    public static AbstractJdbcEventStore detect(String jdbcUrl) {
        if (jdbcUrl == null || jdbcUrl.isEmpty()) {
            throw new IllegalArgumentException("JDBC URL cannot be null or empty");
        }
        String lower = jdbcUrl.toLowerCase(Locale.ROOT);
        for (AbstractJdbcEventStore store : STORES) {
            for (String prefix : store.jdbcUrlPrefixes()) {
                if (lower.startsWith(prefix.toLowerCase(Locale.ROOT))) {
                    return store;
                }
            }
        }

        throw new IllegalArgumentException("No event store found for JDBC URL: " + jdbcUrl +
                ". Supported prefixes: " + allPrefixes());
    }

    private static List<String> allPrefixes() {
        return STORES.stream()
                .flatMap(s -> s.jdbcUrlPrefixes().stream())
                .toList();
    }
}
