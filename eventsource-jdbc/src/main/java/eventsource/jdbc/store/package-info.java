/**
 * Relational {@link eventsource.store.EventStore} implementation.
 *
 * <p>{@link eventsource.jdbc.store.JdbcEventStore} owns connections and transactions;
 * {@link eventsource.jdbc.store.AbstractJdbcEventStore} subclasses supply database-specific
 * SQL. The PostgreSQL store also publishes a {@code pg_notify} envelope on commit.
 *
 * @see eventsource.jdbc.store.H2EventStore
 * @see eventsource.jdbc.store.PostgresEventStore
 * @see eventsource.jdbc.store.JdbcEventStores
 */
package eventsource.jdbc.store;
