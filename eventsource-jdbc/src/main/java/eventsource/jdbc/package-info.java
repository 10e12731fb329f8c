/**
 * JDBC helpers shared by the relational event store, snapshot stores and listener.
 *
 * @see eventsource.jdbc.JdbcTemplate
 * @see eventsource.jdbc.DataSourceConnectionProvider
 */
package eventsource.jdbc;
