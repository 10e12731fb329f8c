/**
 * Relational snapshot stores with one upserted row per aggregate.
 */
package eventsource.jdbc.snapshot;
