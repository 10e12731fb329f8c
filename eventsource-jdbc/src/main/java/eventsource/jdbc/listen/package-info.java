/**
 * Checkpointed event stream listener woken by database notifications or polling.
 *
 * @see eventsource.jdbc.listen.EventStreamListener
 */
package eventsource.jdbc.listen;
