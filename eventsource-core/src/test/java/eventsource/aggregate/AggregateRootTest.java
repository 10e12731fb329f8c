package eventsource.aggregate;

import eventsource.DomainEvent;
import eventsource.snapshot.Snapshot;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AggregateRootTest {

    @Test
    void raisedEventsCarryIdentityAndNextVersion() {
        Account account = new Account("acc-1");

        account.deposit(100);
        account.withdraw(30);

        List<DomainEvent> uncommitted = account.uncommittedEvents();
        assertEquals(2, uncommitted.size());
        assertEquals("acc-1", uncommitted.get(0).aggregateId());
        assertEquals("Account", uncommitted.get(0).aggregateType());
        assertEquals(1, uncommitted.get(0).version());
        assertEquals(2, uncommitted.get(1).version());
        assertEquals(2, account.version());
        assertEquals(70, account.balance());
    }

    @Test
    void markCommittedClearsUncommitted() {
        Account account = new Account("acc-1");
        account.deposit(5);

        account.markCommitted();

        assertTrue(account.uncommittedEvents().isEmpty());
        assertEquals(1, account.version());
    }

    @Test
    void replayRebuildsStateWithoutRecording() {
        Account source = new Account("acc-1");
        source.deposit(10);
        source.deposit(20);

        Account replayed = new Account("acc-1");
        replayed.replay(source.uncommittedEvents());

        assertEquals(30, replayed.balance());
        assertEquals(2, replayed.version());
        assertTrue(replayed.uncommittedEvents().isEmpty());
    }

    @Test
    void replayRejectsGaps() {
        Account source = new Account("acc-1");
        source.deposit(10);
        source.deposit(20);

        Account replayed = new Account("acc-1");

        assertThrows(IllegalStateException.class, () -> replayed.replay(List.of(source.uncommittedEvents().get(1))));
    }

    @Test
    void replayRejectsForeignEvents() {
        Account other = new Account("acc-2");
        other.deposit(10);

        assertThrows(IllegalStateException.class, () -> new Account("acc-1").replay(other.uncommittedEvents()));
    }

    @Test
    void eventsSinceSnapshotCountsFromRestoreVersion() {
        Account restored = Account.SNAPSHOT.restore(
                new Snapshot("acc-1", "Account", 10, Instant.EPOCH, "500"));

        restored.deposit(1);

        assertEquals(1, restored.eventsSinceSnapshot());
        assertEquals(11, restored.version());
        assertEquals(501, restored.balance());
    }
}
