package eventsource.aggregate;

import eventsource.DomainEvent;
import eventsource.snapshot.SnapshotType;
import eventsource.util.JsonCodec;

import java.util.Map;

/**
 * Sample aggregate used across repository tests.
 */
final class Account extends AggregateRoot {
    static final SnapshotType<Account> SNAPSHOT = SnapshotType.of(Account.class,
            s -> new Account(s.aggregateId(), s.version(), Long.parseLong(s.state())));

    private long balance;
    private int applied;

    Account(String id) {
        super(id);
    }

    private Account(String id, long version, long balance) {
        super(id, version);
        this.balance = balance;
    }

    void deposit(long amount) {
        if (amount <= 0) {
            throw new IllegalArgumentException("amount must be > 0");
        }
        raise(nextEvent("Deposited")
                .payloadJson(JsonCodec.getDefault().toJson(Map.of("amount", Long.toString(amount))))
                .build());
    }

    void withdraw(long amount) {
        if (amount > balance) {
            throw new IllegalStateException("insufficient funds");
        }
        raise(nextEvent("Withdrawn")
                .payloadJson(JsonCodec.getDefault().toJson(Map.of("amount", Long.toString(amount))))
                .build());
    }

    long balance() {
        return balance;
    }

    int applied() {
        return applied;
    }

    @Override
    protected void apply(DomainEvent event) {
        long amount = Long.parseLong(JsonCodec.getDefault().parseObject(event.payloadJson()).get("amount"));
        switch (event.eventType()) {
            case "Deposited" -> balance += amount;
            case "Withdrawn" -> balance -= amount;
            default -> throw new IllegalArgumentException("Unknown event " + event.eventType());
        }
        applied++;
    }

    @Override
    public String snapshotState() {
        return Long.toString(balance);
    }
}
