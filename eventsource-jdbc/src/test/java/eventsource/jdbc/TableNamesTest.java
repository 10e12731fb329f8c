package eventsource.jdbc;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TableNamesTest {

    @Test
    void validTableNameReturnsName() {
        assertEquals("domain_events", TableNames.validate("domain_events"));
        assertEquals("Events2", TableNames.validate("Events2"));
        assertEquals("_x", TableNames.validate("_x"));
    }

    @Test
    void nullTableNameThrows() {
        assertThrows(NullPointerException.class, () -> TableNames.validate(null));
    }

    @Test
    void injectionAttemptsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> TableNames.validate(""));
        assertThrows(IllegalArgumentException.class, () -> TableNames.validate("1events"));
        assertThrows(IllegalArgumentException.class, () -> TableNames.validate("events; DROP TABLE x"));
        assertThrows(IllegalArgumentException.class, () -> TableNames.validate("schema.events"));
    }

    @Test
    void channelNamesFollowTheSameRule() {
        assertEquals("domain_events", TableNames.validateChannel("domain_events"));
        assertThrows(IllegalArgumentException.class, () -> TableNames.validateChannel("a-b"));
    }
}
