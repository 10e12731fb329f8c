package eventsource.spi;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JulStructuredLoggerTest {
    private static final String NAME = "eventsource.test.JulStructuredLoggerTest";

    private final List<LogRecord> records = new ArrayList<>();
    private final Logger logger = Logger.getLogger(NAME);
    private final Handler handler = new Handler() {
        @Override
        public void publish(LogRecord record) {
            records.add(record);
        }

        @Override
        public void flush() {
        }

        @Override
        public void close() {
        }
    };

    @BeforeEach
    void attach() {
        logger.setUseParentHandlers(false);
        logger.setLevel(Level.INFO);
        logger.addHandler(handler);
    }

    @AfterEach
    void detach() {
        logger.removeHandler(handler);
        logger.setUseParentHandlers(true);
        logger.setLevel(null);
    }

    @Test
    void rendersFieldsAsKeyValuePairs() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("eventType", "OrderPlaced");
        fields.put("attempts", 2);

        StructuredLogger.jul().log(Level.INFO, "Handler succeeded", NAME, fields);

        assertEquals(1, records.size());
        assertEquals("Handler succeeded eventType=OrderPlaced attempts=2", records.get(0).getMessage());
        assertNull(records.get(0).getThrown());
    }

    @Test
    void attachesThrowableField() {
        IllegalStateException error = new IllegalStateException("boom");

        StructuredLogger.jul().log(Level.WARNING, "Failed", NAME, Map.of("error", error));

        assertSame(error, records.get(0).getThrown());
    }

    @Test
    void skipsDisabledLevels() {
        StructuredLogger.jul().log(Level.FINE, "hidden", NAME, Map.of());

        assertTrue(records.isEmpty());
        assertFalse(StructuredLogger.jul().isLoggable(Level.FINE, NAME));
    }
}
