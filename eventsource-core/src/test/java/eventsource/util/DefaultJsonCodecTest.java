package eventsource.util;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DefaultJsonCodecTest {
    private final JsonCodec codec = JsonCodec.getDefault();

    @Test
    void encodesFlatRecordInInsertionOrder() {
        Map<String, String> record = new LinkedHashMap<>();
        record.put("b", "2");
        record.put("a", "1");
        assertEquals("{\"b\":\"2\",\"a\":\"1\"}", codec.toJson(record));
    }

    @Test
    void encodesNullValuesAsJsonNull() {
        Map<String, String> record = new LinkedHashMap<>();
        record.put("topic", null);
        assertEquals("{\"topic\":null}", codec.toJson(record));
    }

    @Test
    void nullRecordEncodesToNull() {
        assertNull(codec.toJson(null));
    }

    @Test
    void escapesControlCharactersAndQuotes() {
        String json = codec.toJson(Map.of("k", "a\"b\\c\nd\u0001"));
        assertEquals("{\"k\":\"a\\\"b\\\\c\\nd\\u0001\"}", json);
        assertEquals("a\"b\\c\nd\u0001", codec.parseObject(json).get("k"));
    }

    @Test
    void parsesLiteralsAsTextAndDropsNulls() {
        Map<String, String> parsed = codec.parseObject("{ \"n\": 42, \"f\": -1.5e3, \"b\": true, \"x\": null }");
        assertEquals("42", parsed.get("n"));
        assertEquals("-1.5e3", parsed.get("f"));
        assertEquals("true", parsed.get("b"));
        assertTrue(!parsed.containsKey("x"));
    }

    @Test
    void parsesUnicodeEscapes() {
        assertEquals("\u00e9", codec.parseObject("{\"k\":\"\\u00e9\"}").get("k"));
    }

    @Test
    void emptyAndNullInputParseToEmptyMap() {
        assertTrue(codec.parseObject(null).isEmpty());
        assertTrue(codec.parseObject("  ").isEmpty());
        assertTrue(codec.parseObject("{}").isEmpty());
    }

    @Test
    void rejectsNestedValues() {
        assertThrows(IllegalArgumentException.class, () -> codec.parseObject("{\"k\":{\"a\":\"b\"}}"));
        assertThrows(IllegalArgumentException.class, () -> codec.parseObject("{\"k\":[1]}"));
    }

    @Test
    void rejectsMalformedInput() {
        assertThrows(IllegalArgumentException.class, () -> codec.parseObject("[]"));
        assertThrows(IllegalArgumentException.class, () -> codec.parseObject("{\"k\":\"v\""));
        assertThrows(IllegalArgumentException.class, () -> codec.parseObject("{\"k\" \"v\"}"));
        assertThrows(IllegalArgumentException.class, () -> codec.parseObject("{\"k\":bogus}"));
    }
}
