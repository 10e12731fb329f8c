package eventsource.util;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Dependency-free JSON encoder/decoder for flat records.
 *
 * <p>Encoding always emits string values. Decoding additionally accepts number and
 * boolean literals (kept as their text) so envelopes produced by other writers can be
 * read back. Nested objects and arrays are rejected.
 */
public final class DefaultJsonCodec implements JsonCodec {
  static final DefaultJsonCodec INSTANCE = new DefaultJsonCodec();

  DefaultJsonCodec() {
  }

  @Override
  public String toJson(Map<String, String> record) {
    if (record == null) {
      return null;
    }
    StringBuilder sb = new StringBuilder(64 + record.size() * 24);
    sb.append('{');
    boolean first = true;
    for (Map.Entry<String, String> entry : record.entrySet()) {
      if (entry.getKey() == null) {
        throw new IllegalArgumentException("record cannot contain null keys");
      }
      if (!first) {
        sb.append(',');
      }
      first = false;
      sb.append('"').append(escape(entry.getKey())).append("\":");
      if (entry.getValue() == null) {
        sb.append("null");
      } else {
        sb.append('"').append(escape(entry.getValue())).append('"');
      }
    }
    return sb.append('}').toString();
  }

  @Override
  public Map<String, String> parseObject(String json) {
    if (json == null) {
      return Collections.emptyMap();
    }
    String input = json.trim();
    if (input.isEmpty() || "null".equals(input)) {
      return Collections.emptyMap();
    }
    int len = input.length();
    if (input.charAt(0) != '{') {
      throw new IllegalArgumentException("Expected JSON object");
    }
    int idx = 1;
    Map<String, String> result = new LinkedHashMap<>();
    while (true) {
      idx = skipWhitespace(input, idx);
      if (idx >= len) {
        throw new IllegalArgumentException("Unexpected end of JSON object");
      }
      char ch = input.charAt(idx);
      if (ch == '}' && result.isEmpty()) {
        return result;
      }
      if (ch != '"') {
        throw new IllegalArgumentException("Expected string key at " + idx);
      }
      Token key = parseString(input, idx + 1);
      idx = skipWhitespace(input, key.next);
      if (idx >= len || input.charAt(idx) != ':') {
        throw new IllegalArgumentException("Expected ':' after key " + key.text);
      }
      idx = skipWhitespace(input, idx + 1);
      if (idx >= len) {
        throw new IllegalArgumentException("Missing value for key " + key.text);
      }
      char start = input.charAt(idx);
      if (start == '"') {
        Token value = parseString(input, idx + 1);
        result.put(key.text, value.text);
        idx = value.next;
      } else if (start == '{' || start == '[') {
        throw new IllegalArgumentException("Nested value for key " + key.text + " is not supported");
      } else {
        Token literal = parseLiteral(input, idx);
        if (!"null".equals(literal.text)) {
          result.put(key.text, literal.text);
        }
        idx = literal.next;
      }
      idx = skipWhitespace(input, idx);
      if (idx >= len) {
        throw new IllegalArgumentException("Unexpected end of JSON object");
      }
      char next = input.charAt(idx);
      if (next == ',') {
        idx++;
        continue;
      }
      if (next == '}') {
        return result;
      }
      throw new IllegalArgumentException("Expected ',' or '}' at " + idx);
    }
  }

  private static int skipWhitespace(String input, int index) {
    int i = index;
    while (i < input.length() && Character.isWhitespace(input.charAt(i))) {
      i++;
    }
    return i;
  }

  private static Token parseLiteral(String input, int startIndex) {
    int i = startIndex;
    while (i < input.length()) {
      char c = input.charAt(i);
      if (c == ',' || c == '}' || Character.isWhitespace(c)) {
        break;
      }
      i++;
    }
    String text = input.substring(startIndex, i);
    if (!text.equals("null") && !text.equals("true") && !text.equals("false")
        && !text.matches("-?\\d+(\\.\\d+)?([eE][+-]?\\d+)?")) {
      throw new IllegalArgumentException("Invalid literal: " + text);
    }
    return new Token(text, i);
  }

  private static Token parseString(String input, int startIndex) {
    StringBuilder sb = new StringBuilder();
    int i = startIndex;
    while (i < input.length()) {
      char c = input.charAt(i);
      if (c == '"') {
        return new Token(sb.toString(), i + 1);
      }
      if (c != '\\') {
        sb.append(c);
        i++;
        continue;
      }
      if (i + 1 >= input.length()) {
        throw new IllegalArgumentException("Invalid escape sequence");
      }
      char next = input.charAt(i + 1);
      switch (next) {
        case '"', '\\', '/' -> sb.append(next);
        case 'b' -> sb.append('\b');
        case 'f' -> sb.append('\f');
        case 'n' -> sb.append('\n');
        case 'r' -> sb.append('\r');
        case 't' -> sb.append('\t');
        case 'u' -> {
          if (i + 5 >= input.length()) {
            throw new IllegalArgumentException("Invalid unicode escape");
          }
          try {
            sb.append((char) Integer.parseInt(input.substring(i + 2, i + 6), 16));
          } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid unicode escape", ex);
          }
          i += 4;
        }
        default -> throw new IllegalArgumentException("Unsupported escape sequence: \\" + next);
      }
      i += 2;
    }
    throw new IllegalArgumentException("Unterminated string");
  }

  private static String escape(String value) {
    StringBuilder sb = new StringBuilder(value.length() + 8);
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      switch (c) {
        case '"' -> sb.append("\\\"");
        case '\\' -> sb.append("\\\\");
        case '\b' -> sb.append("\\b");
        case '\f' -> sb.append("\\f");
        case '\n' -> sb.append("\\n");
        case '\r' -> sb.append("\\r");
        case '\t' -> sb.append("\\t");
        default -> {
          if (c < 0x20) {
            sb.append(String.format("\\u%04x", (int) c));
          } else {
            sb.append(c);
          }
        }
      }
    }
    return sb.toString();
  }

  private record Token(String text, int next) {
  }
}
