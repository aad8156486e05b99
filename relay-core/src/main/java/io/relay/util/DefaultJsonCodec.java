package io.relay.util;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Dependency-free {@link JsonCodec}. Encodes nested maps and lists; parses flat objects only,
 * which is all the ledger's record format needs.
 */
public final class DefaultJsonCodec implements JsonCodec {
  static final DefaultJsonCodec INSTANCE = new DefaultJsonCodec();

  DefaultJsonCodec() {
  }

  @Override
  public String toJson(Map<String, ?> object) {
    StringBuilder sb = new StringBuilder();
    writeObject(sb, object == null ? Collections.emptyMap() : object);
    return sb.toString();
  }

  @Override
  public Map<String, Object> parseObject(String json) {
    if (json == null) {
      return Collections.emptyMap();
    }
    String trimmed = json.trim();
    if (trimmed.isEmpty() || "null".equals(trimmed)) {
      return Collections.emptyMap();
    }
    int len = trimmed.length();
    if (trimmed.charAt(0) != '{') {
      throw new IllegalArgumentException("Expected JSON object");
    }
    int idx = 1;
    Map<String, Object> result = new LinkedHashMap<>();
    while (true) {
      idx = skipWhitespace(trimmed, idx);
      if (idx >= len) {
        throw new IllegalArgumentException("Unexpected end of JSON object");
      }
      char ch = trimmed.charAt(idx);
      if (ch == '}' && result.isEmpty()) {
        return result;
      }
      if (ch != '"') {
        throw new IllegalArgumentException("Expected string key at " + idx);
      }
      ParseResult key = parseString(trimmed, idx + 1);
      idx = skipWhitespace(trimmed, key.nextIndex);
      if (idx >= len || trimmed.charAt(idx) != ':') {
        throw new IllegalArgumentException("Expected ':' after key " + key.value);
      }
      idx = skipWhitespace(trimmed, idx + 1);
      if (idx >= len) {
        throw new IllegalArgumentException("Missing value for key " + key.value);
      }
      char start = trimmed.charAt(idx);
      if (start == '"') {
        ParseResult value = parseString(trimmed, idx + 1);
        result.put((String) key.value, value.value);
        idx = value.nextIndex;
      } else if (start == '{' || start == '[') {
        throw new IllegalArgumentException("Nested values are not supported: " + key.value);
      } else {
        int end = idx;
        while (end < len && ",} \t\n\r".indexOf(trimmed.charAt(end)) < 0) {
          end++;
        }
        Object literal = parseLiteral(trimmed.substring(idx, end));
        if (literal != null) {
          result.put((String) key.value, literal);
        }
        idx = end;
      }
      idx = skipWhitespace(trimmed, idx);
      if (idx >= len) {
        throw new IllegalArgumentException("Unexpected end of JSON object");
      }
      char next = trimmed.charAt(idx);
      if (next == ',') {
        idx++;
        continue;
      }
      if (next == '}') {
        if (skipWhitespace(trimmed, idx + 1) != len) {
          throw new IllegalArgumentException("Trailing content after JSON object");
        }
        return result;
      }
      throw new IllegalArgumentException("Expected ',' or '}'");
    }
  }

  private static Object parseLiteral(String token) {
    switch (token) {
      case "null":
        return null;
      case "true":
        return Boolean.TRUE;
      case "false":
        return Boolean.FALSE;
      default:
        break;
    }
    try {
      if (token.indexOf('.') < 0 && token.indexOf('e') < 0 && token.indexOf('E') < 0) {
        return Long.parseLong(token);
      }
      return Double.parseDouble(token);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("Invalid JSON literal: " + token, ex);
    }
  }

  private static void writeValue(StringBuilder sb, Object value) {
    if (value == null) {
      sb.append("null");
    } else if (value instanceof CharSequence) {
      sb.append('"').append(escape(value.toString())).append('"');
    } else if (value instanceof Double || value instanceof Float) {
      double d = ((Number) value).doubleValue();
      if (Double.isNaN(d) || Double.isInfinite(d)) {
        throw new IllegalArgumentException("JSON cannot represent " + d);
      }
      sb.append(d);
    } else if (value instanceof Number || value instanceof Boolean) {
      sb.append(value);
    } else if (value instanceof Map<?, ?> map) {
      writeObject(sb, map);
    } else if (value instanceof Collection<?> items) {
      sb.append('[');
      boolean first = true;
      for (Object item : items) {
        if (!first) {
          sb.append(',');
        }
        first = false;
        writeValue(sb, item);
      }
      sb.append(']');
    } else {
      // enums, dates and other value types go out as their string form
      sb.append('"').append(escape(value.toString())).append('"');
    }
  }

  private static void writeObject(StringBuilder sb, Map<?, ?> map) {
    sb.append('{');
    boolean first = true;
    for (Map.Entry<?, ?> entry : map.entrySet()) {
      if (!(entry.getKey() instanceof String)) {
        throw new IllegalArgumentException("JSON object keys must be non-null strings");
      }
      if (!first) {
        sb.append(',');
      }
      first = false;
      sb.append('"').append(escape((String) entry.getKey())).append('"').append(':');
      writeValue(sb, entry.getValue());
    }
    sb.append('}');
  }

  private static int skipWhitespace(String input, int index) {
    int i = index;
    while (i < input.length()) {
      char c = input.charAt(i);
      if (c != ' ' && c != '\t' && c != '\n' && c != '\r') {
        break;
      }
      i++;
    }
    return i;
  }

  private static ParseResult parseString(String input, int startIndex) {
    StringBuilder sb = new StringBuilder();
    int i = startIndex;
    while (i < input.length()) {
      char c = input.charAt(i);
      if (c == '"') {
        return new ParseResult(sb.toString(), i + 1);
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
        case '"':
        case '\\':
        case '/':
          sb.append(next);
          break;
        case 'b':
          sb.append('\b');
          break;
        case 'f':
          sb.append('\f');
          break;
        case 'n':
          sb.append('\n');
          break;
        case 'r':
          sb.append('\r');
          break;
        case 't':
          sb.append('\t');
          break;
        case 'u':
          if (i + 5 >= input.length()) {
            throw new IllegalArgumentException("Invalid unicode escape");
          }
          try {
            sb.append((char) Integer.parseInt(input.substring(i + 2, i + 6), 16));
          } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid unicode escape", ex);
          }
          i += 4;
          break;
        default:
          throw new IllegalArgumentException("Unsupported escape sequence: \\" + next);
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
        case '"':
          sb.append("\\\"");
          break;
        case '\\':
          sb.append("\\\\");
          break;
        case '\n':
          sb.append("\\n");
          break;
        case '\r':
          sb.append("\\r");
          break;
        case '\t':
          sb.append("\\t");
          break;
        default:
          if (c < 0x20) {
            sb.append(String.format("\\u%04x", (int) c));
          } else {
            sb.append(c);
          }
      }
    }
    return sb.toString();
  }

  private static final class ParseResult {
    private final Object value;
    private final int nextIndex;

    private ParseResult(String value, int nextIndex) {
      this.value = value;
      this.nextIndex = nextIndex;
    }
  }
}
