package io.github.cachestats.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads {@link CacheStatsConfig} from JSON without external dependencies.
 *
 * <p>Usage:</p>
 * <pre>{@code
 * CacheStatsConfig config = ConfigLoader.fromJson("{\"collector\": {\"defaultMaximumAgeSeconds\": 60}}");
 * CacheStatsConfig config = ConfigLoader.fromFile(Path.of("cachestats.json"));
 * CacheStatsConfig config = ConfigLoader.fromResource("cachestats.json");
 * }</pre>
 *
 * <p>Absent sections and fields take their defaults; unknown fields are
 * ignored.</p>
 */
public final class ConfigLoader {

    private ConfigLoader() {
    }

    /**
     * Load config from a JSON string.
     *
     * @throws IllegalArgumentException if the JSON is malformed or a value is out of range
     */
    public static CacheStatsConfig fromJson(String json) {
        Object root = new JsonParser(json).parseDocument();
        if (!(root instanceof Map<?, ?> map)) {
            throw new IllegalArgumentException("Config JSON must be an object");
        }
        return new CacheStatsConfig(
            parseCacheConfig(section(map, "cache")),
            parseCollectorConfig(section(map, "collector"))
        );
    }

    public static CacheStatsConfig fromFile(Path path) throws IOException {
        return fromJson(Files.readString(path, StandardCharsets.UTF_8));
    }

    public static CacheStatsConfig fromStream(InputStream stream) throws IOException {
        return fromJson(new String(stream.readAllBytes(), StandardCharsets.UTF_8));
    }

    /**
     * Load config from a classpath resource.
     */
    public static CacheStatsConfig fromResource(String resourcePath) throws IOException {
        try (InputStream stream = ConfigLoader.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (stream == null) {
                throw new IOException("Resource not found: " + resourcePath);
            }
            return fromStream(stream);
        }
    }

    // ============ Sections ============

    private static CacheConfig parseCacheConfig(Map<?, ?> map) {
        if (map == null) return CacheConfig.defaults();
        return new CacheConfig(
            getLong(map, "capacity", CacheConfig.DEFAULT_CAPACITY),
            getInt(map, "numShardBits", CacheConfig.DEFAULT_NUM_SHARD_BITS),
            getBool(map, "strictCapacityLimit", false)
        );
    }

    private static CollectorConfig parseCollectorConfig(Map<?, ?> map) {
        if (map == null) return CollectorConfig.defaults();
        return new CollectorConfig(
            Duration.ofSeconds(getLong(map, "defaultMaximumAgeSeconds",
                CollectorConfig.DEFAULT_MAXIMUM_AGE.getSeconds())),
            Duration.ofMillis(getLong(map, "minimumRescanIntervalMillis",
                CollectorConfig.DEFAULT_MINIMUM_RESCAN_INTERVAL.toMillis())),
            getInt(map, "rescanOverheadFactor", CollectorConfig.DEFAULT_RESCAN_OVERHEAD_FACTOR)
        );
    }

    // ============ Helpers ============

    private static Map<?, ?> section(Map<?, ?> root, String name) {
        Object value = root.get(name);
        if (value == null) return null;
        if (value instanceof Map<?, ?> map) return map;
        throw new IllegalArgumentException("\"" + name + "\" must be an object");
    }

    private static long getLong(Map<?, ?> map, String key, long defaultValue) {
        Object val = map.get(key);
        if (val == null) return defaultValue;
        if (val instanceof Long l) return l;
        if (val instanceof Double d && d == Math.rint(d)) return d.longValue();
        throw new IllegalArgumentException("\"" + key + "\" must be an integer, got " + val);
    }

    private static int getInt(Map<?, ?> map, String key, int defaultValue) {
        long val = getLong(map, key, defaultValue);
        try {
            return Math.toIntExact(val);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("\"" + key + "\" is out of int range: " + val, e);
        }
    }

    private static boolean getBool(Map<?, ?> map, String key, boolean defaultValue) {
        Object val = map.get(key);
        if (val == null) return defaultValue;
        if (val instanceof Boolean b) return b;
        throw new IllegalArgumentException("\"" + key + "\" must be a boolean, got " + val);
    }

    // ============ JSON Parsing ============

    /**
     * Minimal recursive-descent JSON parser. Objects become {@link LinkedHashMap},
     * arrays {@link ArrayList}, integers {@link Long}, other numbers {@link Double}.
     */
    private static final class JsonParser {
        private final String text;
        private int pos;

        JsonParser(String text) {
            if (text == null) {
                throw new IllegalArgumentException("Config JSON cannot be null");
            }
            this.text = text;
        }

        Object parseDocument() {
            Object value = parseValue();
            skipWhitespace();
            if (pos < text.length()) {
                throw error("Trailing content");
            }
            return value;
        }

        private Object parseValue() {
            skipWhitespace();
            if (pos >= text.length()) {
                throw error("Unexpected end of input");
            }
            char c = text.charAt(pos);
            return switch (c) {
                case '{' -> parseObject();
                case '[' -> parseArray();
                case '"' -> parseString();
                case 't' -> literal("true", Boolean.TRUE);
                case 'f' -> literal("false", Boolean.FALSE);
                case 'n' -> literal("null", null);
                default -> {
                    if (c == '-' || Character.isDigit(c)) {
                        yield parseNumber();
                    }
                    throw error("Unexpected character '" + c + "'");
                }
            };
        }

        private Map<String, Object> parseObject() {
            Map<String, Object> map = new LinkedHashMap<>();
            expect('{');
            skipWhitespace();
            if (peek() == '}') {
                pos++;
                return map;
            }
            do {
                skipWhitespace();
                String key = parseString();
                skipWhitespace();
                expect(':');
                map.put(key, parseValue());
                skipWhitespace();
            } while (consume(','));
            expect('}');
            return map;
        }

        private List<Object> parseArray() {
            List<Object> list = new ArrayList<>();
            expect('[');
            skipWhitespace();
            if (peek() == ']') {
                pos++;
                return list;
            }
            do {
                list.add(parseValue());
                skipWhitespace();
            } while (consume(','));
            expect(']');
            return list;
        }

        private String parseString() {
            expect('"');
            StringBuilder sb = new StringBuilder();
            while (true) {
                if (pos >= text.length()) {
                    throw error("Unterminated string");
                }
                char c = text.charAt(pos++);
                if (c == '"') {
                    return sb.toString();
                }
                if (c != '\\') {
                    sb.append(c);
                    continue;
                }
                if (pos >= text.length()) {
                    throw error("Unterminated escape");
                }
                char escaped = text.charAt(pos++);
                switch (escaped) {
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    case 'r' -> sb.append('\r');
                    case 'b' -> sb.append('\b');
                    case 'f' -> sb.append('\f');
                    case 'u' -> {
                        if (pos + 4 > text.length()) {
                            throw error("Truncated unicode escape");
                        }
                        sb.append((char) Integer.parseInt(text.substring(pos, pos + 4), 16));
                        pos += 4;
                    }
                    default -> sb.append(escaped);
                }
            }
        }

        private Number parseNumber() {
            int start = pos;
            boolean integral = true;
            if (peek() == '-') {
                pos++;
            }
            while (pos < text.length()) {
                char c = text.charAt(pos);
                if (Character.isDigit(c)) {
                    pos++;
                } else if (c == '.' || c == 'e' || c == 'E' || c == '+' || c == '-') {
                    integral = false;
                    pos++;
                } else {
                    break;
                }
            }
            String number = text.substring(start, pos);
            try {
                return integral ? (Number) Long.valueOf(number) : (Number) Double.valueOf(number);
            } catch (NumberFormatException e) {
                throw error("Invalid number '" + number + "'");
            }
        }

        private Object literal(String word, Object value) {
            if (!text.startsWith(word, pos)) {
                throw error("Expected " + word);
            }
            pos += word.length();
            return value;
        }

        private char peek() {
            if (pos >= text.length()) {
                throw error("Unexpected end of input");
            }
            return text.charAt(pos);
        }

        private void expect(char c) {
            if (peek() != c) {
                throw error("Expected '" + c + "'");
            }
            pos++;
        }

        private boolean consume(char c) {
            if (pos < text.length() && text.charAt(pos) == c) {
                pos++;
                return true;
            }
            return false;
        }

        private void skipWhitespace() {
            while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
                pos++;
            }
        }

        private IllegalArgumentException error(String message) {
            return new IllegalArgumentException(message + " at position " + pos);
        }
    }
}
