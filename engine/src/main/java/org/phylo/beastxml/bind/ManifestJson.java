package org.phylo.beastxml.bind;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Zero-dependency JSON reader for binding-context manifests.
 *
 * Produces {@code Map} (objects, key order kept), {@code List}, {@code String},
 * {@code Long}/{@code Double}, {@code Boolean} and null. Any syntax error is a
 * {@link ManifestException} carrying the character offset.
 */
final class ManifestJson {

    private ManifestJson() {
    }

    static Object parse(String json) {
        if (json == null || json.isBlank()) {
            throw new ManifestException("Manifest is empty");
        }
        Parser parser = new Parser(json);
        Object value = parser.parseValue();
        parser.skipWhitespace();
        if (parser.pos < json.length()) {
            throw parser.error("Unexpected trailing content");
        }
        return value;
    }

    // ========== TYPED ACCESS ==========

    @SuppressWarnings("unchecked")
    static Map<String, Object> asObject(Object value, String where) {
        if (value instanceof Map) {
            return (Map<String, Object>) value;
        }
        throw new ManifestException(where + " must be an object");
    }

    static List<Object> getList(Map<String, Object> map, String key, String where) {
        Object value = map.get(key);
        if (value == null) {
            return List.of();
        }
        if (value instanceof List<?> list) {
            return new ArrayList<>(list);
        }
        throw new ManifestException(where + "." + key + " must be an array");
    }

    static Map<String, Object> getObject(Map<String, Object> map, String key, String where) {
        Object value = map.get(key);
        return value == null ? Map.of() : asObject(value, where + "." + key);
    }

    static String getString(Map<String, Object> map, String key, String where) {
        Object value = map.get(key);
        if (value == null || value instanceof String) {
            return (String) value;
        }
        throw new ManifestException(where + "." + key + " must be a string");
    }

    static String requireString(Map<String, Object> map, String key, String where) {
        String value = getString(map, key, where);
        if (value == null) {
            throw new ManifestException(where + "." + key + " is required");
        }
        return value;
    }

    // ========== PARSER IMPLEMENTATION ==========

    private static class Parser {
        private final String json;
        private int pos = 0;

        Parser(String json) {
            this.json = json;
        }

        Object parseValue() {
            skipWhitespace();
            if (pos >= json.length()) {
                throw error("Unexpected end of input");
            }
            char c = json.charAt(pos);
            return switch (c) {
                case '{' -> parseObject();
                case '[' -> parseArray();
                case '"' -> parseString();
                case 't', 'f' -> parseBoolean();
                case 'n' -> parseNull();
                default -> parseNumber();
            };
        }

        private Map<String, Object> parseObject() {
            Map<String, Object> map = new LinkedHashMap<>();
            pos++; // skip '{'
            skipWhitespace();
            if (peek() == '}') {
                pos++;
                return map;
            }
            while (true) {
                skipWhitespace();
                if (peek() != '"') {
                    throw error("Expected object key");
                }
                String key = parseString();
                skipWhitespace();
                expect(':');
                if (map.put(key, parseValue()) != null) {
                    throw error("Duplicate key '" + key + "'");
                }
                skipWhitespace();
                char c = peek();
                pos++;
                if (c == '}') {
                    return map;
                }
                if (c != ',') {
                    pos--;
                    throw error("Expected ',' or '}'");
                }
            }
        }

        private List<Object> parseArray() {
            List<Object> list = new ArrayList<>();
            pos++; // skip '['
            skipWhitespace();
            if (peek() == ']') {
                pos++;
                return list;
            }
            while (true) {
                list.add(parseValue());
                skipWhitespace();
                char c = peek();
                pos++;
                if (c == ']') {
                    return list;
                }
                if (c != ',') {
                    pos--;
                    throw error("Expected ',' or ']'");
                }
            }
        }

        private String parseString() {
            pos++; // skip opening quote
            StringBuilder sb = new StringBuilder();
            while (pos < json.length()) {
                char c = json.charAt(pos++);
                if (c == '"') {
                    return sb.toString();
                }
                if (c != '\\') {
                    sb.append(c);
                    continue;
                }
                if (pos >= json.length()) {
                    break;
                }
                char escaped = json.charAt(pos++);
                switch (escaped) {
                    case '"' -> sb.append('"');
                    case '\\' -> sb.append('\\');
                    case '/' -> sb.append('/');
                    case 'b' -> sb.append('\b');
                    case 'f' -> sb.append('\f');
                    case 'n' -> sb.append('\n');
                    case 'r' -> sb.append('\r');
                    case 't' -> sb.append('\t');
                    case 'u' -> {
                        if (pos + 4 > json.length()) {
                            throw error("Truncated unicode escape");
                        }
                        try {
                            sb.append((char) Integer.parseInt(json.substring(pos, pos + 4), 16));
                        } catch (NumberFormatException e) {
                            throw error("Invalid unicode escape");
                        }
                        pos += 4;
                    }
                    default -> throw error("Invalid escape '\\" + escaped + "'");
                }
            }
            throw error("Unterminated string");
        }

        private Number parseNumber() {
            int start = pos;
            if (peek() == '-') {
                pos++;
            }
            while (pos < json.length() && Character.isDigit(json.charAt(pos))) {
                pos++;
            }
            boolean isFloat = false;
            if (peek() == '.') {
                isFloat = true;
                pos++;
                while (pos < json.length() && Character.isDigit(json.charAt(pos))) {
                    pos++;
                }
            }
            if (peek() == 'e' || peek() == 'E') {
                isFloat = true;
                pos++;
                if (peek() == '+' || peek() == '-') {
                    pos++;
                }
                while (pos < json.length() && Character.isDigit(json.charAt(pos))) {
                    pos++;
                }
            }
            String num = json.substring(start, pos);
            try {
                if (isFloat) {
                    return Double.parseDouble(num);
                }
                return Long.parseLong(num);
            } catch (NumberFormatException e) {
                pos = start;
                throw error("Invalid value");
            }
        }

        private Boolean parseBoolean() {
            if (json.startsWith("true", pos)) {
                pos += 4;
                return true;
            } else if (json.startsWith("false", pos)) {
                pos += 5;
                return false;
            }
            throw error("Invalid literal");
        }

        private Object parseNull() {
            if (json.startsWith("null", pos)) {
                pos += 4;
                return null;
            }
            throw error("Invalid literal");
        }

        private char peek() {
            return pos < json.length() ? json.charAt(pos) : '\0';
        }

        void skipWhitespace() {
            while (pos < json.length() && Character.isWhitespace(json.charAt(pos))) {
                pos++;
            }
        }

        private void expect(char expected) {
            if (peek() != expected) {
                throw error("Expected '" + expected + "'");
            }
            pos++;
        }

        ManifestException error(String message) {
            return new ManifestException(message + " at offset " + pos);
        }
    }
}
