package org.dxworks.lintframe.analyzer;

import org.dxworks.lintframe.ConfigurationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Typed view of one analyzer's option bag. Getters are meant to be called from analyzer
 * constructors so a malformed value stops the run before any file is analysed.
 */
public class AnalyzerOptions {

    private final String analyzerId;
    private final Map<String, Object> values;

    public AnalyzerOptions(String analyzerId, Map<String, Object> values) {
        this.analyzerId = analyzerId;
        this.values = values == null ? Collections.emptyMap() : values;
    }

    public static AnalyzerOptions empty(String analyzerId) {
        return new AnalyzerOptions(analyzerId, Collections.emptyMap());
    }

    public String analyzerId() {
        return analyzerId;
    }

    public boolean has(String key) {
        return values.containsKey(key) && values.get(key) != null;
    }

    public int getInt(String key, int defaultValue) {
        Object value = values.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number n && n.doubleValue() == Math.rint(n.doubleValue())) return n.intValue();
        if (value instanceof String s) {
            try {
                return Integer.parseInt(s.trim());
            } catch (NumberFormatException e) {
                throw invalid(key, "an integer", value);
            }
        }
        throw invalid(key, "an integer", value);
    }

    public int getNonNegativeInt(String key, int defaultValue) {
        int value = getInt(key, defaultValue);
        if (value < 0) throw invalid(key, "a non-negative integer", value);
        return value;
    }

    public int getPositiveInt(String key, int defaultValue) {
        int value = getInt(key, defaultValue);
        if (value < 1) throw invalid(key, "a positive integer", value);
        return value;
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        Object value = values.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Boolean b) return b;
        if (value instanceof String s && (s.equalsIgnoreCase("true") || s.equalsIgnoreCase("false"))) {
            return Boolean.parseBoolean(s);
        }
        throw invalid(key, "a boolean", value);
    }

    public List<String> getStringList(String key, List<String> defaultValue) {
        Object value = values.get(key);
        if (value == null) return defaultValue;
        if (!(value instanceof List<?> list)) throw invalid(key, "a list of strings", value);
        List<String> result = new ArrayList<>();
        for (Object item : list) {
            if (!(item instanceof String s)) throw invalid(key, "a list of strings", value);
            result.add(s);
        }
        return Collections.unmodifiableList(result);
    }

    /** Defaults followed by the configured entries. */
    public List<String> getStringListAdding(String key, List<String> defaults) {
        List<String> extra = getStringList(key, Collections.emptyList());
        if (extra.isEmpty()) return defaults;
        List<String> merged = new ArrayList<>(defaults);
        merged.addAll(extra);
        return Collections.unmodifiableList(merged);
    }

    public Map<String, String> getStringMap(String key, Map<String, String> defaultValue) {
        Object value = values.get(key);
        if (value == null) return defaultValue;
        if (!(value instanceof Map<?, ?> map)) throw invalid(key, "a mapping of strings", value);
        Map<String, String> result = new LinkedHashMap<>();
        for (Map.Entry<?, ?> e : map.entrySet()) {
            if (!(e.getKey() instanceof String k) || !(e.getValue() instanceof String v)) {
                throw invalid(key, "a mapping of strings", value);
            }
            result.put(k, v);
        }
        return Collections.unmodifiableMap(result);
    }

    /** Mapping of regular expression to description; every key must compile. */
    public Map<Pattern, String> getPatternMap(String key) {
        Map<String, String> raw = getStringMap(key, Collections.emptyMap());
        Map<Pattern, String> result = new LinkedHashMap<>();
        for (Map.Entry<String, String> e : raw.entrySet()) {
            try {
                result.put(Pattern.compile(e.getKey()), e.getValue());
            } catch (PatternSyntaxException ex) {
                throw new ConfigurationException("Analyzer '" + analyzerId + "': option '" + key
                        + "' contains an invalid regular expression '" + e.getKey() + "': " + ex.getDescription(), ex);
            }
        }
        return result;
    }

    private ConfigurationException invalid(String key, String expected, Object actual) {
        return new ConfigurationException("Analyzer '" + analyzerId + "': option '" + key
                + "' must be " + expected + ", got " + actual);
    }
}
