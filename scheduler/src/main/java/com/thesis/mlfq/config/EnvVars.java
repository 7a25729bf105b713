package com.thesis.mlfq.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Environment parsing helpers with defaulting and clamping.
 * 
 * Every helper takes the environment as a map so values can be
 * injected in tests; malformed values fall back to the default.
 */
public final class EnvVars {
    
    private static final Logger LOG = LoggerFactory.getLogger(EnvVars.class);
    
    private EnvVars() {
    }
    
    public static String getOrDefault(Map<String, String> env, String name, String defaultValue) {
        String v = env.get(name);
        return (v == null || v.isBlank()) ? defaultValue : v.trim();
    }
    
    public static int getIntClamped(Map<String, String> env, String name, int defaultValue, int min, int max) {
        String raw = env.get(name);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            int parsed = Integer.parseInt(raw.trim());
            if (parsed < min) return min;
            return Math.min(parsed, max);
        } catch (NumberFormatException e) {
            LOG.warn("[EnvVars] Invalid integer for {}: '{}', using {}", name, raw, defaultValue);
            return defaultValue;
        }
    }
    
    public static long getLongClamped(Map<String, String> env, String name, long defaultValue, long min, long max) {
        String raw = env.get(name);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            long parsed = Long.parseLong(raw.trim());
            if (parsed < min) return min;
            return Math.min(parsed, max);
        } catch (NumberFormatException e) {
            LOG.warn("[EnvVars] Invalid number for {}: '{}', using {}", name, raw, defaultValue);
            return defaultValue;
        }
    }
    
    /**
     * Parse a comma-separated list of non-negative longs.
     * 
     * @return The parsed values, or {@code defaultValue} if the variable is
     *         missing or any element is malformed or negative
     */
    public static long[] getLongList(Map<String, String> env, String name, long[] defaultValue) {
        String raw = env.get(name);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        List<Long> values = new ArrayList<>();
        for (String part : raw.split(",")) {
            try {
                long parsed = Long.parseLong(part.trim());
                if (parsed < 0) {
                    LOG.warn("[EnvVars] Negative element in {}: '{}', using defaults", name, raw);
                    return defaultValue;
                }
                values.add(parsed);
            } catch (NumberFormatException e) {
                LOG.warn("[EnvVars] Invalid list for {}: '{}', using defaults", name, raw);
                return defaultValue;
            }
        }
        return values.stream().mapToLong(Long::longValue).toArray();
    }
    
    public static <E extends Enum<E>> E getEnum(Map<String, String> env, String name, Class<E> type, E defaultValue) {
        String raw = env.get(name);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            return Enum.valueOf(type, raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            LOG.warn("[EnvVars] Unknown {} value for {}: '{}', using {}",
                type.getSimpleName(), name, raw, defaultValue);
            return defaultValue;
        }
    }
}
