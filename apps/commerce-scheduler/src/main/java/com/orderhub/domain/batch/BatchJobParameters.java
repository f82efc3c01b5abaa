package com.orderhub.domain.batch;

import com.orderhub.support.error.CoreException;
import com.orderhub.support.error.ErrorType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 배치 작업 실행 파라미터.
 *
 * @param values 파라미터 값
 */
public record BatchJobParameters(Map<String, Object> values) {

    public BatchJobParameters {
        values = values == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static BatchJobParameters empty() {
        return new BatchJobParameters(Map.of());
    }

    public static BatchJobParameters of(Map<String, Object> values) {
        return new BatchJobParameters(values);
    }

    public String getString(String key, String defaultValue) {
        Object value = values.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    public double getDouble(String key, double defaultValue) {
        Object value = values.get(key);
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String text && !text.isBlank()) {
            try {
                return Double.parseDouble(text.trim());
            } catch (NumberFormatException e) {
                throw invalidNumber(key, text);
            }
        }
        return defaultValue;
    }

    public int getInt(String key, int defaultValue) {
        Object value = values.get(key);
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value instanceof String text && !text.isBlank()) {
            try {
                return Integer.parseInt(text.trim());
            } catch (NumberFormatException e) {
                throw invalidNumber(key, text);
            }
        }
        return defaultValue;
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> getMap(String key) {
        Object value = values.get(key);
        if (value instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        return Map.of();
    }

    private static CoreException invalidNumber(String key, String text) {
        return new CoreException(ErrorType.BAD_REQUEST,
            String.format("파라미터 '%s'의 값 '%s'은(는) 숫자가 아닙니다.", key, text));
    }
}
