package com.lbs.anomaly.config;

import com.lbs.anomaly.exception.ConfigurationException;

import java.util.Arrays;
import java.util.Locale;

/** Case-insensitive enum parsing for configuration and request values ({@code day-on-day} == {@code DAY_ON_DAY}). */
public final class EnumSettings {

    private EnumSettings() {}

    public static <E extends Enum<E>> E parse(Class<E> type, String value, String field) {
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return Enum.valueOf(type, normalized);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("unknown " + field + " '" + value + "', expected one of "
                    + Arrays.toString(type.getEnumConstants()).toLowerCase(Locale.ROOT));
        }
    }
}
