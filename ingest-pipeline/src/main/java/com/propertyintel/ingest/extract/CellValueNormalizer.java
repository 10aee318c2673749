package com.propertyintel.ingest.extract;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns a raw CSV cell into a typed value: trimmed text, null for empty and
 * placeholder cells, Long or Double for numbers, Boolean for yes/no words.
 */
final class CellValueNormalizer {

    private static final Set<String> NULL_SENTINELS = Set.of("", "null", "none", "n/a", "na", "-");
    private static final Pattern INTEGER = Pattern.compile("[-+]?\\d+");
    private static final Pattern DECIMAL = Pattern.compile("[-+]?(\\d+\\.\\d*|\\.\\d+)([eE][-+]?\\d+)?");

    private CellValueNormalizer() {
    }

    static Object clean(String cell) {
        if (cell == null) {
            return null;
        }
        String value = cell.trim();
        String lower = value.toLowerCase(Locale.ROOT);
        if (NULL_SENTINELS.contains(lower)) {
            return null;
        }

        if (DECIMAL.matcher(value).matches()) {
            return Double.parseDouble(value);
        }
        if (INTEGER.matcher(value).matches()) {
            try {
                return Long.parseLong(value);
            } catch (NumberFormatException tooLong) {
                return value;
            }
        }

        switch (lower) {
            case "true", "yes":
                return Boolean.TRUE;
            case "false", "no":
                return Boolean.FALSE;
            default:
                return value;
        }
    }
}
