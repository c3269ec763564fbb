package io.formresolve.core.model;

import java.util.Locale;

/**
 * UI modality of a field. Within a canonical group, {@link #BASIC} (pickers, selectors) takes
 * precedence over {@link #ADVANCED} (manual entry).
 */
public enum FieldMode {
    BASIC,
    ADVANCED;

    public static FieldMode fromSchema(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
