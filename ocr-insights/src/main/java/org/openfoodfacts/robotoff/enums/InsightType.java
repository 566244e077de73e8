package org.openfoodfacts.robotoff.enums;

import lombok.Getter;

import java.util.Arrays;
import java.util.Locale;

@Getter
public enum InsightType {
    PACKAGER_CODE("packager_code"),
    LABEL("label"),
    NUTRISCORE("nutriscore"),
    WEIGHT_VALUE("weight_value"),
    WEIGHT_MENTION("weight_mention"),
    RECYCLING_INSTRUCTION("recycling_instruction"),
    EMAIL("email"),
    URL("url"),
    PHONE_NUMBER("phone_number"),
    STORAGE_INSTRUCTION("storage_instruction"),
    BEST_BEFORE_DATE("best_before_date");

    private final String name;

    InsightType(String name) {
        this.name = name;
    }

    /**
     * Accepts both the wire name ({@code packager_code}) and the constant name ({@code PACKAGER_CODE}).
     */
    public static InsightType fromName(String name) {
        return Arrays.stream(values())
                .filter(type -> type.name.equals(name) || type.name().equals(name.toUpperCase(Locale.ROOT)))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("unknown insight type: " + name));
    }
}
