package com.creaturebattle.card;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Energy types. COLORLESS only appears in attack requirements and creature types;
 * it can never be attached.
 */
public enum EnergyType {
    FIRE("fire"),
    WATER("water"),
    GRASS("grass"),
    LIGHTNING("lightning"),
    PSYCHIC("psychic"),
    FIGHTING("fighting"),
    DARKNESS("darkness"),
    METAL("metal"),
    COLORLESS("colorless");

    private final String jsonValue;

    EnergyType(String jsonValue) {
        this.jsonValue = jsonValue;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }

    public boolean isAttachable() {
        return this != COLORLESS;
    }

    public static EnergyType fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Energy type cannot be null");
        }
        return switch (value.toLowerCase()) {
            case "fire" -> FIRE;
            case "water" -> WATER;
            case "grass" -> GRASS;
            case "lightning" -> LIGHTNING;
            case "psychic" -> PSYCHIC;
            case "fighting" -> FIGHTING;
            case "darkness" -> DARKNESS;
            case "metal" -> METAL;
            case "colorless" -> COLORLESS;
            default -> throw new IllegalArgumentException("Unknown energy type: " + value);
        };
    }

    /**
     * The eight types that can be generated and attached.
     */
    public static EnergyType[] attachable() {
        return new EnergyType[] {FIRE, WATER, GRASS, LIGHTNING, PSYCHIC, FIGHTING, DARKNESS, METAL};
    }
}
