package com.creaturebattle.card;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Card categories.
 * TRAINER only appears in search criteria, where it matches supporters and items alike.
 */
public enum CardType {
    CREATURE("creature"),
    SUPPORTER("supporter"),
    ITEM("item"),
    TOOL("tool"),
    TRAINER("trainer");

    private final String jsonValue;

    CardType(String jsonValue) {
        this.jsonValue = jsonValue;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }

    /**
     * Whether a card of type {@code actual} satisfies a criterion asking for this type.
     */
    public boolean accepts(CardType actual) {
        if (this == TRAINER) {
            return actual == SUPPORTER || actual == ITEM;
        }
        return this == actual;
    }

    public static CardType fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Card type cannot be null");
        }
        return switch (value.toLowerCase()) {
            case "creature" -> CREATURE;
            case "supporter" -> SUPPORTER;
            case "item" -> ITEM;
            case "tool" -> TOOL;
            case "trainer" -> TRAINER;
            default -> throw new IllegalArgumentException("Unknown card type: " + value);
        };
    }
}
