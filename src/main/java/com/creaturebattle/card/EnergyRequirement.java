package com.creaturebattle.card;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One line of an attack cost. COLORLESS is paid by any attached energy.
 */
public class EnergyRequirement {
    @JsonProperty("type")
    private EnergyType type;

    @JsonProperty("amount")
    private int amount;

    public EnergyRequirement() {
    }

    public EnergyRequirement(EnergyType type, int amount) {
        this.type = type;
        this.amount = amount;
    }

    public EnergyType getType() {
        return type;
    }

    public int getAmount() {
        return amount;
    }

    public void setType(EnergyType type) { this.type = type; }
    public void setAmount(int amount) { this.amount = amount; }
}
