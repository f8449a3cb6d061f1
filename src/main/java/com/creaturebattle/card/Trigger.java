package com.creaturebattle.card;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Binding from a game event to an ability's or tool's effects.
 * Only the flags relevant to {@link #getType()} are read.
 */
public class Trigger {
    @JsonProperty("type")
    private TriggerType type;

    @JsonProperty("own_turn_only")
    private boolean ownTurnOnly;

    @JsonProperty("first_turn_only")
    private boolean firstTurnOnly;

    @JsonProperty("energy_type")
    private EnergyType energyType;

    @JsonProperty("filter_evolution")
    private boolean filterEvolution;

    @JsonProperty("unlimited")
    private boolean unlimited;

    public Trigger() {
    }

    public Trigger(TriggerType type) {
        this.type = type;
    }

    public TriggerType getType() {
        return type;
    }

    public boolean isOwnTurnOnly() {
        return ownTurnOnly;
    }

    public boolean isFirstTurnOnly() {
        return firstTurnOnly;
    }

    /**
     * For energy-attachment triggers: only fire for this type. Null means any type.
     */
    public EnergyType getEnergyType() {
        return energyType;
    }

    /**
     * For on-play triggers: skip plays that happen through evolution.
     */
    public boolean isFilterEvolution() {
        return filterEvolution;
    }

    /**
     * For manual triggers: usable any number of times per turn.
     */
    public boolean isUnlimited() {
        return unlimited;
    }

    public void setType(TriggerType type) { this.type = type; }
    public void setOwnTurnOnly(boolean ownTurnOnly) { this.ownTurnOnly = ownTurnOnly; }
    public void setFirstTurnOnly(boolean firstTurnOnly) { this.firstTurnOnly = firstTurnOnly; }
    public void setEnergyType(EnergyType energyType) { this.energyType = energyType; }
    public void setFilterEvolution(boolean filterEvolution) { this.filterEvolution = filterEvolution; }
    public void setUnlimited(boolean unlimited) { this.unlimited = unlimited; }
}
