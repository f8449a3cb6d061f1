package com.creaturebattle.card;

import com.creaturebattle.card.effect.AmountSpec;
import com.creaturebattle.card.effect.Effect;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * An attack printed on a creature.
 */
public class Attack {
    @JsonProperty("name")
    private String name;

    @JsonProperty("damage")
    private AmountSpec damage = new AmountSpec.Constant(0);

    @JsonProperty("energy_requirements")
    private List<EnergyRequirement> energyRequirements = new ArrayList<>();

    @JsonProperty("effects")
    private List<Effect> effects = new ArrayList<>();

    public String getName() {
        return name;
    }

    public AmountSpec getDamage() {
        return damage;
    }

    public List<EnergyRequirement> getEnergyRequirements() {
        return energyRequirements;
    }

    public List<Effect> getEffects() {
        return effects;
    }

    public void setName(String name) { this.name = name; }
    public void setDamage(AmountSpec damage) { this.damage = damage; }
    public void setEnergyRequirements(List<EnergyRequirement> energyRequirements) { this.energyRequirements = energyRequirements; }
    public void setEffects(List<Effect> effects) { this.effects = effects; }
}
