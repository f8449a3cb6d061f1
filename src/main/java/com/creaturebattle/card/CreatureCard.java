package com.creaturebattle.card;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Creature card data.
 */
public class CreatureCard {
    @JsonProperty("template_id")
    private String templateId;

    @JsonProperty("name")
    private String name;

    @JsonProperty("max_hp")
    private int maxHp;

    @JsonProperty("type")
    private EnergyType type = EnergyType.COLORLESS;

    @JsonProperty("weakness")
    private EnergyType weakness;

    @JsonProperty("retreat_cost")
    private int retreatCost;

    @JsonProperty("attacks")
    private List<Attack> attacks = new ArrayList<>();

    @JsonProperty("ability")
    private Ability ability;

    @JsonProperty("stage")
    private int stage;

    @JsonProperty("evolves_from")
    private String evolvesFrom;

    @JsonProperty("attributes")
    private CreatureAttributes attributes = new CreatureAttributes();

    public String getTemplateId() {
        return templateId;
    }

    public String getName() {
        return name;
    }

    public int getMaxHp() {
        return maxHp;
    }

    public EnergyType getType() {
        return type;
    }

    public EnergyType getWeakness() {
        return weakness;
    }

    public int getRetreatCost() {
        return retreatCost;
    }

    public List<Attack> getAttacks() {
        return attacks;
    }

    public Ability getAbility() {
        return ability;
    }

    public boolean hasAbility() {
        return ability != null;
    }

    public int getStage() {
        return stage;
    }

    /**
     * Name (not template id) of the previous stage, or null for a basic creature.
     */
    public String getEvolvesFrom() {
        return evolvesFrom;
    }

    public boolean isBasic() {
        return evolvesFrom == null;
    }

    public CreatureAttributes getAttributes() {
        return attributes;
    }

    // Setters for Jackson
    public void setTemplateId(String templateId) { this.templateId = templateId; }
    public void setName(String name) { this.name = name; }
    public void setMaxHp(int maxHp) { this.maxHp = maxHp; }
    public void setType(EnergyType type) { this.type = type; }
    public void setWeakness(EnergyType weakness) { this.weakness = weakness; }
    public void setRetreatCost(int retreatCost) { this.retreatCost = retreatCost; }
    public void setAttacks(List<Attack> attacks) { this.attacks = attacks; }
    public void setAbility(Ability ability) { this.ability = ability; }
    public void setStage(int stage) { this.stage = stage; }
    public void setEvolvesFrom(String evolvesFrom) { this.evolvesFrom = evolvesFrom; }
    public void setAttributes(CreatureAttributes attributes) { this.attributes = attributes; }
}
