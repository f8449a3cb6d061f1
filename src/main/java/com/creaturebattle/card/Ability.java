package com.creaturebattle.card;

import com.creaturebattle.card.effect.Effect;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * A creature ability: a trigger bound to a list of effects.
 */
public class Ability {
    @JsonProperty("name")
    private String name;

    @JsonProperty("trigger")
    private Trigger trigger;

    @JsonProperty("effects")
    private List<Effect> effects = new ArrayList<>();

    public String getName() {
        return name;
    }

    public Trigger getTrigger() {
        return trigger;
    }

    public List<Effect> getEffects() {
        return effects;
    }

    public void setName(String name) { this.name = name; }
    public void setTrigger(Trigger trigger) { this.trigger = trigger; }
    public void setEffects(List<Effect> effects) { this.effects = effects; }
}
