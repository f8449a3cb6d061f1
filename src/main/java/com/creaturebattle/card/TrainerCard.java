package com.creaturebattle.card;

import com.creaturebattle.card.effect.Effect;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Supporter and item card data.
 */
public class TrainerCard {
    @JsonProperty("template_id")
    private String templateId;

    @JsonProperty("name")
    private String name;

    @JsonProperty("effects")
    private List<Effect> effects = new ArrayList<>();

    public String getTemplateId() {
        return templateId;
    }

    public String getName() {
        return name;
    }

    public List<Effect> getEffects() {
        return effects;
    }

    public void setTemplateId(String templateId) { this.templateId = templateId; }
    public void setName(String name) { this.name = name; }
    public void setEffects(List<Effect> effects) { this.effects = effects; }
}
