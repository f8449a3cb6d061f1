package com.creaturebattle.card;

import com.creaturebattle.card.effect.Effect;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Tool card data. A tool with a trigger fires its effects on that event;
 * a tool without one grants its modifier effects for as long as it stays attached.
 */
public class ToolCard {
    @JsonProperty("template_id")
    private String templateId;

    @JsonProperty("name")
    private String name;

    @JsonProperty("effects")
    private List<Effect> effects = new ArrayList<>();

    @JsonProperty("trigger")
    private Trigger trigger;

    public String getTemplateId() {
        return templateId;
    }

    public String getName() {
        return name;
    }

    public List<Effect> getEffects() {
        return effects;
    }

    public Trigger getTrigger() {
        return trigger;
    }

    public boolean isTriggered() {
        return trigger != null;
    }

    public void setTemplateId(String templateId) { this.templateId = templateId; }
    public void setName(String name) { this.name = name; }
    public void setEffects(List<Effect> effects) { this.effects = effects; }
    public void setTrigger(Trigger trigger) { this.trigger = trigger; }
}
