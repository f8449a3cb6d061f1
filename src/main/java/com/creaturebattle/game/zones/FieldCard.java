package com.creaturebattle.game.zones;

import java.util.ArrayList;
import java.util.List;

/**
 * A creature in play.
 * The evolution stack holds the base form first and the current form last. The field
 * instance id is the base form's instance id and stays the same through evolution, so
 * energy, tools and passives keyed by it survive evolving.
 */
public class FieldCard {
    private final String fieldInstanceId;
    private final List<EvolutionEntry> evolutionStack;
    private int damageTaken;
    private int turnLastPlayed;

    public FieldCard(CardInstance basic, int turnPlayed) {
        this.fieldInstanceId = basic.instanceId();
        this.evolutionStack = new ArrayList<>();
        this.evolutionStack.add(EvolutionEntry.of(basic));
        this.damageTaken = 0;
        this.turnLastPlayed = turnPlayed;
    }

    public String getFieldInstanceId() {
        return fieldInstanceId;
    }

    /**
     * Template id of the current (top) form.
     */
    public String getTemplateId() {
        return getCurrentForm().templateId();
    }

    public EvolutionEntry getCurrentForm() {
        return evolutionStack.get(evolutionStack.size() - 1);
    }

    public List<EvolutionEntry> getEvolutionStack() {
        return List.copyOf(evolutionStack);
    }

    /**
     * Put an evolution card on top. Damage is kept.
     */
    public void evolve(CardInstance evolution, int turn) {
        evolutionStack.add(EvolutionEntry.of(evolution));
        turnLastPlayed = turn;
    }

    public int getDamageTaken() {
        return damageTaken;
    }

    public boolean isDamaged() {
        return damageTaken > 0;
    }

    /**
     * Add damage, capped so the total never passes {@code effectiveHp}.
     * @return the damage actually added
     */
    public int addDamage(int amount, int effectiveHp) {
        int applied = Math.max(0, Math.min(amount, effectiveHp - damageTaken));
        damageTaken += applied;
        return applied;
    }

    /**
     * Remove damage, never below zero.
     * @return the damage actually removed
     */
    public int heal(int amount) {
        int healed = Math.max(0, Math.min(amount, damageTaken));
        damageTaken -= healed;
        return healed;
    }

    public int getTurnLastPlayed() {
        return turnLastPlayed;
    }

    public void setDamageTaken(int damageTaken) {
        this.damageTaken = damageTaken;
    }

    @Override
    public String toString() {
        return getTemplateId() + "(" + fieldInstanceId + ", damage=" + damageTaken + ")";
    }
}
