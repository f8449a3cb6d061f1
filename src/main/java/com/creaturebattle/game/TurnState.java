package com.creaturebattle.game;

import com.creaturebattle.effect.PendingSelection;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Per-turn flags plus the two things that can block the turn: a pending target
 * selection and players who must promote a new active creature.
 */
public class TurnState {
    private boolean supporterPlayed;
    private boolean retreated;
    private boolean shouldEndTurn;
    private final Set<String> evolvedInstances = new HashSet<>();
    private final Set<String> usedAbilities = new HashSet<>();
    private PendingSelection pendingSelection;
    private final Set<Integer> awaitingActive = new LinkedHashSet<>();
    private final Set<String> beforeKnockoutFired = new HashSet<>();
    private EndTurnStage endTurnStage = EndTurnStage.NONE;

    /**
     * How far an interrupted end of turn got. The end of turn can stop for a target
     * selection after each drain and picks up again from here.
     */
    public enum EndTurnStage {
        NONE,
        END_OF_TURN_FIRED,
        CHECKUP_FIRED
    }

    /**
     * Clear the flags at the start of a turn. Pending selection and promotion state
     * are left alone.
     */
    public void startTurn() {
        supporterPlayed = false;
        retreated = false;
        shouldEndTurn = false;
        evolvedInstances.clear();
        usedAbilities.clear();
    }

    public boolean isSupporterPlayed() {
        return supporterPlayed;
    }

    public void setSupporterPlayed(boolean supporterPlayed) {
        this.supporterPlayed = supporterPlayed;
    }

    public boolean isRetreated() {
        return retreated;
    }

    public void setRetreated(boolean retreated) {
        this.retreated = retreated;
    }

    public boolean isShouldEndTurn() {
        return shouldEndTurn;
    }

    public void setShouldEndTurn(boolean shouldEndTurn) {
        this.shouldEndTurn = shouldEndTurn;
    }

    public void markEvolved(String fieldInstanceId) {
        evolvedInstances.add(fieldInstanceId);
    }

    public boolean hasEvolved(String fieldInstanceId) {
        return evolvedInstances.contains(fieldInstanceId);
    }

    public void markAbilityUsed(String fieldInstanceId, String abilityName) {
        usedAbilities.add(fieldInstanceId + "-" + abilityName);
    }

    public boolean hasUsedAbility(String fieldInstanceId, String abilityName) {
        return usedAbilities.contains(fieldInstanceId + "-" + abilityName);
    }

    public Optional<PendingSelection> getPendingSelection() {
        return Optional.ofNullable(pendingSelection);
    }

    public void setPendingSelection(PendingSelection pendingSelection) {
        this.pendingSelection = pendingSelection;
    }

    public void clearPendingSelection() {
        this.pendingSelection = null;
    }

    public Set<Integer> getAwaitingActive() {
        return Set.copyOf(awaitingActive);
    }

    public boolean isAwaitingActive(int player) {
        return awaitingActive.contains(player);
    }

    public void addAwaitingActive(int player) {
        awaitingActive.add(player);
    }

    public void removeAwaitingActive(int player) {
        awaitingActive.remove(player);
    }

    /**
     * Record that before-knockout triggers ran for a creature.
     * @return false if they had already run
     */
    public boolean markBeforeKnockoutFired(String fieldInstanceId) {
        return beforeKnockoutFired.add(fieldInstanceId);
    }

    public void clearBeforeKnockoutFired(String fieldInstanceId) {
        beforeKnockoutFired.remove(fieldInstanceId);
    }

    public EndTurnStage getEndTurnStage() {
        return endTurnStage;
    }

    public void setEndTurnStage(EndTurnStage endTurnStage) {
        this.endTurnStage = endTurnStage;
    }

    public boolean isEndingTurn() {
        return endTurnStage != EndTurnStage.NONE;
    }
}
