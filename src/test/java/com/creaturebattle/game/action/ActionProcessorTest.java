package com.creaturebattle.game.action;

import com.creaturebattle.card.CardRepository;
import com.creaturebattle.card.CardRepositoryException;
import com.creaturebattle.card.CardType;
import com.creaturebattle.card.EnergyType;
import com.creaturebattle.card.effect.AmountSpec;
import com.creaturebattle.card.effect.Effect;
import com.creaturebattle.card.effect.FieldPosition;
import com.creaturebattle.card.effect.PlayerScope;
import com.creaturebattle.card.effect.StatusCondition;
import com.creaturebattle.config.EngineConfig;
import com.creaturebattle.effect.EffectContext;
import com.creaturebattle.effect.EffectQueue;
import com.creaturebattle.effect.PendingSelection;
import com.creaturebattle.effect.SelectionRole;
import com.creaturebattle.game.GameState;
import com.creaturebattle.game.StateBuilder;
import com.creaturebattle.game.zones.FieldCard;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ActionProcessorTest {

    private static CardRepository repo;

    @BeforeAll
    static void loadCards() throws CardRepositoryException {
        repo = StateBuilder.testCards();
    }

    private static FieldCard at(GameState state, int player, int fieldIndex) {
        return state.getPlayer(player).getField().require(fieldIndex);
    }

    private static int allCards(GameState state) {
        return StateBuilder.totalCards(state, 0) + StateBuilder.totalCards(state, 1);
    }

    // ---- Turn order and gating ----

    @Test
    void testNotYourTurn() {
        GameState state = StateBuilder.forCards(repo).atTurn(3)
                .withActive(0, "alpha").withActive(1, "bravo")
                .withHand(1, "potion")
                .build();
        ActionResult result = ActionProcessor.process(state, 1, new Action.PlayCard(0));

        assertFalse(result.accepted());
        assertTrue(result.message().contains("player 0's turn"));
        assertEquals(1, state.getPlayer(1).getHand().size());
    }

    @Test
    void testUnknownPlayer() {
        GameState state = StateBuilder.forCards(repo).build();
        assertThrows(RuntimeException.class, () -> ActionProcessor.process(state, 2, new Action.EndTurn()));
    }

    @Test
    void testSelectionRejectedWhenNothingPending() {
        GameState state = StateBuilder.forCards(repo).atTurn(3).withActive(0, "alpha").build();
        assertFalse(ActionProcessor.process(state, 0, new Action.SelectTarget(0, 0)).accepted());
        assertFalse(ActionProcessor.process(state, 0, new Action.SelectActive(0)).accepted());
    }

    // ---- Trainers ----

    @Test
    void testSecondSupporterRejected() {
        GameState state = StateBuilder.forCards(repo).atTurn(3)
                .withActive(0, "alpha").withActive(1, "tank")
                .withHand(0, "zap-order", "zap-order")
                .build();
        ActionResult first = ActionProcessor.process(state, 0, new Action.PlayCard(0));
        assertTrue(first.accepted());
        assertEquals(30, at(state, 1, 0).getDamageTaken());
        assertEquals(1, state.getPlayer(0).getDiscard().count(CardType.SUPPORTER));

        ActionResult second = ActionProcessor.process(state, 0, new Action.PlayCard(0));
        assertFalse(second.accepted());
        assertEquals(1, state.getPlayer(0).getHand().size());
        assertEquals(30, at(state, 1, 0).getDamageTaken());
        assertEquals(1, state.getExecutedActions());
    }

    @Test
    void testSupporterWithNothingToDoRejected() {
        GameState state = StateBuilder.forCards(repo).atTurn(3)
                .withActive(0, "alpha").withActive(1, "tank")
                .withHand(0, "field-medic")
                .build();
        ActionResult result = ActionProcessor.process(state, 0, new Action.PlayCard(0));

        assertFalse(result.accepted());
        assertFalse(state.getTurnState().isSupporterPlayed());
        assertEquals(1, state.getPlayer(0).getHand().size());
    }

    @Test
    void testKnockoutFromSupporterAndPromotion() {
        GameState state = StateBuilder.forCards(repo).atTurn(3)
                .withActive(0, "tank")
                .withActive(1, "alpha").withBench(1, "bravo")
                .withDamage(1, 0, 70)
                .withEnergy(1, 0, EnergyType.FIRE, 2)
                .withHand(0, "zap-order")
                .build();
        int before = allCards(state);

        assertTrue(ActionProcessor.process(state, 0, new Action.PlayCard(0)).accepted());

        assertEquals(1, state.getPlayer(0).getPoints());
        assertFalse(state.getPlayer(1).getField().hasActive());
        assertTrue(state.getTurnState().isAwaitingActive(1));
        assertEquals(2, state.getEnergy().totalDiscarded(1));
        assertEquals(before, allCards(state));

        // only the promotion is accepted now
        assertFalse(ActionProcessor.process(state, 0, new Action.EndTurn()).accepted());
        assertFalse(ActionProcessor.process(state, 1, new Action.SelectActive(3)).accepted());
        assertTrue(ActionProcessor.process(state, 1, new Action.SelectActive(0)).accepted());
        assertEquals("bravo", at(state, 1, 0).getTemplateId());
        assertTrue(ActionProcessor.process(state, 0, new Action.EndTurn()).accepted());
    }

    @Test
    void testTargetSelectionFlow() {
        GameState state = StateBuilder.forCards(repo).atTurn(3)
                .withActive(0, "alpha")
                .withActive(1, "tank").withBench(1, "bravo")
                .withHand(0, "sniper")
                .build();
        ActionResult played = ActionProcessor.process(state, 0, new Action.PlayCard(0));

        assertTrue(played.accepted());
        assertTrue(played.isAwaitingSelection());
        ActionResult.SelectionView view = played.getSelection().orElseThrow();
        assertEquals(0, view.chooser());
        assertEquals("Sniper", view.effectName());
        assertEquals(SelectionRole.TARGET, view.role());
        assertEquals(List.of(new FieldPosition(1, 0), new FieldPosition(1, 1)), view.candidates());

        assertFalse(ActionProcessor.process(state, 0, new Action.EndTurn()).accepted());
        assertFalse(ActionProcessor.process(state, 1, new Action.SelectTarget(1, 1)).accepted());
        ActionResult bad = ActionProcessor.process(state, 0, new Action.SelectTarget(0, 0));
        assertFalse(bad.accepted());
        assertTrue(bad.isAwaitingSelection());

        ActionResult chosen = ActionProcessor.process(state, 0, new Action.SelectTarget(1, 1));
        assertTrue(chosen.accepted());
        assertFalse(chosen.isAwaitingSelection());
        assertEquals(20, at(state, 1, 1).getDamageTaken());
        assertEquals(0, at(state, 1, 0).getDamageTaken());
    }

    @Test
    void testRejectedSelectionLeavesPendingSelectionAlone() {
        GameState state = StateBuilder.forCards(repo).atTurn(3)
                .withActive(0, "alpha")
                .withActive(1, "tank").withBench(1, "bravo")
                .withHand(0, "sniper")
                .build();
        assertTrue(ActionProcessor.process(state, 0, new Action.PlayCard(0)).accepted());
        PendingSelection pending = state.getTurnState().getPendingSelection().orElseThrow();
        int executed = state.getExecutedActions();

        ActionResult bad = ActionProcessor.process(state, 0, new Action.SelectTarget(1, 2));
        assertFalse(bad.accepted());
        assertTrue(bad.message().contains("not one of the candidates"));
        assertSame(pending, state.getTurnState().getPendingSelection().orElseThrow());
        assertEquals(executed, state.getExecutedActions());
        assertEquals(0, at(state, 1, 0).getDamageTaken());
        assertEquals(0, at(state, 1, 1).getDamageTaken());
    }

    @Test
    void testToolAttachment() {
        GameState state = StateBuilder.forCards(repo).atTurn(3)
                .withActive(0, "alpha").withBench(0, "bravo")
                .withHand(0, "shell", "alarm", "alarm")
                .build();
        assertTrue(ActionProcessor.process(state, 0, new Action.PlayCard(0, 1)).accepted());
        assertTrue(state.getTools().hasTool(at(state, 0, 1).getFieldInstanceId()));
        assertEquals(1, state.getPassiveEffects().size());

        // a creature holds one tool
        assertFalse(ActionProcessor.process(state, 0, new Action.PlayCard(0, 1)).accepted());
        assertFalse(ActionProcessor.process(state, 0, new Action.PlayCard(0, 2)).accepted());
        assertTrue(ActionProcessor.process(state, 0, new Action.PlayCard(0)).accepted());
        assertEquals(1, state.getPlayer(0).getHand().size());
    }

    @Test
    void testPlayingPreventedBlocksTrainers() {
        GameState state = StateBuilder.forCards(repo).atTurn(3)
                .withActive(0, "alpha").withActive(1, "tank")
                .withHand(0, "potion")
                .withDamage(0, 0, 30)
                .build();
        EffectQueue.enqueue(state, List.of(new Effect.PreventPlaying(List.of(CardType.ITEM), PlayerScope.OPPONENT, null)),
                new EffectContext.Trainer(1, "Lockdown", CardType.SUPPORTER));
        EffectQueue.drain(state);

        assertFalse(ActionProcessor.process(state, 0, new Action.PlayCard(0)).accepted());
    }

    // ---- Creatures ----

    @Test
    void testPlayBasicCreature() {
        GameState state = StateBuilder.forCards(repo).atTurn(3)
                .withHand(0, "alpha", "bravo", "alpha-prime")
                .build();
        assertTrue(ActionProcessor.process(state, 0, new Action.PlayCard(0)).accepted());
        assertEquals("alpha", at(state, 0, 0).getTemplateId());
        assertTrue(ActionProcessor.process(state, 0, new Action.PlayCard(0)).accepted());
        assertEquals("bravo", at(state, 0, 1).getTemplateId());
        // evolutions cannot be played directly
        assertFalse(ActionProcessor.process(state, 0, new Action.PlayCard(0)).accepted());
    }

    @Test
    void testBenchLimit() {
        EngineConfig config = EngineConfig.defaults();
        config.setMaxBenchSize(1);
        GameState state = StateBuilder.forCards(repo).withConfig(config).atTurn(3)
                .withActive(0, "alpha").withBench(0, "bravo")
                .withHand(0, "tank")
                .build();
        ActionResult result = ActionProcessor.process(state, 0, new Action.PlayCard(0));
        assertFalse(result.accepted());
        assertTrue(result.message().contains("Bench is full"));
    }

    @Test
    void testEvolutionMatchesByName() {
        GameState state = StateBuilder.forCards(repo).atTurn(3)
                .withActive(0, "alpha-promo")
                .withDamage(0, 0, 20)
                .withStatus(0, StatusCondition.POISON, 2)
                .withHand(0, "alpha-prime")
                .build();
        String fieldId = at(state, 0, 0).getFieldInstanceId();
        assertTrue(ActionProcessor.process(state, 0, new Action.Evolve(0, 0)).accepted());

        FieldCard evolved = at(state, 0, 0);
        assertEquals("alpha-prime", evolved.getTemplateId());
        assertEquals(fieldId, evolved.getFieldInstanceId());
        assertEquals(2, evolved.getEvolutionStack().size());
        assertEquals(20, evolved.getDamageTaken());
        assertFalse(state.getStatuses().has(0, StatusCondition.POISON));
    }

    @Test
    void testNoEvolutionInFirstTwoTurns() {
        GameState state = StateBuilder.forCards(repo).atTurn(2)
                .withActive(1, "alpha")
                .withHand(1, "alpha-prime")
                .build();
        assertFalse(ActionProcessor.process(state, 1, new Action.Evolve(0, 0)).accepted());
    }

    @Test
    void testNoEvolutionOnTurnPlayed() {
        GameState state = StateBuilder.forCards(repo).atTurn(3)
                .withHand(0, "alpha", "alpha-prime")
                .build();
        assertTrue(ActionProcessor.process(state, 0, new Action.PlayCard(0)).accepted());
        assertFalse(ActionProcessor.process(state, 0, new Action.Evolve(0, 0)).accepted());
    }

    @Test
    void testEvolutionNameMismatch() {
        GameState state = StateBuilder.forCards(repo).atTurn(3)
                .withActive(0, "bravo")
                .withHand(0, "alpha-prime")
                .build();
        ActionResult result = ActionProcessor.process(state, 0, new Action.Evolve(0, 0));
        assertFalse(result.accepted());
        assertTrue(result.message().contains("does not evolve from Bravo"));
    }

    // ---- Energy ----

    @Test
    void testAttachEnergyOncePerTurn() {
        GameState state = StateBuilder.forCards(repo).atTurn(3)
                .withActive(0, "alpha").withBench(0, "bravo")
                .withCurrentEnergy(0, EnergyType.FIRE)
                .build();
        assertTrue(ActionProcessor.process(state, 0, new Action.AttachEnergy(1)).accepted());
        assertEquals(1, state.getEnergy().count(at(state, 0, 1).getFieldInstanceId(), EnergyType.FIRE));
        assertNull(state.getEnergy().getCurrentEnergy(0));

        state.getEnergy().setCurrentEnergy(0, EnergyType.FIRE);
        assertFalse(ActionProcessor.process(state, 0, new Action.AttachEnergy(0)).accepted());
    }

    @Test
    void testNoEnergyOnFirstTurn() {
        GameState state = StateBuilder.forCards(repo)
                .withActive(0, "alpha")
                .withCurrentEnergy(0, EnergyType.FIRE)
                .build();
        assertFalse(ActionProcessor.process(state, 0, new Action.AttachEnergy(0)).accepted());
    }

    // ---- Retreat ----

    @Test
    void testRetreatPaysCost() {
        GameState state = StateBuilder.forCards(repo).atTurn(3)
                .withActive(0, "alpha").withBench(0, "tank")
                .withEnergy(0, 0, EnergyType.FIRE, 2)
                .withStatus(0, StatusCondition.POISON, 2)
                .build();
        String alpha = at(state, 0, 0).getFieldInstanceId();
        assertTrue(ActionProcessor.process(state, 0, new Action.Retreat(0)).accepted());

        assertEquals("tank", at(state, 0, 0).getTemplateId());
        assertEquals(1, state.getEnergy().total(alpha));
        assertEquals(1, state.getEnergy().totalDiscarded(0));
        assertFalse(state.getStatuses().has(0, StatusCondition.POISON));
        assertFalse(ActionProcessor.process(state, 0, new Action.Retreat(0)).accepted());
    }

    @Test
    void testHeavyAnchorBlocksRetreatNextTurn() {
        GameState state = StateBuilder.forCards(repo).atTurn(3)
                .withActive(0, "alpha")
                .withActive(1, "bravo").withBench(1, "tank")
                .withEnergy(1, 0, EnergyType.WATER, 1)
                .withHand(0, "heavy-anchor")
                .build();
        assertTrue(ActionProcessor.process(state, 0, new Action.PlayCard(0)).accepted());
        assertTrue(ActionProcessor.process(state, 0, new Action.EndTurn()).accepted());
        assertEquals(4, state.getTurn());
        assertEquals(1, state.getCurrentPlayer());

        ActionResult result = ActionProcessor.process(state, 1, new Action.Retreat(0));
        assertFalse(result.accepted());
        assertTrue(result.message().contains("costs 2"));

        state.getEnergy().attach(at(state, 1, 0).getFieldInstanceId(), EnergyType.WATER, 1);
        assertTrue(ActionProcessor.process(state, 1, new Action.Retreat(0)).accepted());
    }

    @Test
    void testParalysisBlocksRetreatAndAttack() {
        GameState state = StateBuilder.forCards(repo).atTurn(3)
                .withActive(0, "alpha").withBench(0, "tank")
                .withActive(1, "bravo")
                .withEnergy(0, 0, EnergyType.FIRE, 2)
                .withStatus(0, StatusCondition.PARALYSIS, 2)
                .build();
        assertFalse(ActionProcessor.process(state, 0, new Action.Retreat(0)).accepted());
        assertFalse(ActionProcessor.process(state, 0, new Action.Attack(0)).accepted());
    }

    // ---- Attacks ----

    @Test
    void testAttackAppliesWeaknessAndEndsTurn() {
        GameState state = StateBuilder.forCards(repo).atTurn(3)
                .withActive(0, "bravo")
                .withActive(1, "alpha")
                .withEnergy(0, 0, EnergyType.WATER, 1)
                .withDeck(1, "potion")
                .build();
        ActionResult result = ActionProcessor.process(state, 0, new Action.Attack(0));

        assertTrue(result.accepted());
        assertEquals(40, at(state, 1, 0).getDamageTaken());
        assertEquals(4, state.getTurn());
        assertEquals(1, state.getCurrentPlayer());
        assertEquals(1, state.getPlayer(1).getHand().size());
        assertNotNull(state.getEnergy().getCurrentEnergy(1));
    }

    @Test
    void testAttackRequirements() {
        GameState state = StateBuilder.forCards(repo).atTurn(3)
                .withActive(0, "alpha")
                .withActive(1, "bravo")
                .withEnergy(0, 0, EnergyType.WATER, 2)
                .build();
        // Flame Burst needs two fire
        assertFalse(ActionProcessor.process(state, 0, new Action.Attack(1)).accepted());
        assertFalse(ActionProcessor.process(state, 0, new Action.Attack(5)).accepted());
        assertTrue(ActionProcessor.process(state, 0, new Action.Attack(0)).accepted());
    }

    @Test
    void testNoAttackOnFirstTurn() {
        GameState state = StateBuilder.forCards(repo)
                .withActive(0, "alpha").withActive(1, "bravo")
                .withEnergy(0, 0, EnergyType.FIRE, 1)
                .build();
        assertFalse(ActionProcessor.process(state, 0, new Action.Attack(0)).accepted());
    }

    @Test
    void testDamageBoostAddsToAttack() {
        GameState state = StateBuilder.forCards(repo).atTurn(3)
                .withActive(0, "alpha")
                .withActive(1, "tank")
                .withEnergy(0, 0, EnergyType.FIRE, 1)
                .withHand(0, "power-drill")
                .build();
        assertTrue(ActionProcessor.process(state, 0, new Action.PlayCard(0)).accepted());
        assertTrue(ActionProcessor.process(state, 0, new Action.Attack(0)).accepted());
        assertEquals(40, at(state, 1, 0).getDamageTaken());
        // the boost ended with the turn
        assertEquals(0, state.getPassiveEffects().size());
    }

    @Test
    void testConfusionTailsDealsSelfDamage() {
        GameState state = StateBuilder.forCards(repo).atTurn(3)
                .withActive(0, "alpha").withActive(1, "tank")
                .withEnergy(0, 0, EnergyType.FIRE, 1)
                .withStatus(0, StatusCondition.CONFUSION, 2)
                .build();
        state.getCoinFlipper().queueResults(List.of(false));
        assertTrue(ActionProcessor.process(state, 0, new Action.Attack(0)).accepted());

        assertEquals(30, at(state, 0, 0).getDamageTaken());
        assertEquals(0, at(state, 1, 0).getDamageTaken());
        assertEquals(1, state.getCurrentPlayer());
    }

    @Test
    void testAttackKnockoutScoresAndAwaitsPromotion() {
        GameState state = StateBuilder.forCards(repo).atTurn(3)
                .withActive(0, "alpha")
                .withActive(1, "bravo").withBench(1, "tank")
                .withEnergy(0, 0, EnergyType.FIRE, 2)
                .withEnergy(1, 0, EnergyType.WATER, 1)
                .withTool(1, 0, "alarm")
                .withDamage(1, 0, 20)
                .build();
        int before = allCards(state);
        assertTrue(ActionProcessor.process(state, 0, new Action.Attack(1)).accepted());

        assertEquals(1, state.getPlayer(0).getPoints());
        assertEquals(2, state.getPlayer(1).getDiscard().size());
        assertEquals(1, state.getEnergy().totalDiscarded(1));
        assertEquals(before, allCards(state));
        assertEquals(1, state.getCurrentPlayer());
        assertTrue(state.getTurnState().isAwaitingActive(1));

        assertTrue(ActionProcessor.process(state, 1, new Action.SelectActive(0)).accepted());
        assertTrue(ActionProcessor.process(state, 1, new Action.EndTurn()).accepted());
    }

    @Test
    void testAttackCostReducedByTool() {
        GameState state = StateBuilder.forCards(repo).atTurn(3)
                .withActive(0, "alpha").withActive(1, "tank")
                .withEnergy(0, 0, EnergyType.FIRE, 1)
                .withHand(0, "focus-band")
                .build();
        assertFalse(ActionProcessor.process(state, 0, new Action.Attack(1)).accepted());

        assertTrue(ActionProcessor.process(state, 0, new Action.PlayCard(0, 0)).accepted());
        assertTrue(ActionProcessor.process(state, 0, new Action.Attack(1)).accepted());
        assertEquals(60, at(state, 1, 0).getDamageTaken());
    }

    @Test
    void testLastPointWinsTheGame() {
        EngineConfig config = EngineConfig.defaults();
        config.setPointsToWin(1);
        GameState state = StateBuilder.forCards(repo).withConfig(config).atTurn(3)
                .withActive(0, "alpha")
                .withActive(1, "bravo").withBench(1, "tank")
                .withEnergy(0, 0, EnergyType.FIRE, 2)
                .build();
        assertTrue(ActionProcessor.process(state, 0, new Action.Attack(1)).accepted());

        assertTrue(state.isGameOver());
        assertEquals(0, state.getWinner().orElseThrow());
        assertEquals(3, state.getTurn());
        assertFalse(ActionProcessor.process(state, 1, new Action.SelectActive(0)).accepted());
    }

    // ---- Abilities ----

    @Test
    void testUseManualAbility() {
        GameState state = StateBuilder.forCards(repo).atTurn(3)
                .withActive(0, "tank").withBench(0, "mender")
                .withDamage(0, 0, 50)
                .build();
        assertTrue(ActionProcessor.process(state, 0, new Action.UseAbility(1)).accepted());
        assertEquals(30, at(state, 0, 0).getDamageTaken());
        assertFalse(ActionProcessor.process(state, 0, new Action.UseAbility(1)).accepted());
        assertFalse(ActionProcessor.process(state, 0, new Action.UseAbility(0)).accepted());
    }

    @Test
    void testCardConservationAcrossActions() {
        GameState state = StateBuilder.forCards(repo).atTurn(3)
                .withActive(0, "alpha").withBench(0, "bravo")
                .withActive(1, "tank")
                .withHand(0, "reshuffle", "clean-slate", "potion", "shell", "alpha-prime")
                .withDeck(0, "sniper", "mender", "sentinel")
                .withDeck(1, "bravo")
                .withEnergy(0, 0, EnergyType.FIRE, 2)
                .build();
        int mine = StateBuilder.totalCards(state, 0);
        int theirs = StateBuilder.totalCards(state, 1);

        assertTrue(ActionProcessor.process(state, 0, new Action.Evolve(4, 0)).accepted());
        assertEquals(mine, StateBuilder.totalCards(state, 0));

        assertTrue(ActionProcessor.process(state, 0, new Action.PlayCard(3, 1)).accepted());
        assertEquals(mine, StateBuilder.totalCards(state, 0));

        // alpha-prime pays both fire energy to retreat
        assertTrue(ActionProcessor.process(state, 0, new Action.Retreat(0)).accepted());
        assertEquals("bravo", at(state, 0, 0).getTemplateId());
        assertEquals(mine, StateBuilder.totalCards(state, 0));

        // reshuffle: clean-slate and potion go into the deck, three are drawn
        assertTrue(ActionProcessor.process(state, 0, new Action.PlayCard(0)).accepted());
        assertEquals(3, state.getPlayer(0).getHand().size());
        assertEquals(2, state.getPlayer(0).getDeck().size());
        assertEquals(mine, StateBuilder.totalCards(state, 0));

        EffectQueue.enqueue(state, List.of(new Effect.HandDiscard(AmountSpec.of(2), PlayerScope.SELF, true)),
                new EffectContext.Trainer(0, "Recycle", CardType.ITEM));
        EffectQueue.drain(state);
        assertEquals(1, state.getPlayer(0).getHand().size());
        assertEquals(4, state.getPlayer(0).getDeck().size());
        assertEquals(mine, StateBuilder.totalCards(state, 0));

        assertTrue(ActionProcessor.process(state, 0, new Action.EndTurn()).accepted());
        assertEquals(mine, StateBuilder.totalCards(state, 0));
        assertEquals(theirs, StateBuilder.totalCards(state, 1));
    }
}
