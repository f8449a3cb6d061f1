package com.creaturebattle.effect;

import com.creaturebattle.card.CardRepository;
import com.creaturebattle.card.CardRepositoryException;
import com.creaturebattle.card.CardType;
import com.creaturebattle.card.effect.Effect;
import com.creaturebattle.card.effect.FieldPosition;
import com.creaturebattle.card.effect.FieldTarget;
import com.creaturebattle.card.effect.PlayerRef;
import com.creaturebattle.config.EngineConfig;
import com.creaturebattle.game.GameState;
import com.creaturebattle.game.StateBuilder;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EffectQueueTest {

    private static CardRepository repo;

    @BeforeAll
    static void loadCards() throws CardRepositoryException {
        repo = StateBuilder.testCards();
    }

    private static EffectContext trainer(int player, String templateId) {
        return new EffectContext.Trainer(player, repo.require(templateId).getName(),
                repo.require(templateId).getCardType());
    }

    private static int damageAt(GameState state, int player, int fieldIndex) {
        return state.getPlayer(player).getField().require(fieldIndex).getDamageTaken();
    }

    @Test
    void testEffectsResolveInOrder() {
        GameState state = StateBuilder.forCards(repo)
                .withActive(0, "tank")
                .withActive(1, "tank")
                .build();
        FieldTarget opponentActive = FieldTarget.Fixed.activeOf(PlayerRef.OPPONENT);
        EffectContext context = new EffectContext.Trainer(0, "Test", CardType.ITEM);
        // the heal only has something to remove if the damage resolved first
        EffectQueue.enqueue(state, List.of(
                Effect.Hp.damage(50, opponentActive),
                Effect.Hp.heal(20, opponentActive)), context);

        List<QueuedEffect> snapshot = state.getEffectQueue().snapshot();
        assertEquals(2, snapshot.size());
        assertInstanceOf(Effect.Hp.class, snapshot.get(0).effect());

        assertEquals(DrainStatus.IDLE, EffectQueue.drain(state));
        assertEquals(30, damageAt(state, 1, 0));
        assertTrue(state.getEffectQueue().isEmpty());
    }

    @Test
    void testTriggeredEffectsCascadeWithinOneDrain() {
        GameState state = StateBuilder.forCards(repo)
                .withActive(0, "tank")
                .withActive(1, "reactor")
                .build();
        EffectQueue.enqueue(state, repo.getSupporter("zap-order").getEffects(), trainer(0, "zap-order"));

        assertEquals(DrainStatus.IDLE, EffectQueue.drain(state));
        assertEquals(30, damageAt(state, 1, 0));
        // Backlash hits its owner's opponent, player 0
        assertEquals(10, damageAt(state, 0, 0));
    }

    @Test
    void testMutualTriggersSettleWhenDamageStopsLanding() {
        GameState state = StateBuilder.forCards(repo)
                .withActive(0, "reactor")
                .withActive(1, "reactor")
                .build();
        EffectQueue.enqueue(state, repo.getSupporter("zap-order").getEffects(), trainer(0, "zap-order"));

        assertEquals(DrainStatus.IDLE, EffectQueue.drain(state));
        assertEquals(100, damageAt(state, 1, 0));
        assertEquals(80, damageAt(state, 0, 0));
    }

    @Test
    void testDrainStepLimit() {
        EngineConfig config = EngineConfig.defaults();
        config.setMaxDrainSteps(5);
        GameState state = StateBuilder.forCards(repo)
                .withConfig(config)
                .withActive(0, "reactor")
                .withActive(1, "reactor")
                .build();
        EffectQueue.enqueue(state, repo.getSupporter("zap-order").getEffects(), trainer(0, "zap-order"));

        assertThrows(IllegalStateException.class, () -> EffectQueue.drain(state));
    }

    @Test
    void testSuspendAndResumeOnSelection() {
        GameState state = StateBuilder.forCards(repo)
                .withActive(0, "alpha").withBench(0, "bravo")
                .withActive(1, "tank")
                .withDamage(0, 0, 40)
                .withDamage(0, 1, 10)
                .build();
        EffectQueue.enqueue(state, repo.getSupporter("field-medic").getEffects(), trainer(0, "field-medic"));
        EffectQueue.enqueue(state, List.of(Effect.Hp.damage(10, FieldTarget.Fixed.activeOf(PlayerRef.OPPONENT))),
                trainer(0, "zap-order"));

        assertEquals(DrainStatus.AWAITING_SELECTION, EffectQueue.drain(state));
        PendingSelection pending = state.getTurnState().getPendingSelection().orElseThrow();
        assertEquals(0, pending.chooser());
        assertEquals(SelectionRole.TARGET, pending.role());
        assertEquals(List.of(new FieldPosition(0, 0), new FieldPosition(0, 1)), pending.candidates());
        // the later effect waits behind the suspended one
        assertEquals(1, state.getEffectQueue().size());
        assertEquals(DrainStatus.AWAITING_SELECTION, EffectQueue.drain(state));

        assertEquals(DrainStatus.IDLE, EffectQueue.resumeWithSelection(state, 0, new FieldPosition(0, 0)));
        assertEquals(10, damageAt(state, 0, 0));
        assertEquals(10, damageAt(state, 0, 1));
        assertEquals(10, damageAt(state, 1, 0));
        assertTrue(state.getTurnState().getPendingSelection().isEmpty());
    }

    @Test
    void testInvalidSelectionKeepsPending() {
        GameState state = StateBuilder.forCards(repo)
                .withActive(0, "alpha").withBench(0, "bravo")
                .withActive(1, "tank")
                .withDamage(0, 0, 40)
                .withDamage(0, 1, 10)
                .build();
        EffectQueue.enqueue(state, repo.getSupporter("field-medic").getEffects(), trainer(0, "field-medic"));
        EffectQueue.drain(state);

        // wrong chooser
        assertEquals(DrainStatus.AWAITING_SELECTION,
                EffectQueue.resumeWithSelection(state, 1, new FieldPosition(0, 0)));
        // not a candidate
        assertEquals(DrainStatus.AWAITING_SELECTION,
                EffectQueue.resumeWithSelection(state, 0, new FieldPosition(1, 0)));
        assertTrue(state.getTurnState().getPendingSelection().isPresent());
        assertEquals(40, damageAt(state, 0, 0));
        assertEquals(10, damageAt(state, 0, 1));
    }

    @Test
    void testSingleCandidateResolvesWithoutAsking() {
        GameState state = StateBuilder.forCards(repo)
                .withActive(0, "alpha").withBench(0, "bravo")
                .withActive(1, "tank")
                .withDamage(0, 1, 10)
                .build();
        EffectQueue.enqueue(state, repo.getSupporter("field-medic").getEffects(), trainer(0, "field-medic"));

        assertEquals(DrainStatus.IDLE, EffectQueue.drain(state));
        assertEquals(0, damageAt(state, 0, 1));
    }

    @Test
    void testUnsatisfiableEffectIsSkipped() {
        GameState state = StateBuilder.forCards(repo)
                .withActive(0, "alpha")
                .withActive(1, "tank")
                .build();
        EffectQueue.enqueue(state, repo.getSupporter("field-medic").getEffects(), trainer(0, "field-medic"));
        EffectQueue.enqueue(state, repo.getSupporter("zap-order").getEffects(), trainer(0, "zap-order"));

        assertEquals(DrainStatus.IDLE, EffectQueue.drain(state));
        assertEquals(30, damageAt(state, 1, 0));
    }

    @Test
    void testResumeWithNothingPending() {
        GameState state = StateBuilder.forCards(repo).withActive(0, "alpha").build();
        assertEquals(DrainStatus.IDLE, EffectQueue.resumeWithSelection(state, 0, new FieldPosition(0, 0)));
    }

    @Test
    void testGameOverDropsQueue() {
        GameState state = StateBuilder.forCards(repo)
                .withActive(0, "tank")
                .withActive(1, "tank")
                .build();
        EffectQueue.enqueue(state, repo.getSupporter("zap-order").getEffects(), trainer(0, "zap-order"));
        state.setWinner(1);

        assertEquals(DrainStatus.IDLE, EffectQueue.drain(state));
        assertTrue(state.getEffectQueue().isEmpty());
        assertEquals(0, damageAt(state, 1, 0));
    }
}
