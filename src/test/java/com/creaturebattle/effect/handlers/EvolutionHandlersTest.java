package com.creaturebattle.effect.handlers;

import com.creaturebattle.card.CardRepository;
import com.creaturebattle.card.CardRepositoryException;
import com.creaturebattle.card.CardType;
import com.creaturebattle.card.EnergyType;
import com.creaturebattle.card.effect.CardCriteria;
import com.creaturebattle.card.effect.Effect;
import com.creaturebattle.card.effect.FieldPosition;
import com.creaturebattle.card.effect.FieldTarget;
import com.creaturebattle.card.effect.FieldTargetCriteria;
import com.creaturebattle.card.effect.FixedPosition;
import com.creaturebattle.card.effect.PlayerRef;
import com.creaturebattle.card.effect.StatusCondition;
import com.creaturebattle.effect.DrainStatus;
import com.creaturebattle.effect.EffectContext;
import com.creaturebattle.effect.EffectHandlerRegistry;
import com.creaturebattle.effect.EffectQueue;
import com.creaturebattle.game.GameState;
import com.creaturebattle.game.StateBuilder;
import com.creaturebattle.game.zones.EvolutionEntry;
import com.creaturebattle.game.zones.FieldCard;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Evolution acceleration and pull evolution.
 */
class EvolutionHandlersTest {

    private static CardRepository repo;
    private static final EffectContext ITEM = new EffectContext.Trainer(0, "Test Item", CardType.ITEM);

    @BeforeAll
    static void loadCards() throws CardRepositoryException {
        repo = StateBuilder.testCards();
    }

    private static DrainStatus resolve(GameState state, Effect effect) {
        EffectQueue.enqueue(state, List.of(effect), ITEM);
        return EffectQueue.drain(state);
    }

    private static List<String> stack(FieldCard card) {
        return card.getEvolutionStack().stream().map(EvolutionEntry::templateId).collect(Collectors.toList());
    }

    private static Effect tonic() {
        return repo.getItem("growth-tonic").getEffects().get(0);
    }

    @Test
    void testAccelerationSkipsTheMiddleStage() {
        GameState state = StateBuilder.forCards(repo).atTurn(3)
                .withActive(0, "alpha").withActive(1, "bravo")
                .withHand(0, "potion", "alpha-apex")
                .withDamage(0, 0, 30)
                .withEnergy(0, 0, EnergyType.FIRE, 2)
                .withStatus(0, StatusCondition.POISON, 2)
                .build();
        resolve(state, tonic());

        FieldCard active = state.getPlayer(0).getField().require(0);
        assertEquals(List.of("alpha", "alpha-apex"), stack(active));
        assertEquals(30, active.getDamageTaken());
        assertEquals(2, state.getEnergy().total(active.getFieldInstanceId()));
        assertTrue(state.getStatuses().get(0).isEmpty());
        assertTrue(state.getTurnState().hasEvolved(active.getFieldInstanceId()));
        assertEquals(1, state.getPlayer(0).getHand().size());
        assertEquals("potion", state.getPlayer(0).getHand().getCards().get(0).templateId());
    }

    @Test
    void testAccelerationWithoutMatchingCardIsStillPlayable() {
        GameState state = StateBuilder.forCards(repo).atTurn(3)
                .withActive(0, "alpha")
                .withHand(0, "alpha-prime")
                .build();
        assertTrue(EffectHandlerRegistry.standard().canApply(state, tonic(), ITEM));
        resolve(state, tonic());

        assertEquals(List.of("alpha"), stack(state.getPlayer(0).getField().require(0)));
        assertEquals(1, state.getPlayer(0).getHand().size());
    }

    @Test
    void testAccelerationBasicOnly() {
        GameState state = StateBuilder.forCards(repo).atTurn(3)
                .withActive(0, "alpha")
                .withHand(0, "alpha-apex")
                .build();
        state.getPlayer(0).getField().require(0).evolve(state.newInstance(0, "alpha-prime"), 0);

        assertFalse(EffectHandlerRegistry.standard().canApply(state, tonic(), ITEM));
        resolve(state, tonic());
        assertEquals(List.of("alpha", "alpha-prime"), stack(state.getPlayer(0).getField().require(0)));
    }

    @Test
    void testAccelerationNotOnCreaturePlayedThisTurn() {
        GameState state = StateBuilder.forCards(repo).atTurn(3)
                .withHand(0, "alpha-apex")
                .build();
        state.getPlayer(0).getField().setActive(new FieldCard(state.newInstance(0, "alpha"), 3));

        assertFalse(EffectHandlerRegistry.standard().canApply(state, tonic(), ITEM));
    }

    @Test
    void testPullEvolutionTakesNextStageFromDeck() {
        GameState state = StateBuilder.forCards(repo).atTurn(3)
                .withActive(0, "bravo").withBench(0, "alpha")
                .withDeck(0, "potion", "alpha-apex", "alpha-prime")
                .withHand(0, "sniper")
                .build();
        FieldTarget bench = new FieldTarget.Fixed(PlayerRef.SELF, FixedPosition.BENCH, 0);
        resolve(state, new Effect.PullEvolution(bench, null));

        assertEquals(List.of("alpha", "alpha-prime"), stack(state.getPlayer(0).getField().require(1)));
        assertEquals(2, state.getPlayer(0).getDeck().size());
        assertTrue(state.getPlayer(0).getDeck().getCards().stream().anyMatch(c -> c.templateId().equals("alpha-apex")));
        assertEquals(1, state.getPlayer(0).getHand().size());
    }

    @Test
    void testPullEvolutionCriteriaCanFindNothing() {
        GameState state = StateBuilder.forCards(repo).atTurn(3)
                .withActive(0, "alpha")
                .withDeck(0, "alpha-prime", "potion")
                .build();
        resolve(state, new Effect.PullEvolution(FieldTarget.Fixed.activeOf(PlayerRef.SELF),
                new CardCriteria(null, List.of("Alpha Apex"), null)));

        assertEquals(List.of("alpha"), stack(state.getPlayer(0).getField().require(0)));
        assertEquals(2, state.getPlayer(0).getDeck().size());
    }

    @Test
    void testPullEvolutionWaitsForChoice() {
        GameState state = StateBuilder.forCards(repo).atTurn(3)
                .withActive(0, "bravo").withBench(0, "alpha")
                .withDeck(0, "alpha-prime")
                .build();
        FieldTarget choice = new FieldTarget.SingleChoice(PlayerRef.SELF, FieldTargetCriteria.of(PlayerRef.SELF, null));
        assertTrue(EffectHandlerRegistry.standard().canApply(state, new Effect.PullEvolution(choice, null), ITEM));

        assertEquals(DrainStatus.AWAITING_SELECTION, resolve(state, new Effect.PullEvolution(choice, null)));
        assertEquals(DrainStatus.IDLE, EffectQueue.resumeWithSelection(state, 0, new FieldPosition(0, 1)));
        assertEquals("alpha-prime", state.getPlayer(0).getField().require(1).getTemplateId());
        assertTrue(state.getPlayer(0).getDeck().isEmpty());
    }
}
