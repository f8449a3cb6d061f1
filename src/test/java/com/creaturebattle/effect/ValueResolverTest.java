package com.creaturebattle.effect;

import com.creaturebattle.card.CardRepository;
import com.creaturebattle.card.CardRepositoryException;
import com.creaturebattle.card.CardType;
import com.creaturebattle.card.EnergyType;
import com.creaturebattle.card.effect.AmountSpec;
import com.creaturebattle.card.effect.CardCriteria;
import com.creaturebattle.card.effect.CardLocation;
import com.creaturebattle.card.effect.ContextSource;
import com.creaturebattle.card.effect.FieldCriteria;
import com.creaturebattle.card.effect.FieldTargetCriteria;
import com.creaturebattle.card.effect.FieldZone;
import com.creaturebattle.card.effect.PlayerRef;
import com.creaturebattle.game.GameState;
import com.creaturebattle.game.StateBuilder;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ValueResolverTest {

    private static CardRepository repo;
    private static GameState state;
    private static EffectContext attack;

    @BeforeAll
    static void setUp() throws CardRepositoryException {
        repo = StateBuilder.testCards();
        state = StateBuilder.forCards(repo)
                .withActive(0, "alpha").withBench(0, "bravo")
                .withActive(1, "tank").withBench(1, "alpha-promo", "sentinel")
                .withEnergy(0, 0, EnergyType.FIRE, 2)
                .withEnergy(0, 0, EnergyType.WATER, 1)
                .withDamage(1, 0, 40)
                .withDamage(1, 2, 20)
                .withHand(0, "potion", "alpha", "sniper")
                .build();
        state.getPlayer(0).addPoints(1);
        attack = new EffectContext.Attack(0, "Tackle",
                state.getPlayer(0).getField().require(0).getFieldInstanceId());
    }

    private static int resolve(AmountSpec spec) {
        return ValueResolver.resolve(state, spec, attack);
    }

    @Test
    void testConstantAndNull() {
        assertEquals(30, resolve(AmountSpec.of(30)));
        assertEquals(0, resolve(null));
        assertEquals(0, resolve(AmountSpec.of(-10)));
    }

    @Test
    void testPlayerContext() {
        assertEquals(3, resolve(new AmountSpec.PlayerContext(ContextSource.HAND_SIZE, PlayerRef.SELF)));
        assertEquals(0, resolve(new AmountSpec.PlayerContext(ContextSource.HAND_SIZE, PlayerRef.OPPONENT)));
        assertEquals(1, resolve(new AmountSpec.PlayerContext(ContextSource.CURRENT_POINTS, null)));
        assertEquals(2, resolve(new AmountSpec.PlayerContext(ContextSource.POINTS_TO_WIN, PlayerRef.SELF)));
    }

    @Test
    void testFieldCount() {
        assertEquals(2, resolve(AmountSpec.Count.field(FieldTargetCriteria.of(PlayerRef.OPPONENT, FieldZone.BENCH))));
        assertEquals(5, resolve(AmountSpec.Count.field(null)));
    }

    @Test
    void testEnergyCount() {
        assertEquals(3, resolve(AmountSpec.Count.energy(FieldTargetCriteria.of(PlayerRef.SELF, FieldZone.ACTIVE), null)));
        assertEquals(2, resolve(AmountSpec.Count.energy(FieldTargetCriteria.of(PlayerRef.SELF, FieldZone.ACTIVE),
                List.of(EnergyType.FIRE))));
    }

    @Test
    void testDamageCount() {
        assertEquals(60, resolve(AmountSpec.Count.damage(FieldTargetCriteria.of(PlayerRef.OPPONENT, null))));
    }

    @Test
    void testCardCount() {
        assertEquals(2, resolve(AmountSpec.Count.cards(PlayerRef.SELF, CardLocation.HAND,
                new CardCriteria(CardType.ITEM, null, null))));
        assertEquals(2, resolve(AmountSpec.Count.cards(PlayerRef.OPPONENT, CardLocation.FIELD,
                new CardCriteria(null, List.of("Alpha", "Sentinel"), null))));
    }

    @Test
    void testArithmetic() {
        AmountSpec sum = new AmountSpec.Addition(List.of(AmountSpec.of(10), AmountSpec.of(20)));
        assertEquals(30, resolve(sum));
        // 10 + 20 per opponent bench creature
        AmountSpec scaled = new AmountSpec.Addition(List.of(AmountSpec.of(10), new AmountSpec.Multiplication(
                AmountSpec.of(20), AmountSpec.Count.field(FieldTargetCriteria.of(PlayerRef.OPPONENT, FieldZone.BENCH)))));
        assertEquals(50, resolve(scaled));
    }

    @Test
    void testConditionalChecksSourceCreature() {
        AmountSpec ifFire = new AmountSpec.Conditional(
                new FieldCriteria(null, null, Map.of("fire", 2)), AmountSpec.of(90), AmountSpec.of(30));
        assertEquals(90, resolve(ifFire));

        AmountSpec ifDamaged = new AmountSpec.Conditional(FieldCriteria.damaged(), AmountSpec.of(90), AmountSpec.of(30));
        assertEquals(30, resolve(ifDamaged));
    }

    @Test
    void testCoinFlip() {
        state.getCoinFlipper().queueResults(List.of(true, false, true));
        AmountSpec flips = new AmountSpec.CoinFlip(AmountSpec.of(30), AmountSpec.of(0), 3);
        assertEquals(60, resolve(flips));

        state.getCoinFlipper().queueResults(List.of(false));
        assertEquals(10, resolve(new AmountSpec.CoinFlip(AmountSpec.of(40), AmountSpec.of(10), null)));
    }
}
