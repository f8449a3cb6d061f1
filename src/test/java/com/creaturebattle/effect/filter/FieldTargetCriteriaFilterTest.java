package com.creaturebattle.effect.filter;

import com.creaturebattle.card.CardRepository;
import com.creaturebattle.card.CardRepositoryException;
import com.creaturebattle.card.EnergyType;
import com.creaturebattle.card.effect.CreatureCriteria;
import com.creaturebattle.card.effect.FieldCriteria;
import com.creaturebattle.card.effect.FieldPosition;
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

class FieldTargetCriteriaFilterTest {

    private static CardRepository repo;

    @BeforeAll
    static void loadCards() throws CardRepositoryException {
        repo = StateBuilder.testCards();
    }

    private GameState board() {
        return StateBuilder.forCards(repo)
                .withActive(0, "alpha").withBench(0, "bravo", "tank")
                .withActive(1, "sentinel").withBench(1, "alpha-promo")
                .withDamage(0, 2, 50)
                .withEnergy(0, 1, EnergyType.WATER, 2)
                .build();
    }

    @Test
    void testNullCriteriaMatchesBothSidesSourceFirst() {
        GameState state = board();
        List<FieldPosition> all = FieldTargetCriteriaFilter.matching(state, null, 1);
        assertEquals(List.of(
                new FieldPosition(1, 0), new FieldPosition(1, 1),
                new FieldPosition(0, 0), new FieldPosition(0, 1), new FieldPosition(0, 2)), all);
    }

    @Test
    void testPlayerIsRelativeToSource() {
        GameState state = board();
        FieldTargetCriteria opponentBench = FieldTargetCriteria.of(PlayerRef.OPPONENT, FieldZone.BENCH);
        assertEquals(List.of(new FieldPosition(1, 1)), FieldTargetCriteriaFilter.matching(state, opponentBench, 0));
        assertEquals(List.of(new FieldPosition(0, 1), new FieldPosition(0, 2)),
                FieldTargetCriteriaFilter.matching(state, opponentBench, 1));
    }

    @Test
    void testActiveZone() {
        GameState state = board();
        FieldTargetCriteria anyActive = new FieldTargetCriteria(null, FieldZone.ACTIVE, null);
        assertEquals(List.of(new FieldPosition(0, 0), new FieldPosition(1, 0)),
                FieldTargetCriteriaFilter.matching(state, anyActive, 0));
    }

    @Test
    void testFieldCriteria() {
        GameState state = board();
        FieldTargetCriteria damaged = new FieldTargetCriteria(PlayerRef.SELF, null, FieldCriteria.damaged());
        assertEquals(List.of(new FieldPosition(0, 2)), FieldTargetCriteriaFilter.matching(state, damaged, 0));

        FieldTargetCriteria watered = new FieldTargetCriteria(null, null,
                new FieldCriteria(null, null, Map.of("water", 2)));
        assertEquals(List.of(new FieldPosition(0, 1)), FieldTargetCriteriaFilter.matching(state, watered, 0));

        FieldTargetCriteria named = new FieldTargetCriteria(null, null, new FieldCriteria(
                new CreatureCriteria(List.of("Alpha"), null, null, null, null), null, null));
        assertEquals(List.of(new FieldPosition(0, 0), new FieldPosition(1, 1)),
                FieldTargetCriteriaFilter.matching(state, named, 0));
    }

    @Test
    void testEmptyPositionNeverMatches() {
        GameState state = board();
        assertFalse(FieldTargetCriteriaFilter.matches(state, null, 0, new FieldPosition(1, 3)));
    }
}
