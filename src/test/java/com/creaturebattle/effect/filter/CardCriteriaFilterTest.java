package com.creaturebattle.effect.filter;

import com.creaturebattle.card.CardRepository;
import com.creaturebattle.card.CardRepositoryException;
import com.creaturebattle.card.CardType;
import com.creaturebattle.card.EnergyType;
import com.creaturebattle.card.effect.CardCriteria;
import com.creaturebattle.card.effect.CreatureCriteria;
import com.creaturebattle.game.zones.CardInstance;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CardCriteriaFilterTest {

    private static CardRepository repo;

    @BeforeAll
    static void loadCards() throws CardRepositoryException {
        repo = CardRepository.fromResource("test-cards.json");
    }

    private static CardInstance card(String templateId) {
        return new CardInstance("p0-0", templateId, repo.require(templateId).getCardType());
    }

    @Test
    void testNullCriteriaMatchesEverything() {
        assertTrue(CardCriteriaFilter.matches(repo, null, card("potion")));
    }

    @Test
    void testTrainerCoversSupportersAndItems() {
        CardCriteria trainers = new CardCriteria(CardType.TRAINER, null, null);
        assertTrue(CardCriteriaFilter.matches(repo, trainers, card("zap-order")));
        assertTrue(CardCriteriaFilter.matches(repo, trainers, card("potion")));
        assertFalse(CardCriteriaFilter.matches(repo, trainers, card("shell")));
        assertFalse(CardCriteriaFilter.matches(repo, trainers, card("alpha")));
    }

    @Test
    void testNames() {
        CardCriteria alphas = new CardCriteria(null, List.of("Alpha"), null);
        assertTrue(CardCriteriaFilter.matches(repo, alphas, card("alpha")));
        assertTrue(CardCriteriaFilter.matches(repo, alphas, card("alpha-promo")));
        assertFalse(CardCriteriaFilter.matches(repo, alphas, card("alpha-prime")));
    }

    @Test
    void testCreatureCriteriaOnlyMatchCreatures() {
        CardCriteria basicFire = new CardCriteria(null, null,
                new CreatureCriteria(null, 0, null, EnergyType.FIRE, null));
        assertTrue(CardCriteriaFilter.matches(repo, basicFire, card("alpha")));
        assertFalse(CardCriteriaFilter.matches(repo, basicFire, card("alpha-prime")));
        assertFalse(CardCriteriaFilter.matches(repo, basicFire, card("bravo")));
        assertFalse(CardCriteriaFilter.matches(repo, basicFire, card("potion")));
    }

    @Test
    void testPreviousStageNameIgnoresCase() {
        CardCriteria fromAlpha = new CardCriteria(null, null,
                new CreatureCriteria(null, null, "alpha", null, null));
        assertTrue(CardCriteriaFilter.matches(repo, fromAlpha, card("alpha-prime")));
        assertFalse(CardCriteriaFilter.matches(repo, fromAlpha, card("alpha")));
    }
}
