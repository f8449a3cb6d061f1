package com.creaturebattle.card;

import com.creaturebattle.card.effect.AmountSpec;
import com.creaturebattle.card.effect.DurationPolicy;
import com.creaturebattle.card.effect.Effect;
import com.creaturebattle.card.effect.EvolutionRestriction;
import com.creaturebattle.card.effect.FieldTarget;
import com.creaturebattle.card.effect.FixedPosition;
import com.creaturebattle.card.effect.HpOperation;
import com.creaturebattle.card.effect.PlayerRef;
import com.creaturebattle.card.effect.PlayerScope;
import com.creaturebattle.card.effect.StatusCondition;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for CardRepository.
 */
class CardRepositoryTest {

    private static CardRepository repo;

    @BeforeAll
    static void loadRepository() throws CardRepositoryException {
        repo = CardRepository.fromResource("test-cards.json");
    }

    @Test
    void testLoadCards() {
        assertEquals(25, repo.cardCount());
        assertTrue(repo.hasCard("alpha"));
        assertFalse(repo.hasCard("omega"));
    }

    @Test
    void testGetCreatureCard() throws CardRepositoryException {
        Card card = repo.getCard("alpha");
        assertEquals("Alpha", card.getName());
        assertEquals(CardType.CREATURE, card.getCardType());

        assertInstanceOf(Card.Creature.class, card);
        Card.Creature creature = (Card.Creature) card;
        assertEquals(80, creature.getMaxHp());
        assertEquals(EnergyType.FIRE, creature.getType());
        assertEquals(EnergyType.WATER, creature.getWeakness());
        assertTrue(creature.isBasic());
        assertEquals(2, creature.getAttacks().size());

        Attack flameBurst = creature.getAttacks().get(1);
        assertEquals("Flame Burst", flameBurst.getName());
        assertInstanceOf(AmountSpec.Constant.class, flameBurst.getDamage());
        assertEquals(60, ((AmountSpec.Constant) flameBurst.getDamage()).value());
        assertEquals(EnergyType.FIRE, flameBurst.getEnergyRequirements().get(0).getType());
        assertEquals(2, flameBurst.getEnergyRequirements().get(0).getAmount());
    }

    @Test
    void testEvolutionCard() {
        Card.Creature prime = repo.getCreature("alpha-prime");
        assertFalse(prime.isBasic());
        assertEquals(1, prime.getStage());
        assertEquals("Alpha", prime.getEvolvesFrom());
    }

    @Test
    void testCreaturesNamed() {
        List<Card.Creature> alphas = repo.getCreaturesNamed("Alpha");
        assertEquals(2, alphas.size());
        assertEquals("alpha", alphas.get(0).getTemplateId());
        assertEquals("alpha-promo", alphas.get(1).getTemplateId());
    }

    @Test
    void testAbilityParsing() {
        Card.Creature watcher = repo.getCreature("watcher");
        assertTrue(watcher.hasAbility());
        Ability vigil = watcher.getAbility();
        assertEquals("Vigil", vigil.getName());
        assertEquals(TriggerType.END_OF_TURN, vigil.getTrigger().getType());
        assertTrue(vigil.getTrigger().isOwnTurnOnly());
        assertInstanceOf(Effect.Draw.class, vigil.getEffects().get(0));
    }

    @Test
    void testSupporterEffectParsing() {
        Card.Supporter zap = repo.getSupporter("zap-order");
        assertEquals(CardType.SUPPORTER, zap.getCardType());
        assertEquals(1, zap.getEffects().size());

        assertInstanceOf(Effect.Hp.class, zap.getEffects().get(0));
        Effect.Hp hp = (Effect.Hp) zap.getEffects().get(0);
        assertEquals(HpOperation.DAMAGE, hp.operation());
        assertInstanceOf(FieldTarget.Fixed.class, hp.target());
        FieldTarget.Fixed target = (FieldTarget.Fixed) hp.target();
        assertEquals(PlayerRef.OPPONENT, target.player());
        assertEquals(FixedPosition.ACTIVE, target.position());
    }

    @Test
    void testSingleChoiceTarget() {
        Effect.Hp heal = (Effect.Hp) repo.getSupporter("field-medic").getEffects().get(0);
        assertInstanceOf(FieldTarget.SingleChoice.class, heal.target());
        FieldTarget.SingleChoice choice = (FieldTarget.SingleChoice) heal.target();
        assertEquals(PlayerRef.SELF, choice.chooser());
        assertEquals(PlayerRef.SELF, choice.criteria().player());
        assertTrue(choice.criteria().fieldCriteria().hasDamage());
    }

    @Test
    void testModifierParsing() {
        Effect effect = repo.getItem("heavy-anchor").getEffects().get(0);
        assertInstanceOf(Effect.RetreatCostIncrease.class, effect);
        Effect.RetreatCostIncrease increase = (Effect.RetreatCostIncrease) effect;
        assertEquals(DurationPolicy.UNTIL_END_OF_NEXT_TURN, increase.duration());

        Effect.DamageBoost boost = (Effect.DamageBoost) repo.getItem("power-drill").getEffects().get(0);
        assertNull(boost.duration());
    }

    @Test
    void testToolCards() {
        Card.Tool shell = repo.getTool("shell");
        assertFalse(shell.isTriggered());
        assertInstanceOf(Effect.HpBonus.class, shell.getEffects().get(0));

        Card.Tool alarm = repo.getTool("alarm");
        assertTrue(alarm.isTriggered());
        assertEquals(TriggerType.DAMAGED, alarm.getTrigger().getType());
    }

    @Test
    void testCreatureAttributes() {
        assertTrue(repo.getCreature("titan-ex").getAttributes().isEx());
        assertFalse(repo.getCreature("titan-ex").getAttributes().isMega());
        assertTrue(repo.getCreature("mega-titan").getAttributes().isMega());
        assertFalse(repo.getCreature("alpha").getAttributes().isEx());
    }

    @Test
    void testEvolutionAndCostEffects() {
        Effect.EvolutionAcceleration tonic =
                (Effect.EvolutionAcceleration) repo.getItem("growth-tonic").getEffects().get(0);
        assertEquals(1, tonic.skipStages());
        assertEquals(List.of(EvolutionRestriction.BASIC_CREATURE_ONLY), tonic.restrictions());

        Effect.AttackEnergyCostModifier band =
                (Effect.AttackEnergyCostModifier) repo.getTool("focus-band").getEffects().get(0);
        assertEquals(new AmountSpec.Constant(-1), band.amount());
        assertNull(band.duration());
    }

    @Test
    void testHandAndProtectionEffectsFromJson() throws CardRepositoryException {
        String json = "[{\"card_type\": \"supporter\", \"template_id\": \"s\", \"name\": \"S\", \"effects\": ["
                + "{\"type\": \"swap-cards\", \"discard_amount\": {\"type\": \"constant\", \"value\": 2},"
                + " \"draw_amount\": {\"type\": \"constant\", \"value\": 3}, \"max_drawn\": 2,"
                + " \"target\": \"opponent\"},"
                + "{\"type\": \"status-prevention\", \"conditions\": [\"sleep\"],"
                + " \"duration\": \"until-end-of-next-turn\"},"
                + "{\"type\": \"disable-weakness\", \"target\": {\"player\": \"self\", \"position\": \"active\"}},"
                + "{\"type\": \"pull-evolution\","
                + " \"target\": {\"type\": \"fixed\", \"player\": \"self\", \"position\": \"active\"}}"
                + "]}]";
        List<Effect> effects = CardRepository.fromJson(json).getSupporter("s").getEffects();

        Effect.SwapCards swap = (Effect.SwapCards) effects.get(0);
        assertEquals(2, swap.maxDrawn());
        assertFalse(swap.balanced());
        assertEquals(PlayerScope.OPPONENT, swap.target());

        Effect.StatusPrevention prevention = (Effect.StatusPrevention) effects.get(1);
        assertEquals(List.of(StatusCondition.SLEEP), prevention.conditions());
        assertNull(prevention.target());

        assertInstanceOf(Effect.DisableWeakness.class, effects.get(2));
        Effect.PullEvolution pull = (Effect.PullEvolution) effects.get(3);
        assertNull(pull.evolutionCriteria());
        assertInstanceOf(FieldTarget.Fixed.class, pull.target());
    }

    @Test
    void testUnknownCard() {
        assertThrows(CardRepositoryException.class, () -> repo.getCard("omega"));
        assertThrows(UnknownCardException.class, () -> repo.require("omega"));
    }

    @Test
    void testWrongCategory() {
        UnknownCardException e = assertThrows(UnknownCardException.class, () -> repo.getSupporter("potion"));
        assertTrue(e.getMessage().contains("potion"));
        assertThrows(UnknownCardException.class, () -> repo.getCreature("shell"));
    }

    @Test
    void testDuplicateTemplateId() {
        String json = "["
                + "{\"card_type\": \"item\", \"template_id\": \"x\", \"name\": \"X\", \"effects\": []},"
                + "{\"card_type\": \"item\", \"template_id\": \"x\", \"name\": \"X again\", \"effects\": []}"
                + "]";
        CardRepositoryException e = assertThrows(CardRepositoryException.class, () -> CardRepository.fromJson(json));
        assertTrue(e.getMessage().contains("Duplicate"));
    }

    @Test
    void testMalformedJson() {
        assertThrows(CardRepositoryException.class, () -> CardRepository.fromJson("[{\"card_type\": \"spell\"}]"));
        assertThrows(CardRepositoryException.class, () -> CardRepository.fromJson("not json"));
    }

    @Test
    void testMissingResource() {
        CardRepositoryException e = assertThrows(CardRepositoryException.class,
                () -> CardRepository.fromResource("no-such-cards.json"));
        assertTrue(e.getMessage().contains("no-such-cards.json"));
    }

    @Test
    void testMissingFile() {
        assertThrows(CardRepositoryException.class, () -> CardRepository.fromFile("does/not/exist.json"));
    }
}
