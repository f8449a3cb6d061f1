package com.creaturebattle.card;

import com.creaturebattle.card.effect.Effect;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;

/**
 * Unified card type.
 * Uses Jackson polymorphic deserialization based on the "card_type" field.
 */
@JsonTypeInfo(
    use = JsonTypeInfo.Id.NAME,
    include = JsonTypeInfo.As.PROPERTY,
    property = "card_type"
)
@JsonSubTypes({
    @JsonSubTypes.Type(value = Card.Creature.class, name = "creature"),
    @JsonSubTypes.Type(value = Card.Supporter.class, name = "supporter"),
    @JsonSubTypes.Type(value = Card.Item.class, name = "item"),
    @JsonSubTypes.Type(value = Card.Tool.class, name = "tool")
})
public sealed interface Card permits Card.Creature, Card.Supporter, Card.Item, Card.Tool {

    String getTemplateId();
    String getName();
    CardType getCardType();

    /**
     * Effects resolved when the card is played. Creatures carry theirs on attacks and abilities.
     */
    List<Effect> getEffects();

    /**
     * Creature card wrapper
     */
    final class Creature extends CreatureCard implements Card {
        @Override
        public CardType getCardType() {
            return CardType.CREATURE;
        }

        @Override
        public List<Effect> getEffects() {
            return List.of();
        }
    }

    /**
     * Supporter wrapper. One per turn.
     */
    final class Supporter extends TrainerCard implements Card {
        @Override
        public CardType getCardType() {
            return CardType.SUPPORTER;
        }
    }

    /**
     * Item wrapper
     */
    final class Item extends TrainerCard implements Card {
        @Override
        public CardType getCardType() {
            return CardType.ITEM;
        }
    }

    /**
     * Tool wrapper
     */
    final class Tool extends ToolCard implements Card {
        @Override
        public CardType getCardType() {
            return CardType.TOOL;
        }
    }
}
