package com.creaturebattle.card;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Card repository that loads static card data from JSON.
 * Cards are keyed by template id; several template ids may share a name.
 */
public class CardRepository {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Map<String, Card> cards;

    private CardRepository(Map<String, Card> cards) {
        this.cards = cards;
    }

    /**
     * Load cards from a JSON file.
     */
    public static CardRepository fromFile(String path) throws CardRepositoryException {
        try {
            String content = Files.readString(Path.of(path));
            return fromJson(content);
        } catch (IOException e) {
            throw new CardRepositoryException("IO error: " + e.getMessage(), e);
        }
    }

    /**
     * Load cards from a classpath resource.
     */
    public static CardRepository fromResource(String resourcePath) throws CardRepositoryException {
        try (InputStream is = CardRepository.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (is == null) {
                throw new CardRepositoryException("Resource not found: " + resourcePath);
            }
            List<Card> cardList = MAPPER.readValue(is, new TypeReference<List<Card>>() {});
            return fromCardList(cardList);
        } catch (IOException e) {
            throw new CardRepositoryException("JSON parsing error: " + e.getMessage(), e);
        }
    }

    /**
     * Load cards from a JSON string.
     */
    public static CardRepository fromJson(String json) throws CardRepositoryException {
        try {
            List<Card> cardList = MAPPER.readValue(json, new TypeReference<List<Card>>() {});
            return fromCardList(cardList);
        } catch (IOException e) {
            throw new CardRepositoryException("JSON parsing error: " + e.getMessage(), e);
        }
    }

    /**
     * Build a repository from cards constructed in code.
     */
    public static CardRepository of(List<Card> cardList) throws CardRepositoryException {
        return fromCardList(cardList);
    }

    private static CardRepository fromCardList(List<Card> cardList) throws CardRepositoryException {
        Map<String, Card> cards = new LinkedHashMap<>();
        for (Card card : cardList) {
            if (card.getTemplateId() == null || card.getTemplateId().isBlank()) {
                throw new CardRepositoryException("Card without template_id: " + card.getName());
            }
            if (cards.put(card.getTemplateId(), card) != null) {
                throw new CardRepositoryException("Duplicate template_id: " + card.getTemplateId());
            }
        }
        return new CardRepository(cards);
    }

    /**
     * Get a card by template id.
     * @throws CardRepositoryException if the card is not found
     */
    public Card getCard(String templateId) throws CardRepositoryException {
        Card card = cards.get(templateId);
        if (card == null) {
            throw new CardRepositoryException("Card not found: " + templateId);
        }
        return card;
    }

    /**
     * Get a card of any category.
     * @throws UnknownCardException if the card is not found
     */
    public Card require(String templateId) {
        return lookup(templateId, Card.class);
    }

    public Card.Creature getCreature(String templateId) {
        return lookup(templateId, Card.Creature.class);
    }

    public Card.Supporter getSupporter(String templateId) {
        return lookup(templateId, Card.Supporter.class);
    }

    public Card.Item getItem(String templateId) {
        return lookup(templateId, Card.Item.class);
    }

    public Card.Tool getTool(String templateId) {
        return lookup(templateId, Card.Tool.class);
    }

    private <T extends Card> T lookup(String templateId, Class<T> type) {
        Card card = cards.get(templateId);
        if (card == null) {
            throw new UnknownCardException("Card not found: " + templateId);
        }
        if (!type.isInstance(card)) {
            throw new UnknownCardException("Card " + templateId + " is a " + card.getCardType().getJsonValue()
                    + ", not a " + type.getSimpleName().toLowerCase());
        }
        return type.cast(card);
    }

    /**
     * Every creature sharing the given name, in load order.
     */
    public List<Card.Creature> getCreaturesNamed(String name) {
        List<Card.Creature> matches = new ArrayList<>();
        for (Card card : cards.values()) {
            if (card instanceof Card.Creature creature && creature.getName().equals(name)) {
                matches.add(creature);
            }
        }
        return matches;
    }

    public Collection<Card> allCards() {
        return Collections.unmodifiableCollection(cards.values());
    }

    /**
     * Get total number of cards.
     */
    public int cardCount() {
        return cards.size();
    }

    /**
     * Check if a card exists.
     */
    public boolean hasCard(String templateId) {
        return cards.containsKey(templateId);
    }
}
