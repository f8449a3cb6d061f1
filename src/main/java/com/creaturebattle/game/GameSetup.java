package com.creaturebattle.game;

import com.creaturebattle.card.Card;
import com.creaturebattle.card.CardRepository;
import com.creaturebattle.card.EnergyType;
import com.creaturebattle.config.EngineConfig;
import com.creaturebattle.game.zones.CardInstance;
import com.creaturebattle.rng.GameRng;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds a ready-to-play game from two deck lists.
 */
public final class GameSetup {
    private static final Logger logger = LoggerFactory.getLogger(GameSetup.class);

    private GameSetup() {
        // Utility class - prevent instantiation
    }

    /**
     * Create a game: build and shuffle both decks, deal opening hands, restrict each
     * player's energy to the types of the creatures in their deck and roll the first
     * player's energy.
     *
     * @param repository Card data
     * @param config     Engine settings
     * @param seed       Seed for shuffles, coin flips and energy
     * @param deckLists  One list of template ids per player
     * @return The new game, on turn 1 with player 0 to act
     * @throws com.creaturebattle.card.UnknownCardException if a deck names an unknown card
     */
    public static GameState newGame(CardRepository repository, EngineConfig config, long seed,
                                    List<List<String>> deckLists) {
        if (deckLists.size() != 2) {
            throw new IllegalArgumentException("Expected 2 deck lists, got " + deckLists.size());
        }
        GameState state = new GameState(repository, config, new GameRng(seed));
        for (int player = 0; player < 2; player++) {
            List<CardInstance> cards = new ArrayList<>();
            for (String templateId : deckLists.get(player)) {
                cards.add(state.newInstance(player, templateId));
            }
            PlayerState playerState = state.getPlayer(player);
            playerState.getDeck().addAllToBottom(cards);
            playerState.getDeck().shuffle(state.getRng());
            state.drawCards(player, config.getInitialHandSize());

            List<EnergyType> types = energyTypesOf(repository, deckLists.get(player));
            if (!types.isEmpty()) {
                state.getEnergy().setAvailableTypes(player, types);
            }
            logger.debug("Player {}: {} cards in deck, energy {}", player, playerState.getDeck().size(),
                    state.getEnergy().getAvailableTypes(player));
        }
        state.getEnergy().generate(state.getCurrentPlayer(), state.getRng());
        logger.info("New game with seed {}", seed);
        return state;
    }

    private static List<EnergyType> energyTypesOf(CardRepository repository, List<String> deckList) {
        List<EnergyType> types = new ArrayList<>();
        for (String templateId : deckList) {
            if (repository.require(templateId) instanceof Card.Creature creature) {
                EnergyType type = creature.getType();
                if (type != null && type.isAttachable() && !types.contains(type)) {
                    types.add(type);
                }
            }
        }
        return types;
    }
}
