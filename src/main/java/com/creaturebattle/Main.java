package com.creaturebattle;

import com.creaturebattle.card.Card;
import com.creaturebattle.card.CardRepository;
import com.creaturebattle.card.CardRepositoryException;
import com.creaturebattle.card.CardType;
import com.creaturebattle.config.EngineConfig;
import com.creaturebattle.config.EngineConfigException;
import com.creaturebattle.simulation.DeckList;
import com.creaturebattle.simulation.DemoGame;
import com.creaturebattle.simulation.GameResult;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Creature battle engine CLI - Main entry point.
 */
@Command(name = "creature-battle",
        mixinStandardHelpOptions = true,
        version = "1.0",
        description = "Creature battle effect engine",
        subcommands = {
                Main.CardsCommand.class,
                Main.DemoCommand.class
        })
public class Main implements Runnable {
    static final String DEMO_CARDS = "demo-cards.json";
    static final String DEMO_DECK_1 = "demo-deck-1.txt";
    static final String DEMO_DECK_2 = "demo-deck-2.txt";

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public void run() {
        // Show help if no subcommand
        CommandLine.usage(this, System.out);
    }

    // ========== CARDS COMMAND ==========
    @Command(name = "cards", description = "Load a card file and summarise it")
    static class CardsCommand implements Callable<Integer> {
        @Parameters(index = "0", description = "Path to a card JSON file")
        String cardsPath;

        @Override
        public Integer call() {
            CardRepository repository;
            try {
                repository = CardRepository.fromFile(cardsPath);
            } catch (CardRepositoryException e) {
                System.err.println("✗ Failed to load cards: " + e.getMessage());
                return 1;
            }
            System.out.println("✓ Loaded " + repository.cardCount() + " cards from " + cardsPath);

            Map<CardType, Integer> counts = new EnumMap<>(CardType.class);
            for (Card card : repository.allCards()) {
                counts.merge(card.getCardType(), 1, Integer::sum);
            }
            counts.forEach((type, count) -> System.out.printf("  %-10s %d%n", type.getJsonValue(), count));

            System.out.println();
            for (Card card : repository.allCards()) {
                if (card instanceof Card.Creature creature) {
                    System.out.printf("  %-24s %-10s HP %3d  stage %d  %d attack(s)%s%n",
                            creature.getTemplateId(), creature.getType().getJsonValue(), creature.getMaxHp(),
                            creature.getStage(), creature.getAttacks().size(),
                            creature.hasAbility() ? "  ability: " + creature.getAbility().getName() : "");
                } else {
                    System.out.printf("  %-24s %-10s %d effect(s)%n",
                            card.getTemplateId(), card.getCardType().getJsonValue(), card.getEffects().size());
                }
            }
            return 0;
        }
    }

    // ========== DEMO COMMAND ==========
    @Command(name = "demo", description = "Play a seeded demo game and print its log")
    static class DemoCommand implements Callable<Integer> {
        @Option(names = {"-s", "--seed"}, defaultValue = "42",
                description = "Random seed")
        long seed;

        @Option(names = {"-c", "--cards"},
                description = "Path to a card JSON file (default: bundled demo cards)")
        String cardsPath;

        @Option(names = {"--deck1"},
                description = "Deck file for player 0 (default: bundled demo deck)")
        String deck1Path;

        @Option(names = {"--deck2"},
                description = "Deck file for player 1 (default: bundled demo deck)")
        String deck2Path;

        @Option(names = {"--config"},
                description = "Path to an engine config JSON file")
        String configPath;

        @Option(names = {"-t", "--max-turns"}, defaultValue = "60",
                description = "Stop after this many turns")
        int maxTurns;

        @Override
        public Integer call() {
            CardRepository repository;
            try {
                repository = cardsPath == null
                        ? CardRepository.fromResource(DEMO_CARDS)
                        : CardRepository.fromFile(cardsPath);
            } catch (CardRepositoryException e) {
                System.err.println("✗ Failed to load cards: " + e.getMessage());
                return 1;
            }

            EngineConfig config;
            try {
                config = configPath == null
                        ? EngineConfig.fromResource(EngineConfig.DEFAULT_RESOURCE)
                        : EngineConfig.fromFile(configPath);
            } catch (EngineConfigException e) {
                System.err.println("✗ Failed to load config: " + e.getMessage());
                return 1;
            }

            DeckList deck1;
            DeckList deck2;
            try {
                deck1 = deck1Path == null
                        ? DeckList.loadFromResource(DEMO_DECK_1, repository)
                        : DeckList.loadFromFile(deck1Path, repository);
                deck2 = deck2Path == null
                        ? DeckList.loadFromResource(DEMO_DECK_2, repository)
                        : DeckList.loadFromFile(deck2Path, repository);
            } catch (DeckList.DeckException e) {
                System.err.println("✗ Failed to parse deck: " + e.getMessage());
                return 1;
            }

            System.out.println("\n=== Creature Battle Demo ===\n");
            System.out.println("Player 0: " + deck1.getName() + " (" + deck1.size() + " cards)");
            System.out.println("Player 1: " + deck2.getName() + " (" + deck2.size() + " cards)");
            System.out.println("Seed: " + seed);
            System.out.println();

            GameResult result = DemoGame.play(repository, config, seed, List.of(deck1, deck2), maxTurns,
                    System.out::println);

            System.out.println();
            if (result.hasWinner()) {
                System.out.println("Winner: player " + result.winner() + " on turn " + result.turns());
            } else {
                System.out.println("No winner after " + maxTurns + " turns");
            }
            System.out.println("Points: " + result.points() + ", actions: " + result.executedActions());
            return 0;
        }
    }
}
