package com.creaturebattle.simulation;

import com.creaturebattle.card.CardRepository;
import com.creaturebattle.config.EngineConfig;
import com.creaturebattle.game.GameSetup;
import com.creaturebattle.game.GameState;
import com.creaturebattle.game.PlayerState;
import com.creaturebattle.game.action.Action;
import com.creaturebattle.game.action.ActionProcessor;
import com.creaturebattle.game.action.ActionResult;

import java.util.List;
import java.util.function.Consumer;

/**
 * Plays a seeded game between two {@link DecisionEngine} players.
 */
public final class DemoGame {
    private static final int MAX_ACTIONS_PER_TURN = 40;

    private DemoGame() {
        // Utility class - prevent instantiation
    }

    /**
     * Play until someone wins or {@code maxTurns} is passed.
     *
     * @param repository Card data
     * @param config     Engine settings
     * @param seed       Game seed; the same seed and decks always give the same game
     * @param decks      One deck per player
     * @param maxTurns   Turn limit
     * @param log        Receives one line per accepted action
     * @return The outcome
     */
    public static GameResult play(CardRepository repository, EngineConfig config, long seed,
                                  List<DeckList> decks, int maxTurns, Consumer<String> log) {
        GameState state = GameSetup.newGame(repository, config, seed,
                List.of(decks.get(0).getTemplateIds(), decks.get(1).getTemplateIds()));

        while (!state.isGameOver() && state.getTurn() <= maxTurns) {
            int turn = state.getTurn();
            log.accept("--- Turn " + turn + " (player " + state.getCurrentPlayer() + ") ---");
            int actionsThisTurn = 0;
            while (!state.isGameOver() && state.getTurn() == turn) {
                int actor = nextActor(state);
                boolean acted = false;
                boolean mustAnswer = state.getTurnState().getPendingSelection().isPresent()
                        || !state.getTurnState().getAwaitingActive().isEmpty();
                if (mustAnswer || actionsThisTurn < MAX_ACTIONS_PER_TURN) {
                    for (Action action : DecisionEngine.candidateActions(state, actor)) {
                        ActionResult result = ActionProcessor.process(state, actor, action);
                        if (result.accepted()) {
                            log.accept("✓ P" + actor + " " + result.message());
                            acted = true;
                            break;
                        }
                    }
                }
                if (!acted) {
                    ActionResult result = ActionProcessor.process(state, actor, new Action.EndTurn());
                    if (!result.accepted()) {
                        throw new IllegalStateException("Player " + actor + " is stuck: " + result.message());
                    }
                    log.accept("✓ P" + actor + " " + result.message());
                }
                actionsThisTurn++;
            }
        }

        List<Integer> points = state.getPlayers().stream().map(PlayerState::getPoints).toList();
        state.getWinner().ifPresent(w -> log.accept("Player " + w + " wins with " + points.get(w) + " points"));
        return new GameResult(state.getWinner().orElse(null), state.getTurn(), state.getExecutedActions(), points);
    }

    /**
     * The player the engine is waiting on: a chooser, a promoting player or the current player.
     */
    private static int nextActor(GameState state) {
        if (state.getTurnState().getPendingSelection().isPresent()) {
            return state.getTurnState().getPendingSelection().get().chooser();
        }
        if (!state.getTurnState().getAwaitingActive().isEmpty()) {
            return state.getTurnState().getAwaitingActive().iterator().next();
        }
        return state.getCurrentPlayer();
    }
}
