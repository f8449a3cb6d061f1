package com.creaturebattle.game;

import com.creaturebattle.card.Card;
import com.creaturebattle.card.CardRepository;
import com.creaturebattle.card.effect.FieldPosition;
import com.creaturebattle.config.EngineConfig;
import com.creaturebattle.effect.EffectQueueState;
import com.creaturebattle.effect.PassiveEffectTracker;
import com.creaturebattle.game.zones.CardInstance;
import com.creaturebattle.game.zones.FieldCard;
import com.creaturebattle.rng.CoinFlipper;
import com.creaturebattle.rng.GameRng;

import java.util.List;
import java.util.Optional;

/**
 * Complete state of one game. Everything the engine mutates lives here; two games never
 * share anything but the read-only card repository and config.
 */
public class GameState {
    private final CardRepository repository;
    private final EngineConfig config;
    private final List<PlayerState> players;
    private final EnergyStore energy = new EnergyStore();
    private final ToolAttachments tools = new ToolAttachments();
    private final StatusConditions statuses = new StatusConditions();
    private final TurnState turnState = new TurnState();
    private final EffectQueueState effectQueue = new EffectQueueState();
    private final PassiveEffectTracker passiveEffects = new PassiveEffectTracker();
    private final GameRng rng;
    private final CoinFlipper coinFlipper;

    private int turn = 1;
    private int currentPlayer = 0;
    private int executedActions;
    private Integer winner;
    private int instanceCounter;

    public GameState(CardRepository repository, EngineConfig config, GameRng rng) {
        this.repository = repository;
        this.config = config;
        this.players = List.of(
                new PlayerState(0, config.getMaxBenchSize()),
                new PlayerState(1, config.getMaxBenchSize()));
        this.rng = rng;
        this.coinFlipper = new CoinFlipper(rng);
    }

    // ---- Collaborators ----

    public CardRepository getRepository() {
        return repository;
    }

    public EngineConfig getConfig() {
        return config;
    }

    public EnergyStore getEnergy() {
        return energy;
    }

    public ToolAttachments getTools() {
        return tools;
    }

    public StatusConditions getStatuses() {
        return statuses;
    }

    public TurnState getTurnState() {
        return turnState;
    }

    public EffectQueueState getEffectQueue() {
        return effectQueue;
    }

    public PassiveEffectTracker getPassiveEffects() {
        return passiveEffects;
    }

    public GameRng getRng() {
        return rng;
    }

    public CoinFlipper getCoinFlipper() {
        return coinFlipper;
    }

    // ---- Players ----

    /**
     * @throws InvalidReferenceException for anything but 0 or 1
     */
    public PlayerState getPlayer(int playerId) {
        if (playerId < 0 || playerId >= players.size()) {
            throw new InvalidReferenceException("Invalid player id: " + playerId);
        }
        return players.get(playerId);
    }

    public List<PlayerState> getPlayers() {
        return players;
    }

    public static int opponentOf(int playerId) {
        return 1 - playerId;
    }

    // ---- Turn ----

    public int getTurn() {
        return turn;
    }

    public int getCurrentPlayer() {
        return currentPlayer;
    }

    /**
     * The very first turn of the game.
     */
    public boolean isFirstTurn() {
        return turn == 1;
    }

    /**
     * Advance to the next player's turn.
     */
    public void advanceTurn() {
        turn++;
        currentPlayer = opponentOf(currentPlayer);
    }

    public int getExecutedActions() {
        return executedActions;
    }

    public void incrementExecutedActions() {
        executedActions++;
    }

    public Optional<Integer> getWinner() {
        return Optional.ofNullable(winner);
    }

    public boolean isGameOver() {
        return winner != null;
    }

    public void setWinner(int playerId) {
        if (winner == null) {
            winner = playerId;
        }
    }

    // ---- Cards ----

    /**
     * Create a new physical card owned by {@code playerId}. Only used while building decks.
     */
    public CardInstance newInstance(int playerId, String templateId) {
        Card card = repository.require(templateId);
        return new CardInstance("p" + playerId + "-" + (instanceCounter++), templateId, card.getCardType());
    }

    /**
     * Draw up to {@code count} cards from deck to hand.
     * @return Number of cards actually drawn
     */
    public int drawCards(int playerId, int count) {
        PlayerState player = getPlayer(playerId);
        List<CardInstance> drawn = player.getDeck().drawN(count);
        player.getHand().addAll(drawn);
        return drawn.size();
    }

    // ---- Field lookups ----

    public Optional<FieldCard> fieldCardAt(FieldPosition position) {
        return getPlayer(position.playerId()).getField().get(position.fieldIndex());
    }

    /**
     * @throws InvalidReferenceException if the position is empty
     */
    public FieldCard requireFieldCard(FieldPosition position) {
        return fieldCardAt(position).orElseThrow(
                () -> new InvalidReferenceException("No creature at " + position));
    }

    /**
     * Printed data of the creature's current form.
     */
    public Card.Creature creatureData(FieldCard fieldCard) {
        return repository.getCreature(fieldCard.getTemplateId());
    }

    /**
     * Where a creature currently sits, searching both fields.
     */
    public Optional<FieldPosition> locate(String fieldInstanceId) {
        for (PlayerState player : players) {
            int index = player.getField().indexOf(fieldInstanceId);
            if (index >= 0) {
                return Optional.of(new FieldPosition(player.getId(), index));
            }
        }
        return Optional.empty();
    }
}
