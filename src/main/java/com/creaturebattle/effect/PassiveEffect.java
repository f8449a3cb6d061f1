package com.creaturebattle.effect;

import com.creaturebattle.card.effect.DurationPolicy;
import com.creaturebattle.card.effect.Effect;

import java.util.List;

/**
 * A registered modifier.
 *
 * @param id                   unique id, {@code passive-effect-N}
 * @param sourcePlayer         the player whose card created it
 * @param effectName           display name, usually the card or attack name
 * @param modifier             the modifier descriptor
 * @param amount               the modifier's amount, resolved when registered
 * @param duration             lifetime policy
 * @param createdTurn          turn number at registration
 * @param anchorInstanceId     creature it is tied to, for while-in-play and while-attached
 * @param anchorToolInstanceId tool it is tied to, for while-attached
 * @param targetInstanceIds    creatures a retreat prevention was resolved to
 */
public record PassiveEffect(
        String id,
        int sourcePlayer,
        String effectName,
        Effect.Modifier modifier,
        int amount,
        DurationPolicy duration,
        int createdTurn,
        String anchorInstanceId,
        String anchorToolInstanceId,
        List<String> targetInstanceIds) {

    public PassiveEffect {
        targetInstanceIds = targetInstanceIds == null ? List.of() : List.copyOf(targetInstanceIds);
    }

    public PassiveEffect withId(String newId) {
        return new PassiveEffect(newId, sourcePlayer, effectName, modifier, amount, duration, createdTurn,
                anchorInstanceId, anchorToolInstanceId, targetInstanceIds);
    }

    /**
     * Whether the effect is still live at the start of {@code currentTurn}.
     */
    public boolean isLiveAt(int currentTurn) {
        return switch (duration) {
            case UNTIL_END_OF_TURN -> currentTurn <= createdTurn;
            case UNTIL_END_OF_NEXT_TURN -> currentTurn <= createdTurn + 1;
            case WHILE_IN_PLAY, WHILE_ATTACHED -> true;
        };
    }
}
