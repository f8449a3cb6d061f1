package com.creaturebattle.game.action;

import com.creaturebattle.card.effect.FieldPosition;
import com.creaturebattle.effect.DrainStatus;
import com.creaturebattle.effect.PendingSelection;
import com.creaturebattle.effect.SelectionRole;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of processing an action.
 *
 * @param accepted  false if the action was rejected and nothing changed
 * @param message   what happened, or why the action was rejected
 * @param status    whether the engine is idle or waiting for a target selection
 * @param selection the pending selection, when waiting for one
 */
public record ActionResult(boolean accepted, String message, DrainStatus status, SelectionView selection) {

    /**
     * What a client needs to prompt for a pending selection.
     */
    public record SelectionView(int chooser, String effectName, SelectionRole role, List<FieldPosition> candidates) {

        static SelectionView of(PendingSelection pending) {
            return new SelectionView(pending.chooser(), pending.queued().context().effectName(),
                    pending.role(), pending.candidates());
        }
    }

    public static ActionResult accepted(String message, DrainStatus status, Optional<PendingSelection> pending) {
        return new ActionResult(true, message, status, pending.map(SelectionView::of).orElse(null));
    }

    public static ActionResult rejected(String reason, DrainStatus status, Optional<PendingSelection> pending) {
        return new ActionResult(false, reason, status, pending.map(SelectionView::of).orElse(null));
    }

    public Optional<SelectionView> getSelection() {
        return Optional.ofNullable(selection);
    }

    public boolean isAwaitingSelection() {
        return status == DrainStatus.AWAITING_SELECTION;
    }
}
