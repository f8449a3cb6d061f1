package com.creaturebattle.effect.handlers;

import com.creaturebattle.card.effect.Effect;

public class PreventEnergyAttachmentEffectHandler extends AbstractModifierHandler<Effect.PreventEnergyAttachment> {

    public PreventEnergyAttachmentEffectHandler() {
        super(Effect.PreventEnergyAttachment.class);
    }
}
