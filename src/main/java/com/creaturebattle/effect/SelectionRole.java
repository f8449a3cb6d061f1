package com.creaturebattle.effect;

/**
 * The part of an effect a target selection fills. Sources are always resolved before targets.
 */
public enum SelectionRole {
    SOURCE,
    TARGET
}
