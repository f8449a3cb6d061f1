package com.creaturebattle.card;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Rule-relevant flags printed on a creature.
 */
public class CreatureAttributes {
    @JsonProperty("ex")
    private boolean ex;

    @JsonProperty("mega")
    private boolean mega;

    @JsonProperty("ultra_beast")
    private boolean ultraBeast;

    public boolean isEx() {
        return ex;
    }

    public boolean isMega() {
        return mega;
    }

    public boolean isUltraBeast() {
        return ultraBeast;
    }

    public void setEx(boolean ex) { this.ex = ex; }
    public void setMega(boolean mega) { this.mega = mega; }
    public void setUltraBeast(boolean ultraBeast) { this.ultraBeast = ultraBeast; }
}
