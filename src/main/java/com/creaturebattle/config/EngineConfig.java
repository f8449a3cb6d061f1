package com.creaturebattle.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Game rule constants. Values missing from a loaded file keep their defaults.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class EngineConfig {
    public static final String DEFAULT_RESOURCE = "engine-config.json";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @JsonProperty("points_to_win")
    private int pointsToWin = 3;

    @JsonProperty("max_bench_size")
    private int maxBenchSize = 3;

    @JsonProperty("initial_hand_size")
    private int initialHandSize = 5;

    @JsonProperty("weakness_bonus")
    private int weaknessBonus = 20;

    @JsonProperty("poison_damage")
    private int poisonDamage = 10;

    @JsonProperty("burn_damage")
    private int burnDamage = 20;

    @JsonProperty("confusion_self_damage")
    private int confusionSelfDamage = 30;

    @JsonProperty("max_drain_steps")
    private int maxDrainSteps = 500;

    /**
     * Built-in defaults, without touching the classpath.
     */
    public static EngineConfig defaults() {
        return new EngineConfig();
    }

    public static EngineConfig fromFile(String path) throws EngineConfigException {
        try {
            return validate(MAPPER.readValue(Files.readString(Path.of(path)), EngineConfig.class));
        } catch (IOException e) {
            throw new EngineConfigException("Cannot read engine config " + path + ": " + e.getMessage(), e);
        }
    }

    public static EngineConfig fromResource(String resourcePath) throws EngineConfigException {
        try (InputStream is = EngineConfig.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (is == null) {
                throw new EngineConfigException("Resource not found: " + resourcePath);
            }
            return validate(MAPPER.readValue(is, EngineConfig.class));
        } catch (IOException e) {
            throw new EngineConfigException("Cannot parse engine config " + resourcePath + ": " + e.getMessage(), e);
        }
    }

    private static EngineConfig validate(EngineConfig config) throws EngineConfigException {
        if (config.pointsToWin < 1) {
            throw new EngineConfigException("points_to_win must be at least 1");
        }
        if (config.maxBenchSize < 1) {
            throw new EngineConfigException("max_bench_size must be at least 1");
        }
        if (config.maxDrainSteps < 1) {
            throw new EngineConfigException("max_drain_steps must be at least 1");
        }
        return config;
    }

    public int getPointsToWin() {
        return pointsToWin;
    }

    public int getMaxBenchSize() {
        return maxBenchSize;
    }

    public int getInitialHandSize() {
        return initialHandSize;
    }

    public int getWeaknessBonus() {
        return weaknessBonus;
    }

    public int getPoisonDamage() {
        return poisonDamage;
    }

    public int getBurnDamage() {
        return burnDamage;
    }

    public int getConfusionSelfDamage() {
        return confusionSelfDamage;
    }

    public int getMaxDrainSteps() {
        return maxDrainSteps;
    }

    public void setPointsToWin(int pointsToWin) { this.pointsToWin = pointsToWin; }
    public void setMaxBenchSize(int maxBenchSize) { this.maxBenchSize = maxBenchSize; }
    public void setInitialHandSize(int initialHandSize) { this.initialHandSize = initialHandSize; }
    public void setWeaknessBonus(int weaknessBonus) { this.weaknessBonus = weaknessBonus; }
    public void setPoisonDamage(int poisonDamage) { this.poisonDamage = poisonDamage; }
    public void setBurnDamage(int burnDamage) { this.burnDamage = burnDamage; }
    public void setConfusionSelfDamage(int confusionSelfDamage) { this.confusionSelfDamage = confusionSelfDamage; }
    public void setMaxDrainSteps(int maxDrainSteps) { this.maxDrainSteps = maxDrainSteps; }
}
