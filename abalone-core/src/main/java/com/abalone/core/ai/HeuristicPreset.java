package com.abalone.core.ai;

import java.util.Locale;
import java.util.logging.Logger;

/**
 * Named weight profiles for {@link HeuristicEvaluator}.
 */
public enum HeuristicPreset {
    /** Material and captures dominate; center control and mobility nudge otherwise equal positions. */
    BALANCED("balanced", 1400.0, 40.0, 4.0, 1.0),
    /** Captures and material only. */
    MATERIAL("material", 1800.0, 50.0, 0.0, 0.0);

    public static final HeuristicPreset DEFAULT = BALANCED;

    private static final Logger LOGGER = Logger.getLogger(HeuristicPreset.class.getName());

    private final String presetName;
    private final double scoreWeight;
    private final double materialWeight;
    private final double centerWeight;
    private final double mobilityWeight;

    HeuristicPreset(String presetName, double scoreWeight, double materialWeight, double centerWeight,
            double mobilityWeight) {
        this.presetName = presetName;
        this.scoreWeight = scoreWeight;
        this.materialWeight = materialWeight;
        this.centerWeight = centerWeight;
        this.mobilityWeight = mobilityWeight;
    }

    public String presetName() {
        return presetName;
    }

    public double scoreWeight() {
        return scoreWeight;
    }

    public double materialWeight() {
        return materialWeight;
    }

    public double centerWeight() {
        return centerWeight;
    }

    public double mobilityWeight() {
        return mobilityWeight;
    }

    /**
     * Resolves a preset by name. Unknown names fall back to {@link #DEFAULT}.
     */
    public static HeuristicPreset fromName(String name) {
        if (name != null) {
            String normalized = name.trim().toLowerCase(Locale.ROOT);
            for (HeuristicPreset preset : values()) {
                if (preset.presetName.equals(normalized)) {
                    return preset;
                }
            }
        }
        LOGGER.warning(() -> String.format("Unknown heuristic preset '%s', using '%s'", name, DEFAULT.presetName));
        return DEFAULT;
    }
}
