package com.iksanov.checkpoint.node.storage;

/**
 * Host settings section of a {@link StateDocument}.
 *
 * @param autoSaveInterval auto-save period in minutes
 */
public record StateSettings(String theme, boolean animationsEnabled, boolean autoMode, long autoSaveInterval) {

    public StateSettings {
        if (theme == null || theme.isBlank()) throw new IllegalArgumentException("theme cannot be null or blank");
        if (autoSaveInterval <= 0) throw new IllegalArgumentException("autoSaveInterval must be > 0");
    }

    public static StateSettings defaults() {
        return new StateSettings("cyberpunk", true, false, 5);
    }
}
