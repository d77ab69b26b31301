package com.project.image.editor.controller;

import java.util.Arrays;
import java.util.Optional;
import java.util.stream.Collectors;

/** Entries of the console menu, in display order. */
public enum MenuOption {
    GAMMA("1", "Gamma", true),
    HIST_EQ("2", "HistEq", false),
    BRIGHTNESS("3", "Brightness", true),
    CONTRAST("4", "Contrast", true),
    SHARPNESS("5", "Sharpness", true),
    SATURATION("6", "Saturation", true),
    EXPOSURE("7", "Exposure", true),
    SHOW("8", "Show", false),
    SAVE("9", "Save", false),
    EXIT("0", "Exit", false);

    /** Value used when the user just presses enter at a parameter prompt. */
    public static final double DEFAULT_PARAMETER = 1.0;

    private final String key;
    private final String label;
    private final boolean takesParameter;

    MenuOption(String key, String label, boolean takesParameter) {
        this.key = key;
        this.label = label;
        this.takesParameter = takesParameter;
    }

    public String key() {
        return key;
    }

    public String label() {
        return label;
    }

    public boolean takesParameter() {
        return takesParameter;
    }

    /** Operations 1-7 change the image; the rest don't. */
    public boolean isAdjustment() {
        return this != SHOW && this != SAVE && this != EXIT;
    }

    public String parameterPrompt() {
        return label + " [1]: ";
    }

    /** Whether {@code value} is usable for this option; gamma must not be negative. */
    public boolean accepts(double value) {
        if (!Double.isFinite(value)) return false;
        return this != GAMMA || value >= 0;
    }

    public static Optional<MenuOption> fromInput(String input) {
        if (input == null) return Optional.empty();
        String trimmed = input.trim();
        return Arrays.stream(values()).filter(o -> o.key.equals(trimmed)).findFirst();
    }

    public static String menuText() {
        return Arrays.stream(values())
                .map(o -> o.key + ": " + o.label)
                .collect(Collectors.joining(System.lineSeparator()));
    }
}
