package com.project.image.editor.controller;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MenuOptionTest {

    @Test
    void fromInput_matchesTrimmedKeys() {
        assertThat(MenuOption.fromInput(" 1 ")).contains(MenuOption.GAMMA);
        assertThat(MenuOption.fromInput("0")).contains(MenuOption.EXIT);
        assertThat(MenuOption.fromInput("10")).isEmpty();
        assertThat(MenuOption.fromInput("")).isEmpty();
        assertThat(MenuOption.fromInput(null)).isEmpty();
    }

    @Test
    void adjustments_areTheFirstSevenEntries() {
        assertThat(MenuOption.values()).filteredOn(MenuOption::isAdjustment).hasSize(7);
        assertThat(MenuOption.HIST_EQ.takesParameter()).isFalse();
        assertThat(MenuOption.EXPOSURE.parameterPrompt()).isEqualTo("Exposure [1]: ");
    }

    @Test
    void accepts_rejectsNegativeGammaOnly() {
        assertThat(MenuOption.GAMMA.accepts(-0.1)).isFalse();
        assertThat(MenuOption.GAMMA.accepts(0)).isTrue();
        assertThat(MenuOption.BRIGHTNESS.accepts(-0.1)).isTrue();
        assertThat(MenuOption.CONTRAST.accepts(Double.NaN)).isFalse();
    }
}
