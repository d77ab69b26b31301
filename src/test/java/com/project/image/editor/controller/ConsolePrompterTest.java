package com.project.image.editor.controller;

import com.project.image.editor.exceptions.InvalidInputException;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;

import static org.assertj.core.api.Assertions.*;

class ConsolePrompterTest {

    @Test
    void parseNumber_acceptsNumbersAndBlankDefault() {
        assertThat(ConsolePrompter.parseNumber(" 2.5 ", 1.0)).isEqualTo(2.5);
        assertThat(ConsolePrompter.parseNumber("-3", 1.0)).isEqualTo(-3.0);
        assertThat(ConsolePrompter.parseNumber("   ", 1.0)).isEqualTo(1.0);
    }

    @Test
    void parseNumber_rejectsTextAndNonFiniteValues() {
        assertThatThrownBy(() -> ConsolePrompter.parseNumber("abc", 1.0))
                .isInstanceOf(InvalidInputException.class)
                .hasMessage("Invalid number: abc");
        assertThatThrownBy(() -> ConsolePrompter.parseNumber("NaN", 1.0))
                .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> ConsolePrompter.parseNumber("Infinity", 1.0))
                .isInstanceOf(InvalidInputException.class);
    }

    @Test
    void ask_printsPromptAndSignalsEndOfInput() {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        ConsolePrompter prompter = new ConsolePrompter(
                new BufferedReader(new StringReader("first\n")), new PrintStream(bytes, true));

        assertThat(prompter.ask("Path: ")).contains("first");
        assertThat(prompter.ask("Choose: ")).isEmpty();
        assertThat(bytes.toString()).isEqualTo("Path: Choose: ");
    }
}
