package com.project.image.editor.controller;

import com.project.image.editor.exceptions.InvalidInputException;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.util.Optional;

/** Line-based prompts on a reader/stream pair. An empty Optional means end of input. */
public class ConsolePrompter {
    private final BufferedReader in;
    private final PrintStream out;

    public ConsolePrompter(BufferedReader in, PrintStream out) {
        this.in = in;
        this.out = out;
    }

    public Optional<String> ask(String prompt) {
        out.print(prompt);
        out.flush();
        try {
            return Optional.ofNullable(in.readLine());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read from console", e);
        }
    }

    public void println(String line) {
        out.println(line);
    }

    /**
     * Parses a numeric answer. Blank input means {@code defaultValue}.
     *
     * @throws InvalidInputException if the text is not a finite number
     */
    public static double parseNumber(String text, double defaultValue) {
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return defaultValue;
        }
        double value;
        try {
            value = Double.parseDouble(trimmed);
        } catch (NumberFormatException e) {
            throw new InvalidInputException("Invalid number: " + trimmed, e);
        }
        if (!Double.isFinite(value)) {
            throw new InvalidInputException("Invalid number: " + trimmed);
        }
        return value;
    }
}
