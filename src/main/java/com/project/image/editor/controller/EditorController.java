package com.project.image.editor.controller;

import com.project.image.editor.DTOs.PixelBuffer;
import com.project.image.editor.config.EditorProperties;
import com.project.image.editor.config.EditorProperties.InvalidInputPolicy;
import com.project.image.editor.exceptions.ConsoleExceptionHandler;
import com.project.image.editor.exceptions.InvalidInputException;
import com.project.image.editor.service.AdjustmentService;
import com.project.image.editor.service.ImageViewer;
import com.project.image.editor.service.OpenCVEqualizationService;
import com.project.image.editor.service.StorageService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Controller;

import java.io.BufferedReader;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Console session: asks for an image, then loops over the menu until the user exits or the
 * input ends. Load failures end the session immediately; every other error is reported and
 * the loop goes on with the last good image.
 */
@Controller
public class EditorController {
    private static final Logger log = LoggerFactory.getLogger(EditorController.class);

    private final StorageService storageService;
    private final AdjustmentService adjustmentService;
    private final OpenCVEqualizationService equalizationService;
    private final ImageViewer imageViewer;
    private final ConsoleExceptionHandler exceptionHandler;
    private final EditorProperties properties;

    public EditorController(StorageService storageService,
                            AdjustmentService adjustmentService,
                            OpenCVEqualizationService equalizationService,
                            ImageViewer imageViewer,
                            ConsoleExceptionHandler exceptionHandler,
                            EditorProperties properties) {
        this.storageService = storageService;
        this.adjustmentService = adjustmentService;
        this.equalizationService = equalizationService;
        this.imageViewer = imageViewer;
        this.exceptionHandler = exceptionHandler;
        this.properties = properties;
    }

    private enum Outcome { UNCHANGED, APPLIED, EXIT }

    public void run(BufferedReader in, PrintStream out) {
        ConsolePrompter console = new ConsolePrompter(in, out);

        Optional<String> path = console.ask("Path: ");
        if (path.isEmpty()) {
            return;
        }
        SessionState session;
        try {
            session = new SessionState(storageService.load(Path.of(path.get().trim())));
        } catch (RuntimeException e) {
            console.println("Error loading image: " + exceptionHandler.describe(e));
            return;
        }

        log.info("Session started with {}", session.current());
        while (true) {
            console.println("");
            console.println(MenuOption.menuText());
            Optional<String> choice = console.ask("Choose: ");
            if (choice.isEmpty()) {
                break;
            }
            Outcome outcome = handle(choice.get(), session, console);
            if (outcome == Outcome.EXIT) {
                break;
            }
            if (outcome == Outcome.APPLIED) {
                console.println("Applied.");
                if (properties.autoShow()) {
                    show(session, console);
                }
            }
        }
        if (session.isModified()) {
            log.info("Session ended with unsaved changes");
        }
    }

    private Outcome handle(String input, SessionState session, ConsolePrompter console) {
        Optional<MenuOption> option = MenuOption.fromInput(input);
        if (option.isEmpty()) {
            console.println("Invalid.");
            return Outcome.UNCHANGED;
        }
        return switch (option.get()) {
            case EXIT -> Outcome.EXIT;
            case SHOW -> {
                show(session, console);
                yield Outcome.UNCHANGED;
            }
            case SAVE -> save(session, console);
            default -> adjust(option.get(), session, console);
        };
    }

    private Outcome adjust(MenuOption option, SessionState session, ConsolePrompter console) {
        double parameter = MenuOption.DEFAULT_PARAMETER;
        if (option.takesParameter()) {
            OptionalDouble value;
            try {
                value = askParameter(option, console);
            } catch (InvalidInputException e) {
                console.println(exceptionHandler.describe(e));
                return Outcome.EXIT;
            }
            if (value.isEmpty()) {
                return Outcome.EXIT;
            }
            parameter = value.getAsDouble();
        }

        try {
            session.apply(apply(option, session.current(), parameter));
        } catch (RuntimeException e) {
            console.println("Error applying " + option.label() + ": " + exceptionHandler.describe(e));
            return Outcome.UNCHANGED;
        }
        log.info("{} applied (parameter {})", option.label(), option.takesParameter() ? parameter : "-");
        return Outcome.APPLIED;
    }

    private PixelBuffer apply(MenuOption option, PixelBuffer image, double parameter) {
        return switch (option) {
            case GAMMA -> adjustmentService.gamma(image, parameter);
            case HIST_EQ -> equalizationService.equalize(image);
            case BRIGHTNESS -> adjustmentService.brightness(image, parameter);
            case CONTRAST -> adjustmentService.contrast(image, parameter);
            case SHARPNESS -> adjustmentService.sharpness(image, parameter);
            case SATURATION -> adjustmentService.saturation(image, parameter);
            case EXPOSURE -> adjustmentService.exposure(image, parameter);
            default -> throw new IllegalArgumentException(option + " is not an adjustment");
        };
    }

    /**
     * Reads the parameter for {@code option}, applying the configured policy to bad input.
     * Empty result: input ended.
     *
     * @throws InvalidInputException when the policy is ABORT
     */
    private OptionalDouble askParameter(MenuOption option, ConsolePrompter console) {
        InvalidInputPolicy policy = properties.invalidInput();
        while (true) {
            Optional<String> answer = console.ask(option.parameterPrompt());
            if (answer.isEmpty()) {
                return OptionalDouble.empty();
            }
            try {
                double value = ConsolePrompter.parseNumber(answer.get(), MenuOption.DEFAULT_PARAMETER);
                if (!option.accepts(value)) {
                    throw new InvalidInputException(option.label() + " must not be negative: " + answer.get().trim());
                }
                return OptionalDouble.of(value);
            } catch (InvalidInputException e) {
                switch (policy) {
                    case ABORT -> throw e;
                    case DEFAULT -> {
                        console.println(exceptionHandler.describe(e) + " (using " + MenuOption.DEFAULT_PARAMETER + ")");
                        return OptionalDouble.of(MenuOption.DEFAULT_PARAMETER);
                    }
                    default -> console.println(exceptionHandler.describe(e));
                }
            }
        }
    }

    private Outcome save(SessionState session, ConsolePrompter console) {
        if (!session.isModified()) {
            console.println("Nothing to save.");
            return Outcome.UNCHANGED;
        }
        Optional<String> target = console.ask("Save as: ");
        if (target.isEmpty()) {
            return Outcome.EXIT;
        }
        try {
            Path path = Path.of(target.get().trim());
            storageService.save(session.current(), path);
            session.markSaved();
            console.println("Saved: " + path);
        } catch (RuntimeException e) {
            console.println("Error saving image: " + exceptionHandler.describe(e));
        }
        return Outcome.UNCHANGED;
    }

    private void show(SessionState session, ConsolePrompter console) {
        try {
            Path preview = imageViewer.show(session.current());
            console.println("Preview: " + preview);
        } catch (RuntimeException e) {
            console.println("Error showing image: " + exceptionHandler.describe(e));
        }
    }
}
