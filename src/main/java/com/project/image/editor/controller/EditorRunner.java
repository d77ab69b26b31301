package com.project.image.editor.controller;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.Charset;

/**
 * Starts the console session on stdin/stdout once the context is up.
 * Disabled with {@code app.editor.interactive=false}.
 */
@Component
@ConditionalOnProperty(prefix = "app.editor", name = "interactive", havingValue = "true", matchIfMissing = true)
public class EditorRunner implements CommandLineRunner {
    private static final Logger log = LoggerFactory.getLogger(EditorRunner.class);

    private final EditorController editorController;

    public EditorRunner(EditorController editorController) {
        this.editorController = editorController;
    }

    @Override
    public void run(String... args) {
        log.debug("Starting interactive session");
        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, Charset.defaultCharset()));
        editorController.run(in, System.out);
        log.debug("Interactive session finished");
    }
}
