package com.project.image.editor;

import com.project.image.editor.config.EditorProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Entry point of the Spring Boot application. The purpose of this class is ONLY to bootstrap
 * the app. It must NOT contain business logic.
 *
 * The application is non-web: the interactive console loop is started by
 * {@link com.project.image.editor.controller.EditorRunner} once the context is ready.
 */
@SpringBootApplication
@EnableConfigurationProperties(EditorProperties.class)
public class Application {
    public static void main(String[] args) {
        SpringApplication.run(Application.class, args);
    }
}
