package com.sceneit.engine.io;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

import lombok.Data;
import lombok.extern.log4j.Log4j2;

/**
 * POJO representation of the engine settings, read from {@code sceneit.json}.
 *
 * Unknown keys are ignored and absent keys keep their defaults.
 */
@Data
@Log4j2
@JsonIgnoreProperties(ignoreUnknown = true)
public final class SceneItConfig {
    public static final String RESOURCE = "sceneit.json";

    private int maxTitleLength = 100;
    private int maxNameLength = 100;
    private String defaultTitle = "Untitled Storyboard";
    /** Indentation unit per traversal depth in outline listings. */
    private String indent = "  ";
    /** Must be a power of two. */
    private int ringBufferSize = 1024;

    public static SceneItConfig defaults() {
        return new SceneItConfig();
    }

    /**
     * Loads {@link #RESOURCE} from the context class path, or returns the defaults
     * if it is absent.
     *
     * @throws UncheckedIOException if the resource exists but cannot be parsed.
     */
    public static SceneItConfig load() {
        ClassLoader cl = Thread.currentThread().getContextClassLoader();
        if (cl == null)
            cl = SceneItConfig.class.getClassLoader();
        try (InputStream in = cl.getResourceAsStream(RESOURCE)) {
            if (in == null) {
                log.debug("No {} on class path, using defaults", RESOURCE);
                return defaults();
            }
            return parse(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE, e);
        }
    }

    /** Parses a configuration document from a stream. */
    public static SceneItConfig parse(InputStream in) throws IOException {
        SceneItConfig config = new ObjectMapper().readValue(in, SceneItConfig.class);
        log.debug("Loaded configuration: {}", config);
        return config;
    }

    /** Parses a configuration document from a JSON string. */
    public static SceneItConfig parse(String json) {
        try {
            return new ObjectMapper().readValue(json, SceneItConfig.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Malformed configuration", e);
        }
    }
}
