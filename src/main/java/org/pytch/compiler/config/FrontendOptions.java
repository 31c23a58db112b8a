package org.pytch.compiler.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.nio.file.Path;

/**
 * Settings of the front end, read from the {@code pytch.frontend} section of the configuration.
 *
 * @param verbosity The {@link org.pytch.compiler.diagnostics.CompilerLogger} level.
 * @param defaultFileName The file name used in diagnostics when the caller gives none.
 * @param dumpTokens Whether raw and preparsed token streams are written to {@code dumpDirectory}.
 * @param dumpDirectory Where token dumps are written.
 */
public record FrontendOptions(
        int verbosity,
        String defaultFileName,
        boolean dumpTokens,
        Path dumpDirectory
) {

    /** The configuration path of the front-end section. */
    public static final String SECTION = "pytch.frontend";

    /**
     * Reads the options from a configuration. Missing keys fall back to built-in defaults.
     * @param config The full configuration (the {@value #SECTION} section is read).
     * @return The options.
     */
    public static FrontendOptions fromConfig(Config config) {
        Config options = config.hasPath(SECTION) ? config.getConfig(SECTION) : ConfigFactory.empty();
        int verbosity = options.hasPath("verbosity") ? options.getInt("verbosity") : 2;
        String defaultFileName = options.hasPath("default-file-name") ? options.getString("default-file-name") : "<memory>";
        boolean dumpTokens = options.hasPath("dump-tokens") && options.getBoolean("dump-tokens");
        String dumpDirectory = options.hasPath("dump-directory") ? options.getString("dump-directory") : "build/frontend-dumps";
        return new FrontendOptions(verbosity, defaultFileName, dumpTokens, Path.of(dumpDirectory));
    }

    /**
     * @return The options defined by {@code reference.conf}.
     */
    public static FrontendOptions defaults() {
        return fromConfig(ConfigFactory.parseResources("reference.conf").resolve());
    }
}
