package org.pbrtscene.loader;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;

import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.UnsupportedCharsetException;

/**
 * Tunables of the {@link SceneLoader}, read from the {@code pbrt-scene.loader} configuration block.
 *
 * @param maxIncludeDepth The maximum number of simultaneously open files, including the top-level one.
 * @param charset The encoding of every scene file.
 * @param logSummary Whether to log a summary line after each successful load.
 */
public record LoaderOptions(int maxIncludeDepth, Charset charset, boolean logSummary) {

    public static final String CONFIG_PATH = "pbrt-scene.loader";

    public LoaderOptions {
        if (maxIncludeDepth < 1) {
            throw new IllegalArgumentException("maxIncludeDepth must be at least 1, got " + maxIncludeDepth);
        }
    }

    /**
     * @return The options from {@code reference.conf} and any application overrides on the classpath.
     */
    public static LoaderOptions defaults() {
        return fromConfig(ConfigFactory.load());
    }

    /**
     * Reads options from a configuration that contains a {@code pbrt-scene.loader} block.
     * @param config The root configuration.
     * @return The options.
     * @throws ConfigException if a key is missing or has the wrong type, or the charset is unknown.
     */
    public static LoaderOptions fromConfig(Config config) {
        Config loader = config.getConfig(CONFIG_PATH);
        String charsetName = loader.getString("charset");
        Charset charset;
        try {
            charset = Charset.forName(charsetName);
        } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
            throw new ConfigException.BadValue(loader.origin(), "charset", "Unknown charset '" + charsetName + "'", e);
        }
        return new LoaderOptions(loader.getInt("max-include-depth"), charset, loader.getBoolean("log-summary"));
    }
}
