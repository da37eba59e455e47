package com.mimecast.enquiry.main;

import com.mimecast.enquiry.config.ParserConfig;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;

/**
 * Master configuration initializer and container.
 *
 * <p>Holds the parser configuration for command line use.
 * <p>Library components take their configuration by constructor and never read this holder.
 *
 * @see ParserConfig
 */
public class Config {
    private static final Logger log = LogManager.getLogger(Config.class);

    /**
     * Protected constructor.
     */
    private Config() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Parser configuration.
     */
    private static ParserConfig parser = new ParserConfig();

    /**
     * Gets parser config.
     *
     * @return ParserConfig.
     */
    public static ParserConfig getParser() {
        return parser;
    }

    /**
     * Init parser config.
     *
     * @param path File path.
     * @throws IOException Unable to read file.
     */
    public static void initParser(String path) throws IOException {
        parser = new ParserConfig(path);
        log.info("Loaded parser config: {}", path);
    }
}
