package com.comiccomp.collector.config;

import io.github.cdimascio.dotenv.Dotenv;
import org.apache.commons.logging.Log;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.env.EnvironmentPostProcessor;
import org.springframework.boot.logging.DeferredLogFactory;
import org.springframework.core.Ordered;
import org.springframework.core.env.ConfigurableEnvironment;
import org.springframework.core.env.MapPropertySource;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Loads marketplace feed settings from a {@code .env} file.
 * <p>
 * Feed URLs such as {@code EBAY_FEED_URL} are referenced from application.yml
 * but kept out of it; a deployment drops them into {@code .env} next to the jar,
 * or into the directory named by {@code collector.dotenv.directory}. Only entries
 * declared in the file are added, as the highest-precedence property source.
 * A missing or empty file adds nothing.
 * </p>
 */
public class DotenvEnvironmentPostProcessor implements EnvironmentPostProcessor, Ordered {

    static final String PROPERTY_SOURCE_NAME = "collectorDotenv";

    static final String DIRECTORY_PROPERTY = "collector.dotenv.directory";

    private final Log log;

    public DotenvEnvironmentPostProcessor(final DeferredLogFactory logFactory) {
        this.log = logFactory.getLog(DotenvEnvironmentPostProcessor.class);
    }

    @Override
    public int getOrder() {
        return Ordered.HIGHEST_PRECEDENCE;
    }

    @Override
    public void postProcessEnvironment(final ConfigurableEnvironment env,
                                       final SpringApplication application) {
        String directory = env.getProperty(DIRECTORY_PROPERTY, ".");
        Dotenv dotenv = Dotenv.configure()
                .directory(directory)
                .filename(".env")
                .ignoreIfMissing()
                .load();

        Map<String, Object> entries = new LinkedHashMap<>();
        dotenv.entries(Dotenv.Filter.DECLARED_IN_ENV_FILE).forEach(e -> entries.put(e.getKey(), e.getValue()));
        if (entries.isEmpty()) {
            log.debug("No .env entries found in " + directory);
            return;
        }

        env.getPropertySources().addFirst(new MapPropertySource(PROPERTY_SOURCE_NAME, entries));
        log.info("Loaded " + entries.size() + " .env entries from " + directory + ": " + entries.keySet());
    }
}
