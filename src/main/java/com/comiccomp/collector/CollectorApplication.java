package com.comiccomp.collector;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * The main entry point of the comic listing collector.
 *
 * <p>This Spring Boot application searches several comic marketplaces at once,
 * validates and scores every listing it gets back, and exposes:
 * <ul>
 *   <li><code>POST /api/collect/search</code> to run a search,</li>
 *   <li><code>GET /api/collect/status</code> for source health and statistics.</li>
 * </ul>
 *
 * <p>Usage:
 * <pre>{@code
 *   mvn spring-boot:run
 *
 *   java -jar target/listing-collector-0.1.0-SNAPSHOT.jar
 * }</pre>
 *
 * <p>Marketplace feed URLs are read from <code>application.yml</code> or from a
 * <code>.env</code> file in the working directory.</p>
 */
@SpringBootApplication
public class CollectorApplication {

    /**
     * Bootstrap method to launch the Spring Boot application.
     *
     * @param args command-line arguments
     */
    public static void main(final String[] args) {
        SpringApplication.run(CollectorApplication.class, args);
    }
}
