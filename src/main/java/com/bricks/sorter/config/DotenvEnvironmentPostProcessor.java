package com.bricks.sorter.config;

import io.github.cdimascio.dotenv.Dotenv;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.env.EnvironmentPostProcessor;
import org.springframework.core.Ordered;
import org.springframework.core.env.ConfigurableEnvironment;
import org.springframework.core.env.MapPropertySource;

import java.util.HashMap;
import java.util.Map;

/**
 * Loads a `.env` file from the application root and adds its entries
 * as a high-priority property source so that
 * `${REBRICKABLE_KEY}` resolves without exporting it in the shell.
 */
public class DotenvEnvironmentPostProcessor
        implements EnvironmentPostProcessor, Ordered {

    /** Name of the property source holding the .env entries. */
    static final String PROPERTY_SOURCE_NAME = "dotenvProperties";

    /** highest precedence so .env entries override everything else */
    @Override
    public int getOrder() {
        return Ordered.HIGHEST_PRECEDENCE;
    }

    @Override
    public void postProcessEnvironment(ConfigurableEnvironment env,
                                       SpringApplication application) {
        Dotenv dotenv = Dotenv.configure()
                .filename(".env")
                .ignoreIfMissing()
                .load();

        Map<String, Object> map = new HashMap<>();
        dotenv.entries(Dotenv.Filter.DECLARED_IN_ENV_FILE)
                .forEach(e -> map.put(e.getKey(), e.getValue()));

        if (map.isEmpty()) {
            return;
        }
        env.getPropertySources()
                .addFirst(new MapPropertySource(PROPERTY_SOURCE_NAME, map));
    }
}
