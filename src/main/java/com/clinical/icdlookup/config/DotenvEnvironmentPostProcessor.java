package com.clinical.icdlookup.config;

import io.github.cdimascio.dotenv.Dotenv;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.env.EnvironmentPostProcessor;
import org.springframework.core.Ordered;
import org.springframework.core.env.ConfigurableEnvironment;
import org.springframework.core.env.MapPropertySource;

import java.util.HashMap;
import java.util.Map;

/**
 * Loads the untracked `.env` file from the application root and adds its
 * entries as a high-priority property source so that `${ICD_CLIENT_ID}` and
 * `${ICD_CLIENT_SECRET}` resolve in <code>application.yml</code>.
 * <p>
 * A missing file is not an error here; the registry credentials simply stay
 * blank and {@link com.clinical.icdlookup.service.auth.CredentialStore}
 * reports it as a configuration problem on first use.
 */
public class DotenvEnvironmentPostProcessor
        implements EnvironmentPostProcessor, Ordered {

    /** Name of the property source holding the dotenv entries. */
    static final String PROPERTY_SOURCE_NAME = "dotenvProperties";

    /** highest precedence so .env entries override everything else */
    @Override
    public int getOrder() {
        return Ordered.HIGHEST_PRECEDENCE;
    }

    @Override
    public void postProcessEnvironment(final ConfigurableEnvironment env,
                                       final SpringApplication application) {
        Dotenv dotenv = Dotenv.configure()
                .directory(env.getProperty("icd.dotenv.directory", "./"))
                .filename(env.getProperty("icd.dotenv.filename", ".env"))
                .ignoreIfMissing()
                .ignoreIfMalformed()
                .load();

        Map<String, Object> map = new HashMap<>();
        dotenv.entries(Dotenv.Filter.DECLARED_IN_ENV_FILE)
                .forEach(e -> map.put(e.getKey(), e.getValue()));

        if (map.isEmpty()) {
            return;
        }
        // Insert at the very front so .env wins over application.yml, system properties, etc.
        env.getPropertySources()
                .addFirst(new MapPropertySource(PROPERTY_SOURCE_NAME, map));
    }
}
