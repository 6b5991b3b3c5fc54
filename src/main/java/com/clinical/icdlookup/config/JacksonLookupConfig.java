package com.clinical.icdlookup.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class JacksonLookupConfig {

    /**
     * A dedicated {@link ObjectMapper} for registry payloads and the seed dataset.
     * <p>
     * • Has its own qualifier (<b>registryObjectMapper</b>) so it never clashes with the
     * default mapper that Spring Boot auto‑configures for MVC.<br>
     * • Tolerates unknown properties: the registry adds fields between API versions.
     *
     * @return ObjectMapper for registry JSON
     */
    @Bean
    @Qualifier("registryObjectMapper")
    public ObjectMapper registryObjectMapper() {

        ObjectMapper mapper = new ObjectMapper();

        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

        return mapper;
    }

}
