package com.bricks.sorter.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class JacksonSorterConfig {

    /**
     * A dedicated {@link ObjectMapper} for inventory files and catalog payloads.
     * <p>
     * • Has its own qualifier (<b>sorterObjectMapper</b>) so it never clashes with the
     * default mapper that Spring Boot auto‑configures for MVC.<br>
     * • Tolerates the many fields of Rebrickable payloads we never read.
     *
     * @return ObjectMapper for inventory payloads
     */
    @Bean
    @Qualifier("sorterObjectMapper")
    public ObjectMapper sorterObjectMapper() {

        ObjectMapper mapper = new ObjectMapper();

        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

        return mapper;
    }

    /**
     * Clock used for every "today" decision (cache timestamps, image retries).
     *
     * @return the system clock in the default zone
     */
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

}
