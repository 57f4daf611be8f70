package com.comiccomp.collector.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class JacksonCollectorConfig {

    /**
     * The {@link ObjectMapper} used to read marketplace feeds and to write results.
     * <p>
     * • Qualified as <b>collectorObjectMapper</b> so sources ask for it by name.<br>
     * • Unknown feed fields are ignored; marketplaces add fields without notice.
     *
     * @return ObjectMapper for the collector
     */
    @Bean
    @Qualifier("collectorObjectMapper")
    public ObjectMapper collectorObjectMapper() {

        ObjectMapper mapper = new ObjectMapper();

        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

        return mapper;
    }

}
