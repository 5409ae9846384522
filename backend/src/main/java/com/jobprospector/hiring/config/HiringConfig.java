package com.jobprospector.hiring.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class HiringConfig {

    @Bean(name = "hiringExecutor", destroyMethod = "shutdown")
    public ExecutorService hiringExecutor(HiringProperties properties) {
        return Executors.newFixedThreadPool(properties.getBatch().getConcurrency());
    }

    @Bean(name = "httpExecutor", destroyMethod = "shutdown")
    public ExecutorService httpExecutor(HiringProperties properties) {
        int size = Math.max(4, properties.getHttp().getGlobalConcurrency() * 2);
        return Executors.newFixedThreadPool(size);
    }

    @Bean(name = "browserExecutor", destroyMethod = "shutdown")
    public ExecutorService browserExecutor(HiringProperties properties) {
        return Executors.newFixedThreadPool(properties.getFetch().getMaxConcurrentBrowsers());
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }
}
