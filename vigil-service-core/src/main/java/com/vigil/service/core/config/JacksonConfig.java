package com.vigil.service.core.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.springframework.beans.factory.config.BeanPostProcessor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class JacksonConfig {

    /**
     * Boot's auto-configured mapper is built by {@code Jackson2ObjectMapperBuilder}, which lives in
     * spring-web. The engine runs without spring-web, so it supplies its own.
     */
    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper vigilObjectMapper() {
        return JsonMapper.builder().findAndAddModules().build();
    }

    /** Retention files carry ISO-8601 instants and omit unset fields. */
    @Bean
    public static BeanPostProcessor retentionObjectMapperCustomizer() {
        return new BeanPostProcessor() {
            @Override
            public Object postProcessAfterInitialization(Object bean, String beanName) {
                if (bean instanceof ObjectMapper om) {
                    om.setSerializationInclusion(JsonInclude.Include.NON_NULL);
                    om.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
                    om.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
                }
                return bean;
            }
        };
    }
}
