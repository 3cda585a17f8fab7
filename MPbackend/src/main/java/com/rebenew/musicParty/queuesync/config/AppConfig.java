package com.rebenew.musicParty.queuesync.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

@Configuration
@EnableConfigurationProperties({SessionProperties.class, CatalogProperties.class})
public class AppConfig {

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.findAndRegisterModules();
        return mapper;
    }

    // Timers de teardown, fin de track y barrido de conexiones
    @Bean(destroyMethod = "shutdown")
    public ScheduledExecutorService scheduledExecutorService() {
        return Executors.newScheduledThreadPool(2);
    }

    @Bean
    public RestTemplate catalogRestTemplate(RestTemplateBuilder builder, CatalogProperties catalog) {
        return builder
                .setConnectTimeout(catalog.getConnectTimeout())
                .setReadTimeout(catalog.getReadTimeout())
                .build();
    }

    @Bean
    public ServletServerContainerFactoryBean createWebSocketContainer(SessionProperties session) {
        ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
        container.setMaxTextMessageBufferSize(8192);
        container.setMaxBinaryMessageBufferSize(8192);
        container.setMaxSessionIdleTimeout(session.getClientIdleTimeout().toMillis());
        return container;
    }
}
