package com.shelfsync.converter.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.shelfsync.converter.util.JsonSupport;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
public class WebClientConfig {

    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        return JsonSupport.objectMapper();
    }

    /** Client of the image storage service; only built into a gateway when storage is configured. */
    @Bean(name = "storageClient")
    public WebClient storageClient(StorageProperties storageProperties) {
        WebClient.Builder builder = WebClient.builder()
                .defaultHeaders(headers -> headers.setAccept(MediaType.parseMediaTypes("application/json")));
        if (storageProperties.isConfigured()) {
            builder.baseUrl(storageProperties.getBaseUrl().trim().replaceAll("/+$", ""))
                    .defaultHeader("Authorization", "Bearer " + storageProperties.getApiToken().trim());
        }
        return builder.build();
    }
}
