package com.bbthechange.tvguide.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;

@Configuration
public class HttpClientConfig {

    private final TvGuideProperties properties;

    public HttpClientConfig(TvGuideProperties properties) {
        this.properties = properties;
    }

    @Bean
    public HttpClient externalHttpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(properties.getTwitch().getConnectTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }
}
