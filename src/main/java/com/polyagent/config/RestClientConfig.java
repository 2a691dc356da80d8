package com.polyagent.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpRequest;
import org.springframework.http.client.BufferingClientHttpRequestFactory;
import org.springframework.http.client.ClientHttpRequestExecution;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.RestClient;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

@Configuration
@Slf4j
public class RestClientConfig {

    @Bean
    public RestClientCustomizer restClientCustomizer() {
        return restClientBuilder -> restClientBuilder.requestInterceptor(new LoggingRequestInterceptor());
    }

    @Bean
    public RestClient bridgeRestClient(RestClient.Builder builder, PolyAgentProperties properties) {
        PolyAgentProperties.BridgeConfig bridge = properties.getBridge();
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(bridge.getTimeout());
        requestFactory.setReadTimeout(bridge.getTimeout());
        log.info("Bridge gateway client configured (enabled={}, baseUrl={}).", bridge.isEnabled(), bridge.getBaseUrl());
        return builder
                .baseUrl(bridge.getBaseUrl())
                // Buffering lets the logging interceptor read the body before the caller does
                .requestFactory(new BufferingClientHttpRequestFactory(requestFactory))
                .build();
    }

    static class LoggingRequestInterceptor implements ClientHttpRequestInterceptor {
        private static final org.slf4j.Logger httpLogger = org.slf4j.LoggerFactory.getLogger("com.polyagent.http.logging");

        @Override
        public ClientHttpResponse intercept(HttpRequest request, byte[] body, ClientHttpRequestExecution execution) throws IOException {
            // Providers configured without a key send "Bearer none"; strip it instead of sending garbage
            var headers = request.getHeaders();
            String auth = headers.getFirst("Authorization");
            if (auth != null) {
                String trimmed = auth.trim();
                if (trimmed.equalsIgnoreCase("Bearer none") || trimmed.equalsIgnoreCase("Bearer EMPTY")) {
                    headers.remove("Authorization");
                }
            }

            if (!httpLogger.isDebugEnabled()) {
                return execution.execute(request, body);
            }
            logRequest(request, body);
            ClientHttpResponse response = execution.execute(request, body);
            logResponse(response);
            return response;
        }

        private void logRequest(HttpRequest request, byte[] body) {
            httpLogger.debug("--> {} {}", request.getMethod(), request.getURI());
            if (body.length > 0) {
                httpLogger.debug("--> body: {}", new String(body, StandardCharsets.UTF_8));
            }
        }

        private void logResponse(ClientHttpResponse response) throws IOException {
            try {
                httpLogger.debug("<-- status: {}", response.getStatusCode());
            } catch (IOException e) {
                httpLogger.debug("<-- status: unknown");
            }
            byte[] body = StreamUtils.copyToByteArray(response.getBody());
            if (body.length > 0) {
                httpLogger.debug("<-- body: {}", new String(body, StandardCharsets.UTF_8));
            }
        }
    }
}
