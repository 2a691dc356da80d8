package com.polyagent.bridge;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.Map;

/**
 * Calls the bridge on the caller's thread. The connect and read timeouts of the {@code bridgeRestClient}
 * request factory bound each call, so a timed out exchange is closed rather than left running.
 */
@Component
@Slf4j
public class RestClientBridgeGateway implements BridgeGateway {

    private static final ParameterizedTypeReference<Map<String, Object>> BODY_TYPE = new ParameterizedTypeReference<>() {
    };

    private final RestClient restClient;

    public RestClientBridgeGateway(@Qualifier("bridgeRestClient") RestClient restClient) {
        this.restClient = restClient;
    }

    @Override
    public BridgeResponse call(String endpoint, Object payload, Duration timeout) throws BridgeException {
        try {
            ResponseEntity<Map<String, Object>> response = restClient.post()
                    .uri(endpoint)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(payload)
                    .retrieve()
                    // Status handling belongs to the caller
                    .onStatus(status -> true, (request, resp) -> {
                    })
                    .toEntity(BODY_TYPE);
            return new BridgeResponse(response.getStatusCode().value(), response.getBody());
        } catch (ResourceAccessException ex) {
            log.debug("Bridge endpoint {} unreachable: {}", endpoint, ex.getMessage());
            if (ex.getCause() instanceof SocketTimeoutException) {
                throw new BridgeException(BridgeException.Reason.TIMEOUT,
                        "Bridge call to " + endpoint + " timed out after " + timeout + ".", ex);
            }
            throw new BridgeException(BridgeException.Reason.NETWORK,
                    "Bridge call to " + endpoint + " failed: " + rootMessage(ex), ex);
        } catch (RestClientException ex) {
            log.debug("Bridge endpoint {} returned an unreadable response: {}", endpoint, ex.getMessage());
            throw new BridgeException(BridgeException.Reason.NETWORK,
                    "Bridge call to " + endpoint + " failed: " + rootMessage(ex), ex);
        }
    }

    private static String rootMessage(Exception ex) {
        Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
