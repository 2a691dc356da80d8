package com.polyagent.bridge;

import java.time.Duration;

/**
 * Remote capability provider reached over HTTP. May be down at any time.
 */
public interface BridgeGateway {

    /**
     * Calls one endpoint of the bridge service. {@code timeout} bounds the whole exchange.
     *
     * @return the response, including non-2xx statuses
     * @throws BridgeException with reason {@code NETWORK} or {@code TIMEOUT} when no response arrives
     */
    BridgeResponse call(String endpoint, Object payload, Duration timeout) throws BridgeException;
}
