package com.fleetdeck.core.dispatch;

/**
 * Opens connections to nodes, either straight to their address or through a
 * local relay tunnel endpoint.
 */
public interface ConnectionProvider {

    /**
     * @param endpoint {@code host:port} of the node
     * @throws ConnectionException if the node cannot be reached
     */
    Connection openDirect(String endpoint);

    /**
     * @param relayEndpoint local {@code host:port} of a relay tunnel
     * @throws ConnectionException if the tunnel does not answer
     */
    Connection openRelayed(String relayEndpoint);
}
