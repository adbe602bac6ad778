package com.cookapi.jobclient.auth;

import java.net.URI;
import java.util.Optional;

/**
 * Supplies the {@code Authorization} header for a request to the scheduler.
 *
 * Called once per HTTP request, on the calling thread, just before sending.
 */
public interface RequestAuthenticator {

    /**
     * @param target the full request URI (Kerberos derives the service principal from its host)
     * @return the header value, or empty to send the request unauthenticated
     * @throws AuthenticationException if credentials cannot be produced
     */
    Optional<String> authorizationHeader(URI target) throws AuthenticationException;
}
