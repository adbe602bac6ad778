package com.cookapi.jobclient.auth;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Optional;

/**
 * HTTP Basic credentials, sent preemptively on every request.
 */
public class BasicAuthenticator implements RequestAuthenticator {

    private final String user;
    private final String header;

    public BasicAuthenticator(String user, String password) {
        this.user   = user;
        this.header = "Basic " + Base64.getEncoder()
                .encodeToString((user + ":" + password).getBytes(StandardCharsets.UTF_8));
    }

    public String user() { return user; }

    @Override
    public Optional<String> authorizationHeader(URI target) {
        return Optional.of(header);
    }

    @Override
    public String toString() {
        return "BasicAuthenticator[user=" + user + "]";
    }
}
