package com.cookapi.jobclient.auth;

import org.ietf.jgss.GSSContext;
import org.ietf.jgss.GSSException;
import org.ietf.jgss.GSSManager;
import org.ietf.jgss.GSSName;
import org.ietf.jgss.Oid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.Base64;
import java.util.Optional;

/**
 * SPNEGO ({@code Authorization: Negotiate}) via the JDK GSS-API.
 *
 * A fresh initiator token is produced for every request against the host-based
 * principal {@code <serviceName>@<host>}. Credentials come from the JAAS login
 * context or, with {@code javax.security.auth.useSubjectCredsOnly=false}, from
 * the native ticket cache; nothing is contacted until the first request.
 */
public class KerberosAuthenticator implements RequestAuthenticator {

    private static final Logger log = LoggerFactory.getLogger(KerberosAuthenticator.class);

    private static final String SPNEGO_OID = "1.3.6.1.5.5.2";

    private final String     serviceName;
    private final GSSManager manager;

    public KerberosAuthenticator(String serviceName) {
        this.serviceName = serviceName;
        this.manager     = GSSManager.getInstance();
    }

    public String serviceName() { return serviceName; }

    @Override
    public Optional<String> authorizationHeader(URI target) {
        String principal = serviceName + "@" + target.getHost();
        GSSContext context = null;
        try {
            GSSName server = manager.createName(principal, GSSName.NT_HOSTBASED_SERVICE);
            context = manager.createContext(server, new Oid(SPNEGO_OID), null, GSSContext.DEFAULT_LIFETIME);
            context.requestMutualAuth(false);
            context.requestCredDeleg(false);
            byte[] token = context.initSecContext(new byte[0], 0, 0);
            log.debug("Generated SPNEGO token for {}", principal);
            return Optional.of("Negotiate " + Base64.getEncoder().encodeToString(token));
        } catch (GSSException e) {
            throw new AuthenticationException("Kerberos negotiation for " + principal + " failed: " + e.getMessage(), e);
        } finally {
            if (context != null) {
                try {
                    context.dispose();
                } catch (GSSException e) {
                    log.debug("Failed to dispose GSS context for {}: {}", principal, e.getMessage());
                }
            }
        }
    }

    @Override
    public String toString() {
        return "KerberosAuthenticator[service=" + serviceName + "]";
    }
}
