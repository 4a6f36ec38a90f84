package com.webfront.core.server;

import javax.net.ssl.SNIHostName;
import javax.net.ssl.SNIMatcher;
import javax.net.ssl.SNIServerName;
import javax.net.ssl.StandardConstants;

import com.webfront.core.routing.Authorization;
import com.webfront.core.routing.HostAuthorizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Accepts a TLS server name only if the current rule table covers it. Clients
 * that send no server name are not affected.
 */
public class AuthorizedHostSniMatcher extends SNIMatcher {

    private static final Logger log = LoggerFactory.getLogger(AuthorizedHostSniMatcher.class);

    private final HostAuthorizer authorizer;

    /**
     * @param authorizer Policy consulted for every handshake.
     */
    public AuthorizedHostSniMatcher(HostAuthorizer authorizer) {
        super(StandardConstants.SNI_HOST_NAME);
        this.authorizer = authorizer;
    }

    @Override
    public boolean matches(SNIServerName serverName) {
        if (!(serverName instanceof SNIHostName hostName)) {
            return false;
        }
        Authorization result = authorizer.authorize(hostName.getAsciiName());
        if (!result.allowed()) {
            log.debug("Rejecting TLS handshake: {}", result.reason());
        }
        return result.allowed();
    }
}
