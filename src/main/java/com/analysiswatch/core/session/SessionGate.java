package com.analysiswatch.core.session;

import com.analysiswatch.backend.ApiResponse;
import com.analysiswatch.backend.BackendApiClient;
import com.analysiswatch.backend.BackendApiException;
import com.analysiswatch.core.model.SessionStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks whether the configured session is authenticated before the engine starts.
 * <p>
 * Fails closed: only a 2xx response from the identity probe authorizes. A network failure
 * yields {@link SessionStatus#UNKNOWN}, which is logged and also treated as not authorized.
 * No retries.
 */
public class SessionGate {

    private static final Logger log = LoggerFactory.getLogger(SessionGate.class);

    private final BackendApiClient client;
    private final String identityPath;

    public SessionGate(BackendApiClient client, String identityPath) {
        this.client = client;
        this.identityPath = identityPath;
    }

    public SessionStatus check() {
        ApiResponse response;
        try {
            response = client.get(identityPath);
        } catch (BackendApiException e) {
            log.warn("Identity probe failed, not starting this cycle: {}", e.getMessage());
            return SessionStatus.UNKNOWN;
        }

        if (response.isSuccess()) {
            return SessionStatus.AUTHORIZED;
        }
        if (response.isAuthFailure()) {
            log.debug("Identity probe returned HTTP {}; session not authenticated", response.statusCode());
        } else {
            log.warn("Identity probe returned unexpected HTTP {}; treating session as not authenticated",
                    response.statusCode());
        }
        return SessionStatus.UNAUTHORIZED;
    }

    public boolean isAuthorized() {
        return check() == SessionStatus.AUTHORIZED;
    }
}
