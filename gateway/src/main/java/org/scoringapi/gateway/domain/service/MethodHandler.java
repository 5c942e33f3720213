package org.scoringapi.gateway.domain.service;

import org.scoringapi.gateway.domain.model.MethodResponse;
import org.scoringapi.gateway.domain.model.RequestContext;
import org.scoringapi.gateway.domain.request.MethodRequest;

/**
 * Handler for one method name, called after the envelope is validated and authenticated.
 */
public interface MethodHandler {

    /**
     * @param request validated, authenticated envelope
     * @param context per-call context
     * @return response to send back
     */
    MethodResponse handle(MethodRequest request, RequestContext context);
}
