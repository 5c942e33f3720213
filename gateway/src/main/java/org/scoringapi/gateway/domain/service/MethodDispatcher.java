package org.scoringapi.gateway.domain.service;

import org.scoringapi.gateway.domain.auth.AuthService;
import org.scoringapi.gateway.domain.field.ValidationException;
import org.scoringapi.gateway.domain.model.MethodResponse;
import org.scoringapi.gateway.domain.model.RequestContext;
import org.scoringapi.gateway.domain.model.ResponseCode;
import org.scoringapi.gateway.domain.request.MethodRequest;
import org.scoringapi.gateway.store.Store;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Validates the envelope, authenticates the caller and routes to the method handler.
 *
 * Steps, each of which may end the call:
 * <ol>
 *   <li>envelope validation (422)</li>
 *   <li>method name present (422)</li>
 *   <li>authentication (403, no payload)</li>
 *   <li>routing (422 for an unknown method)</li>
 *   <li>the handler itself</li>
 * </ol>
 * Exceptions other than validation failures propagate to the caller.
 */
public final class MethodDispatcher {

    private static final Logger LOG = Logger.getLogger(MethodDispatcher.class.getName());

    private final AuthService authService;
    private final Map<String, MethodHandler> handlers;

    public MethodDispatcher(AuthService authService, Map<String, MethodHandler> handlers) {
        this.authService = Objects.requireNonNull(authService, "authService must not be null");
        Objects.requireNonNull(handlers, "handlers must not be null");
        this.handlers = Collections.unmodifiableMap(new LinkedHashMap<>(handlers));
    }

    /**
     * Dispatcher serving {@code online_score} and {@code clients_interests}.
     */
    public static MethodDispatcher standard(AuthService authService, ScoringService scoringService,
                                            Store store) {
        Map<String, MethodHandler> handlers = new LinkedHashMap<>();
        handlers.put(ClientsInterestsHandler.METHOD, new ClientsInterestsHandler(scoringService, store));
        handlers.put(OnlineScoreHandler.METHOD, new OnlineScoreHandler(scoringService, store));
        return new MethodDispatcher(authService, handlers);
    }

    public MethodResponse dispatch(Map<String, ?> body, RequestContext context) {
        MethodRequest request = new MethodRequest(body);
        try {
            request.validate();
        } catch (ValidationException e) {
            LOG.info(() -> String.format("Invalid envelope (%s): %s", context.getRequestId(), e.getMessage()));
            return MethodResponse.invalid(e.getMessage());
        }

        String method = request.getMethod();
        if (method == null || method.isEmpty()) {
            return MethodResponse.invalid(ResponseCode.INVALID_REQUEST.name());
        }

        if (!authService.checkAuth(request)) {
            LOG.info(() -> String.format("Authentication failed for login '%s' (%s)",
                    request.getLogin(), context.getRequestId()));
            return MethodResponse.error(ResponseCode.FORBIDDEN);
        }

        MethodHandler handler = handlers.get(method);
        if (handler == null) {
            LOG.info(() -> String.format("Unknown method '%s' (%s)", method, context.getRequestId()));
            return MethodResponse.invalid(ResponseCode.INVALID_REQUEST.name() + ": unknown method " + method);
        }

        return handler.handle(request, context);
    }
}
