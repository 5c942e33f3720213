package org.scoringapi.gateway.domain.service;

import org.scoringapi.gateway.domain.field.ValidationException;
import org.scoringapi.gateway.domain.model.MethodResponse;
import org.scoringapi.gateway.domain.model.RequestContext;
import org.scoringapi.gateway.domain.request.ClientsInterestsRequest;
import org.scoringapi.gateway.domain.request.MethodRequest;
import org.scoringapi.gateway.store.Store;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@code clients_interests}: interests of every requested client, keyed {@code client_id<N>}.
 */
public final class ClientsInterestsHandler implements MethodHandler {

    public static final String METHOD = "clients_interests";
    static final String KEY_PREFIX = "client_id";

    private final ScoringService scoringService;
    private final Store store;

    public ClientsInterestsHandler(ScoringService scoringService, Store store) {
        this.scoringService = Objects.requireNonNull(scoringService, "scoringService must not be null");
        this.store = store;
    }

    @Override
    public MethodResponse handle(MethodRequest request, RequestContext context) {
        ClientsInterestsRequest arguments = new ClientsInterestsRequest(request.getArguments());
        try {
            arguments.validate();
        } catch (ValidationException e) {
            return MethodResponse.invalid(e.getMessage());
        }

        List<Long> clientIds = arguments.getClientIds();
        context.put("nclients", clientIds.size());

        Map<String, List<String>> interests = new LinkedHashMap<>();
        for (Long clientId : clientIds) {
            interests.put(KEY_PREFIX + clientId, scoringService.getInterests(store, clientId));
        }
        return MethodResponse.ok(interests);
    }
}
