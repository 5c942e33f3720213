package org.scoringapi.gateway.domain.service;

import org.scoringapi.gateway.domain.field.ValidationException;
import org.scoringapi.gateway.domain.model.MethodResponse;
import org.scoringapi.gateway.domain.model.RequestContext;
import org.scoringapi.gateway.domain.request.MethodRequest;
import org.scoringapi.gateway.domain.request.OnlineScoreRequest;
import org.scoringapi.gateway.domain.request.Schema;
import org.scoringapi.gateway.store.Store;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * {@code online_score}: admins get a fixed score, everyone else is scored from their arguments.
 */
public final class OnlineScoreHandler implements MethodHandler {

    private static final Logger LOG = Logger.getLogger(OnlineScoreHandler.class.getName());

    public static final String METHOD = "online_score";
    public static final int ADMIN_SCORE = 42;
    public static final String NOT_ENOUGH_FIELDS = "INVALID_REQUEST: not enough fields";

    private final ScoringService scoringService;
    private final Store store;
    private final Schema schema;

    public OnlineScoreHandler(ScoringService scoringService, Store store) {
        this(scoringService, store, OnlineScoreRequest.SCHEMA);
    }

    public OnlineScoreHandler(ScoringService scoringService, Store store, Schema schema) {
        this.scoringService = Objects.requireNonNull(scoringService, "scoringService must not be null");
        this.store = store;
        this.schema = Objects.requireNonNull(schema, "schema must not be null");
    }

    @Override
    public MethodResponse handle(MethodRequest request, RequestContext context) {
        if (request.isAdmin()) {
            LOG.fine(() -> "Admin score for " + context.getRequestId());
            return score(ADMIN_SCORE);
        }

        OnlineScoreRequest arguments = new OnlineScoreRequest(schema, request.getArguments());
        try {
            arguments.validate();
        } catch (ValidationException e) {
            return MethodResponse.invalid(e.getMessage());
        }
        context.put("has", arguments.getPresentFields());

        if (!arguments.hasEnoughFields()) {
            return MethodResponse.invalid(NOT_ENOUGH_FIELDS);
        }

        double score = scoringService.getScore(store, arguments);
        return score(score);
    }

    private static MethodResponse score(Number score) {
        Map<String, Object> payload = Collections.singletonMap("score", score);
        return MethodResponse.ok(payload);
    }
}
