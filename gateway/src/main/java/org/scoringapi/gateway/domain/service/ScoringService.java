package org.scoringapi.gateway.domain.service;

import org.scoringapi.gateway.domain.request.OnlineScoreRequest;
import org.scoringapi.gateway.store.Store;

import java.util.List;

/**
 * Business functions behind the {@code online_score} and {@code clients_interests} methods.
 */
public interface ScoringService {

    /**
     * Calculate the score for a validated request.
     * Same fields and same store state give the same score.
     *
     * @param store backing store, may be used as a cache
     * @param request validated online score arguments
     * @return the score, higher means more information supplied
     */
    double getScore(Store store, OnlineScoreRequest request);

    /**
     * Look up the interests of one client.
     *
     * @param store backing store
     * @param clientId client id
     * @return interest names, never null
     */
    List<String> getInterests(Store store, long clientId);
}
