package org.scoringapi.gateway.domain.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.scoringapi.gateway.domain.request.OnlineScoreRequest;
import org.scoringapi.gateway.store.InMemoryStore;
import org.scoringapi.gateway.store.Store;

import java.time.Clock;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ScoringServiceImplTest {

    private ScoringServiceImpl scoring;
    private InMemoryStore store;

    @BeforeEach
    void setUp() {
        scoring = new ScoringServiceImpl(new Random(7));
        store = new InMemoryStore(Clock.systemUTC(), 100);
    }

    @Test
    void phoneAndEmail() {
        OnlineScoreRequest request = new OnlineScoreRequest(Map.of("phone", "79175002040", "email", "stupnikov@otus.ru"));

        assertThat(scoring.getScore(store, request)).isEqualTo(3.0);
    }

    @Test
    void allFields() {
        OnlineScoreRequest request = new OnlineScoreRequest(Map.of(
                "phone", 79175002040L,
                "email", "stupnikov@otus.ru",
                "gender", 1,
                "birthday", "01.01.2000",
                "first_name", "a",
                "last_name", "b"));

        assertThat(scoring.getScore(store, request)).isEqualTo(5.0);
    }

    @Test
    void birthdayCountsOnlyWithGender() {
        assertThat(scoring.getScore(null, new OnlineScoreRequest(Map.of("birthday", "01.01.2000", "gender", 0))))
                .isEqualTo(1.5);
        assertThat(scoring.getScore(null, new OnlineScoreRequest(Map.of("birthday", "01.01.2000", "first_name", "a"))))
                .isEqualTo(0.0);
    }

    @Test
    void scoreIsCachedForAnHour() {
        OnlineScoreRequest request = new OnlineScoreRequest(Map.of("first_name", "a", "last_name", "b"));
        String key = ScoringServiceImpl.scoreKey(request);

        assertThat(scoring.getScore(store, request)).isEqualTo(0.5);
        assertThat(store.cacheGet(key)).isEqualTo("0.5");

        store.cacheSet(key, "9.5", ScoringServiceImpl.SCORE_TTL_SECONDS);
        assertThat(scoring.getScore(store, request)).isEqualTo(9.5);
    }

    @Test
    void keyDependsOnIdentityFields() {
        String a = ScoringServiceImpl.scoreKey(new OnlineScoreRequest(Map.of("phone", "79175002040", "email", "a@b.c")));
        String b = ScoringServiceImpl.scoreKey(new OnlineScoreRequest(Map.of("phone", 79175002040L, "email", "x@y.z")));
        String c = ScoringServiceImpl.scoreKey(new OnlineScoreRequest(Map.of("phone", "79175002041")));

        assertThat(a).startsWith("uid:").isEqualTo(b).isNotEqualTo(c);
    }

    @Test
    void brokenStoreDoesNotFailScoring() {
        Store broken = mock(Store.class);
        when(broken.cacheGet(anyString())).thenThrow(new IllegalStateException("down"));
        doThrow(new IllegalStateException("down"))
                .when(broken).cacheSet(anyString(), anyString(), anyLong());

        OnlineScoreRequest request = new OnlineScoreRequest(Map.of("phone", "79175002040", "email", "a@b.c"));

        assertThat(scoring.getScore(broken, request)).isEqualTo(3.0);
        verify(broken).cacheSet(any(), eq("3.0"), eq(ScoringServiceImpl.SCORE_TTL_SECONDS));
    }

    @Test
    void interestsFromStore() {
        store.set("i:5", "[\"books\",\"tv\"]");

        assertThat(scoring.getInterests(store, 5)).containsExactly("books", "tv");
    }

    @Test
    void interestsSampledWhenStoreHasNone() {
        assertThat(scoring.getInterests(store, 6))
                .hasSize(ScoringServiceImpl.SAMPLED_INTERESTS)
                .doesNotHaveDuplicates()
                .allMatch(ScoringServiceImpl.INTERESTS::contains);
        assertThat(scoring.getInterests(null, 6)).hasSize(ScoringServiceImpl.SAMPLED_INTERESTS);
    }

    @Test
    void malformedStoredInterestsFallBackToSample() {
        store.set("i:7", "not json");

        assertThat(scoring.getInterests(store, 7)).allMatch(ScoringServiceImpl.INTERESTS::contains);
    }

    @Test
    void storedJsonNullFallsBackToSample() {
        store.set("i:1", "null");

        assertThat(scoring.getInterests(store, 1))
                .isNotNull()
                .hasSize(2)
                .allMatch(ScoringServiceImpl.INTERESTS::contains);
    }
}
