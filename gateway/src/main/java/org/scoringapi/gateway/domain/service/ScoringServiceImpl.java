package org.scoringapi.gateway.domain.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.scoringapi.gateway.domain.request.OnlineScoreRequest;
import org.scoringapi.gateway.store.Store;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Implementation of ScoringService using a fixed weight per informative field pair.
 *
 * Score formula:
 *   1.5 for a phone
 * + 1.5 for an email
 * + 1.5 for birthday and gender together
 * + 0.5 for first and last name together
 *
 * Scores are cached in the store for an hour under a key derived from the
 * identity fields. Store failures never fail the call.
 */
public final class ScoringServiceImpl implements ScoringService {

    private static final Logger LOG = Logger.getLogger(ScoringServiceImpl.class.getName());
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };

    public static final List<String> INTERESTS = Collections.unmodifiableList(Arrays.asList(
            "cars", "pets", "travel", "hi-tech", "sport", "music", "books", "tv", "cinema", "geek", "otus"));

    static final long SCORE_TTL_SECONDS = 60L * 60L;
    static final int SAMPLED_INTERESTS = 2;

    private static final double PHONE_WEIGHT = 1.5;
    private static final double EMAIL_WEIGHT = 1.5;
    private static final double BIRTHDAY_GENDER_WEIGHT = 1.5;
    private static final double NAME_WEIGHT = 0.5;

    private static final DateTimeFormatter KEY_DATE_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd");

    private final Random random;

    public ScoringServiceImpl() {
        this(new Random());
    }

    public ScoringServiceImpl(Random random) {
        this.random = Objects.requireNonNull(random, "random must not be null");
    }

    @Override
    public double getScore(Store store, OnlineScoreRequest request) {
        String key = scoreKey(request);

        Double cached = readCachedScore(store, key);
        if (cached != null) {
            LOG.fine(() -> "Score cache hit for " + key);
            return cached;
        }

        double score = 0.0;
        if (request.isPresent(OnlineScoreRequest.PHONE)) {
            score += PHONE_WEIGHT;
        }
        if (request.isPresent(OnlineScoreRequest.EMAIL)) {
            score += EMAIL_WEIGHT;
        }
        if (request.isPresent(OnlineScoreRequest.BIRTHDAY) && request.getGender() != null) {
            score += BIRTHDAY_GENDER_WEIGHT;
        }
        if (request.isPresent(OnlineScoreRequest.FIRST_NAME) && request.isPresent(OnlineScoreRequest.LAST_NAME)) {
            score += NAME_WEIGHT;
        }

        final double finalScore = score;
        LOG.fine(() -> String.format("Scored %s: %.1f", key, finalScore));
        writeCachedScore(store, key, score);
        return score;
    }

    @Override
    public List<String> getInterests(Store store, long clientId) {
        String stored = null;
        if (store != null) {
            try {
                stored = store.get("i:" + clientId);
            } catch (RuntimeException e) {
                LOG.log(Level.WARNING, e, () -> "Store read failed for client " + clientId);
            }
        }
        if (stored != null) {
            try {
                List<String> interests = MAPPER.readValue(stored, STRING_LIST);
                if (interests != null) {
                    return interests;
                }
                LOG.warning(() -> "Null interests stored for client " + clientId);
            } catch (JsonProcessingException e) {
                LOG.log(Level.WARNING, e, () -> "Malformed interests for client " + clientId);
            }
        }
        return sampleInterests();
    }

    /**
     * Cache key: md5 of first name, last name, phone and birthday (yyyyMMdd), missing parts empty.
     */
    static String scoreKey(OnlineScoreRequest request) {
        LocalDate birthday = request.getBirthday();
        String parts = nullToEmpty(request.getFirstName())
                + nullToEmpty(request.getLastName())
                + nullToEmpty(request.getPhone())
                + (birthday != null ? birthday.format(KEY_DATE_FORMAT) : "");
        return "uid:" + md5Hex(parts);
    }

    private Double readCachedScore(Store store, String key) {
        if (store == null) {
            return null;
        }
        try {
            String value = store.cacheGet(key);
            return value == null ? null : Double.valueOf(value);
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, e, () -> "Score cache read failed for " + key);
            return null;
        }
    }

    private void writeCachedScore(Store store, String key, double score) {
        if (store == null) {
            return;
        }
        try {
            store.cacheSet(key, String.valueOf(score), SCORE_TTL_SECONDS);
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, e, () -> "Score cache write failed for " + key);
        }
    }

    private List<String> sampleInterests() {
        List<String> pool = new ArrayList<>(INTERESTS);
        Collections.shuffle(pool, random);
        return new ArrayList<>(pool.subList(0, SAMPLED_INTERESTS));
    }

    private static String md5Hex(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("MD5");
            return HexFormat.of().formatHex(digest.digest(input.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
