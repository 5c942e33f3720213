package org.scoringapi.gateway.domain.auth;

import org.scoringapi.gateway.domain.request.MethodRequest;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.HexFormat;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Checks the SHA-512 token of a method request.
 *
 * Regular callers sign {@code account + login + salt}. The admin signs the current
 * hour ({@code yyyyMMddHH}) plus the admin salt, so an admin token is only valid
 * until the top of the hour.
 */
public final class AuthService {

    private static final Logger LOG = Logger.getLogger(AuthService.class.getName());

    public static final String DEFAULT_SALT = "Otus";
    public static final String DEFAULT_ADMIN_SALT = "42";

    static final DateTimeFormatter HOUR_FORMAT = DateTimeFormatter.ofPattern("yyyyMMddHH");

    private final Clock clock;
    private final String salt;
    private final String adminSalt;

    public AuthService() {
        this(Clock.systemDefaultZone(), DEFAULT_SALT, DEFAULT_ADMIN_SALT);
    }

    public AuthService(Clock clock, String salt, String adminSalt) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.salt = Objects.requireNonNull(salt, "salt must not be null");
        this.adminSalt = Objects.requireNonNull(adminSalt, "adminSalt must not be null");
    }

    /**
     * Whether the token matches the expected digest. Never throws.
     */
    public boolean checkAuth(MethodRequest request) {
        String token = request.getToken();
        if (token == null) {
            return false;
        }
        try {
            String expected = request.isAdmin()
                    ? adminDigest()
                    : userDigest(request.getAccount(), request.getLogin());
            return MessageDigest.isEqual(
                    expected.getBytes(StandardCharsets.UTF_8),
                    token.getBytes(StandardCharsets.UTF_8));
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "Token check failed", e);
            return false;
        }
    }

    /**
     * Token the admin must present during the current hour.
     */
    public String adminDigest() {
        return sha512Hex(LocalDateTime.now(clock).format(HOUR_FORMAT) + adminSalt);
    }

    /**
     * Token for a regular caller; null parts count as empty.
     */
    public String userDigest(String account, String login) {
        return sha512Hex(nullToEmpty(account) + nullToEmpty(login) + salt);
    }

    static String sha512Hex(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-512");
            return HexFormat.of().formatHex(digest.digest(input.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-512 not available", e);
        }
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
