package com.qqsuccubus.chat.socket.auth;

import com.qqsuccubus.chat.socket.error.AuthenticationException;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Date;

/**
 * HS256 access tokens shared with the service that signs users in.
 * <p>
 * The user id travels in the {@code userId} claim; {@code sub} is accepted as a fallback.
 * </p>
 */
public class TokenService {

    static final String USER_ID_CLAIM = "userId";

    private final SecretKey key;
    private final long clockSkewSec;
    private final Clock clock;

    /**
     * @throws io.jsonwebtoken.security.WeakKeyException if the secret is shorter than 256 bits
     */
    public TokenService(String secret, long clockSkewSec, Clock clock) {
        this.key = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.clockSkewSec = clockSkewSec;
        this.clock = clock;
    }

    /**
     * Verifies signature and expiry.
     *
     * @return the user id carried by the token
     * @throws AuthenticationException if the token is missing, malformed, forged or expired
     */
    public String verify(String token) {
        if (token == null || token.isBlank()) {
            throw new AuthenticationException("Missing access token");
        }
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(key)
                    .clockSkewSeconds(clockSkewSec)
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();

            String userId = claims.get(USER_ID_CLAIM, String.class);
            if (userId == null || userId.isBlank()) {
                userId = claims.getSubject();
            }
            if (userId == null || userId.isBlank()) {
                throw new AuthenticationException("Access token carries no user id");
            }
            return userId;
        } catch (ExpiredJwtException e) {
            throw new AuthenticationException("Access token expired", e);
        } catch (JwtException | IllegalArgumentException e) {
            throw new AuthenticationException("Invalid access token", e);
        }
    }
}
