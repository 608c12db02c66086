package org.rewardledger.security;

import io.jsonwebtoken.*;
import io.jsonwebtoken.security.Keys;
import jakarta.annotation.PostConstruct;
import org.rewardledger.service.Identities;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.security.Key;
import java.util.Base64;
import java.util.Date;

/**
 * Utilitaire JWT. Le sujet du jeton est l'adresse de l'appelant (normalisée en minuscules).
 * Le secret doit être fourni via la propriété "jwt.secret" (clé encodée en BASE64, 32 octets min).
 */
@Component
public class JwtUtil {
    static final String ISSUER = "reward-ledger";

    private Key key;

    @Value("${jwt.secret:}")
    private String jwtSecretBase64;

    @Value("${jwt.expiration-ms:86400000}")
    private long jwtExpirationMs;

    @PostConstruct
    public void init() {
        if (jwtSecretBase64 == null || jwtSecretBase64.isBlank()) {
            throw new IllegalStateException("jwt.secret must be set (base64).");
        }
        byte[] keyBytes = Base64.getDecoder().decode(jwtSecretBase64);
        this.key = Keys.hmacShaKeyFor(keyBytes);
    }

    public String generateToken(String address) {
        String subject = Identities.normalize(address);
        if (subject == null) {
            throw new IllegalArgumentException("Adresse manquante");
        }
        Date now = new Date();
        return Jwts.builder()
                .setSubject(subject)
                .setIssuer(ISSUER)
                .setIssuedAt(now)
                .setExpiration(new Date(now.getTime() + jwtExpirationMs))
                .signWith(key, SignatureAlgorithm.HS256)
                .compact();
    }

    public String extractAddress(String token) {
        return Identities.normalize(parse(token).getSubject());
    }

    public boolean validateToken(String token) {
        try {
            return ISSUER.equals(parse(token).getIssuer());
        } catch (JwtException | IllegalArgumentException e) {
            return false;
        }
    }

    private Claims parse(String token) {
        return Jwts.parserBuilder().setSigningKey(key).build()
                .parseClaimsJws(token).getBody();
    }
}
