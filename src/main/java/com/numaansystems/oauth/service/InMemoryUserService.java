package com.numaansystems.oauth.service;

import com.numaansystems.oauth.provider.OAuthProviderClient;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.oauth2.core.OAuth2AccessToken;

import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Default {@link UserService} keeping users in memory, keyed by token.
 *
 * <h2>Token Lifecycle</h2>
 * <ol>
 *   <li>User created after a successful provider login, with a random UUID token</li>
 *   <li>Token delivered to the client via header, cookie or URL parameter</li>
 *   <li>Client presents it as {@code Authorization: token <value>} on later requests</li>
 *   <li>Token auto-expires after the configured TTL</li>
 * </ol>
 *
 * <p>The provider's access token is not handed to the client. State is lost on
 * restart and not shared between instances.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
public class InMemoryUserService implements UserService {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryUserService.class);

    private final long ttlMinutes;

    private final ConcurrentHashMap<String, AppUser> users = new ConcurrentHashMap<>();
    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();

    public InMemoryUserService(long ttlMinutes) {
        this.ttlMinutes = ttlMinutes;
    }

    @Override
    public AppUser findOrNew(String credential) {
        if (credential == null || credential.isEmpty()) {
            return AppUser.anonymous();
        }

        AppUser user = users.get(credential);
        if (user == null) {
            logger.debug("No user found for presented token");
            return AppUser.anonymous();
        }

        if (user.isExpired(System.currentTimeMillis())) {
            users.remove(credential);
            logger.info("Rejected expired token for {} user", user.getProviderType());
            return AppUser.anonymous();
        }

        return user;
    }

    @Override
    public AppUser createUser(OAuthProviderClient client, OAuth2AccessToken accessToken) {
        String token = UUID.randomUUID().toString();
        long expiresAt = System.currentTimeMillis() + (ttlMinutes * 60 * 1000);

        AppUser user = new AppUser(token, client.getProviderType(), expiresAt);
        users.put(token, user);

        // Schedule automatic user removal after TTL
        scheduler.schedule(() -> {
            AppUser removed = users.remove(token);
            if (removed != null) {
                logger.info("Expired token removed for {} user", removed.getProviderType());
            }
        }, ttlMinutes, TimeUnit.MINUTES);

        logger.info("Created {} user with provider scopes {}, expires in {} minutes",
                client.getProviderType(), accessToken.getScopes(), ttlMinutes);

        return user;
    }

    /**
     * Returns the count of users whose token has not yet been removed.
     *
     * @return the number of active users in storage
     */
    public int getActiveUserCount() {
        return users.size();
    }

    @PreDestroy
    public void shutdown() {
        scheduler.shutdownNow();
    }
}
