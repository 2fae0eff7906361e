package com.numaansystems.oauth;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * OAuth Middleware Application
 *
 * <p>Adds third-party (OAuth2) login to a servlet application through a single
 * filter that intercepts the provider routes and attaches a user to every
 * other request.</p>
 *
 * <h2>Flow</h2>
 * <ol>
 *   <li>Client sends the user to {@code /auth/{provider}?return=<url>}</li>
 *   <li>Middleware stores the return URL and redirects to the provider</li>
 *   <li>Provider redirects back to {@code /auth/{provider}/callback?code=...}</li>
 *   <li>Middleware exchanges the code, creates the user and issues a token</li>
 *   <li>Client is pointed back to the return URL with the token</li>
 *   <li>Later requests carry {@code Authorization: token <value>}</li>
 * </ol>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@SpringBootApplication
public class OAuthMiddlewareApplication {

    /**
     * Main entry point for the OAuth middleware application.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        SpringApplication.run(OAuthMiddlewareApplication.class, args);
    }
}
