package com.numaansystems.oauth.controller;

import com.numaansystems.oauth.filter.OAuthMiddlewareFilter;
import com.numaansystems.oauth.service.AppUser;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

/**
 * Reports the user the middleware attached to the current request.
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@RestController
public class UserController {

    /**
     * @param user the user set by {@link OAuthMiddlewareFilter}, null if the filter did not run
     * @return JSON response with the user's authentication state
     */
    @GetMapping("/user")
    public ResponseEntity<Map<String, Object>> currentUser(
            @RequestAttribute(name = OAuthMiddlewareFilter.USER_ATTRIBUTE, required = false) AppUser user) {
        Map<String, Object> response = new HashMap<>();

        if (user != null && user.hasToken()) {
            response.put("authenticated", true);
            response.put("provider", user.getProviderType());
            response.put("expiresAt", user.getExpiresAt());
        } else {
            response.put("authenticated", false);
        }

        return ResponseEntity.ok(response);
    }
}
