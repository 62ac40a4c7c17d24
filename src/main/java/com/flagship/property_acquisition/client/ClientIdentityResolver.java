package com.flagship.property_acquisition.client;

import com.flagship.property_acquisition.exception.NotFoundException;
import com.flagship.property_acquisition.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Maps the identity supplied by the authentication gateway to the canonical client id.
 *
 * Called exactly once per request at the REST boundary. Everything below the
 * controllers works with {@code clients.id} only.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ClientIdentityResolver {

    private final ClientStore clientStore;

    public UUID resolveClientId(String authUserId) {
        if (authUserId == null || authUserId.isBlank()) {
            throw new ValidationException("authUserId", "Authenticated user id is required");
        }
        return clientStore.findByAuthUserId(authUserId.trim())
                .map(Client::getId)
                .orElseThrow(() -> {
                    log.warn("No client registered for auth user {}", authUserId);
                    return new NotFoundException("No client profile for the authenticated user");
                });
    }
}
