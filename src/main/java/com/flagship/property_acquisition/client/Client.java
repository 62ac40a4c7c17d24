package com.flagship.property_acquisition.client;

import lombok.Builder;
import lombok.Value;

import java.util.UUID;

/**
 * A registered buyer.
 *
 * {@code id} is the canonical client identity used by every other table;
 * {@code authUserId} is the identity issued by the upstream authentication gateway
 * and is only used to resolve the caller at the REST boundary.
 */
@Value
@Builder
public class Client {
    UUID id;
    String authUserId;
    String fullName;
    String email;
    String phone;

    /**
     * Whether a typed signature matches the registered full name.
     * Surrounding whitespace and letter case are ignored.
     */
    public boolean signatureMatches(String signature) {
        if (signature == null || fullName == null) {
            return false;
        }
        return signature.trim().equalsIgnoreCase(fullName.trim());
    }
}
