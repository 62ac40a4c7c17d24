package com.flagship.property_acquisition.interest;

import com.flagship.property_acquisition.client.ClientIdentityResolver;
import com.flagship.property_acquisition.interest.dto.CancelInterestRequest;
import com.flagship.property_acquisition.interest.dto.DepositResponse;
import com.flagship.property_acquisition.interest.dto.InterestResponse;
import com.flagship.property_acquisition.interest.dto.PayDepositRequest;
import com.flagship.property_acquisition.interest.dto.SignAgreementRequest;
import com.flagship.property_acquisition.payment.SettlementStatus;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * Client-facing endpoints of the acquisition journey.
 *
 * The caller is identified by the {@code X-Auth-User-Id} header set by the gateway in
 * front of this service; it is resolved to the canonical client id once per request and
 * only that id is passed on.
 */
@RestController
@RequestMapping("/api/clients/me/properties/{propertyId}")
@RequiredArgsConstructor
@Slf4j
public class InterestController {

    public static final String AUTH_USER_HEADER = "X-Auth-User-Id";

    private final InterestStateMachine stateMachine;
    private final ClientIdentityResolver identityResolver;

    @GetMapping("/interest")
    public ResponseEntity<InterestResponse> getInterest(
            @PathVariable("propertyId") UUID propertyId,
            @RequestHeader(AUTH_USER_HEADER) String authUserId) {
        UUID clientId = identityResolver.resolveClientId(authUserId);
        return ResponseEntity.ok(InterestResponse.from(stateMachine.getInterest(clientId, propertyId)));
    }

    @PostMapping("/interest")
    public ResponseEntity<InterestResponse> expressInterest(
            @PathVariable("propertyId") UUID propertyId,
            @RequestHeader(AUTH_USER_HEADER) String authUserId) {
        UUID clientId = identityResolver.resolveClientId(authUserId);
        ClientPropertyInterest interest = stateMachine.expressInterest(clientId, propertyId);
        return ResponseEntity.status(HttpStatus.CREATED).body(InterestResponse.from(interest));
    }

    @PostMapping("/reservation")
    public ResponseEntity<InterestResponse> reserve(
            @PathVariable("propertyId") UUID propertyId,
            @RequestHeader(AUTH_USER_HEADER) String authUserId) {
        UUID clientId = identityResolver.resolveClientId(authUserId);
        return ResponseEntity.ok(InterestResponse.from(stateMachine.reserveProperty(clientId, propertyId)));
    }

    @DeleteMapping("/interest")
    public ResponseEntity<InterestResponse> cancel(
            @PathVariable("propertyId") UUID propertyId,
            @RequestHeader(AUTH_USER_HEADER) String authUserId,
            @Valid @RequestBody(required = false) CancelInterestRequest request) {
        UUID clientId = identityResolver.resolveClientId(authUserId);
        String reason = request != null ? request.getReason() : null;
        return ResponseEntity.ok(InterestResponse.from(stateMachine.cancelInterest(clientId, propertyId, reason)));
    }

    @PostMapping("/commitment")
    public ResponseEntity<InterestResponse> commit(
            @PathVariable("propertyId") UUID propertyId,
            @RequestHeader(AUTH_USER_HEADER) String authUserId) {
        UUID clientId = identityResolver.resolveClientId(authUserId);
        return ResponseEntity.ok(InterestResponse.from(stateMachine.commitProperty(clientId, propertyId)));
    }

    @PostMapping("/agreement")
    public ResponseEntity<InterestResponse> signAgreement(
            @PathVariable("propertyId") UUID propertyId,
            @RequestHeader(AUTH_USER_HEADER) String authUserId,
            @Valid @RequestBody SignAgreementRequest request) {
        UUID clientId = identityResolver.resolveClientId(authUserId);
        return ResponseEntity.ok(InterestResponse.from(
                stateMachine.signAgreement(clientId, propertyId, request.getSignature())));
    }

    /**
     * Pays the deposit. 201 when a settled payment converted the interest, 202 when the
     * payment awaits verification, 200 when the reference was already used.
     */
    @PostMapping("/deposit")
    public ResponseEntity<DepositResponse> payDeposit(
            @PathVariable("propertyId") UUID propertyId,
            @RequestHeader(AUTH_USER_HEADER) String authUserId,
            @Valid @RequestBody PayDepositRequest request) {
        UUID clientId = identityResolver.resolveClientId(authUserId);
        log.info("Deposit request: amount={}, method={}", request.getAmount(), request.getPaymentMethod());

        DepositResult result = stateMachine.payDeposit(clientId, propertyId, request.toCommand());
        HttpStatus status = result.isDuplicate() ? HttpStatus.OK
                : result.getSettlementStatus() == SettlementStatus.PENDING_VERIFICATION ? HttpStatus.ACCEPTED
                : HttpStatus.CREATED;
        return ResponseEntity.status(status).body(DepositResponse.from(result));
    }
}
