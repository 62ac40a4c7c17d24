package com.flagship.property_acquisition.interest;

import com.flagship.property_acquisition.interest.dto.DepositResponse;
import com.flagship.property_acquisition.interest.dto.VerifyDepositRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * Administrative confirmation of deposits the gateway reported as pending.
 */
@RestController
@RequestMapping("/api/properties/{propertyId}/deposits")
@RequiredArgsConstructor
@Slf4j
public class DepositVerificationController {

    private final InterestStateMachine stateMachine;

    @PostMapping("/{reference}/verification")
    public ResponseEntity<DepositResponse> verify(
            @PathVariable("propertyId") UUID propertyId,
            @PathVariable("reference") String reference,
            @Valid @RequestBody VerifyDepositRequest request) {
        log.info("Deposit verification requested: reference={}, verifiedBy={}", reference, request.getVerifiedBy());
        return ResponseEntity.ok(DepositResponse.from(
                stateMachine.confirmDeposit(propertyId, reference, request.getVerifiedBy())));
    }
}
