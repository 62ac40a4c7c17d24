package com.flagship.property_acquisition.interest;

import com.flagship.property_acquisition.client.Client;
import com.flagship.property_acquisition.client.ClientStore;
import com.flagship.property_acquisition.exception.ConflictException;
import com.flagship.property_acquisition.exception.InvalidStateException;
import com.flagship.property_acquisition.exception.NotFoundException;
import com.flagship.property_acquisition.exception.UnavailableException;
import com.flagship.property_acquisition.exception.ValidationException;
import com.flagship.property_acquisition.handover.HandoverResult;
import com.flagship.property_acquisition.handover.HandoverTransitionOrchestrator;
import com.flagship.property_acquisition.handover.TriggerEvent;
import com.flagship.property_acquisition.notification.AcquisitionEvent;
import com.flagship.property_acquisition.notification.AcquisitionEventType;
import com.flagship.property_acquisition.notification.NotificationSink;
import com.flagship.property_acquisition.observability.AcquisitionMetrics;
import com.flagship.property_acquisition.observability.CorrelationContext;
import com.flagship.property_acquisition.payment.DepositPolicy;
import com.flagship.property_acquisition.payment.DepositReferenceRegistry;
import com.flagship.property_acquisition.payment.InstallmentStatus;
import com.flagship.property_acquisition.payment.InstallmentStore;
import com.flagship.property_acquisition.payment.PaymentGateway;
import com.flagship.property_acquisition.payment.PaymentInstallment;
import com.flagship.property_acquisition.payment.SettlementStatus;
import com.flagship.property_acquisition.property.Property;
import com.flagship.property_acquisition.property.PropertyLockManager;
import com.flagship.property_acquisition.property.PropertyStore;
import com.flagship.property_acquisition.saga.Saga;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Optional;
import java.util.UUID;

/**
 * Lifecycle of a client's interest in a property, from first interest to the
 * hand-off into the handover pipeline.
 *
 * Key principles:
 * - Every write is a single conditional statement; there is no surrounding transaction
 * - Multi-row transitions run as a {@link Saga}: property first, then interest, then
 *   the payment ledger, each followed by its compensation on later failure
 * - Primary-path failures abort and compensate; secondary effects (deactivating
 *   competing interests, notifications, the handover hand-off) are logged and dropped
 * - Nothing is cached between calls; every decision starts from a fresh read
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InterestStateMachine {

    static final String COMMITTED_ELSEWHERE_NOTE = "Property committed to another client";
    static final String GATEWAY_VERIFIER = "payment-gateway";

    private final InterestStore interestStore;
    private final PropertyStore propertyStore;
    private final ClientStore clientStore;
    private final PropertyLockManager lockManager;
    private final InstallmentStore installmentStore;
    private final DepositReferenceRegistry referenceRegistry;
    private final DepositPolicy depositPolicy;
    private final PaymentGateway paymentGateway;
    private final HandoverTransitionOrchestrator handoverOrchestrator;
    private final NotificationSink notificationSink;
    private final AcquisitionMetrics metrics;

    // ==================== Interest ====================

    /**
     * (none) or INACTIVE to ACTIVE.
     *
     * @throws UnavailableException if the property is completed, subdivided or committed to another client
     * @throws ConflictException if the client already has a live interest in the property
     */
    public ClientPropertyInterest expressInterest(UUID clientId, UUID propertyId) {
        try (var scope = CorrelationContext.bind(propertyId, clientId)) {
            Property property = loadProperty(propertyId);
            loadClient(clientId);

            if (property.isCompleted() || property.isSubdivided()) {
                throw new UnavailableException("Property is no longer available");
            }
            if (property.isCommittedToOther(clientId)) {
                throw new UnavailableException("Property is committed to another client");
            }

            Optional<ClientPropertyInterest> existing = interestStore.findByClientAndProperty(clientId, propertyId);
            UUID interestId;
            if (existing.isPresent()) {
                ClientPropertyInterest interest = existing.get();
                if (interest.getStatus() != InterestStatus.INACTIVE) {
                    throw new ConflictException("You have already expressed interest in this property");
                }
                if (interestStore.reactivate(interest.getId()) == 0) {
                    metrics.recordConflict("reactivate-interest");
                    throw new ConflictException("Interest was changed concurrently, please retry");
                }
                interestId = interest.getId();
                log.info("Reactivated interest {}", interestId);
            } else {
                ClientPropertyInterest interest = ClientPropertyInterest.newActive(clientId, propertyId);
                try {
                    interestStore.insert(interest);
                } catch (DuplicateKeyException e) {
                    metrics.recordConflict("express-interest");
                    throw new ConflictException("You have already expressed interest in this property", e);
                }
                interestId = interest.getId();
                log.info("Created interest {}", interestId);
            }

            metrics.recordTransition(InterestStatus.ACTIVE.name());
            notifyEvent(AcquisitionEventType.INTEREST_EXPRESSED, propertyId, clientId,
                    "Client expressed interest in " + property.getName());
            return loadInterest(interestId);
        }
    }

    /**
     * ACTIVE to RESERVED. Places the property reservation first and releases it again
     * if the interest cannot be moved.
     */
    public ClientPropertyInterest reserveProperty(UUID clientId, UUID propertyId) {
        try (var scope = CorrelationContext.bind(propertyId, clientId)) {
            ClientPropertyInterest interest = requireInterest(clientId, propertyId);
            if (interest.getStatus() == InterestStatus.RESERVED) {
                return interest;
            }
            if (interest.getStatus() != InterestStatus.ACTIVE) {
                throw new InvalidStateException("Only an active interest can reserve, current status " + interest.getStatus());
            }

            Saga saga = new Saga("reserve-property", metrics);
            saga.execute("reserve-property",
                    () -> lockManager.reserve(propertyId, clientId),
                    placed -> {
                        if (placed) {
                            lockManager.releaseReservation(propertyId, clientId);
                        }
                    });
            saga.run("mark-interest-reserved",
                    () -> requireUpdated(interestStore.transition(interest.getId(),
                            EnumSet.of(InterestStatus.ACTIVE), InterestStatus.RESERVED, null), "reserve-interest"),
                    null);

            metrics.recordTransition(InterestStatus.RESERVED.name());
            notifyEvent(AcquisitionEventType.PROPERTY_RESERVED, propertyId, clientId, "Property reserved");
            return loadInterest(interest.getId());
        }
    }

    /**
     * ACTIVE or RESERVED to INACTIVE. Cancelling an inactive interest is a no-op.
     *
     * @throws InvalidStateException if the client holds the commitment or the interest is already binding
     */
    public ClientPropertyInterest cancelInterest(UUID clientId, UUID propertyId, String reason) {
        try (var scope = CorrelationContext.bind(propertyId, clientId)) {
            Property property = loadProperty(propertyId);
            if (property.isCommittedTo(clientId)) {
                throw new InvalidStateException("A committed purchase cannot be cancelled");
            }

            ClientPropertyInterest interest = requireInterest(clientId, propertyId);
            if (interest.getStatus() == InterestStatus.INACTIVE) {
                return interest;
            }
            if (!interest.getStatus().isCancellable()) {
                throw new InvalidStateException("Interest in status " + interest.getStatus() + " cannot be cancelled");
            }

            Saga saga = new Saga("cancel-interest", metrics);
            saga.execute("release-reservation",
                    () -> lockManager.releaseReservation(propertyId, clientId),
                    released -> {
                        if (released) {
                            lockManager.restoreReservation(propertyId, clientId);
                        }
                    });
            saga.run("deactivate-interest",
                    () -> requireUpdated(interestStore.transition(interest.getId(), InterestStatus.CANCELLABLE,
                            InterestStatus.INACTIVE, reason != null && !reason.isBlank() ? reason.trim() : null),
                            "cancel-interest"),
                    null);

            metrics.recordTransition(InterestStatus.INACTIVE.name());
            notifyEvent(AcquisitionEventType.INTEREST_CANCELLED, propertyId, clientId, "Interest cancelled");
            return loadInterest(interest.getId());
        }
    }

    // ==================== Commitment ====================

    /**
     * ACTIVE or RESERVED to COMMITTED.
     *
     * The property lock is taken first; if it is lost the interest is untouched and the
     * call fails with {@link ConflictException}. A client whose interest was deactivated
     * because another client committed gets the same conflict. If the interest write fails afterwards
     * the lock is released again. Every other live interest on the property is then
     * deactivated on a best-effort basis.
     */
    public ClientPropertyInterest commitProperty(UUID clientId, UUID propertyId) {
        try (var scope = CorrelationContext.bind(propertyId, clientId)) {
            ClientPropertyInterest interest = requireInterest(clientId, propertyId);
            if (interest.getStatus().isBinding()) {
                log.debug("Interest {} already {}, commit is a no-op", interest.getId(), interest.getStatus());
                return interest;
            }
            if (interest.getStatus() == InterestStatus.INACTIVE) {
                if (loadProperty(propertyId).isCommittedToOther(clientId)) {
                    metrics.recordConflict("commit");
                    throw new ConflictException("This property was just taken by another client");
                }
                throw new InvalidStateException("Express interest again before committing");
            }

            Saga saga = new Saga("commit-property", metrics);
            saga.execute("lock-property",
                    () -> lockManager.commit(propertyId, clientId),
                    taken -> {
                        if (taken) {
                            lockManager.release(propertyId, clientId);
                        }
                    });
            saga.run("mark-interest-committed",
                    () -> {
                        try {
                            requireUpdated(interestStore.transition(interest.getId(), InterestStatus.CANCELLABLE,
                                    InterestStatus.COMMITTED, null), "commit-interest");
                        } catch (DuplicateKeyException e) {
                            metrics.recordConflict("commit-interest");
                            throw new ConflictException("This property was just taken by another client", e);
                        }
                    },
                    null);

            deactivateCompetingInterests(propertyId, clientId);

            metrics.recordTransition(InterestStatus.COMMITTED.name());
            notifyEvent(AcquisitionEventType.PROPERTY_COMMITTED, propertyId, clientId, "Client committed to property");
            return loadInterest(interest.getId());
        }
    }

    /**
     * Records the client's typed signature on a committed interest. The signature has
     * to match the registered full name, ignoring case and surrounding whitespace, also
     * when the agreement was already signed. Signing twice is a no-op.
     */
    public ClientPropertyInterest signAgreement(UUID clientId, UUID propertyId, String signature) {
        try (var scope = CorrelationContext.bind(propertyId, clientId)) {
            if (signature == null || signature.isBlank()) {
                throw new ValidationException("signature", "Signature is required");
            }
            Client client = loadClient(clientId);
            ClientPropertyInterest interest = requireInterest(clientId, propertyId);

            boolean alreadySigned = interest.isAgreementSigned() && interest.getStatus().isBinding();
            if (!alreadySigned && interest.getStatus() != InterestStatus.COMMITTED) {
                throw new InvalidStateException("The agreement can only be signed after committing to the property");
            }
            if (!client.signatureMatches(signature)) {
                throw new ValidationException("signature", "Signature must match your registered full name");
            }
            if (alreadySigned) {
                return interest;
            }

            if (interestStore.signAgreement(interest.getId(), signature.trim(), Instant.now()) == 0) {
                ClientPropertyInterest current = loadInterest(interest.getId());
                if (current.isAgreementSigned()) {
                    return current;
                }
                metrics.recordConflict("sign-agreement");
                throw new ConflictException("Interest was changed concurrently, please retry");
            }

            log.info("Agreement signed for interest {}", interest.getId());
            notifyEvent(AcquisitionEventType.AGREEMENT_SIGNED, propertyId, clientId, "Purchase agreement signed");
            return loadInterest(interest.getId());
        }
    }

    // ==================== Deposit ====================

    /**
     * Pays the deposit on a committed interest with a signed agreement.
     *
     * A settled payment converts the interest (COMMITTED to CONVERTED), appends a
     * verified installment and hands the property to the handover orchestrator. A
     * payment the gateway has not settled yet is recorded as a pending installment and
     * converted later by {@link #confirmDeposit}. A reference that was already used
     * returns the installment it produced.
     */
    public DepositResult payDeposit(UUID clientId, UUID propertyId, DepositCommand command) {
        try (var scope = CorrelationContext.bind(propertyId, clientId)) {
            validateDeposit(command);
            String reference = command.getPaymentReference().trim();

            Optional<PaymentInstallment> previous = referenceRegistry.lookup(reference);
            if (previous.isPresent()) {
                return duplicateDeposit(previous.get(), clientId, propertyId);
            }

            ClientPropertyInterest interest = requireInterest(clientId, propertyId);
            if (interest.getStatus() == InterestStatus.CONVERTED || interest.getStatus() == InterestStatus.IN_HANDOVER) {
                throw new InvalidStateException("The deposit for this property has already been paid");
            }
            if (interest.getStatus() != InterestStatus.COMMITTED) {
                throw new InvalidStateException("Commit to the property before paying the deposit");
            }
            if (!interest.isAgreementSigned()) {
                throw new InvalidStateException("Sign the purchase agreement before paying the deposit");
            }
            if (interest.getPaymentReference() != null) {
                throw new InvalidStateException("A deposit is already awaiting verification");
            }

            Property property = loadProperty(propertyId);
            requireHandoverPossible(property);
            depositPolicy.validate(command.getAmount(), property.getAskingPrice());

            SettlementStatus settlement = paymentGateway.verify(reference);
            log.info("Gateway reported {} for deposit reference {}", settlement, reference);

            return settlement == SettlementStatus.COMPLETED
                    ? settleDeposit(interest, command, reference)
                    : recordPendingDeposit(interest, command, reference);
        }
    }

    /**
     * Administrative verification of a pending deposit, followed by conversion and the
     * handover hand-off. Verifying an already verified deposit retries only the hand-off.
     */
    public DepositResult confirmDeposit(UUID propertyId, String paymentReference, String verifiedBy) {
        if (paymentReference == null || paymentReference.isBlank()) {
            throw new ValidationException("paymentReference", "Payment reference is required");
        }
        if (verifiedBy == null || verifiedBy.isBlank()) {
            throw new ValidationException("verifiedBy", "Verifier is required");
        }

        PaymentInstallment installment = installmentStore.findByReference(paymentReference.trim())
                .filter(found -> found.getPropertyId().equals(propertyId))
                .orElseThrow(() -> new NotFoundException("No deposit with reference " + paymentReference + " on this property"));

        try (var scope = CorrelationContext.bind(propertyId, installment.getClientId())) {
            ClientPropertyInterest interest = interestStore.findById(installment.getInterestId())
                    .orElseThrow(() -> new NotFoundException("Interest for deposit " + paymentReference + " not found"));

            if (installment.isVerified()) {
                HandoverOutcome handover = interest.getStatus() == InterestStatus.CONVERTED
                        ? handOff(interest, paymentReference)
                        : HandoverOutcome.NONE;
                return resultOf(interest, installment, SettlementStatus.COMPLETED, true, handover);
            }
            if (interest.getStatus() != InterestStatus.COMMITTED) {
                throw new InvalidStateException("Interest in status " + interest.getStatus() + " cannot take a deposit");
            }
            requireHandoverPossible(loadProperty(propertyId));

            Instant now = Instant.now();
            Saga saga = new Saga("confirm-deposit", metrics);
            saga.run("convert-interest",
                    () -> requireUpdated(interestStore.convert(interest.getId(), installment.getAmount(),
                            installment.getPaymentReference(), now, now), "convert-interest"),
                    () -> interestStore.revertVerification(interest.getId()));
            saga.run("verify-installment",
                    () -> requireUpdated(installmentStore.markVerified(installment.getId(), verifiedBy.trim(), now),
                            "verify-installment"),
                    null);

            metrics.recordTransition(InterestStatus.CONVERTED.name());
            notifyEvent(AcquisitionEventType.DEPOSIT_PAID, propertyId, interest.getClientId(),
                    "Deposit " + installment.getPaymentReference() + " verified by " + verifiedBy.trim());

            ClientPropertyInterest converted = loadInterest(interest.getId());
            HandoverOutcome handover = handOff(converted, installment.getPaymentReference());
            return resultOf(loadInterest(interest.getId()),
                    installmentStore.findById(installment.getId()).orElse(installment),
                    SettlementStatus.COMPLETED, false, handover);
        }
    }

    /**
     * Current interest of a client in a property.
     */
    public ClientPropertyInterest getInterest(UUID clientId, UUID propertyId) {
        return requireInterest(clientId, propertyId);
    }

    private DepositResult settleDeposit(ClientPropertyInterest interest, DepositCommand command, String reference) {
        Instant now = Instant.now();
        Saga saga = new Saga("pay-deposit", metrics);

        saga.run("convert-interest",
                () -> requireUpdated(interestStore.convert(interest.getId(), command.getAmount(), reference, now, now),
                        "convert-interest"),
                () -> interestStore.revertConversion(interest.getId()));

        PaymentInstallment installment = saga.execute("append-installment",
                () -> appendInstallment(interest, command, reference, InstallmentStatus.VERIFIED, now),
                null);
        referenceRegistry.remember(reference, installment.getId());

        metrics.recordTransition(InterestStatus.CONVERTED.name());
        log.info("Deposit {} settled as installment #{}", reference, installment.getInstallmentNumber());
        notifyEvent(AcquisitionEventType.DEPOSIT_PAID, interest.getPropertyId(), interest.getClientId(),
                "Deposit of " + command.getAmount().toPlainString() + " received (" + reference + ")");

        HandoverOutcome handover = handOff(loadInterest(interest.getId()), reference);
        return resultOf(loadInterest(interest.getId()), installment, SettlementStatus.COMPLETED, false, handover);
    }

    private DepositResult recordPendingDeposit(ClientPropertyInterest interest, DepositCommand command, String reference) {
        Instant now = Instant.now();
        Saga saga = new Saga("record-pending-deposit", metrics);

        saga.run("record-deposit",
                () -> requireUpdated(interestStore.recordPendingDeposit(interest.getId(), command.getAmount(), reference, now),
                        "record-deposit"),
                () -> interestStore.clearPendingDeposit(interest.getId(), reference));

        PaymentInstallment installment = saga.execute("append-installment",
                () -> appendInstallment(interest, command, reference, InstallmentStatus.PENDING_VERIFICATION, now),
                null);
        referenceRegistry.remember(reference, installment.getId());

        log.info("Deposit {} recorded as pending installment #{}", reference, installment.getInstallmentNumber());
        notifyEvent(AcquisitionEventType.DEPOSIT_PENDING, interest.getPropertyId(), interest.getClientId(),
                "Deposit " + reference + " awaits verification");

        return resultOf(loadInterest(interest.getId()), installment, SettlementStatus.PENDING_VERIFICATION, false,
                HandoverOutcome.NONE);
    }

    private PaymentInstallment appendInstallment(ClientPropertyInterest interest, DepositCommand command,
                                                 String reference, InstallmentStatus status, Instant now) {
        boolean verified = status == InstallmentStatus.VERIFIED;
        PaymentInstallment installment = PaymentInstallment.builder()
                .id(UUID.randomUUID())
                .propertyId(interest.getPropertyId())
                .interestId(interest.getId())
                .clientId(interest.getClientId())
                .amount(command.getAmount())
                .paymentMethod(command.getPaymentMethod())
                .paymentReference(reference)
                .status(status)
                .verifiedBy(verified ? GATEWAY_VERIFIER : null)
                .verifiedAt(verified ? now : null)
                .createdAt(now)
                .build();
        try {
            return installmentStore.append(installment);
        } catch (DuplicateKeyException e) {
            metrics.recordConflict("append-installment");
            throw new ConflictException("Payment reference " + reference + " was just used by another request", e);
        }
    }

    private DepositResult duplicateDeposit(PaymentInstallment installment, UUID clientId, UUID propertyId) {
        if (!installment.getPropertyId().equals(propertyId) || !clientId.equals(installment.getClientId())) {
            throw new ValidationException("paymentReference", "Payment reference has already been used");
        }
        log.info("Deposit reference {} already recorded as installment #{}",
                installment.getPaymentReference(), installment.getInstallmentNumber());
        SettlementStatus settlement = installment.isVerified()
                ? SettlementStatus.COMPLETED
                : SettlementStatus.PENDING_VERIFICATION;
        return resultOf(requireInterest(clientId, propertyId), installment, settlement, true, HandoverOutcome.NONE);
    }

    /**
     * Starts the handover after a settled deposit. Never throws: the conversion stands
     * whatever happens here.
     */
    private HandoverOutcome handOff(ClientPropertyInterest interest, String reference) {
        try {
            HandoverResult result = handoverOrchestrator.startHandover(interest.getPropertyId(), interest.getClientId(),
                    TriggerEvent.DEPOSIT_PAID, "Deposit " + reference + " verified");
            return new HandoverOutcome(result, null);
        } catch (RuntimeException e) {
            log.warn("Deposit {} converted but handover was not started: {}", reference, e.getMessage());
            return new HandoverOutcome(null, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    /**
     * A converted deposit must be able to move the property into handover, which a
     * started or finished subdivision forbids.
     */
    private void requireHandoverPossible(Property property) {
        if (property.isSubdivided() || property.isSubdivisionActive()) {
            throw new UnavailableException("Property is being subdivided, deposits are on hold");
        }
    }

    private void deactivateCompetingInterests(UUID propertyId, UUID clientId) {
        try {
            int deactivated = interestStore.deactivateOthers(propertyId, clientId, COMMITTED_ELSEWHERE_NOTE);
            if (deactivated > 0) {
                log.info("Deactivated {} competing interests", deactivated);
            }
        } catch (RuntimeException e) {
            log.warn("Failed to deactivate competing interests: {}", e.getMessage());
        }
    }

    private void validateDeposit(DepositCommand command) {
        if (command == null) {
            throw new ValidationException("deposit", "Deposit details are required");
        }
        if (command.getAmount() == null || command.getAmount().compareTo(BigDecimal.ZERO) <= 0) {
            throw new ValidationException("amount", "Amount must be greater than 0");
        }
        if (command.getPaymentReference() == null || command.getPaymentReference().isBlank()) {
            throw new ValidationException("paymentReference", "Payment reference is required");
        }
        if (command.getPaymentMethod() == null) {
            throw new ValidationException("paymentMethod", "Payment method is required");
        }
    }

    private void notifyEvent(AcquisitionEventType type, UUID propertyId, UUID clientId, String message) {
        notificationSink.notify(AcquisitionEvent.of(type, propertyId, clientId, message));
    }

    private void requireUpdated(int rows, String operation) {
        if (rows == 0) {
            metrics.recordConflict(operation);
            throw new ConflictException("The record was changed by another request, please retry");
        }
    }

    private ClientPropertyInterest requireInterest(UUID clientId, UUID propertyId) {
        return interestStore.findByClientAndProperty(clientId, propertyId)
                .orElseThrow(() -> new NotFoundException("No interest in property " + propertyId));
    }

    private ClientPropertyInterest loadInterest(UUID interestId) {
        return interestStore.findById(interestId)
                .orElseThrow(() -> new NotFoundException("Interest not found: " + interestId));
    }

    private Property loadProperty(UUID propertyId) {
        return propertyStore.findById(propertyId)
                .orElseThrow(() -> new NotFoundException("Property not found: " + propertyId));
    }

    private Client loadClient(UUID clientId) {
        return clientStore.findById(clientId)
                .orElseThrow(() -> new NotFoundException("Client not found: " + clientId));
    }

    private static DepositResult resultOf(ClientPropertyInterest interest, PaymentInstallment installment,
                                          SettlementStatus settlement, boolean duplicate, HandoverOutcome handover) {
        return DepositResult.builder()
                .interest(interest)
                .installment(installment)
                .settlementStatus(settlement)
                .duplicate(duplicate)
                .handover(handover.result())
                .handoverFailure(handover.failure())
                .build();
    }

    private record HandoverOutcome(HandoverResult result, String failure) {
        static final HandoverOutcome NONE = new HandoverOutcome(null, null);
    }
}
