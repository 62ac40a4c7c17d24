package com.flagship.property_acquisition.interest;

import com.flagship.property_acquisition.IntegrationTestSupport;
import com.flagship.property_acquisition.client.Client;
import com.flagship.property_acquisition.exception.ConflictException;
import com.flagship.property_acquisition.exception.InvalidStateException;
import com.flagship.property_acquisition.exception.NotFoundException;
import com.flagship.property_acquisition.exception.UnavailableException;
import com.flagship.property_acquisition.exception.ValidationException;
import com.flagship.property_acquisition.handover.HandoverPipeline;
import com.flagship.property_acquisition.handover.HandoverPipelineStore;
import com.flagship.property_acquisition.outbox.OutboxEvent;
import com.flagship.property_acquisition.outbox.OutboxService;
import com.flagship.property_acquisition.payment.InstallmentStatus;
import com.flagship.property_acquisition.payment.InstallmentStore;
import com.flagship.property_acquisition.payment.PaymentInstallment;
import com.flagship.property_acquisition.payment.PaymentMethod;
import com.flagship.property_acquisition.payment.SettlementStatus;
import com.flagship.property_acquisition.property.HandoverStatus;
import com.flagship.property_acquisition.property.Property;
import com.flagship.property_acquisition.property.ReservationStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Interest lifecycle against a real database.
 *
 * Key invariants verified:
 * - At most one client holds a binding commitment per property, also under concurrency
 * - A lost commitment race leaves the loser's interest untouched
 * - The deposit converts the interest, appends installment max + 1 and starts the handover
 * - A payment reference is applied only once
 */
class InterestStateMachineTest extends IntegrationTestSupport {

    private static final BigDecimal ASKING_PRICE = new BigDecimal("1000000.00");
    private static final BigDecimal DEPOSIT = new BigDecimal("100000.00");

    @Autowired
    private InterestStateMachine stateMachine;

    @Autowired
    private InterestStore interestStore;

    @Autowired
    private InstallmentStore installmentStore;

    @Autowired
    private HandoverPipelineStore pipelineStore;

    @Autowired
    private OutboxService outboxService;

    private Client alice;
    private Client bob;
    private Property property;

    @BeforeEach
    void setUp() {
        alice = createClient("Alice Njeri");
        bob = createClient("Bob Otieno");
        property = createProperty(ASKING_PRICE);
    }

    private DepositCommand deposit(BigDecimal amount, String reference) {
        return DepositCommand.builder()
                .amount(amount)
                .paymentReference(reference)
                .paymentMethod(PaymentMethod.BANK_TRANSFER)
                .build();
    }

    private void commitAndSign(Client client) {
        stateMachine.expressInterest(client.getId(), property.getId());
        stateMachine.commitProperty(client.getId(), property.getId());
        stateMachine.signAgreement(client.getId(), property.getId(), client.getFullName());
    }

    @Nested
    @DisplayName("Expressing interest")
    class ExpressInterest {

        @Test
        @DisplayName("Creates an ACTIVE interest and an outbox event")
        void createsActiveInterest() {
            printTestHeader("Express Interest");

            ClientPropertyInterest interest = stateMachine.expressInterest(alice.getId(), property.getId());

            printOutput("Status", interest.getStatus());
            assertEquals(InterestStatus.ACTIVE, interest.getStatus());
            List<OutboxEvent> events = outboxService.getEventsForAggregate("Property", property.getId());
            assertEquals(1, events.size());
            assertEquals("INTEREST_EXPRESSED", events.get(0).getEventType());
            printSuccess("Interest created");
        }

        @Test
        @DisplayName("A second live interest by the same client is a conflict")
        void duplicateIsConflict() {
            stateMachine.expressInterest(alice.getId(), property.getId());

            assertThrows(ConflictException.class,
                    () -> stateMachine.expressInterest(alice.getId(), property.getId()));
        }

        @Test
        @DisplayName("An inactive interest is reactivated in place")
        void inactiveIsReactivated() {
            ClientPropertyInterest first = stateMachine.expressInterest(alice.getId(), property.getId());
            stateMachine.cancelInterest(alice.getId(), property.getId(), "changed my mind");

            ClientPropertyInterest again = stateMachine.expressInterest(alice.getId(), property.getId());

            assertEquals(first.getId(), again.getId());
            assertEquals(InterestStatus.ACTIVE, again.getStatus());
        }

        @Test
        @DisplayName("A property committed to someone else is unavailable")
        void committedElsewhereIsUnavailable() {
            stateMachine.expressInterest(alice.getId(), property.getId());
            stateMachine.commitProperty(alice.getId(), property.getId());

            assertThrows(UnavailableException.class,
                    () -> stateMachine.expressInterest(bob.getId(), property.getId()));
        }

        @Test
        @DisplayName("Unknown property is not found")
        void unknownProperty() {
            assertThrows(NotFoundException.class,
                    () -> stateMachine.expressInterest(alice.getId(), UUID.randomUUID()));
        }
    }

    @Nested
    @DisplayName("Reservation and cancellation")
    class ReservationAndCancellation {

        @Test
        @DisplayName("Reserving places the property reservation")
        void reservePlacesReservation() {
            stateMachine.expressInterest(alice.getId(), property.getId());

            ClientPropertyInterest interest = stateMachine.reserveProperty(alice.getId(), property.getId());

            assertEquals(InterestStatus.RESERVED, interest.getStatus());
            assertNotNull(interest.getReservationDate());
            Property current = reload(property);
            assertEquals(ReservationStatus.RESERVED, current.getReservationStatus());
            assertEquals(alice.getId(), current.getReservedBy());
        }

        @Test
        @DisplayName("A property reserved by someone else cannot be reserved again")
        void reservedElsewhereIsConflict() {
            stateMachine.expressInterest(alice.getId(), property.getId());
            stateMachine.expressInterest(bob.getId(), property.getId());
            stateMachine.reserveProperty(alice.getId(), property.getId());

            assertThrows(ConflictException.class,
                    () -> stateMachine.reserveProperty(bob.getId(), property.getId()));

            ClientPropertyInterest bobs = stateMachine.getInterest(bob.getId(), property.getId());
            assertEquals(InterestStatus.ACTIVE, bobs.getStatus());
        }

        @Test
        @DisplayName("Cancelling a reservation releases it")
        void cancelReleasesReservation() {
            stateMachine.expressInterest(alice.getId(), property.getId());
            stateMachine.reserveProperty(alice.getId(), property.getId());

            ClientPropertyInterest interest = stateMachine.cancelInterest(alice.getId(), property.getId(), "too far");

            assertEquals(InterestStatus.INACTIVE, interest.getStatus());
            assertTrue(interest.getNotes().contains("too far"));
            Property current = reload(property);
            assertNull(current.getReservationStatus());
            assertNull(current.getReservedBy());
        }

        @Test
        @DisplayName("Cancelling twice is a no-op")
        void cancelIsIdempotent() {
            stateMachine.expressInterest(alice.getId(), property.getId());
            stateMachine.cancelInterest(alice.getId(), property.getId(), null);

            ClientPropertyInterest again = stateMachine.cancelInterest(alice.getId(), property.getId(), null);

            assertEquals(InterestStatus.INACTIVE, again.getStatus());
        }

        @Test
        @DisplayName("A committed purchase cannot be cancelled")
        void committedCannotCancel() {
            stateMachine.expressInterest(alice.getId(), property.getId());
            stateMachine.commitProperty(alice.getId(), property.getId());

            assertThrows(InvalidStateException.class,
                    () -> stateMachine.cancelInterest(alice.getId(), property.getId(), null));
            assertEquals(InterestStatus.COMMITTED,
                    stateMachine.getInterest(alice.getId(), property.getId()).getStatus());
        }
    }

    @Nested
    @DisplayName("Commitment")
    class Commitment {

        @Test
        @DisplayName("A commits, then B is rejected and A's competitors are deactivated")
        void abScenario() {
            printTestHeader("A/B Commit Scenario");
            stateMachine.expressInterest(alice.getId(), property.getId());
            stateMachine.expressInterest(bob.getId(), property.getId());

            ClientPropertyInterest alices = stateMachine.commitProperty(alice.getId(), property.getId());
            assertEquals(InterestStatus.COMMITTED, alices.getStatus());

            ClientPropertyInterest bobs = stateMachine.getInterest(bob.getId(), property.getId());
            printOutput("Bob's interest", bobs.getStatus());
            assertEquals(InterestStatus.INACTIVE, bobs.getStatus());
            assertTrue(bobs.getNotes().contains(InterestStateMachine.COMMITTED_ELSEWHERE_NOTE));

            assertThrows(ConflictException.class,
                    () -> stateMachine.commitProperty(bob.getId(), property.getId()));

            Property current = reload(property);
            assertEquals(alice.getId(), current.getCommittedClientId());
            assertNotNull(current.getCommitmentDate());
            printSuccess("Only Alice holds the commitment");
        }

        @Test
        @DisplayName("Committing twice is idempotent")
        void commitIsIdempotent() {
            stateMachine.expressInterest(alice.getId(), property.getId());
            ClientPropertyInterest first = stateMachine.commitProperty(alice.getId(), property.getId());

            ClientPropertyInterest second = stateMachine.commitProperty(alice.getId(), property.getId());

            assertEquals(first.getId(), second.getId());
            assertEquals(InterestStatus.COMMITTED, second.getStatus());
        }

        @Test
        @DisplayName("Commit clears the committing client's own reservation")
        void commitFromReservation() {
            stateMachine.expressInterest(alice.getId(), property.getId());
            stateMachine.reserveProperty(alice.getId(), property.getId());

            stateMachine.commitProperty(alice.getId(), property.getId());

            Property current = reload(property);
            assertEquals(alice.getId(), current.getCommittedClientId());
            assertNull(current.getReservedBy());
        }

        @Test
        @DisplayName("Concurrent commits: exactly one wins, the others fail with Conflict")
        void concurrentCommits() throws InterruptedException {
            printTestHeader("Concurrent Commits");
            int clients = 5;
            List<Client> contenders = new java.util.ArrayList<>();
            for (int i = 0; i < clients; i++) {
                Client client = createClient("Contender " + i);
                stateMachine.expressInterest(client.getId(), property.getId());
                contenders.add(client);
            }

            ExecutorService executor = Executors.newFixedThreadPool(clients);
            CountDownLatch start = new CountDownLatch(1);
            CountDownLatch done = new CountDownLatch(clients);
            AtomicInteger successes = new AtomicInteger();
            AtomicInteger conflicts = new AtomicInteger();
            AtomicInteger others = new AtomicInteger();

            for (Client client : contenders) {
                executor.submit(() -> {
                    try {
                        start.await();
                        stateMachine.commitProperty(client.getId(), property.getId());
                        successes.incrementAndGet();
                    } catch (ConflictException e) {
                        conflicts.incrementAndGet();
                    } catch (Exception e) {
                        others.incrementAndGet();
                    } finally {
                        done.countDown();
                    }
                });
            }
            start.countDown();
            assertTrue(done.await(30, TimeUnit.SECONDS));
            executor.shutdown();

            printOutput("Successes", successes.get());
            printOutput("Conflicts", conflicts.get());
            assertEquals(1, successes.get());
            assertEquals(clients - 1, conflicts.get());
            assertEquals(0, others.get());

            Integer committed = jdbcTemplate.queryForObject(
                    "SELECT COUNT(*) FROM client_property_interests WHERE property_id = ? " +
                    "AND status IN ('COMMITTED', 'CONVERTED', 'IN_HANDOVER')", Integer.class, property.getId());
            assertEquals(1, committed);
            printSuccess("Single commitment under concurrency");
        }
    }

    @Nested
    @DisplayName("Agreement")
    class Agreement {

        @Test
        @DisplayName("Signature matches the full name ignoring case and whitespace")
        void caseInsensitiveSignature() {
            stateMachine.expressInterest(alice.getId(), property.getId());
            stateMachine.commitProperty(alice.getId(), property.getId());

            ClientPropertyInterest signed =
                    stateMachine.signAgreement(alice.getId(), property.getId(), "  alice NJERI ");

            assertTrue(signed.isAgreementSigned());
            assertEquals("alice NJERI", signed.getAgreementSignature());
            assertNotNull(signed.getAgreementGeneratedAt());
        }

        @Test
        @DisplayName("A wrong signature fails on the signature field")
        void wrongSignature() {
            stateMachine.expressInterest(alice.getId(), property.getId());
            stateMachine.commitProperty(alice.getId(), property.getId());

            ValidationException e = assertThrows(ValidationException.class,
                    () -> stateMachine.signAgreement(alice.getId(), property.getId(), "Bob Otieno"));

            assertEquals("signature", e.getField());
        }

        @Test
        @DisplayName("Signing again with someone else's name fails even when already signed")
        void resignWithWrongName() {
            commitAndSign(alice);
            ClientPropertyInterest signed = stateMachine.getInterest(alice.getId(), property.getId());

            ValidationException e = assertThrows(ValidationException.class,
                    () -> stateMachine.signAgreement(alice.getId(), property.getId(), "John Smith"));

            assertEquals("signature", e.getField());
            ClientPropertyInterest current = stateMachine.getInterest(alice.getId(), property.getId());
            assertEquals(signed.getAgreementSignature(), current.getAgreementSignature());
            assertEquals(signed.getAgreementSignedAt(), current.getAgreementSignedAt());
        }

        @Test
        @DisplayName("Signing before committing is an invalid state")
        void signBeforeCommit() {
            stateMachine.expressInterest(alice.getId(), property.getId());

            assertThrows(InvalidStateException.class,
                    () -> stateMachine.signAgreement(alice.getId(), property.getId(), alice.getFullName()));
        }

        @Test
        @DisplayName("Signing twice is a no-op")
        void signTwice() {
            commitAndSign(alice);
            ClientPropertyInterest first = stateMachine.getInterest(alice.getId(), property.getId());

            ClientPropertyInterest second =
                    stateMachine.signAgreement(alice.getId(), property.getId(), alice.getFullName());

            assertEquals(first.getAgreementSignedAt(), second.getAgreementSignedAt());
        }
    }

    @Nested
    @DisplayName("Deposit")
    class Deposit {

        @Test
        @DisplayName("A settled deposit converts, appends installment max + 1 and starts the handover")
        void settledDeposit() {
            printTestHeader("Deposit Conversion");
            commitAndSign(alice);
            ClientPropertyInterest interest = stateMachine.getInterest(alice.getId(), property.getId());
            jdbcTemplate.update(
                    "INSERT INTO property_payment_installments (id, property_id, interest_id, client_id, " +
                    "installment_number, amount, payment_method, payment_reference, status, verified_by, verified_at) " +
                    "VALUES (?, ?, ?, ?, 3, 500.00, 'CARD', ?, 'VERIFIED', 'legacy', CURRENT_TIMESTAMP)",
                    UUID.randomUUID(), property.getId(), interest.getId(), alice.getId(), "LEGACY-" + UUID.randomUUID());

            String reference = "TX-" + UUID.randomUUID();
            printInput("Amount", DEPOSIT);
            printInput("Reference", reference);
            DepositResult result = stateMachine.payDeposit(alice.getId(), property.getId(), deposit(DEPOSIT, reference));

            printOutput("Installment #", result.getInstallment().getInstallmentNumber());
            printOutput("Handover", result.getHandover());
            assertEquals(SettlementStatus.COMPLETED, result.getSettlementStatus());
            assertFalse(result.isDuplicate());
            assertEquals(4, result.getInstallment().getInstallmentNumber());
            assertEquals(InstallmentStatus.VERIFIED, result.getInstallment().getStatus());
            assertEquals(InterestStateMachine.GATEWAY_VERIFIER, result.getInstallment().getVerifiedBy());

            assertTrue(result.isHandoverStarted());
            assertEquals(InterestStatus.IN_HANDOVER, result.getInterest().getStatus());
            assertEquals(0, DEPOSIT.compareTo(result.getInterest().getDepositAmount()));
            assertEquals(reference, result.getInterest().getPaymentReference());
            assertNotNull(result.getInterest().getPaymentVerifiedAt());

            assertEquals(HandoverStatus.IN_PROGRESS, reload(property).getHandoverStatus());
            HandoverPipeline pipeline = pipelineStore.findByPropertyId(property.getId()).orElseThrow();
            assertEquals(3, pipeline.getCurrentStage());
            assertEquals(50, pipeline.getOverallProgress());
            printSuccess("Deposit converted and handover started");
        }

        @Test
        @DisplayName("Paying with the same reference twice returns the first installment")
        void duplicateReference() {
            commitAndSign(alice);
            String reference = "TX-" + UUID.randomUUID();
            DepositResult first = stateMachine.payDeposit(alice.getId(), property.getId(), deposit(DEPOSIT, reference));

            DepositResult second = stateMachine.payDeposit(alice.getId(), property.getId(), deposit(DEPOSIT, reference));

            assertTrue(second.isDuplicate());
            assertEquals(first.getInstallment().getId(), second.getInstallment().getId());
            assertEquals(1, installmentStore.findByProperty(property.getId()).size());
            assertEquals(1, countPipelines(property.getId()));
        }

        @Test
        @DisplayName("A reference already used on another property is rejected")
        void referenceFromOtherProperty() {
            commitAndSign(alice);
            String reference = "TX-" + UUID.randomUUID();
            stateMachine.payDeposit(alice.getId(), property.getId(), deposit(DEPOSIT, reference));

            Property other = createProperty(ASKING_PRICE);
            stateMachine.expressInterest(bob.getId(), other.getId());
            stateMachine.commitProperty(bob.getId(), other.getId());
            stateMachine.signAgreement(bob.getId(), other.getId(), bob.getFullName());

            ValidationException e = assertThrows(ValidationException.class,
                    () -> stateMachine.payDeposit(bob.getId(), other.getId(), deposit(DEPOSIT, reference)));
            assertEquals("paymentReference", e.getField());
        }

        @Test
        @DisplayName("A deposit outside the tolerance is rejected and nothing changes")
        void wrongAmount() {
            commitAndSign(alice);

            ValidationException e = assertThrows(ValidationException.class,
                    () -> stateMachine.payDeposit(alice.getId(), property.getId(),
                            deposit(new BigDecimal("90000"), "TX-" + UUID.randomUUID())));

            assertEquals("amount", e.getField());
            assertEquals(InterestStatus.COMMITTED,
                    stateMachine.getInterest(alice.getId(), property.getId()).getStatus());
            assertTrue(installmentStore.findByProperty(property.getId()).isEmpty());
        }

        @Test
        @DisplayName("A deposit during a subdivision is rejected before anything is recorded")
        void depositDuringSubdivision() {
            commitAndSign(alice);
            jdbcTemplate.update("UPDATE properties SET subdivision_status = 'SUB_DIVISION_STARTED' WHERE id = ?",
                    property.getId());

            assertThrows(UnavailableException.class,
                    () -> stateMachine.payDeposit(alice.getId(), property.getId(),
                            deposit(DEPOSIT, "TX-" + UUID.randomUUID())));

            ClientPropertyInterest interest = stateMachine.getInterest(alice.getId(), property.getId());
            assertEquals(InterestStatus.COMMITTED, interest.getStatus());
            assertNull(interest.getPaymentReference());
            assertTrue(installmentStore.findByProperty(property.getId()).isEmpty());
            assertEquals(HandoverStatus.NOT_STARTED, reload(property).getHandoverStatus());
        }

        @Test
        @DisplayName("A pending deposit cannot be confirmed while the property is being subdivided")
        void confirmDuringSubdivision() {
            commitAndSign(alice);
            String reference = "PENDING-" + UUID.randomUUID();
            stateMachine.payDeposit(alice.getId(), property.getId(), deposit(DEPOSIT, reference));
            jdbcTemplate.update("UPDATE properties SET subdivision_status = 'SUB_DIVISION_STARTED' WHERE id = ?",
                    property.getId());

            assertThrows(UnavailableException.class,
                    () -> stateMachine.confirmDeposit(property.getId(), reference, "finance-officer"));

            assertEquals(InterestStatus.COMMITTED,
                    stateMachine.getInterest(alice.getId(), property.getId()).getStatus());
            assertEquals(InstallmentStatus.PENDING_VERIFICATION,
                    installmentStore.findByReference(reference).orElseThrow().getStatus());
        }

        @Test
        @DisplayName("A deposit before signing is an invalid state")
        void depositBeforeSigning() {
            stateMachine.expressInterest(alice.getId(), property.getId());
            stateMachine.commitProperty(alice.getId(), property.getId());

            assertThrows(InvalidStateException.class,
                    () -> stateMachine.payDeposit(alice.getId(), property.getId(),
                            deposit(DEPOSIT, "TX-" + UUID.randomUUID())));
        }

        @Test
        @DisplayName("A pending deposit waits for verification, then converts and hands over")
        void pendingThenConfirmed() {
            printTestHeader("Pending Deposit Verification");
            commitAndSign(alice);
            String reference = "PENDING-" + UUID.randomUUID();

            DepositResult pending = stateMachine.payDeposit(alice.getId(), property.getId(), deposit(DEPOSIT, reference));

            assertEquals(SettlementStatus.PENDING_VERIFICATION, pending.getSettlementStatus());
            assertEquals(InterestStatus.COMMITTED, pending.getInterest().getStatus());
            assertEquals(InstallmentStatus.PENDING_VERIFICATION, pending.getInstallment().getStatus());
            assertFalse(pending.isHandoverStarted());
            assertEquals(HandoverStatus.NOT_STARTED, reload(property).getHandoverStatus());

            DepositResult confirmed = stateMachine.confirmDeposit(property.getId(), reference, "finance-officer");

            assertEquals(SettlementStatus.COMPLETED, confirmed.getSettlementStatus());
            assertTrue(confirmed.isHandoverStarted());
            assertEquals(InterestStatus.IN_HANDOVER, confirmed.getInterest().getStatus());
            PaymentInstallment installment = confirmed.getInstallment();
            assertEquals(InstallmentStatus.VERIFIED, installment.getStatus());
            assertEquals("finance-officer", installment.getVerifiedBy());
            assertEquals(HandoverStatus.IN_PROGRESS, reload(property).getHandoverStatus());

            DepositResult again = stateMachine.confirmDeposit(property.getId(), reference, "finance-officer");
            assertTrue(again.isDuplicate());
            assertEquals(1, countPipelines(property.getId()));
            printSuccess("Pending deposit confirmed once");
        }

        @Test
        @DisplayName("A second deposit while one is pending is an invalid state")
        void secondDepositWhilePending() {
            commitAndSign(alice);
            stateMachine.payDeposit(alice.getId(), property.getId(),
                    deposit(DEPOSIT, "PENDING-" + UUID.randomUUID()));

            assertThrows(InvalidStateException.class,
                    () -> stateMachine.payDeposit(alice.getId(), property.getId(),
                            deposit(DEPOSIT, "TX-" + UUID.randomUUID())));
        }

        @Test
        @DisplayName("Confirming an unknown reference is not found")
        void confirmUnknown() {
            assertThrows(NotFoundException.class,
                    () -> stateMachine.confirmDeposit(property.getId(), "TX-" + UUID.randomUUID(), "finance-officer"));
        }
    }
}
