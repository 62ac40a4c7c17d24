package com.flagship.property_acquisition.payment;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC access to {@code property_payment_installments} and its per-property number sequence.
 *
 * Installment numbers are allocated by a single upsert on
 * {@code property_installment_sequences}, which row-locks the counter for the length
 * of the statement. Two concurrent appends can never read the same number. A failed
 * insert after allocation leaves a gap, which is acceptable; a duplicate is not.
 */
@Repository
@RequiredArgsConstructor
public class InstallmentStore {

    private static final RowMapper<PaymentInstallment> ROW_MAPPER = InstallmentStore::mapRow;

    private final JdbcTemplate jdbcTemplate;

    /**
     * Atomically allocates the next installment number of a property. The counter
     * starts from the highest number already recorded, so pre-existing ledgers continue
     * without collisions.
     */
    public int nextInstallmentNumber(UUID propertyId) {
        Integer next = jdbcTemplate.queryForObject(
            "INSERT INTO property_installment_sequences (property_id, last_number) " +
            "VALUES (?, (SELECT COALESCE(MAX(installment_number), 0) + 1 " +
            "            FROM property_payment_installments WHERE property_id = ?)) " +
            "ON CONFLICT (property_id) DO UPDATE " +
            "SET last_number = property_installment_sequences.last_number + 1 " +
            "RETURNING last_number",
            Integer.class,
            propertyId,
            propertyId
        );
        if (next == null) {
            throw new IllegalStateException("Installment sequence returned no value for property " + propertyId);
        }
        return next;
    }

    /**
     * Allocates a number and appends the installment.
     *
     * @return the stored installment, carrying its number
     */
    public PaymentInstallment append(PaymentInstallment installment) {
        int number = nextInstallmentNumber(installment.getPropertyId());
        PaymentInstallment numbered = installment.toBuilder().installmentNumber(number).build();
        jdbcTemplate.update(
            "INSERT INTO property_payment_installments (id, property_id, interest_id, client_id, installment_number, " +
            "amount, payment_method, payment_reference, status, verified_by, verified_at, created_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
            numbered.getId(),
            numbered.getPropertyId(),
            numbered.getInterestId(),
            numbered.getClientId(),
            numbered.getInstallmentNumber(),
            numbered.getAmount(),
            numbered.getPaymentMethod().name(),
            numbered.getPaymentReference(),
            numbered.getStatus().name(),
            numbered.getVerifiedBy(),
            numbered.getVerifiedAt() != null ? Timestamp.from(numbered.getVerifiedAt()) : null,
            Timestamp.from(numbered.getCreatedAt())
        );
        return numbered;
    }

    public Optional<PaymentInstallment> findById(UUID installmentId) {
        return jdbcTemplate.query("SELECT * FROM property_payment_installments WHERE id = ?", ROW_MAPPER, installmentId)
                .stream()
                .findFirst();
    }

    public Optional<PaymentInstallment> findByReference(String paymentReference) {
        return jdbcTemplate.query(
                "SELECT * FROM property_payment_installments WHERE payment_reference = ?",
                ROW_MAPPER, paymentReference)
                .stream()
                .findFirst();
    }

    public List<PaymentInstallment> findByProperty(UUID propertyId) {
        return jdbcTemplate.query(
            "SELECT * FROM property_payment_installments WHERE property_id = ? ORDER BY installment_number",
            ROW_MAPPER, propertyId);
    }

    /**
     * PENDING_VERIFICATION to VERIFIED. Zero rows if it was already verified.
     */
    public int markVerified(UUID installmentId, String verifiedBy, Instant verifiedAt) {
        return jdbcTemplate.update(
            "UPDATE property_payment_installments SET status = 'VERIFIED', verified_by = ?, verified_at = ? " +
            "WHERE id = ? AND status = 'PENDING_VERIFICATION'",
            verifiedBy,
            Timestamp.from(verifiedAt),
            installmentId
        );
    }

    private static PaymentInstallment mapRow(ResultSet rs, int rowNum) throws SQLException {
        Timestamp verifiedAt = rs.getTimestamp("verified_at");
        return PaymentInstallment.builder()
                .id(rs.getObject("id", UUID.class))
                .propertyId(rs.getObject("property_id", UUID.class))
                .interestId(rs.getObject("interest_id", UUID.class))
                .clientId(rs.getObject("client_id", UUID.class))
                .installmentNumber(rs.getInt("installment_number"))
                .amount(rs.getBigDecimal("amount"))
                .paymentMethod(PaymentMethod.valueOf(rs.getString("payment_method")))
                .paymentReference(rs.getString("payment_reference"))
                .status(InstallmentStatus.valueOf(rs.getString("status")))
                .verifiedBy(rs.getString("verified_by"))
                .verifiedAt(verifiedAt != null ? verifiedAt.toInstant() : null)
                .createdAt(rs.getTimestamp("created_at").toInstant())
                .build();
    }
}
