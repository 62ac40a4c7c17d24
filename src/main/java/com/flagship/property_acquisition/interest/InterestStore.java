package com.flagship.property_acquisition.interest;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * JDBC access to the {@code client_property_interests} table.
 *
 * Status changes are conditional on the expected prior status and return the
 * affected row count. The partial unique index on binding statuses rejects a second
 * commitment per property even if every application check were bypassed.
 */
@Repository
@RequiredArgsConstructor
public class InterestStore {

    private static final RowMapper<ClientPropertyInterest> ROW_MAPPER = InterestStore::mapRow;

    // CONCAT_WS skips nulls, so the first note lands without a leading newline
    private static final String APPEND_NOTE = "CONCAT_WS(chr(10), notes, CAST(? AS TEXT))";

    private final JdbcTemplate jdbcTemplate;

    public Optional<ClientPropertyInterest> findById(UUID interestId) {
        return jdbcTemplate.query("SELECT * FROM client_property_interests WHERE id = ?", ROW_MAPPER, interestId)
                .stream()
                .findFirst();
    }

    public Optional<ClientPropertyInterest> findByClientAndProperty(UUID clientId, UUID propertyId) {
        return jdbcTemplate.query(
                "SELECT * FROM client_property_interests WHERE client_id = ? AND property_id = ?",
                ROW_MAPPER, clientId, propertyId)
                .stream()
                .findFirst();
    }

    public List<ClientPropertyInterest> findByProperty(UUID propertyId, Collection<InterestStatus> statuses) {
        List<Object> args = new ArrayList<>();
        args.add(propertyId);
        args.addAll(names(statuses));
        return jdbcTemplate.query(
                "SELECT * FROM client_property_interests WHERE property_id = ? AND status IN (" +
                placeholders(statuses.size()) + ") ORDER BY created_at",
                ROW_MAPPER, args.toArray());
    }

    /**
     * Inserts a new interest. Throws {@link org.springframework.dao.DuplicateKeyException}
     * if the client already has a row for the property.
     */
    public void insert(ClientPropertyInterest interest) {
        jdbcTemplate.update(
            "INSERT INTO client_property_interests (id, client_id, property_id, status, notes) " +
            "VALUES (?, ?, ?, ?, ?)",
            interest.getId(),
            interest.getClientId(),
            interest.getPropertyId(),
            interest.getStatus().name(),
            interest.getNotes()
        );
    }

    /**
     * Reopens a cancelled interest, wiping everything recorded by its previous life.
     */
    public int reactivate(UUID interestId) {
        return jdbcTemplate.update(
            "UPDATE client_property_interests SET status = 'ACTIVE', reservation_date = NULL, " +
            "deposit_amount = NULL, deposit_paid_at = NULL, payment_reference = NULL, payment_verified_at = NULL, " +
            "agreement_generated_at = NULL, agreement_signed_at = NULL, agreement_signature = NULL, " +
            "notes = NULL, updated_at = CURRENT_TIMESTAMP " +
            "WHERE id = ? AND status = 'INACTIVE'",
            interestId
        );
    }

    /**
     * Moves the interest to {@code next} if it is currently in one of {@code expected}.
     * A non-null note is appended to the existing notes.
     */
    public int transition(UUID interestId, Collection<InterestStatus> expected, InterestStatus next, String note) {
        List<Object> args = new ArrayList<>();
        args.add(next.name());
        args.add(note);
        args.add(interestId);
        args.addAll(names(expected));
        String reservationDate = next == InterestStatus.RESERVED ? "reservation_date = CURRENT_TIMESTAMP, " : "";
        return jdbcTemplate.update(
            "UPDATE client_property_interests SET status = ?, notes = " + APPEND_NOTE + ", " +
            reservationDate + "updated_at = CURRENT_TIMESTAMP " +
            "WHERE id = ? AND status IN (" + placeholders(expected.size()) + ")",
            args.toArray()
        );
    }

    /**
     * Forces every other cancellable interest on the property to INACTIVE.
     */
    public int deactivateOthers(UUID propertyId, UUID keepClientId, String note) {
        return jdbcTemplate.update(
            "UPDATE client_property_interests SET status = 'INACTIVE', notes = " + APPEND_NOTE + ", " +
            "updated_at = CURRENT_TIMESTAMP " +
            "WHERE property_id = ? AND client_id <> ? AND status IN ('ACTIVE', 'RESERVED')",
            note,
            propertyId,
            keepClientId
        );
    }

    public int signAgreement(UUID interestId, String signature, Instant signedAt) {
        Timestamp ts = Timestamp.from(signedAt);
        return jdbcTemplate.update(
            "UPDATE client_property_interests SET agreement_signed_at = ?, agreement_signature = ?, " +
            "agreement_generated_at = COALESCE(agreement_generated_at, ?), updated_at = CURRENT_TIMESTAMP " +
            "WHERE id = ? AND status = 'COMMITTED' AND agreement_signed_at IS NULL",
            ts,
            signature,
            ts,
            interestId
        );
    }

    /**
     * Records a deposit the gateway has not settled yet. The interest stays COMMITTED.
     */
    public int recordPendingDeposit(UUID interestId, BigDecimal amount, String paymentReference, Instant paidAt) {
        return jdbcTemplate.update(
            "UPDATE client_property_interests SET deposit_amount = ?, deposit_paid_at = ?, payment_reference = ?, " +
            "updated_at = CURRENT_TIMESTAMP " +
            "WHERE id = ? AND status = 'COMMITTED' AND agreement_signed_at IS NOT NULL AND payment_reference IS NULL",
            amount,
            Timestamp.from(paidAt),
            paymentReference,
            interestId
        );
    }

    /**
     * COMMITTED to CONVERTED with the settled deposit recorded.
     */
    public int convert(UUID interestId, BigDecimal amount, String paymentReference, Instant paidAt, Instant verifiedAt) {
        return jdbcTemplate.update(
            "UPDATE client_property_interests SET status = 'CONVERTED', deposit_amount = ?, " +
            "deposit_paid_at = COALESCE(deposit_paid_at, ?), payment_reference = ?, payment_verified_at = ?, " +
            "updated_at = CURRENT_TIMESTAMP " +
            "WHERE id = ? AND status = 'COMMITTED' AND agreement_signed_at IS NOT NULL " +
            "AND (payment_reference IS NULL OR payment_reference = ?)",
            amount,
            Timestamp.from(paidAt),
            paymentReference,
            Timestamp.from(verifiedAt),
            interestId,
            paymentReference
        );
    }

    /**
     * Compensation for {@link #convert}: back to COMMITTED without deposit fields.
     */
    public int revertConversion(UUID interestId) {
        return jdbcTemplate.update(
            "UPDATE client_property_interests SET status = 'COMMITTED', deposit_amount = NULL, " +
            "deposit_paid_at = NULL, payment_reference = NULL, payment_verified_at = NULL, " +
            "updated_at = CURRENT_TIMESTAMP " +
            "WHERE id = ? AND status = 'CONVERTED'",
            interestId
        );
    }

    /**
     * Compensation for {@link #recordPendingDeposit}.
     */
    public int clearPendingDeposit(UUID interestId, String paymentReference) {
        return jdbcTemplate.update(
            "UPDATE client_property_interests SET deposit_amount = NULL, deposit_paid_at = NULL, " +
            "payment_reference = NULL, updated_at = CURRENT_TIMESTAMP " +
            "WHERE id = ? AND status = 'COMMITTED' AND payment_reference = ?",
            interestId,
            paymentReference
        );
    }

    /**
     * Compensation for a conversion of a previously pending deposit: back to COMMITTED,
     * keeping the pending deposit fields.
     */
    public int revertVerification(UUID interestId) {
        return jdbcTemplate.update(
            "UPDATE client_property_interests SET status = 'COMMITTED', payment_verified_at = NULL, " +
            "updated_at = CURRENT_TIMESTAMP " +
            "WHERE id = ? AND status = 'CONVERTED'",
            interestId
        );
    }

    private static List<String> names(Collection<InterestStatus> statuses) {
        return statuses.stream().map(Enum::name).collect(Collectors.toList());
    }

    private static String placeholders(int count) {
        return String.join(", ", Collections.nCopies(count, "?"));
    }

    private static ClientPropertyInterest mapRow(ResultSet rs, int rowNum) throws SQLException {
        return ClientPropertyInterest.builder()
                .id(rs.getObject("id", UUID.class))
                .clientId(rs.getObject("client_id", UUID.class))
                .propertyId(rs.getObject("property_id", UUID.class))
                .status(InterestStatus.valueOf(rs.getString("status")))
                .reservationDate(toInstant(rs.getTimestamp("reservation_date")))
                .depositAmount(rs.getBigDecimal("deposit_amount"))
                .depositPaidAt(toInstant(rs.getTimestamp("deposit_paid_at")))
                .paymentReference(rs.getString("payment_reference"))
                .paymentVerifiedAt(toInstant(rs.getTimestamp("payment_verified_at")))
                .agreementGeneratedAt(toInstant(rs.getTimestamp("agreement_generated_at")))
                .agreementSignedAt(toInstant(rs.getTimestamp("agreement_signed_at")))
                .agreementSignature(rs.getString("agreement_signature"))
                .notes(rs.getString("notes"))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .updatedAt(toInstant(rs.getTimestamp("updated_at")))
                .build();
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }
}
