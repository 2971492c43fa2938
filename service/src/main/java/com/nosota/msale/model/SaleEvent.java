package com.nosota.msale.model;

import com.nosota.msale.api.model.SaleEventType;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Audit record. Append-only: rows are built once and never updated or deleted.
 *
 * <p>Vesting events carry {@code scheduleId}; sale events carry {@code saleId}; events produced
 * by a sale driving its schedule carry both.
 */
@Entity
@Table(name = "sale_event")
@Getter
@Builder
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class SaleEvent {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "sale_id")
    private Long saleId;

    @Column(name = "schedule_id")
    private Long scheduleId;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", nullable = false, length = 40)
    private SaleEventType type;

    /**
     * Account the event is about (beneficiary, contributor, new administrator).
     */
    @Column(name = "account")
    private String account;

    private Long amount;

    @Column(name = "interval_number")
    private Integer intervalNumber;

    @Column(name = "detail", length = 500)
    private String detail;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;
}
