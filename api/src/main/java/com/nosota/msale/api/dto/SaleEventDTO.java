package com.nosota.msale.api.dto;

import com.nosota.msale.api.model.SaleEventType;

import java.time.Instant;

public record SaleEventDTO(
        Long id,
        Long saleId,
        Long scheduleId,
        SaleEventType type,
        String account,
        Long amount,
        Integer intervalNumber,
        String detail,
        Instant createdAt
) {}
