package com.nosota.msale.repository;

import com.nosota.msale.api.model.SaleEventType;
import com.nosota.msale.model.SaleEvent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface SaleEventRepository extends JpaRepository<SaleEvent, Long> {

    List<SaleEvent> findBySaleIdOrderByIdAsc(Long saleId);

    List<SaleEvent> findByScheduleIdOrderByIdAsc(Long scheduleId);

    /**
     * Events of a sale together with the events of the vesting schedule bound to it.
     */
    List<SaleEvent> findBySaleIdOrScheduleIdOrderByIdAsc(Long saleId, Long scheduleId);

    long countBySaleIdAndType(Long saleId, SaleEventType type);
}
