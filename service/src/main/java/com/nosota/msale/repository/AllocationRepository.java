package com.nosota.msale.repository;

import com.nosota.msale.model.Allocation;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface AllocationRepository extends JpaRepository<Allocation, Long> {

    List<Allocation> findByScheduleIdOrderByAllocationIndexAsc(Long scheduleId);

    Optional<Allocation> findByScheduleIdAndAllocationIndex(Long scheduleId, Integer allocationIndex);

    long countByScheduleId(Long scheduleId);
}
