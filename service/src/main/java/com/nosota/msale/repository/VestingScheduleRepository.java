package com.nosota.msale.repository;

import com.nosota.msale.model.VestingSchedule;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface VestingScheduleRepository extends JpaRepository<VestingSchedule, Long> {
    /**
     * Retrieves the {@link VestingSchedule} with the specified ID and locks it for update.
     * <p>
     * The schedule row guards its allocation list as well: allocation indices are assigned and
     * intervals advanced only while holding this lock.
     * </p>
     *
     * @param id The unique identifier (ID) of the schedule.
     * @return The locked schedule, or {@code null} if it does not exist.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT v FROM VestingSchedule v WHERE v.id = :id")
    VestingSchedule getOneForUpdate(@Param("id") Long id);
}
