package com.nosota.msale.repository;

import com.nosota.msale.model.Sale;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface SaleRepository extends JpaRepository<Sale, Long> {
    /**
     * Retrieves the {@link Sale} with the specified ID and locks it for update.
     * <p>
     * Every state-changing sale operation starts here, so operations on one sale execute one at a
     * time: the lock is held until the surrounding transaction commits or rolls back.
     * </p>
     *
     * @param id The unique identifier (ID) of the sale.
     * @return The locked sale, or {@code null} if it does not exist.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM Sale s WHERE s.id = :id")
    Sale getOneForUpdate(@Param("id") Long id);

    /**
     * Finds finalized sales, which keep releasing vested rewards after admission has ended.
     *
     * @return Finalized sales ordered by ID
     */
    List<Sale> findByFinalizedTrueOrderByIdAsc();
}
