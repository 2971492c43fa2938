package com.nosota.msale.repository;

import com.nosota.msale.model.RewardBook;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface RewardBookRepository extends JpaRepository<RewardBook, String> {
    /**
     * Retrieves the {@link RewardBook} with the specified name and locks it for update.
     * Used when issuing, so that issuance cannot interleave with a freeze.
     *
     * @param name Book name
     * @return The locked book, or {@code null} if it does not exist.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT b FROM RewardBook b WHERE b.name = :name")
    RewardBook getOneForUpdate(@Param("name") String name);
}
