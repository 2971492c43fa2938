package com.nosota.msale.repository;

import com.nosota.msale.model.RewardBalance;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface RewardBalanceRepository extends JpaRepository<RewardBalance, Long> {

    Optional<RewardBalance> findByBookNameAndAccount(String bookName, String account);

    /**
     * Retrieves the balance row of an account and locks it for update.
     *
     * @param bookName Book name
     * @param account  Account
     * @return The locked balance row if the account ever held units in this book
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT b FROM RewardBalance b WHERE b.bookName = :bookName AND b.account = :account")
    Optional<RewardBalance> findForUpdate(@Param("bookName") String bookName, @Param("account") String account);
}
