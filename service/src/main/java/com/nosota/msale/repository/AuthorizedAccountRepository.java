package com.nosota.msale.repository;

import com.nosota.msale.model.AuthorizedAccount;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface AuthorizedAccountRepository extends JpaRepository<AuthorizedAccount, Long> {

    boolean existsByListNameAndAccount(String listName, String account);

    Optional<AuthorizedAccount> findByListNameAndAccount(String listName, String account);

    long countByListName(String listName);
}
