package com.nosota.msale.repository;

import com.nosota.msale.model.AuthorizationList;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface AuthorizationListRepository extends JpaRepository<AuthorizationList, String> {
}
