package com.nosota.msale.repository;

import com.nosota.msale.model.RewardEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface RewardEntryRepository extends JpaRepository<RewardEntry, Long> {

    List<RewardEntry> findByBookNameOrderByIdAsc(String bookName);
}
