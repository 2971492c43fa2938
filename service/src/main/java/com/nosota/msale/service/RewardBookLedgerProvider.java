package com.nosota.msale.service;

import com.nosota.msale.error.RewardBookNotFoundException;
import com.nosota.msale.external.RewardLedger;
import com.nosota.msale.external.RewardLedgerProvider;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Resolves reward ledger names to reward books.
 */
@Component
@RequiredArgsConstructor
public class RewardBookLedgerProvider implements RewardLedgerProvider {

    private final RewardBookService rewardBookService;

    @Override
    public boolean exists(String name) {
        return rewardBookService.exists(name);
    }

    @Override
    public RewardLedger resolve(String name) {
        if (!rewardBookService.exists(name)) {
            throw new RewardBookNotFoundException("Reward book not found: " + name);
        }
        return new BookRewardLedger(name, rewardBookService);
    }
}
