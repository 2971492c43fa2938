package com.nosota.msale.service;

import com.nosota.msale.external.RewardLedger;

/**
 * {@link RewardLedger} handle bound to one reward book.
 */
class BookRewardLedger implements RewardLedger {

    private final String bookName;
    private final RewardBookService rewardBookService;

    BookRewardLedger(String bookName, RewardBookService rewardBookService) {
        this.bookName = bookName;
        this.rewardBookService = rewardBookService;
    }

    @Override
    public void issue(String account, long amount) {
        rewardBookService.issue(bookName, account, amount);
    }

    @Override
    public boolean transfer(String from, String to, long amount) {
        return rewardBookService.transfer(bookName, from, to, amount);
    }

    @Override
    public long balanceOf(String account) {
        return rewardBookService.balanceOf(bookName, account);
    }

    @Override
    public void freezeIssuance() {
        rewardBookService.freezeIssuance(bookName);
    }

    @Override
    public void setLedgerReference(String issuer) {
        rewardBookService.bindIssuer(bookName, issuer);
    }

    @Override
    public void clearLedgerReference(String issuer) {
        rewardBookService.releaseIssuer(bookName, issuer);
    }

    @Override
    public String toString() {
        return "BookRewardLedger[" + bookName + "]";
    }
}
