package com.nosota.msale.service;

import com.nosota.msale.error.IssuanceFrozenException;
import com.nosota.msale.error.RewardBookNotFoundException;
import com.nosota.msale.error.RewardBookUnavailableException;
import com.nosota.msale.model.RewardBalance;
import com.nosota.msale.model.RewardBook;
import com.nosota.msale.model.RewardEntry;
import com.nosota.msale.model.RewardEntryType;
import com.nosota.msale.repository.RewardBalanceRepository;
import com.nosota.msale.repository.RewardBookRepository;
import com.nosota.msale.repository.RewardEntryRepository;
import jakarta.transaction.Transactional;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.time.Clock;

/**
 * Service for reward books, the built-in reward-unit ledgers.
 *
 * <p>Every movement is recorded as an immutable {@link RewardEntry} and applied to the
 * {@link RewardBalance} rows of the accounts involved:
 * <ul>
 *   <li>ISSUE: credits new units; refused once issuance is frozen</li>
 *   <li>TRANSFER: debits one account and credits another; refused (returns false) on insufficient balance</li>
 * </ul>
 *
 * <p>Balance rows are locked in account order during a transfer so that concurrent transfers
 * between the same accounts cannot deadlock.
 *
 * <p>Sales do not call this service directly. They go through {@link com.nosota.msale.external.RewardLedger}
 * handles obtained from {@link RewardBookLedgerProvider}.
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class RewardBookService {

    private final RewardBookRepository rewardBookRepository;
    private final RewardBalanceRepository rewardBalanceRepository;
    private final RewardEntryRepository rewardEntryRepository;
    private final Clock clock;

    /**
     * Opens a new, empty reward book.
     *
     * @param name Unique book name
     * @return The created book
     * @throws IllegalArgumentException if a book with that name already exists
     */
    @Transactional
    public RewardBook openBook(@NotBlank String name) {
        if (rewardBookRepository.existsById(name)) {
            throw new IllegalArgumentException("Reward book already exists: " + name);
        }

        RewardBook book = new RewardBook(name, null, false, null, clock.instant());
        log.info("Opened reward book: name={}", name);
        return rewardBookRepository.save(book);
    }

    public RewardBook getBook(@NotBlank String name) {
        return rewardBookRepository.findById(name)
                .orElseThrow(() -> new RewardBookNotFoundException("Reward book not found: " + name));
    }

    public boolean exists(String name) {
        return name != null && rewardBookRepository.existsById(name);
    }

    public long balanceOf(@NotBlank String bookName, @NotBlank String account) {
        return rewardBalanceRepository.findByBookNameAndAccount(bookName, account)
                .map(RewardBalance::getBalance)
                .orElse(0L);
    }

    /**
     * Credits newly issued units to an account.
     *
     * @throws IssuanceFrozenException if the book's issuance is frozen
     * @throws ArithmeticException     if the balance would overflow
     */
    @Transactional
    public void issue(@NotBlank String bookName, @NotBlank String account, @PositiveOrZero long amount) {
        RewardBook book = lockBook(bookName);
        if (book.isIssuanceFrozen()) {
            throw new IssuanceFrozenException("Issuance of reward book " + bookName + " is frozen");
        }

        RewardBalance balance = lockBalance(bookName, account);
        balance.setBalance(Math.addExact(balance.getBalance(), amount));
        rewardBalanceRepository.save(balance);

        rewardEntryRepository.save(RewardEntry.builder()
                .bookName(bookName)
                .type(RewardEntryType.ISSUE)
                .toAccount(account)
                .amount(amount)
                .issuer(book.getIssuer())
                .createdAt(clock.instant())
                .build());

        log.debug("Issued {} units in book {} to {}", amount, bookName, account);
    }

    /**
     * Moves units between two accounts of the same book.
     *
     * @return false if {@code from} holds less than {@code amount}; nothing is changed then
     */
    @Transactional
    public boolean transfer(@NotBlank String bookName, @NotBlank String from, @NotBlank String to,
                            @PositiveOrZero long amount) {
        // the book lock serializes creation of missing balance rows
        lockBook(bookName);

        // lock in account order
        boolean fromFirst = from.compareTo(to) <= 0;
        RewardBalance first = lockBalance(bookName, fromFirst ? from : to);
        RewardBalance second = from.equals(to) ? first : lockBalance(bookName, fromFirst ? to : from);
        RewardBalance source = fromFirst ? first : second;
        RewardBalance target = fromFirst ? second : first;

        if (source.getBalance() < amount) {
            log.warn("Transfer refused in book {}: {} holds {}, requested {}", bookName, from, source.getBalance(), amount);
            return false;
        }

        if (source != target) {
            source.setBalance(Math.subtractExact(source.getBalance(), amount));
            target.setBalance(Math.addExact(target.getBalance(), amount));
            rewardBalanceRepository.save(source);
            rewardBalanceRepository.save(target);
        }

        rewardEntryRepository.save(RewardEntry.builder()
                .bookName(bookName)
                .type(RewardEntryType.TRANSFER)
                .fromAccount(from)
                .toAccount(to)
                .amount(amount)
                .createdAt(clock.instant())
                .build());

        log.debug("Transferred {} units in book {}: {} → {}", amount, bookName, from, to);
        return true;
    }

    /**
     * Freezes issuance. Calling it on a frozen book changes nothing.
     */
    @Transactional
    public void freezeIssuance(@NotBlank String bookName) {
        RewardBook book = lockBook(bookName);
        if (book.isIssuanceFrozen()) {
            return;
        }
        book.setIssuanceFrozen(true);
        book.setFrozenAt(clock.instant());
        rewardBookRepository.save(book);
        log.info("Froze issuance of reward book {}", bookName);
    }

    /**
     * Wires {@code issuer} as the issuing authority of the book. A book serves one issuer at a time.
     *
     * @throws RewardBookUnavailableException if another issuer is wired or issuance is frozen
     */
    @Transactional
    public void bindIssuer(@NotBlank String bookName, @NotBlank String issuer) {
        RewardBook book = lockBook(bookName);
        if (book.isIssuanceFrozen()) {
            throw new RewardBookUnavailableException("Issuance of reward book " + bookName + " is frozen");
        }
        if (book.getIssuer() != null && !book.getIssuer().equals(issuer)) {
            throw new RewardBookUnavailableException("Reward book " + bookName + " already issues for " + book.getIssuer());
        }
        book.setIssuer(issuer);
        rewardBookRepository.save(book);
        log.info("Reward book {} issuer set to {}", bookName, issuer);
    }

    /**
     * Unwires {@code issuer}. Does nothing when another issuer, or none, is wired.
     */
    @Transactional
    public void releaseIssuer(@NotBlank String bookName, @NotBlank String issuer) {
        RewardBook book = lockBook(bookName);
        if (!issuer.equals(book.getIssuer())) {
            return;
        }
        book.setIssuer(null);
        rewardBookRepository.save(book);
        log.info("Reward book {} released by issuer {}", bookName, issuer);
    }

    private RewardBook lockBook(String bookName) {
        RewardBook book = rewardBookRepository.getOneForUpdate(bookName);
        if (book == null) {
            throw new RewardBookNotFoundException("Reward book not found: " + bookName);
        }
        return book;
    }

    private RewardBalance lockBalance(String bookName, String account) {
        return rewardBalanceRepository.findForUpdate(bookName, account)
                .orElseGet(() -> rewardBalanceRepository.save(new RewardBalance(bookName, account)));
    }
}
