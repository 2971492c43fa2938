package com.nosota.msale.service;

import com.nosota.msale.error.AuthorizationListNotFoundException;
import com.nosota.msale.error.UnauthorizedException;
import com.nosota.msale.external.AuthorizationOracle;
import com.nosota.msale.external.AuthorizationOracleProvider;
import com.nosota.msale.model.AuthorizationList;
import com.nosota.msale.model.AuthorizedAccount;
import com.nosota.msale.repository.AuthorizationListRepository;
import com.nosota.msale.repository.AuthorizedAccountRepository;
import jakarta.transaction.Transactional;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.time.Clock;

/**
 * Service for authorization lists, the built-in authorization oracles.
 *
 * <p>A list is owned by the account that opened it; only the owner may add or remove accounts.
 * Sales refer to a list by name and query it through {@link AuthorizationOracle}.
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class AuthorizationListService implements AuthorizationOracleProvider {

    private final AuthorizationListRepository authorizationListRepository;
    private final AuthorizedAccountRepository authorizedAccountRepository;
    private final Clock clock;

    @Transactional
    public AuthorizationList openList(@NotBlank String owner, @NotBlank String name) {
        if (authorizationListRepository.existsById(name)) {
            throw new IllegalArgumentException("Authorization list already exists: " + name);
        }
        log.info("Opened authorization list: name={}, owner={}", name, owner);
        return authorizationListRepository.save(new AuthorizationList(name, owner, clock.instant()));
    }

    public AuthorizationList getList(@NotBlank String name) {
        return authorizationListRepository.findById(name)
                .orElseThrow(() -> new AuthorizationListNotFoundException("Authorization list not found: " + name));
    }

    /**
     * Adds an account to a list. Adding a member again changes nothing.
     */
    @Transactional
    public void authorize(@NotBlank String name, @NotBlank String caller, @NotBlank String account) {
        requireOwner(getList(name), caller);

        if (!authorizedAccountRepository.existsByListNameAndAccount(name, account)) {
            authorizedAccountRepository.save(new AuthorizedAccount(name, account, clock.instant()));
            log.info("Authorized account {} in list {}", account, name);
        }
    }

    @Transactional
    public void revoke(@NotBlank String name, @NotBlank String caller, @NotBlank String account) {
        requireOwner(getList(name), caller);

        authorizedAccountRepository.findByListNameAndAccount(name, account)
                .ifPresent(member -> {
                    authorizedAccountRepository.delete(member);
                    log.info("Revoked account {} from list {}", account, name);
                });
    }

    public boolean isAuthorized(@NotBlank String name, @NotBlank String account) {
        return authorizedAccountRepository.existsByListNameAndAccount(name, account);
    }

    public long size(@NotBlank String name) {
        return authorizedAccountRepository.countByListName(name);
    }

    @Override
    public boolean exists(String name) {
        return name != null && authorizationListRepository.existsById(name);
    }

    @Override
    public AuthorizationOracle resolve(String name) {
        getList(name);
        return account -> authorizedAccountRepository.existsByListNameAndAccount(name, account);
    }

    private void requireOwner(AuthorizationList list, String caller) {
        if (!list.getOwner().equals(caller)) {
            throw new UnauthorizedException("Account " + caller + " does not own authorization list " + list.getName());
        }
    }
}
