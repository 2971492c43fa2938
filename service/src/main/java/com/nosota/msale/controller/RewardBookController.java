package com.nosota.msale.controller;

import com.nosota.msale.api.RewardBookApi;
import com.nosota.msale.api.response.BalanceResponse;
import com.nosota.msale.api.response.RewardBookResponse;
import com.nosota.msale.model.RewardBook;
import com.nosota.msale.service.RewardBookService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Validated
@RequiredArgsConstructor
@Slf4j
public class RewardBookController implements RewardBookApi {

    private final RewardBookService rewardBookService;

    @Override
    public ResponseEntity<RewardBookResponse> openBook(String name) {
        RewardBook book = rewardBookService.openBook(name);
        return ResponseEntity.status(HttpStatus.CREATED).body(toResponse(book));
    }

    @Override
    public ResponseEntity<RewardBookResponse> getBook(String name) {
        return ResponseEntity.ok(toResponse(rewardBookService.getBook(name)));
    }

    @Override
    public ResponseEntity<BalanceResponse> getBalance(String name, String account) {
        rewardBookService.getBook(name);
        long balance = rewardBookService.balanceOf(name, account);
        return ResponseEntity.ok(new BalanceResponse(name, account, balance));
    }

    private RewardBookResponse toResponse(RewardBook book) {
        return new RewardBookResponse(book.getName(), book.getIssuer(), book.isIssuanceFrozen());
    }
}
