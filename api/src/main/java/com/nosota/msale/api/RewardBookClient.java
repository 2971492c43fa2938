package com.nosota.msale.api;

import com.nosota.msale.api.response.BalanceResponse;
import com.nosota.msale.api.response.RewardBookResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;

@RequiredArgsConstructor
@Slf4j
public class RewardBookClient implements RewardBookApi {

    private final WebClient webClient;

    @Override
    public ResponseEntity<RewardBookResponse> openBook(String name) {
        log.debug("Calling openBook: name={}", name);

        return webClient.post()
                .uri(uriBuilder -> uriBuilder
                        .path("/api/v1/reward-books")
                        .queryParam("name", name)
                        .build())
                .retrieve()
                .toEntity(RewardBookResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<RewardBookResponse> getBook(String name) {
        return webClient.get()
                .uri("/api/v1/reward-books/{name}", name)
                .retrieve()
                .toEntity(RewardBookResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<BalanceResponse> getBalance(String name, String account) {
        log.debug("Calling getBalance: book={}, account={}", name, account);

        return webClient.get()
                .uri("/api/v1/reward-books/{name}/balances/{account}", name, account)
                .retrieve()
                .toEntity(BalanceResponse.class)
                .block();
    }
}
