package com.nosota.msale.api;

import com.nosota.msale.api.response.AuthorizationListResponse;
import com.nosota.msale.api.response.AuthorizationResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;

@RequiredArgsConstructor
@Slf4j
public class AuthorizationListClient implements AuthorizationListApi {

    private final WebClient webClient;

    @Override
    public ResponseEntity<AuthorizationListResponse> openList(String caller, String name) {
        log.debug("Calling openList: name={}, caller={}", name, caller);

        return webClient.post()
                .uri(uriBuilder -> uriBuilder
                        .path("/api/v1/authorization-lists")
                        .queryParam("name", name)
                        .build())
                .header(ApiHeaders.ACCOUNT_ID, caller)
                .retrieve()
                .toEntity(AuthorizationListResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<AuthorizationListResponse> getList(String name) {
        return webClient.get()
                .uri("/api/v1/authorization-lists/{name}", name)
                .retrieve()
                .toEntity(AuthorizationListResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<AuthorizationResponse> authorize(String name, String account, String caller) {
        log.debug("Calling authorize: list={}, account={}", name, account);

        return webClient.put()
                .uri("/api/v1/authorization-lists/{name}/accounts/{account}", name, account)
                .header(ApiHeaders.ACCOUNT_ID, caller)
                .retrieve()
                .toEntity(AuthorizationResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<AuthorizationResponse> revoke(String name, String account, String caller) {
        log.debug("Calling revoke: list={}, account={}", name, account);

        return webClient.delete()
                .uri("/api/v1/authorization-lists/{name}/accounts/{account}", name, account)
                .header(ApiHeaders.ACCOUNT_ID, caller)
                .retrieve()
                .toEntity(AuthorizationResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<AuthorizationResponse> check(String name, String account) {
        return webClient.get()
                .uri("/api/v1/authorization-lists/{name}/accounts/{account}", name, account)
                .retrieve()
                .toEntity(AuthorizationResponse.class)
                .block();
    }
}
