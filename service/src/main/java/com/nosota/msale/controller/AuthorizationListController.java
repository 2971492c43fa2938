package com.nosota.msale.controller;

import com.nosota.msale.api.AuthorizationListApi;
import com.nosota.msale.api.response.AuthorizationListResponse;
import com.nosota.msale.api.response.AuthorizationResponse;
import com.nosota.msale.model.AuthorizationList;
import com.nosota.msale.service.AuthorizationListService;
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
public class AuthorizationListController implements AuthorizationListApi {

    private final AuthorizationListService authorizationListService;

    @Override
    public ResponseEntity<AuthorizationListResponse> openList(String caller, String name) {
        AuthorizationList list = authorizationListService.openList(caller, name);
        return ResponseEntity.status(HttpStatus.CREATED).body(
                new AuthorizationListResponse(list.getName(), list.getOwner(), 0L));
    }

    @Override
    public ResponseEntity<AuthorizationListResponse> getList(String name) {
        AuthorizationList list = authorizationListService.getList(name);
        return ResponseEntity.ok(new AuthorizationListResponse(
                list.getName(), list.getOwner(), authorizationListService.size(name)));
    }

    @Override
    public ResponseEntity<AuthorizationResponse> authorize(String name, String account, String caller) {
        authorizationListService.authorize(name, caller, account);
        return ResponseEntity.ok(new AuthorizationResponse(name, account, true));
    }

    @Override
    public ResponseEntity<AuthorizationResponse> revoke(String name, String account, String caller) {
        authorizationListService.revoke(name, caller, account);
        return ResponseEntity.ok(new AuthorizationResponse(name, account, false));
    }

    @Override
    public ResponseEntity<AuthorizationResponse> check(String name, String account) {
        authorizationListService.getList(name);
        boolean authorized = authorizationListService.isAuthorized(name, account);
        return ResponseEntity.ok(new AuthorizationResponse(name, account, authorized));
    }
}
