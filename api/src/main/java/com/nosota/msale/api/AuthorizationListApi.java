package com.nosota.msale.api;

import com.nosota.msale.api.response.AuthorizationListResponse;
import com.nosota.msale.api.response.AuthorizationResponse;
import jakarta.validation.constraints.NotBlank;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Authorization list API interface.
 *
 * <p>Authorization lists are the built-in authorization oracles. The account opening a
 * list owns it and is the only one allowed to add or remove accounts.
 */
@RequestMapping("/api/v1/authorization-lists")
public interface AuthorizationListApi {

    @PostMapping
    ResponseEntity<AuthorizationListResponse> openList(
            @RequestHeader(ApiHeaders.ACCOUNT_ID) @NotBlank String caller,
            @RequestParam("name") @NotBlank String name);

    @GetMapping("/{name}")
    ResponseEntity<AuthorizationListResponse> getList(@PathVariable("name") String name);

    @PutMapping("/{name}/accounts/{account}")
    ResponseEntity<AuthorizationResponse> authorize(
            @PathVariable("name") String name,
            @PathVariable("account") String account,
            @RequestHeader(ApiHeaders.ACCOUNT_ID) @NotBlank String caller);

    @DeleteMapping("/{name}/accounts/{account}")
    ResponseEntity<AuthorizationResponse> revoke(
            @PathVariable("name") String name,
            @PathVariable("account") String account,
            @RequestHeader(ApiHeaders.ACCOUNT_ID) @NotBlank String caller);

    @GetMapping("/{name}/accounts/{account}")
    ResponseEntity<AuthorizationResponse> check(
            @PathVariable("name") String name,
            @PathVariable("account") String account);
}
