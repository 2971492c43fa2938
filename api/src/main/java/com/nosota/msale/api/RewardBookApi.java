package com.nosota.msale.api;

import com.nosota.msale.api.response.BalanceResponse;
import com.nosota.msale.api.response.RewardBookResponse;
import jakarta.validation.constraints.NotBlank;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Reward book API interface.
 *
 * <p>Reward books are the built-in reward ledgers a sale issues into. Issuance and
 * transfers only happen through sale operations; this API opens books and reads them.
 */
@RequestMapping("/api/v1/reward-books")
public interface RewardBookApi {

    @PostMapping
    ResponseEntity<RewardBookResponse> openBook(@RequestParam("name") @NotBlank String name);

    @GetMapping("/{name}")
    ResponseEntity<RewardBookResponse> getBook(@PathVariable("name") String name);

    @GetMapping("/{name}/balances/{account}")
    ResponseEntity<BalanceResponse> getBalance(
            @PathVariable("name") String name,
            @PathVariable("account") String account);
}
