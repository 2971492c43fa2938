package com.nosota.msale.scheduler;

import com.nosota.msale.model.Sale;
import com.nosota.msale.repository.SaleRepository;
import com.nosota.msale.service.SaleService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Scheduled job releasing vested rewards of finalized sales.
 *
 * <p>After finalization nobody contributes any more, but the remaining vesting intervals still
 * have to be paid out. The job calls {@link SaleService#releaseVestedRewards} on behalf of each
 * finalized sale's administrator; sales whose next interval is not due yet simply report false.
 *
 * <p>Configuration:
 * <pre>
 * scheduler:
 *   vesting-release:
 *     enabled: true                # enable/disable scheduler
 *     cron: "0 *&#47;10 * * * *"       # every 10 minutes
 * </pre>
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(
        value = "scheduler.vesting-release.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class VestingReleaseScheduler {

    private final SaleRepository saleRepository;
    private final SaleService saleService;

    @Scheduled(cron = "${scheduler.vesting-release.cron:0 */10 * * * *}")
    public void releaseVestedRewards() {
        log.info("Starting scheduled job: release vested rewards");

        List<Sale> sales = saleRepository.findByFinalizedTrueOrderByIdAsc();
        int released = 0;

        for (Sale sale : sales) {
            try {
                if (saleService.releaseVestedRewards(sale.getId(), sale.getAdministrator())) {
                    released++;
                }
            } catch (Exception e) {
                // continue with the next sale
                log.error("Failed to release vested rewards of sale {}: {}", sale.getId(), e.getMessage(), e);
            }
        }

        if (released > 0) {
            log.info("Released vested rewards for {} of {} finalized sales", released, sales.size());
        } else {
            log.debug("No vested rewards due among {} finalized sales", sales.size());
        }
    }
}
