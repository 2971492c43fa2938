package com.nosota.msale;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.nosota.msale.api.request.CreateSaleRequest;
import com.nosota.msale.model.Sale;
import com.nosota.msale.repository.SaleEventRepository;
import com.nosota.msale.service.AuthorizationListService;
import com.nosota.msale.service.RewardBookService;
import com.nosota.msale.service.SaleAdministrationService;
import com.nosota.msale.service.SaleService;
import com.nosota.msale.service.VestingLedgerService;
import com.nosota.msale.support.MutableClock;
import com.nosota.msale.support.TestClockConfig;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

@SpringBootTest(classes = MsaleApplication.class)
@AutoConfigureMockMvc
@Import(TestClockConfig.class)
@ActiveProfiles("test")
public abstract class TestBase {

    protected static final Duration WINDOW_OFFSET = Duration.ofHours(1);
    protected static final Duration WINDOW_LENGTH = Duration.ofDays(1);
    protected static final Duration UNLOCK_AFTER_END = Duration.ofHours(1);
    protected static final Duration INTERVAL = Duration.ofDays(1);
    protected static final int NUM_INTERVALS = 4;

    @Autowired
    protected SaleService saleService;

    @Autowired
    protected SaleAdministrationService saleAdministrationService;

    @Autowired
    protected VestingLedgerService vestingLedgerService;

    @Autowired
    protected RewardBookService rewardBookService;

    @Autowired
    protected AuthorizationListService authorizationListService;

    @Autowired
    protected SaleEventRepository saleEventRepository;

    @Autowired
    protected MutableClock clock;

    @Autowired
    protected MockMvc mockMvc;

    @Autowired
    protected ObjectMapper objectMapper;

    // Counter for unique account, list and book names; the database is shared by all tests
    private static final AtomicLong nameCounter = new AtomicLong(1);

    @BeforeEach
    void resetClock() {
        clock.setInstant(TestClockConfig.T0);
    }

    protected String unique(String prefix) {
        return prefix + "-" + nameCounter.getAndIncrement();
    }

    /**
     * Helper method to open an authorization list owned by {@code owner} with the given members.
     */
    protected String openAuthorizationList(String owner, String... accounts) {
        String name = unique("list");
        authorizationListService.openList(owner, name);
        for (String account : accounts) {
            authorizationListService.authorize(name, owner, account);
        }
        return name;
    }

    protected String openRewardBook() {
        String name = unique("book");
        rewardBookService.openBook(name);
        return name;
    }

    /**
     * Sale request with rate 5, administrator rate 1, bonus 20%, capacity 1000, contributions 1..500.
     * The window opens one hour from now and lasts a day; vesting unlocks one hour after it closes
     * and runs four daily intervals.
     */
    protected CreateSaleRequest saleRequest(String authorizationList, String rewardBook) {
        return saleRequest(authorizationList, rewardBook, 1000L, 1L, 500L);
    }

    protected CreateSaleRequest saleRequest(String authorizationList, String rewardBook,
                                            long capacity, long minContribution, long maxContribution) {
        Instant start = clock.instant().plus(WINDOW_OFFSET);
        Instant end = start.plus(WINDOW_LENGTH);
        return new CreateSaleRequest(
                start,
                end,
                5L,
                1L,
                20L,
                capacity,
                minContribution,
                maxContribution,
                end.plus(UNLOCK_AFTER_END),
                INTERVAL.getSeconds(),
                NUM_INTERVALS,
                authorizationList,
                rewardBook
        );
    }

    protected Sale createSale(String administrator, String authorizationList, String rewardBook) {
        return saleAdministrationService.createSale(administrator, saleRequest(authorizationList, rewardBook));
    }

    protected void moveToOpenWindow(Sale sale) {
        clock.setInstant(sale.getWindow().getStartTime().plusSeconds(1));
    }

    protected void moveAfterWindow(Sale sale) {
        clock.setInstant(sale.getWindow().getEndTime().plusSeconds(1));
    }

    /**
     * Moves the clock into vesting interval {@code interval} (1-based) of the sale's schedule.
     */
    protected void moveIntoInterval(Sale sale, int interval) {
        Instant unlock = vestingLedgerService.getSchedule(sale.getVestingScheduleId()).getUnlockDate();
        clock.setInstant(unlock.plus(INTERVAL.multipliedBy(interval - 1)).plusSeconds(1));
    }

    protected long balance(String rewardBook, String account) {
        return rewardBookService.balanceOf(rewardBook, account);
    }
}
