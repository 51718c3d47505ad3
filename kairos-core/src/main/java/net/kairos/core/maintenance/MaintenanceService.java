package net.kairos.core.maintenance;

import net.kairos.core.spi.Clock;
import net.kairos.core.spi.ExecutionRepository;
import net.kairos.core.spi.LeaseRepository;
import net.kairos.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;

public final class MaintenanceService {
    private static final Logger log = LoggerFactory.getLogger(MaintenanceService.class);

    public static final String ABANDONED_REASON = "abandoned: no outcome recorded";

    private final LeaseRepository leases;
    private final ExecutionRepository executions;
    private final TxRunner tx;
    private final Clock clock;

    public MaintenanceService(LeaseRepository leases,
                              ExecutionRepository executions,
                              TxRunner tx,
                              Clock clock) {
        this.leases = leases;
        this.executions = executions;
        this.tx = tx;
        this.clock = clock;
    }

    /**
     * 주기 점검.
     * - 만료된 lease 행 삭제
     * - staleAfter 보다 오래 RUNNING 인 실행을 FAILED로 마감 (프로세스가 죽어 결과가 안 남은 경우)
     */
    public MaintenanceReport runOnce(Duration staleAfter) throws Exception {
        Instant now = clock.now();

        int expired = tx.required(leases::deleteExpired);

        int abandoned = 0;
        if (staleAfter != null && !staleAfter.isZero() && !staleAfter.isNegative()) {
            Instant threshold = now.minus(staleAfter);
            abandoned = tx.required(() -> executions.failAbandoned(threshold, ABANDONED_REASON));
        }

        MaintenanceReport r = new MaintenanceReport(now, expired, abandoned);
        if (expired > 0 || abandoned > 0) {
            log.info("Maintenance: {}", r);
        }
        return r;
    }

    public record MaintenanceReport(Instant timestamp, int expiredLeases, int abandonedExecutions) { }
}
