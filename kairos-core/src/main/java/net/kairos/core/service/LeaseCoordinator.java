package net.kairos.core.service;

import net.kairos.core.model.Lease;
import net.kairos.core.spi.LeaseRepository;
import net.kairos.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * job 단위 상호배제 lease.
 * 경합으로 인한 획득 실패는 오류가 아니다. 정확성은 실행 ledger의 유니크 제약이 보장하고
 * lease는 중복 핸들러 호출을 줄이는 역할만 한다.
 */
public final class LeaseCoordinator {
    private static final Logger log = LoggerFactory.getLogger(LeaseCoordinator.class);

    private final LeaseRepository leases;
    private final TxRunner tx;

    public LeaseCoordinator(LeaseRepository leases, TxRunner tx) {
        this.leases = leases;
        this.tx = tx;
    }

    public boolean tryAcquire(String jobName, String holderId, Duration lease) {
        try {
            boolean acquired = tx.requiresNew(() -> leases.tryAcquire(jobName, holderId, lease));
            if (!acquired) {
                log.debug("Lease for job '{}' is held by another instance", jobName);
            }
            return acquired;
        } catch (Exception e) {
            log.warn("Lease acquisition for job '{}' failed: {}", jobName, e.toString());
            return false;
        }
    }

    /** holder가 아니면 false. 저장소 오류는 그대로 던짐 (heartbeat에서 로그) */
    public boolean renew(String jobName, String holderId, Duration lease) throws Exception {
        return tx.requiresNew(() -> leases.renew(jobName, holderId, lease));
    }

    /** finally 에서 호출되므로 예외를 던지지 않는다. 실패해도 만료로 회수됨 */
    public void release(String jobName, String holderId) {
        try {
            boolean released = tx.requiresNew(() -> leases.release(jobName, holderId));
            if (!released) {
                log.debug("Lease for job '{}' was no longer held by {}", jobName, holderId);
            }
        } catch (Exception e) {
            log.warn("Lease release for job '{}' failed, it will expire on its own: {}", jobName, e.toString());
        }
    }

    public Optional<Lease> find(String jobName) throws Exception {
        return tx.required(() -> leases.findByJob(jobName));
    }
}
