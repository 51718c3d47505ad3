package net.kairos.core.spi;

import net.kairos.core.model.Lease;

import java.time.Duration;
import java.util.Optional;

public interface LeaseRepository {
    /** 없음 / 동일 holder / 만료 중 하나일 때만 기록. 반영 여부 반환 */
    boolean tryAcquire(String jobName, String holderId, Duration lease) throws Exception;

    /** 여전히 holder일 때만 expires_at 연장 */
    boolean renew(String jobName, String holderId, Duration lease) throws Exception;

    /** holder일 때만 삭제 */
    boolean release(String jobName, String holderId) throws Exception;

    Optional<Lease> findByJob(String jobName) throws Exception;

    /** 만료된 행 일괄 삭제 (정리용, 정확성과 무관) */
    int deleteExpired() throws Exception;
}
