package net.kairos.core.job;

import net.kairos.core.spi.EventLog;
import net.kairos.core.spi.SqlOperations;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;

/** 핸들러 한 번의 호출 컨텍스트 */
public final class CronContext {
    private static final Logger log = LoggerFactory.getLogger(CronContext.class);

    private final String jobName;
    private final Instant scheduledTime;
    private final Instant actualTime;
    private final String executionId;
    private final SqlOperations db;
    private final EventLog eventLog;

    public CronContext(String jobName,
                       Instant scheduledTime,
                       Instant actualTime,
                       String executionId,
                       SqlOperations db,
                       EventLog eventLog) {
        this.jobName = jobName;
        this.scheduledTime = scheduledTime;
        this.actualTime = actualTime;
        this.executionId = executionId;
        this.db = db;
        this.eventLog = eventLog;
    }

    public String jobName() { return jobName; }
    public Instant scheduledTime() { return scheduledTime; }
    public Instant actualTime() { return actualTime; }
    public String executionId() { return executionId; }
    public SqlOperations db() { return db; }

    /**
     * 외부 이벤트 로그에 기록. 실패해도 실행을 실패시키지 않는다.
     * @return 기록 성공 여부
     */
    public boolean emit(String logName, Object data) {
        try {
            eventLog.append(logName, data);
            return true;
        } catch (Exception e) {
            log.warn("Emit to '{}' failed for execution {}: {}", logName, executionId, e.toString());
            return false;
        }
    }
}
