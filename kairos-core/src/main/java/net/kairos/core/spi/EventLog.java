package net.kairos.core.spi;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** 외부 append-only 로그. 실패해도 실행 결과에는 영향 없음 (호출 측에서 흡수) */
@FunctionalInterface
public interface EventLog {
    void append(String logName, Object data) throws Exception;

    /** 기본값: 아무 데도 쓰지 않고 debug 로그만 */
    static EventLog discarding() {
        Logger log = LoggerFactory.getLogger(EventLog.class);
        return (logName, data) -> log.debug("event discarded: log='{}' data={}", logName, data);
    }
}
