package net.kairos.core.spi;

import java.util.concurrent.Callable;

/**
 * 트랜잭션 경계. repository 호출은 모두 이 안에서 실행된다.
 * required: 진행 중 트랜잭션이 있으면 참여, requiresNew: 항상 새 트랜잭션.
 */
public interface TxRunner {
    <T> T required(Callable<T> body) throws Exception;
    <T> T requiresNew(Callable<T> body) throws Exception;
    default void required(Runnable body) throws Exception { required(() -> { body.run(); return null; }); }
    default void requiresNew(Runnable body) throws Exception { requiresNew(() -> { body.run(); return null; }); }

    /** 트랜잭션 관리가 필요 없는 저장소(인메모리 등)용 */
    static TxRunner direct() {
        return new TxRunner() {
            @Override public <T> T required(Callable<T> body) throws Exception { return body.call(); }
            @Override public <T> T requiresNew(Callable<T> body) throws Exception { return body.call(); }
        };
    }
}
