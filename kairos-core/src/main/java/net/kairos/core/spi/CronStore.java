package net.kairos.core.spi;

/**
 * 스케줄러가 소비하는 저장소 묶음.
 * 구현체는 같은 관계형 저장소를 공유하는 repository들과 TxRunner를 제공한다.
 */
public interface CronStore {
    TxRunner tx();

    JobRepository jobs();

    ExecutionRepository executions();

    LeaseRepository leases();

    SqlOperations sql();

    OutputCodec codec();

    /**
     * 접속 가능 여부와 관계형(지원 dialect) 여부 확인.
     * 실패 시 IllegalStateException. 빌드 시점에 바로 드러나게.
     */
    void verify();
}
