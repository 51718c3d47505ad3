package net.kairos.core.spi;

/** cron이 핸들러 대신 durable workflow를 시작할 때 쓰는 SPI */
public interface WorkflowLauncher<I, O> {
    WorkflowHandle<O> start(String workflowId, I input) throws Exception;

    interface WorkflowHandle<O> {
        String workflowId();

        /** 완료까지 대기 */
        O result() throws Exception;
    }
}
