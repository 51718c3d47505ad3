package net.kairos.core.job;

import net.kairos.core.spi.WorkflowLauncher;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * 스케줄된 시각마다 호출되는 사용자 핸들러.
 * 반환값은 직렬화되어 실행 이력의 output이 되고, 예외는 FAILED 실행으로 기록된다.
 */
@FunctionalInterface
public interface CronHandler<T> {
    T handle(CronContext ctx) throws Exception;

    /** 핸들러 대신 workflow를 시작하고 결과를 기다린다. workflowId = cron_&lt;executionId&gt; */
    static <I, O> CronHandler<O> workflow(WorkflowLauncher<I, O> launcher, Function<CronContext, I> inputFn) {
        return ctx -> launcher.start("cron_" + ctx.executionId(), inputFn.apply(ctx)).result();
    }

    /** 입력 함수가 없으면 scheduledTime/actualTime/executionId 맵을 넘김 */
    static <O> CronHandler<O> workflow(WorkflowLauncher<Map<String, Object>, O> launcher) {
        return workflow(launcher, ctx -> {
            Map<String, Object> input = new LinkedHashMap<>();
            input.put("scheduledTime", ctx.scheduledTime());
            input.put("actualTime", ctx.actualTime());
            input.put("executionId", ctx.executionId());
            return input;
        });
    }
}
