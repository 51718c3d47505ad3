package net.kairos.integration.spring.sched;

import net.kairos.core.maintenance.MaintenanceService;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Duration;

/** 주기 정리 작업. job tick 자체는 CronJob 이 각자 돌린다 */
public class KairosSchedulers {
    private final MaintenanceService maintenance;

    private Duration staleAfter = Duration.ofHours(1);

    public KairosSchedulers(MaintenanceService maintenance) {
        this.maintenance = maintenance;
    }

    @Scheduled(fixedDelayString = "${kairos.scheduler.maintenance-delay-ms:60000}")
    public void maintenance() throws Exception {
        maintenance.runOnce(staleAfter);
    }

    public void setStaleAfter(Duration staleAfter) {
        this.staleAfter = staleAfter;
    }

    public Duration getStaleAfter() {
        return staleAfter;
    }
}
