package com.greenwashradar.pipeline.scheduler;

import com.greenwashradar.pipeline.checkpoint.CheckpointStore;
import com.greenwashradar.pipeline.config.PipelineProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;

/**
 * 보관 기간이 지난 완료 작업 정리 스케줄러.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ArchivedJobCleanupScheduler {

    private final CheckpointStore checkpointStore;
    private final PipelineProperties properties;

    @Value("${pipeline.cleanup.enabled:true}")
    private boolean cleanupEnabled;

    /**
     * 기본값: 매일 03:30
     */
    @Scheduled(cron = "${pipeline.cleanup.cron:0 30 3 * * *}")
    public void purgeArchivedJobs() {
        if (!cleanupEnabled) {
            log.debug("Archived job cleanup is disabled");
            return;
        }
        LocalDateTime cutoff = LocalDateTime.now().minusDays(properties.getRetentionDays());
        try {
            int purged = checkpointStore.purgeArchivedBefore(cutoff);
            if (purged > 0) {
                log.info("Purged {} archived jobs older than {}", purged, cutoff);
            }
        } catch (RuntimeException e) {
            log.error("Archived job cleanup failed: {}", e.getMessage(), e);
        }
    }
}
