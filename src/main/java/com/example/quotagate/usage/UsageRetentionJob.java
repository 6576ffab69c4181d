package com.example.quotagate.usage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

/** Deletes usage records whose billing period ended longer ago than the retention. */
@Component
public class UsageRetentionJob {

    private static final Logger log = LoggerFactory.getLogger(UsageRetentionJob.class);

    private final UsageRecordRepository records;
    private final UsageSampler sampler;
    private final UsageProperties props;
    private final Clock clock;

    public UsageRetentionJob(UsageRecordRepository records, UsageSampler sampler, UsageProperties props, Clock clock) {
        this.records = records;
        this.sampler = sampler;
        this.props = props;
        this.clock = clock;
    }

    @Scheduled(
            fixedDelayString = "${admission.usage.purge-interval:PT1H}",
            initialDelayString = "${admission.usage.purge-interval:PT1H}"
    )
    @Transactional
    public int purge() {
        Instant now = clock.instant();
        Instant cutoff = now.atOffset(ZoneOffset.UTC).minus(props.getRetention()).toInstant();
        int deleted = records.deleteEndedBefore(cutoff);
        sampler.evictEndedBefore(now);
        if (deleted > 0) {
            log.info("Purged {} usage records with billing period ended before {}", deleted, cutoff);
        }
        return deleted;
    }
}
