package com.fintracker.recurring.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "recurring.generation")
public record RecurringGenerationProperties(
        Integer horizonMonths,
        Integer parallelism,
        String triggerToken,
        Scheduler scheduler
) {
    public RecurringGenerationProperties {
        if (horizonMonths == null || horizonMonths < 1) {
            horizonMonths = 3;
        }
        if (parallelism == null || parallelism < 1) {
            parallelism = 4;
        }
        if (triggerToken != null && triggerToken.isBlank()) {
            triggerToken = null;
        }
        if (scheduler == null) {
            scheduler = new Scheduler(false, null);
        }
    }

    public boolean triggerTokenRequired() {
        return triggerToken != null;
    }

    public record Scheduler(boolean enabled, String cron) {
        public Scheduler {
            if (cron == null || cron.isBlank()) {
                cron = "0 0 3 * * *";
            }
        }
    }
}
