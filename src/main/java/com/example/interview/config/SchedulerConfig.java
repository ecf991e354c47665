package com.example.interview.config;

import lombok.Data;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
@Data
public class SchedulerConfig {

    @Value("${scheduler.zone:UTC}")
    String zone;

    @Value("${scheduler.default-lead-time:PT24H}")
    Duration defaultLeadTime;

    @Value("${scheduler.default-search-horizon:P30D}")
    Duration defaultSearchHorizon;

    @Value("${scheduler.reschedule.max-attempts:3}")
    int maxRescheduleAttempts;

    @Value("${scheduler.external-timeout:PT10S}")
    Duration externalTimeout;

    @Value("${scheduler.gather.pool-size:8}")
    int gatherPoolSize;

    @Value("${scheduler.candidates.base-url}")
    String candidatesApiUrl;

    @Value("${scheduler.calendar.base-url:}")
    String calendarApiUrl;

    @Value("${scheduler.notifications.enabled:true}")
    boolean notificationsEnabled;

    @Value("${scheduler.notifications.base-url:}")
    String notificationsApiUrl;

    @Bean
    public Clock schedulerClock() {
        return Clock.system(ZoneId.of(zone));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService availabilityExecutor() {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = r -> {
            Thread t = new Thread(r, "availability-gather-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        return Executors.newFixedThreadPool(gatherPoolSize, factory);
    }

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder) {
        return builder
                .setConnectTimeout(externalTimeout)
                .setReadTimeout(externalTimeout)
                .build();
    }
}
