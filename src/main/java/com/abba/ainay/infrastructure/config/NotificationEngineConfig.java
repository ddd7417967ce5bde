package com.abba.ainay.infrastructure.config;

import com.abba.ainay.application.notification.DispatchSettings;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.time.ZoneId;

@Configuration
@EnableScheduling
@Slf4j
public class NotificationEngineConfig {

    public static final String PUSH_EXECUTOR = "pushDispatchExecutor";
    public static final String TELEGRAM_EXECUTOR = "telegramDispatchExecutor";
    public static final String EMAIL_EXECUTOR = "emailDispatchExecutor";

    @Bean
    public Clock clock(NotificationProperties properties) {
        if (properties.getZone() == null || properties.getZone().isBlank()) {
            return Clock.systemDefaultZone();
        }
        return Clock.system(ZoneId.of(properties.getZone()));
    }

    @Bean
    public DispatchSettings dispatchSettings(NotificationProperties properties) {
        DispatchSettings settings = properties.toSettings();
        log.info("Missed-dose notifications enabled={} tiers={} maxMinutesPast={} maxConcurrentSends={}",
                settings.enabled(), settings.tiers(), settings.maxMinutesPast(), settings.maxConcurrentSends());
        return settings;
    }

    @Bean(name = PUSH_EXECUTOR)
    public ThreadPoolTaskExecutor pushDispatchExecutor(NotificationProperties properties) {
        return channelExecutor("push-", properties.getMaxConcurrentSends());
    }

    @Bean(name = TELEGRAM_EXECUTOR)
    public ThreadPoolTaskExecutor telegramDispatchExecutor(NotificationProperties properties) {
        return channelExecutor("telegram-", properties.getMaxConcurrentSends());
    }

    @Bean(name = EMAIL_EXECUTOR)
    public ThreadPoolTaskExecutor emailDispatchExecutor(NotificationProperties properties) {
        return channelExecutor("email-", properties.getMaxConcurrentSends());
    }

    /**
     * One pool per channel: a provider that stops answering ties up its own threads only.
     */
    static ThreadPoolTaskExecutor channelExecutor(String threadNamePrefix, int maxConcurrentSends) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        int size = Math.max(1, maxConcurrentSends);
        executor.setCorePoolSize(size);
        executor.setMaxPoolSize(size);
        executor.setQueueCapacity(size * 10);
        executor.setThreadNamePrefix(threadNamePrefix);
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }
}
