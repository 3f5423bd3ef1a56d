package com.example.DnsQueryLog.config;

import com.example.DnsQueryLog.cache.RecentQueryCache;
import com.example.DnsQueryLog.codec.QueryLogEntryCodec;
import com.example.DnsQueryLog.repository.LogFileLock;
import com.example.DnsQueryLog.repository.QueryLogFileStore;
import com.example.DnsQueryLog.repository.QueryLogSettingsStore;
import com.example.DnsQueryLog.stats.TopStatsAggregator;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.nio.file.Path;
import java.time.Clock;

@Configuration
@EnableConfigurationProperties(QueryLogProperties.class)
public class QueryLogConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public LogFileLock logFileLock() {
        return new LogFileLock();
    }

    @Bean
    public QueryLogEntryCodec queryLogEntryCodec() {
        return new QueryLogEntryCodec();
    }

    @Bean
    public QueryLogFileStore queryLogFileStore(QueryLogProperties properties, LogFileLock logFileLock,
                                               QueryLogEntryCodec codec) {
        return new QueryLogFileStore(Path.of(properties.getFile()), logFileLock, codec);
    }

    @Bean
    public QueryLogSettingsStore queryLogSettingsStore(QueryLogProperties properties) {
        return new QueryLogSettingsStore(Path.of(properties.getSettingsFile()));
    }

    @Bean
    public RecentQueryCache recentQueryCache(QueryLogProperties properties) {
        return new RecentQueryCache(properties.getMemorySize());
    }

    @Bean
    public TopStatsAggregator topStatsAggregator(QueryLogProperties properties) {
        return new TopStatsAggregator(properties.getTopHours(), properties.getTopSize());
    }

    @Bean
    public ThreadPoolTaskScheduler queryLogTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("querylog-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        return scheduler;
    }
}
