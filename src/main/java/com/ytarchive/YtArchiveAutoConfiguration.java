package com.ytarchive;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.ytarchive.collaborator.ArchiveStorage;
import com.ytarchive.collaborator.MetadataService;
import com.ytarchive.collaborator.VideoDownloader;
import com.ytarchive.config.YtArchiveProperties;
import com.ytarchive.internal.FileJobRepository;
import com.ytarchive.internal.FileRecoveryPlanRepository;
import com.ytarchive.internal.JobCleaner;
import com.ytarchive.internal.JsonLinesErrorReportSink;
import com.ytarchive.internal.YtArchiveMetrics;
import com.ytarchive.recovery.ErrorRecoveryManager;
import com.ytarchive.recovery.ErrorReportSink;
import com.ytarchive.recovery.ErrorReporter;
import com.ytarchive.recovery.ServiceErrorHandler;
import com.ytarchive.recovery.strategy.AdaptiveMetricsRegistry;
import com.ytarchive.recovery.strategy.CircuitBreakerRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;

@AutoConfiguration(afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@EnableScheduling
@EnableConfigurationProperties(YtArchiveProperties.class)
public class YtArchiveAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(name = "ytarchiveObjectMapper")
    public ObjectMapper ytarchiveObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean
    @ConditionalOnMissingBean(name = "ytarchiveClock")
    public Clock ytarchiveClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public JobRepository jobRepository(YtArchiveProperties properties,
            @Qualifier("ytarchiveObjectMapper") ObjectMapper objectMapper) {
        YtArchiveProperties.Storage storage = properties.getStorage();
        return new FileJobRepository(Path.of(storage.getBaseDir(), storage.getJobsDir()), objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public RecoveryPlanRepository recoveryPlanRepository(YtArchiveProperties properties,
            @Qualifier("ytarchiveObjectMapper") ObjectMapper objectMapper) {
        YtArchiveProperties.Storage storage = properties.getStorage();
        return new FileRecoveryPlanRepository(Path.of(storage.getBaseDir(), storage.getRecoveryPlanFile()),
                objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public ErrorReportSink errorReportSink(YtArchiveProperties properties,
            @Qualifier("ytarchiveObjectMapper") ObjectMapper objectMapper) {
        YtArchiveProperties.Storage storage = properties.getStorage();
        return new JsonLinesErrorReportSink(Path.of(storage.getBaseDir(), storage.getReportsDir()), objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public ErrorReporter errorReporter(ErrorReportSink errorReportSink,
            @Qualifier("ytarchiveClock") Clock clock) {
        return new ErrorReporter(errorReportSink, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public ErrorRecoveryManager errorRecoveryManager(ErrorReporter errorReporter,
            @Qualifier("ytarchiveClock") Clock clock) {
        return new ErrorRecoveryManager(errorReporter, new CircuitBreakerRegistry(), new AdaptiveMetricsRegistry(),
                clock);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean({MetadataService.class, VideoDownloader.class, ArchiveStorage.class})
    public JobOrchestrator jobOrchestrator(JobRepository jobRepository,
            RecoveryPlanRepository recoveryPlanRepository,
            ErrorRecoveryManager errorRecoveryManager,
            MetadataService metadataService,
            VideoDownloader videoDownloader,
            ArchiveStorage archiveStorage,
            ObjectProvider<ServiceErrorHandler> serviceErrorHandlers,
            YtArchiveProperties properties,
            @Qualifier("ytarchiveClock") Clock clock) {
        List<ServiceErrorHandler> handlers = serviceErrorHandlers.orderedStream().toList();
        return new JobOrchestrator(jobRepository, recoveryPlanRepository, errorRecoveryManager, metadataService,
                videoDownloader, archiveStorage, handlers, properties, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "ytarchive.background-job-server", name = "enabled", havingValue = "true", matchIfMissing = true)
    public JobCleaner jobCleaner(JobRepository jobRepository, YtArchiveProperties properties,
            @Qualifier("ytarchiveClock") Clock clock) {
        return new JobCleaner(jobRepository, properties, clock);
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(MeterRegistry.class)
    static class MetricsConfiguration {

        @Bean
        @ConditionalOnBean(MeterRegistry.class)
        public YtArchiveMetrics ytarchiveMetrics(JobRepository jobRepository,
                ErrorRecoveryManager errorRecoveryManager, MeterRegistry meterRegistry) {
            return new YtArchiveMetrics(jobRepository, errorRecoveryManager, meterRegistry);
        }
    }
}
