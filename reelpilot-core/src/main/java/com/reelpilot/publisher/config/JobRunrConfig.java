package com.reelpilot.publisher.config;

import lombok.extern.slf4j.Slf4j;
import org.jobrunr.jobs.mappers.JobMapper;
import org.jobrunr.scheduling.JobScheduler;
import org.jobrunr.server.BackgroundJobServer;
import org.jobrunr.server.BackgroundJobServerConfiguration;
import org.jobrunr.server.JobActivator;
import org.jobrunr.storage.StorageProvider;
import org.jobrunr.storage.sql.common.SqlStorageProviderFactory;
import org.jobrunr.utils.mapper.JsonMapper;
import org.jobrunr.utils.mapper.jackson.JacksonJsonMapper;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;

/**
 * Job storage shares the application datasource. The background server runs the recurring
 * upload and cleanup jobs with the worker count and poll interval from {@code app.jobs}.
 */
@Configuration
@Slf4j
public class JobRunrConfig {

    @Bean
    public JsonMapper jobRunrJsonMapper() {
        return new JacksonJsonMapper();
    }

    @Bean
    public StorageProvider storageProvider(DataSource dataSource, JsonMapper jobRunrJsonMapper) {
        StorageProvider storageProvider = SqlStorageProviderFactory.using(dataSource);
        storageProvider.setJobMapper(new JobMapper(jobRunrJsonMapper));
        return storageProvider;
    }

    @Bean
    public JobScheduler jobScheduler(StorageProvider storageProvider) {
        return new JobScheduler(storageProvider);
    }

    @Bean
    public JobActivator jobActivator(ApplicationContext applicationContext) {
        return applicationContext::getBean;
    }

    @Bean
    public BackgroundJobServerConfiguration backgroundJobServerConfiguration(PublisherProperties properties) {
        PublisherProperties.Jobs jobs = properties.getJobs();
        return BackgroundJobServerConfiguration.usingStandardBackgroundJobServerConfiguration()
                .andWorkerCount(jobs.getWorkerCount())
                .andPollIntervalInSeconds(jobs.getPollIntervalSeconds());
    }

    // stopped with the context so no new cycle starts during shutdown
    @Bean(destroyMethod = "stop")
    public BackgroundJobServer backgroundJobServer(StorageProvider storageProvider, JsonMapper jobRunrJsonMapper,
                                                   JobActivator jobActivator,
                                                   BackgroundJobServerConfiguration configuration) {
        BackgroundJobServer server = new BackgroundJobServer(storageProvider, jobRunrJsonMapper, jobActivator, configuration);
        server.start();
        log.info("Background job server started");
        return server;
    }
}
