package io.refactor.flowscheduler.config;

import io.refactor.flowscheduler.registry.DispatchLoop;
import io.refactor.flowscheduler.registry.JobRegistry;
import io.refactor.flowscheduler.service.ScheduleRunHandler;
import net.javacrumbs.shedlock.core.LockProvider;
import net.javacrumbs.shedlock.provider.jdbctemplate.JdbcTemplateLockProvider;
import net.javacrumbs.shedlock.spring.annotation.EnableSchedulerLock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.SmartLifecycle;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import javax.sql.DataSource;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

@Configuration
@EnableScheduling
@EnableSchedulerLock(defaultLockAtMostFor = "PT5M")
@EnableConfigurationProperties(FlowSchedulerProperties.class)
public class SchedulerConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public JobRegistry jobRegistry() {
        return new JobRegistry();
    }

    @Bean
    public DispatchLoop dispatchLoop(JobRegistry registry, ScheduleRunHandler handler, Clock clock,
                                     FlowSchedulerProperties props) {
        int threads = Math.max(1, props.getWorkerThreads());
        ExecutorService workers = new ThreadPoolExecutor(threads, threads, 0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(), new CustomizableThreadFactory("schedule-worker-"));
        return new DispatchLoop(registry, handler, workers, clock, props.getMisfireGrace());
    }

    @Bean
    public SmartLifecycle dispatchLoopLifecycle(DispatchLoop loop, FlowSchedulerProperties props) {
        return new SmartLifecycle() {
            @Override
            public void start() {
                loop.start();
            }

            @Override
            public void stop() {
                loop.shutdown();
            }

            @Override
            public boolean isRunning() {
                return loop.isRunning();
            }

            @Override
            public boolean isAutoStartup() {
                return props.isAutoStart();
            }
        };
    }

    @Bean
    public LockProvider lockProvider(DataSource dataSource) {
        return new JdbcTemplateLockProvider(JdbcTemplateLockProvider.Configuration.builder()
                .withJdbcTemplate(new JdbcTemplate(dataSource))
                .build());
    }
}
