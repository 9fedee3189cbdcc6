package io.refactor.flowscheduler.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "flow-scheduler")
public class FlowSchedulerProperties {
    /** A due occurrence observed later than this is skipped instead of run late. */
    private Duration misfireGrace = Duration.ofSeconds(300);
    /** Upper bound on flows running at the same time. */
    private int workerThreads = 4;
    /** Start the dispatch thread with the application context. */
    private boolean autoStart = true;

    public Duration getMisfireGrace() { return misfireGrace; }
    public void setMisfireGrace(Duration misfireGrace) { this.misfireGrace = misfireGrace; }
    public int getWorkerThreads() { return workerThreads; }
    public void setWorkerThreads(int workerThreads) { this.workerThreads = workerThreads; }
    public boolean isAutoStart() { return autoStart; }
    public void setAutoStart(boolean autoStart) { this.autoStart = autoStart; }
}
