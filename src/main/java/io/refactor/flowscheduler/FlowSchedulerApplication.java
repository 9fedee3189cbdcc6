package io.refactor.flowscheduler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FlowSchedulerApplication {
    public static void main(String[] args) {
        SpringApplication.run(FlowSchedulerApplication.class, args);
    }
}
