package com.example.alerthistory;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Alert History - alert suppression backend.
 *
 * Answers, for every incoming alert, whether it is currently suppressed and by what:
 * - Silences → operator-defined, time-bounded label predicates
 * - Inhibition rules → static rules muting targets while a correlated source alert fires
 * - State tracker → durable record of active inhibitions, survives restarts
 * - Fail-open guard → infrastructure faults never hide an alert
 */
@SpringBootApplication
@EnableScheduling
public class AlertHistoryApplication {

    public static void main(String[] args) {
        SpringApplication.run(AlertHistoryApplication.class, args);
    }
}
