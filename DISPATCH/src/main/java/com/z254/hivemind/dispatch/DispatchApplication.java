package com.z254.hivemind.dispatch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * DISPATCH - task routing and learning coordinator for the HIVEMIND agent pool.
 *
 * <p>DISPATCH provides:
 * <ul>
 *   <li>Agent Registry - declared capabilities, proficiency and concurrency limits</li>
 *   <li>Task Routing - capability scoring with load penalty and priority escalation</li>
 *   <li>Messaging - durable inboxes plus best-effort live broadcast</li>
 *   <li>Learning - success and failure pattern mining from reported outcomes</li>
 *   <li>Improvements - ranked architecture proposals from the learned state</li>
 * </ul>
 */
@SpringBootApplication
@EnableScheduling
public class DispatchApplication {

    public static void main(String[] args) {
        SpringApplication.run(DispatchApplication.class, args);
    }
}
