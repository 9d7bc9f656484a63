package com.algoexec.broker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ApplicationContext;
import org.springframework.stereotype.Component;

/** Closes the Spring context, then exits the JVM with the context's exit code. */
@Component
public class SystemProcessTerminator implements ProcessTerminator {

    private static final Logger log = LoggerFactory.getLogger(SystemProcessTerminator.class);

    private final ApplicationContext applicationContext;

    public SystemProcessTerminator(ApplicationContext applicationContext) {
        this.applicationContext = applicationContext;
    }

    @Override
    public void terminate(int exitCode, String reason) {
        log.error("Terminating: {}", reason);
        System.exit(SpringApplication.exit(applicationContext, () -> exitCode));
    }
}
