package com.cred.freestyle.registration;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main Spring Boot application class for the offering registration service.
 *
 * System Overview:
 * - Users apply to tests and enroll in courses by paying the exact price
 * - A Redis lock per (user, offering) serializes competing requests across instances
 * - Payment and registration are written in one database transaction, guarded by a unique constraint
 * - Cancelling a payment reverses its registration atomically
 * - Registration counts are refreshed asynchronously from a Redis set
 * - Lifecycle events are published to Kafka; metrics go to CloudWatch
 *
 * @author Registration Team
 */
@SpringBootApplication
@EnableScheduling
public class RegistrationApplication {

    public static void main(String[] args) {
        SpringApplication.run(RegistrationApplication.class, args);
    }
}
