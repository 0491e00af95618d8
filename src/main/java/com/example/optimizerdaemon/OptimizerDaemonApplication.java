package com.example.optimizerdaemon;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Optimizer Daemon - autonomous host monitoring and remediation.
 *
 * Architecture:
 * - Metrics Collector → samples CPU, memory, disk, network and process counts
 * - Decider → local threshold rule table or remote HTTP decision service
 * - Action Executor → allow-listed host operations behind a policy gate
 * - Daemon Loop → sample, decide, execute, audit on a fixed interval
 * - Audit Log → append-only record of every snapshot, decision and outcome
 */
@SpringBootApplication
public class OptimizerDaemonApplication {

    public static void main(String[] args) {
        System.out.println("""
            ╔══════════════════════════════════════════════════╗
            ║         Optimizer Daemon v0.1.0                  ║
            ║         sample → decide → execute → audit        ║
            ╚══════════════════════════════════════════════════╝
            """);
        SpringApplication.run(OptimizerDaemonApplication.class, args);
    }
}
