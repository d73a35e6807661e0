package com.example.riskintel;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Risk Intelligence Pipeline.
 *
 * Ingests security, operational and compliance events and turns them into
 * explainable risk with a business blast radius.
 *
 * Architecture:
 * - Deduplication Engine → canonical fingerprints, windowed merge of duplicates
 * - Transparent Scoring Engine → 0-100 score with a full adjustment audit trail
 * - Dependency Graph Store → copy-on-write snapshots of services, assets and edges
 * - Blast Radius Engine → budgeted, decayed traversal over the dependency graph
 * - Cache Layer → Caffeine fast tier in front of a JPA durable tier
 */
@SpringBootApplication
@EnableScheduling
@EnableAsync
public class RiskIntelApplication {

    public static void main(String[] args) {
        SpringApplication.run(RiskIntelApplication.class, args);
    }
}
