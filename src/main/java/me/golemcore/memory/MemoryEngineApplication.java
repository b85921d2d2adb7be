package me.golemcore.memory;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the GolemCore memory engine.
 *
 * <p>
 * The engine ingests natural-language statements about a single user's life,
 * turns them into structured events and grows provisional knowledge about
 * behavioral patterns without letting that knowledge silently corrupt itself.
 *
 * <h2>Pipeline</h2>
 *
 * <pre>
 * Event Store → Entity Resolver → Pattern Detector → Conflict Detector
 *             → Promotion Gate → Stable Concept Registry
 * </pre>
 *
 * <p>
 * New events feed counter-evidence back into active derived views, which
 * re-triggers gate evaluation. Pattern detection, conflict detection and gate
 * evaluation run as a periodic background sweep.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports &amp; Adapters):
 *
 * <pre>
 * Inbound port       → MemoryConsumerPort (plugins, ReadOnly / ReadWriteDerived)
 * Domain Layer       → Services, PromotionGate, ConflictDetector
 * Outbound ports     → StoragePort (local files), ExtractionPort (langchain4j)
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under the
 * {@code memory.*} prefix.
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class MemoryEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(MemoryEngineApplication.class, args);
    }

}
