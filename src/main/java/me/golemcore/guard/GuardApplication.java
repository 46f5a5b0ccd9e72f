package me.golemcore.guard;

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
 * Main application class for GolemCore Guard.
 *
 * <p>
 * GolemCore Guard is the moderation engine of a chat companion bot: it detects
 * behavioral violations in inbound messages, keeps per-user trust profiles
 * with decay and recovery, and decides an escalating punishment for the host
 * platform to apply.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports & Adapters):
 *
 * <pre>
 * Domain Layer       → ModerationService, detection pipeline, trust and escalation engines
 * Ports              → ProfileStorePort, ActionExecutorPort, ThreatIntelPort, StoragePort
 * Infrastructure     → local storage, OkHttp threat intel, logging executor
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under {@code guard.*}
 * prefix.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class GuardApplication {

    public static void main(String[] args) {
        SpringApplication.run(GuardApplication.class, args);
    }

}
