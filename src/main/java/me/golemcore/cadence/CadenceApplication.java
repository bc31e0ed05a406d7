package me.golemcore.cadence;

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
 * Main application class for Cadence, the clinical research coordinator
 * assistant core.
 *
 * <p>
 * Cadence turns a coordinator's message into a validated plan of actions
 * against the site's patient, task, trial and knowledge data, runs the safe
 * actions and holds write actions for approval.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports & Adapters):
 *
 * <pre>
 * Domain Layer       → CoordinatorAgent, ActionPlanner, knowledge and resolution services
 * Ports              → LlmPort, EmbeddingPort, ActionProviderPort, clinical data ports
 * Infrastructure     → langchain4j, local JSON storage, data-store action router
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under {@code cadence.*}
 * prefix.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class CadenceApplication {

    public static void main(String[] args) {
        SpringApplication.run(CadenceApplication.class, args);
    }

}
