/*
 * Copyright 2022 - 2025 The Original Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 *     you may not use this file except in compliance with the License.
 *     You may obtain a copy of the License at
 *
 *           http://www.apache.org/licenses/LICENSE-2.0
 *
 *     Unless required by applicable law or agreed to in writing, software
 *     distributed under the License is distributed on an "AS IS" BASIS,
 *     WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *     See the License for the specific language governing permissions and
 *     limitations under the License.
 *
 */

package org.elasticsoftware.behaviors.beans;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.PropertySource;

import java.time.Duration;

@Configuration
@PropertySource("classpath:behaviors-runtime.properties")
public class BehaviorRuntimeConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(BehaviorRuntimeConfiguration.class);

    @Bean(name = "aggregateDispatcherFactory")
    public AggregateDispatcherFactory aggregateDispatcherFactory(@Value("${behaviors.runtime.partitions}") int partitions,
                                                                 @Value("${behaviors.runtime.validation-timeout-ms}") long validationTimeoutMs,
                                                                 @Value("${behaviors.runtime.shutdown-timeout-ms}") long shutdownTimeoutMs) {
        Duration validationTimeout = Duration.ofMillis(validationTimeoutMs);
        Duration shutdownTimeout = Duration.ofMillis(shutdownTimeoutMs);
        logger.info("Configuring aggregate dispatchers with {} partitions, validation timeout {} and shutdown timeout {}",
                partitions, validationTimeout, shutdownTimeout);
        return new AggregateDispatcherFactory(partitions, validationTimeout, shutdownTimeout);
    }
}
