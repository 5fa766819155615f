/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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
 */

package dev.mars.maestro.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link MaestroConfiguration}.
 */
@DisplayName("MaestroConfiguration Tests")
class MaestroConfigurationTest {

    private static Properties properties(String... keyValues) {
        Properties properties = new Properties();
        for (int i = 0; i < keyValues.length; i += 2) {
            properties.setProperty(keyValues[i], keyValues[i + 1]);
        }
        return properties;
    }

    @Nested
    @DisplayName("Defaults")
    class DefaultTests {

        @Test
        @DisplayName("Should provide documented defaults")
        void testDefaults() {
            MaestroConfiguration config = new MaestroConfiguration(new Properties());

            assertThat(config.getDefaultTimeoutMs()).isEqualTo(30000);
            assertThat(config.getDefaultMaxRetries()).isEqualTo(3);
            assertThat(config.getDefaultCooldownMs()).isZero();
            assertThat(config.getRateLimitMax()).isEqualTo(10);
            assertThat(config.getRateLimitWindowMs()).isEqualTo(60000);
            assertThat(config.getCircularUpdateThreshold()).isEqualTo(3);
            assertThat(config.getCircularUpdateWindowMs()).isEqualTo(300000);
            assertThat(config.getMaxHistorySize()).isEqualTo(100);
            assertThat(config.getMaxConcurrency()).isEqualTo(5);
            assertThat(config.isSkipDependentsOnFailure()).isTrue();
        }

        @Test
        @DisplayName("Should pass validation with defaults")
        void testValidateDefaults() {
            assertThatCode(() -> new MaestroConfiguration(new Properties()).validate())
                .doesNotThrowAnyException();
        }
    }

    @Nested
    @DisplayName("Overrides")
    class OverrideTests {

        @Test
        @DisplayName("Should apply explicit properties over defaults")
        void testExplicitProperties() {
            MaestroConfiguration config = new MaestroConfiguration(properties(
                    MaestroConfiguration.POOL_TIMEOUT_MS, "5000",
                    MaestroConfiguration.ORCHESTRATOR_SKIP_DEPENDENTS, "false"));

            assertThat(config.getDefaultTimeoutMs()).isEqualTo(5000);
            assertThat(config.isSkipDependentsOnFailure()).isFalse();
            assertThat(config.getDefaultMaxRetries()).isEqualTo(3);
        }

        @Test
        @DisplayName("Should fall back to the default for malformed numbers")
        void testMalformedNumber() {
            MaestroConfiguration config = new MaestroConfiguration(properties(
                    MaestroConfiguration.POOL_MAX_RETRIES, "three",
                    MaestroConfiguration.POOL_RATE_LIMIT_WINDOW_MS, "1m"));

            assertThat(config.getDefaultMaxRetries()).isEqualTo(3);
            assertThat(config.getRateLimitWindowMs()).isEqualTo(60000);
        }

        @Test
        @DisplayName("Should read maestro.properties from the classpath")
        void testClasspathFile() {
            MaestroConfiguration config = new MaestroConfiguration();

            assertThat(config.getMaxHistorySize()).isEqualTo(250);
            assertThat(config.getMaxConcurrency()).isEqualTo(4);
        }

        @Test
        @DisplayName("Should let system properties win over the classpath file")
        void testSystemPropertyOverride() {
            System.setProperty(MaestroConfiguration.POOL_HISTORY_MAX_SIZE, "42");
            try {
                MaestroConfiguration config = new MaestroConfiguration();
                assertThat(config.getMaxHistorySize()).isEqualTo(42);
            } finally {
                System.clearProperty(MaestroConfiguration.POOL_HISTORY_MAX_SIZE);
            }
        }

        @Test
        @DisplayName("Should ignore system properties for explicit configurations")
        void testExplicitIgnoresSystemProperties() {
            System.setProperty(MaestroConfiguration.POOL_HISTORY_MAX_SIZE, "42");
            try {
                MaestroConfiguration config = new MaestroConfiguration(new Properties());
                assertThat(config.getMaxHistorySize()).isEqualTo(100);
            } finally {
                System.clearProperty(MaestroConfiguration.POOL_HISTORY_MAX_SIZE);
            }
        }

        @Test
        @DisplayName("Should apply setProperty")
        void testSetProperty() {
            MaestroConfiguration config = new MaestroConfiguration(new Properties());
            config.setProperty(MaestroConfiguration.POOL_COOLDOWN_MS, "250");

            assertThat(config.getDefaultCooldownMs()).isEqualTo(250);
        }
    }

    @Nested
    @DisplayName("Validation")
    class ValidationTests {

        @Test
        @DisplayName("Should reject non-positive concurrency")
        void testRejectZeroConcurrency() {
            MaestroConfiguration config = new MaestroConfiguration(properties(
                    MaestroConfiguration.ORCHESTRATOR_MAX_CONCURRENCY, "0"));

            assertThatThrownBy(config::validate)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining(MaestroConfiguration.ORCHESTRATOR_MAX_CONCURRENCY);
        }

        @Test
        @DisplayName("Should reject negative retries")
        void testRejectNegativeRetries() {
            MaestroConfiguration config = new MaestroConfiguration(properties(
                    MaestroConfiguration.POOL_MAX_RETRIES, "-1"));

            assertThatThrownBy(config::validate)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("cannot be negative");
        }
    }
}
