package me.filot.bot.admission;

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

import lombok.extern.slf4j.Slf4j;
import me.filot.bot.domain.service.NavigationTracker;
import me.filot.bot.infrastructure.config.BotProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Spring configuration wiring the admission layer from {@code bot.admission.*}.
 *
 * <p>
 * The {@link ActionClassifier} bean backs off when the application supplies
 * its own predicate.
 */
@Configuration
@Slf4j
public class AdmissionConfig {

    @Bean
    public EventKeyStore eventKeyStore(BotProperties properties, Clock clock) {
        BotProperties.AdmissionProperties admission = properties.getAdmission();
        return new EventKeyStore(admission.getMaxTrackedKeys(), admission.getMaxKeyAge(), clock);
    }

    @Bean
    @ConditionalOnMissingBean(ActionClassifier.class)
    public ActionClassifier actionClassifier(BotProperties properties) {
        return PrefixActionClassifier.fromProperties(properties.getAdmission());
    }

    @Bean(destroyMethod = "close")
    public ChatCircuitBreaker chatCircuitBreaker(Clock clock) {
        return new ChatCircuitBreaker(clock);
    }

    @Bean
    public AdmissionGate admissionGate(EventKeyStore eventKeyStore, ChatCircuitBreaker chatCircuitBreaker,
            NavigationTracker navigationTracker, ActionClassifier actionClassifier, BotProperties properties,
            Clock clock) {
        BotProperties.AdmissionProperties admission = properties.getAdmission();
        log.info("[Admission] maxTrackedKeys={}, maxKeyAge={}, statefulCooldown={}, breakerDuration={}",
                admission.getMaxTrackedKeys(), admission.getMaxKeyAge(), admission.getStatefulCooldown(),
                admission.getBreakerDuration());
        return new AdmissionGate(eventKeyStore, chatCircuitBreaker, navigationTracker, actionClassifier,
                admission, clock);
    }
}
