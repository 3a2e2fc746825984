package me.filot.bot.port.outbound;

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

import me.filot.bot.domain.model.AdmissionDecision;
import me.filot.bot.domain.model.InboundEvent;

/**
 * Business layer invoked for every admitted inbound event. Builds and sends
 * the single response for the event.
 *
 * <p>
 * Runs on a dispatcher worker thread. Exceptions are logged by the caller and
 * reset the chat's navigation session.
 */
public interface ActionHandlerPort {

    void handle(InboundEvent event, AdmissionDecision decision);
}
