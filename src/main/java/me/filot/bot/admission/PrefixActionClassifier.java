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

import me.filot.bot.infrastructure.config.BotProperties;

import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * {@link ActionClassifier} backed by a set of exact actions and a list of
 * prefixes, read from {@code bot.admission.navigational-actions} and
 * {@code bot.admission.navigational-prefixes}.
 */
public class PrefixActionClassifier implements ActionClassifier {

    private final Set<String> actions;
    private final List<String> prefixes;

    public PrefixActionClassifier(Collection<String> actions, Collection<String> prefixes) {
        this.actions = Set.copyOf(actions);
        this.prefixes = List.copyOf(prefixes);
    }

    public static PrefixActionClassifier fromProperties(BotProperties.AdmissionProperties properties) {
        return new PrefixActionClassifier(properties.getNavigationalActions(),
                properties.getNavigationalPrefixes());
    }

    @Override
    public boolean isNavigational(String payload) {
        if (payload == null || payload.isBlank()) {
            return false;
        }
        String action = payload.trim();
        if (actions.contains(action)) {
            return true;
        }
        for (String prefix : prefixes) {
            if (action.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }
}
