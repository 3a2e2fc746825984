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

/**
 * Decides whether an action payload is navigational (safe to repeat, it only
 * re-renders a screen) or stateful (has a side effect).
 *
 * <p>
 * Implementations must be thread-safe. The admission gate treats an exception
 * thrown here as "navigational" so that a broken classifier never blocks
 * traffic.
 *
 * @since 1.0
 * @see PrefixActionClassifier
 */
@FunctionalInterface
public interface ActionClassifier {

    boolean isNavigational(String payload);
}
