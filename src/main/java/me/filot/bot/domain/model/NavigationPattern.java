package me.filot.bot.domain.model;

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
 * Navigation pattern detected from the most recent steps of one chat.
 */
public enum NavigationPattern {

    /** No recognizable pattern. */
    NONE("none"),

    /** A, B, A: the user is switching between two screens. */
    BACK_FORTH("back_forth"),

    /** A, B, C, A: the user went around a loop of screens. */
    CIRCULAR("circular"),

    /** Several menu roots opened in a row. */
    MENU_SWITCHING("menu_switching");

    private final String code;

    NavigationPattern(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
