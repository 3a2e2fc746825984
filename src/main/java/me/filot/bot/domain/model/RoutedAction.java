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

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * Business action resolved from callback data, handed to the content layer.
 */
@Value
@Builder
public class RoutedAction {

    public static final String UNKNOWN = "unknown";
    public static final String INVALID = "invalid";

    String type;

    @Singular
    Map<String, Object> params;

    /** User-facing text when no content layer handles the action. */
    String message;

    String error;

    public boolean isUnknown() {
        return UNKNOWN.equals(type);
    }

    public boolean isError() {
        return error != null;
    }
}
