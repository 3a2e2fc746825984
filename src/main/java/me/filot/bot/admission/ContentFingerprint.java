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

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Stable short hash of event content, namespaced by chat.
 *
 * <p>
 * Used when the platform does not supply a usable event id, and to catch two
 * different event ids carrying the same content (client-side double submit).
 */
public final class ContentFingerprint {

    static final String PREFIX = "content:";
    private static final int HASH_BYTES = 6;

    private ContentFingerprint() {
    }

    /**
     * Returns {@code content:<chatId>:<12 hex digits>}.
     */
    public static String fingerprint(long chatId, String payload) {
        return PREFIX + chatId + ":" + hash(payload);
    }

    static String hash(String payload) {
        byte[] bytes = (payload != null ? payload : "").getBytes(StandardCharsets.UTF_8);
        byte[] digest = sha256().digest(bytes);
        return HexFormat.of().formatHex(digest, 0, HASH_BYTES);
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
