/*
 * Copyright 2026 Mark Andrew Ray-Smith
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
package dev.mars.objectstore.storage;

import java.util.regex.Pattern;

/**
 * Bucket and object identifier rules.
 * <p>
 * The on-disk record format is unescaped: identifiers are delimited by a space
 * and records by a newline, so an identifier must never contain either.
 */
public final class Identifiers {

    /** Regex fragment matching a valid identifier. */
    public static final String REGEX = "[a-z0-9_-]+";

    private static final Pattern PATTERN = Pattern.compile(REGEX);

    private Identifiers() {
    }

    /** Returns whether {@code id} is a valid bucket or object identifier. */
    public static boolean isValid(String id) {
        return id != null && PATTERN.matcher(id).matches();
    }

    /** Returns whether {@code b} may appear in an identifier. */
    public static boolean isIdentifierByte(int b) {
        return (b >= 'a' && b <= 'z') || (b >= '0' && b <= '9') || b == '_' || b == '-';
    }

    /**
     * Validates an object and bucket identifier pair.
     *
     * @throws IllegalArgumentException if either identifier is invalid
     */
    public static void check(String objectId, String bucketId) {
        if (!isValid(bucketId)) {
            throw new IllegalArgumentException("Invalid bucket id '" + bucketId + "', expected " + REGEX);
        }
        if (!isValid(objectId)) {
            throw new IllegalArgumentException("Invalid object id '" + objectId + "', expected " + REGEX);
        }
    }
}
