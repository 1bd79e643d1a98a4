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
package dev.mars.objectstore.server.http.exception;

/**
 * Superclass for all exceptions a handler throws to bail out of a request with
 * a specific HTTP status. They are caught by
 * {@link dev.mars.objectstore.server.http.ExceptionHandler} and turned into a
 * plain-text response carrying the exception message.
 */
public abstract class HttpServerException extends RuntimeException {

    public HttpServerException(String message) {
        super(message);
    }

    public abstract ErrorType errorType();

    public enum ErrorType {
        REQUEST(400),
        NOT_FOUND(404),
        METHOD_NOT_ALLOWED(405),
        PAYLOAD_TOO_LARGE(413),
        UNSUPPORTED_MEDIA_TYPE(415);
        // Internal server errors are never created intentionally

        public final int httpCode;

        ErrorType(int httpCode) {
            this.httpCode = httpCode;
        }
    }
}
