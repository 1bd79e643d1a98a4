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
 * Throw this to bail out of the request and respond with a "400 Bad Request"
 * code and the given message.
 */
public class InvalidRequestException extends HttpServerException {

    public InvalidRequestException(String message) {
        super("Invalid request: " + message);
    }

    @Override
    public ErrorType errorType() {
        return ErrorType.REQUEST;
    }
}
