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
package dev.mars.objectstore.server.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.eclipse.jetty.http.HttpHeader;
import org.eclipse.jetty.http.HttpStatus;
import org.eclipse.jetty.http.MimeTypes;
import org.eclipse.jetty.server.Response;
import org.eclipse.jetty.util.BufferUtil;
import org.eclipse.jetty.util.Callback;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * Static helpers for completing a Jetty {@link Response}.
 * <p>
 * Every method writes the last content chunk and returns {@code true}, so a
 * handler can end with {@code return HttpResponses.respondText(...)}.
 */
public final class HttpResponses {

    /** Shared, thread-safe mapper for JSON response bodies. */
    public static final ObjectMapper objectMapper = new ObjectMapper();

    private HttpResponses() {
    }

    public static boolean respondText(int code, String message, Response response, Callback callback) {
        response.setStatus(code);
        response.getHeaders().put(HttpHeader.CONTENT_TYPE, MimeTypes.Type.TEXT_PLAIN_UTF_8.asString());
        response.write(true, wrapString(message), callback);
        return true;
    }

    public static boolean respondServerError(String message, Response response, Callback callback) {
        return respondText(HttpStatus.INTERNAL_SERVER_ERROR_500, message, response, callback);
    }

    /** Responds with raw object bytes as {@code text/plain}, the only content type objects are stored with. */
    public static boolean respondBytes(int code, byte[] body, Response response, Callback callback) {
        response.setStatus(code);
        response.getHeaders().put(HttpHeader.CONTENT_TYPE, MimeTypes.Type.TEXT_PLAIN.asString());
        response.getHeaders().put(HttpHeader.CONTENT_LENGTH, body.length);
        response.write(true, ByteBuffer.wrap(body), callback);
        return true;
    }

    /** Responds with an object serialized as JSON and the proper content type header. */
    public static boolean respondJson(int code, Object object, Response response, Callback callback) {
        byte[] jsonBytes;
        try {
            jsonBytes = objectMapper.writeValueAsBytes(object);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize response body", e);
        }
        response.setStatus(code);
        response.getHeaders().put(HttpHeader.CONTENT_TYPE, MimeTypes.Type.APPLICATION_JSON.asString());
        response.write(true, ByteBuffer.wrap(jsonBytes), callback);
        return true;
    }

    public static boolean respondEmpty(int code, Response response, Callback callback) {
        response.setStatus(code);
        response.write(true, BufferUtil.EMPTY_BUFFER, callback);
        return true;
    }

    /** Convert a String to a UTF-8 ByteBuffer for writing to an HTTP response body. */
    public static ByteBuffer wrapString(String string) {
        return ByteBuffer.wrap(string.getBytes(StandardCharsets.UTF_8));
    }
}
