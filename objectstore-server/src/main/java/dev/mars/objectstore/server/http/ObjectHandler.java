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

import dev.mars.objectstore.server.http.exception.GenericHttpServerException;
import dev.mars.objectstore.server.http.exception.HttpServerException.ErrorType;
import dev.mars.objectstore.server.http.exception.InvalidRequestException;
import dev.mars.objectstore.server.http.exception.NotFoundException;
import dev.mars.objectstore.storage.ObjectStore;
import dev.mars.objectstore.storage.StorageException;
import org.eclipse.jetty.http.HttpFields;
import org.eclipse.jetty.http.HttpHeader;
import org.eclipse.jetty.http.HttpMethod;
import org.eclipse.jetty.http.HttpStatus;
import org.eclipse.jetty.http.MimeTypes;
import org.eclipse.jetty.io.Content;
import org.eclipse.jetty.server.Handler;
import org.eclipse.jetty.server.Request;
import org.eclipse.jetty.server.Response;
import org.eclipse.jetty.util.Callback;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Serves {@code /{bucketId}/{objectId}} below its context path.
 * <ul>
 *   <li>{@code PUT} stores the {@code text/plain} request body: 201 for a new
 *       object, 200 for a replacement, with {@code {"id":"<objectId>"}}</li>
 *   <li>{@code GET} returns the stored bytes, or 404</li>
 *   <li>{@code DELETE} removes the object: 200, or 404 if it does not exist</li>
 * </ul>
 * Any other method on an object path is answered with 405. Paths whose
 * segments are not valid identifiers are answered with 404.
 */
public class ObjectHandler extends Handler.Abstract {

    private static final Logger LOG = LoggerFactory.getLogger(ObjectHandler.class);

    private static final Pattern OBJECT_PATH = Pattern.compile("^/([a-z0-9_-]+)/([a-z0-9_-]+)$");

    /** JSON body of a successful {@code PUT}. */
    public record StoredObject(String id) {
    }

    private final ObjectStore store;
    private final long maxObjectSize;

    /**
     * @param store         the backend objects are kept in
     * @param maxObjectSize largest accepted request body in bytes
     */
    public ObjectHandler(ObjectStore store, long maxObjectSize) {
        this.store = store;
        this.maxObjectSize = maxObjectSize;
    }

    @Override
    public boolean handle(Request request, Response response, Callback callback) throws Exception {
        String subPath = Request.getPathInContext(request);
        Matcher matcher = OBJECT_PATH.matcher(subPath);
        if (!matcher.matches()) {
            throw new NotFoundException("Not found: " + subPath);
        }
        String bucketId = matcher.group(1);
        String objectId = matcher.group(2);

        String method = request.getMethod();
        if (HttpMethod.PUT.is(method)) {
            return put(bucketId, objectId, request, response, callback);
        }
        if (HttpMethod.GET.is(method)) {
            return get(bucketId, objectId, response, callback);
        }
        if (HttpMethod.DELETE.is(method)) {
            return delete(bucketId, objectId, response, callback);
        }
        response.getHeaders().put(HttpHeader.ALLOW, "GET, PUT, DELETE");
        throw new GenericHttpServerException("Method " + method + " not allowed", ErrorType.METHOD_NOT_ALLOWED);
    }

    // ========================================================================
    // PUT
    // ========================================================================

    private boolean put(String bucketId, String objectId, Request request, Response response, Callback callback)
            throws IOException {
        HttpFields headers = request.getHeaders();
        String contentType = headers.get(HttpHeader.CONTENT_TYPE);
        if (!MimeTypes.Type.TEXT_PLAIN.asString().equals(contentType)) {
            throw new GenericHttpServerException("Content-Type must be text/plain, got " + contentType,
                    ErrorType.UNSUPPORTED_MEDIA_TYPE);
        }
        if (!headers.contains(HttpHeader.CONTENT_LENGTH) && !headers.contains(HttpHeader.TRANSFER_ENCODING)) {
            throw new InvalidRequestException("Request body is missing");
        }
        long declaredLength = request.getLength();
        if (declaredLength > maxObjectSize) {
            throw tooLarge(declaredLength);
        }

        byte[] payload = readBody(request);
        boolean replaced;
        try {
            replaced = store.store(payload, objectId, bucketId);
        } catch (StorageException e) {
            LOG.error("Error storing object {}/{}: {}", bucketId, objectId, e.getMessage());
            return HttpResponses.respondServerError("Error storing object: " + e.getMessage(), response, callback);
        }
        int status = replaced ? HttpStatus.OK_200 : HttpStatus.CREATED_201;
        return HttpResponses.respondJson(status, new StoredObject(objectId), response, callback);
    }

    /** Reads the whole body, failing once it grows past the maximum object size. */
    private byte[] readBody(Request request) throws IOException {
        int limit = (int) Math.min(maxObjectSize + 1, Integer.MAX_VALUE - 8);
        try (InputStream in = Content.Source.asInputStream(request)) {
            byte[] body = in.readNBytes(limit);
            if (body.length > maxObjectSize) {
                throw tooLarge(body.length);
            }
            return body;
        }
    }

    private GenericHttpServerException tooLarge(long length) {
        return new GenericHttpServerException("Object of " + length + " bytes exceeds the maximum of "
                + maxObjectSize + " bytes", ErrorType.PAYLOAD_TOO_LARGE);
    }

    // ========================================================================
    // GET / DELETE
    // ========================================================================

    private boolean get(String bucketId, String objectId, Response response, Callback callback) {
        Optional<byte[]> payload;
        try {
            payload = store.retrieve(objectId, bucketId);
        } catch (StorageException e) {
            LOG.error("Error retrieving object {}/{}: {}", bucketId, objectId, e.getMessage());
            return HttpResponses.respondServerError("Error retrieving object: " + e.getMessage(), response, callback);
        }
        if (payload.isEmpty()) {
            throw notFound(bucketId, objectId);
        }
        return HttpResponses.respondBytes(HttpStatus.OK_200, payload.get(), response, callback);
    }

    private boolean delete(String bucketId, String objectId, Response response, Callback callback) {
        boolean deleted;
        try {
            deleted = store.delete(objectId, bucketId);
        } catch (StorageException e) {
            LOG.error("Error deleting object {}/{}: {}", bucketId, objectId, e.getMessage());
            return HttpResponses.respondServerError("Error deleting object: " + e.getMessage(), response, callback);
        }
        if (!deleted) {
            throw notFound(bucketId, objectId);
        }
        return HttpResponses.respondEmpty(HttpStatus.OK_200, response, callback);
    }

    private static NotFoundException notFound(String bucketId, String objectId) {
        return new NotFoundException("Object " + bucketId + "/" + objectId + " not found");
    }
}
