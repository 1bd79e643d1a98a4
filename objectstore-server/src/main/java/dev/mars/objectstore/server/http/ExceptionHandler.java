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

import dev.mars.objectstore.server.http.exception.HttpServerException;
import org.eclipse.jetty.server.Handler;
import org.eclipse.jetty.server.Request;
import org.eclipse.jetty.server.Response;
import org.eclipse.jetty.util.Callback;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wraps other handlers to catch any exceptions they produce and convert them
 * into plain-text responses with the appropriate HTTP status.
 * <p>
 * {@link HttpServerException}s are expected in normal operation (unknown
 * objects, bad content types) and are answered without a stack trace. Anything
 * else is unexpected: it is logged in full and answered with a 500 naming the
 * exception type.
 */
public class ExceptionHandler extends Handler.Wrapper {

    private static final Logger LOG = LoggerFactory.getLogger(ExceptionHandler.class);

    public ExceptionHandler(Handler handler) {
        super(handler);
    }

    @Override
    public boolean handle(Request request, Response response, Callback callback) throws Exception {
        try {
            return super.handle(request, response, callback);
        } catch (HttpServerException e) {
            LOG.debug("Request {} rejected: {}", request.getHttpURI().getPath(), e.getMessage());
            return HttpResponses.respondText(e.errorType().httpCode, e.getMessage(), response, callback);
        } catch (Throwable t) {
            LOG.error("Unhandled error serving {}", request.getHttpURI().getPath(), t);
            return HttpResponses.respondServerError(briefThrowableMessage(t), response, callback);
        }
    }

    /**
     * One-line message made of the exception class name and its message, if any.
     */
    static String briefThrowableMessage(Throwable throwable) {
        String message = throwable.getMessage();
        String className = throwable.getClass().getSimpleName();
        return message == null ? className : className + ": " + message;
    }
}
