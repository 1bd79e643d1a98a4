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

import org.eclipse.jetty.http.HttpStatus;
import org.eclipse.jetty.server.Handler;
import org.eclipse.jetty.server.Request;
import org.eclipse.jetty.server.Response;
import org.eclipse.jetty.util.Callback;
import org.slf4j.Logger;

/**
 * Logs {@code <uri> <status>} for every request: at DEBUG for successful
 * responses, at WARN when the status is 400 or above.
 * <p>
 * The logger is supplied by the caller rather than looked up here, so the
 * access log can be routed independently of the server's own logging.
 */
public class AccessLogHandler extends Handler.Wrapper {

    private final Logger accessLog;

    public AccessLogHandler(Logger accessLog, Handler handler) {
        super(handler);
        this.accessLog = accessLog;
    }

    @Override
    public boolean handle(Request request, Response response, Callback callback) throws Exception {
        boolean handled = super.handle(request, response, callback);
        // Unhandled requests are answered with a 404 by the server
        int status = handled ? response.getStatus() : HttpStatus.NOT_FOUND_404;
        String uri = request.getHttpURI().getPathQuery();
        if (status >= HttpStatus.BAD_REQUEST_400) {
            accessLog.warn("{} {}", uri, status);
        } else {
            accessLog.debug("{} {}", uri, status);
        }
        return handled;
    }
}
