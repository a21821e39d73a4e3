/*
 * Copyright © 2025, 2026 Peter Doornbosch
 *
 * This file is part of Weir, an embeddable HTTP/1.1 server engine
 *
 * Weir is free software: you can redistribute it and/or modify it under
 * the terms of the GNU Lesser General Public License as published by the
 * Free Software Foundation, either version 3 of the License, or (at your option)
 * any later version.
 *
 * Weir is distributed in the hope that it will be useful, but
 * WITHOUT ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or
 * FITNESS FOR A PARTICULAR PURPOSE. See the GNU Lesser General Public License for
 * more details.
 *
 * You should have received a copy of the GNU Lesser General Public License
 * along with this program. If not, see <http://www.gnu.org/licenses/>.
 */
package tech.kwik.weir.server;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tech.kwik.weir.http.HttpConstants;
import tech.kwik.weir.http.HttpError;
import tech.kwik.weir.http.HttpStatus;
import tech.kwik.weir.http.incoming.BodyDecoder;
import tech.kwik.weir.http.incoming.HttpServerRequest;
import tech.kwik.weir.http.incoming.RequestHeadersReader;
import tech.kwik.weir.http.outgoing.ConnectionState;
import tech.kwik.weir.http.outgoing.ConnectionStateRule;
import tech.kwik.weir.http.outgoing.HttpServerResponse;
import tech.kwik.weir.network.BufferedInput;
import tech.kwik.weir.server.handler.DefaultErrorHandler;
import tech.kwik.weir.server.handler.ErrorHandler;
import tech.kwik.weir.server.handler.RequestInterceptor;
import tech.kwik.weir.server.router.HttpRouter;
import tech.kwik.weir.server.router.RouteMatch;

import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;

/**
 * Processes one request read from a connection: read headers, route, intercept or invoke the endpoint and form the
 * response. The pieces are shared with the cooperative {@link HttpProcessorCoroutine}.
 */
public final class HttpProcessor {

    private static final Logger log = LoggerFactory.getLogger(HttpProcessor.class);

    static final String INVALID_HEADERS_MESSAGE = "Invalid request headers";
    static final String NO_MAPPING_MESSAGE = "Current url has no mapping";
    static final String UNKNOWN_ERROR_MESSAGE = "Unknown error";

    private HttpProcessor() {
    }

    public static ProcessingResult processRequest(Components components, BufferedInput input) {
        return processRequest(components.router(), components.headersReader(), input, components.bodyDecoder(),
                components.errorHandler(), components.interceptors(), components.config().serverName());
    }

    /**
     * @return the response to send, or a result without response when the connection should be dropped silently
     */
    public static ProcessingResult processRequest(HttpRouter router, RequestHeadersReader headersReader, BufferedInput input,
                                                  BodyDecoder bodyDecoder, ErrorHandler errorHandler,
                                                  List<RequestInterceptor> interceptors, String serverName) {
        RequestHeadersReader.Result headers;
        try {
            headers = headersReader.readHeaders(input);
        }
        catch (HttpError error) {
            log.debug("Invalid request headers: {}", error.getMessage());
            HttpServerResponse response = errorHandler.handleError(error.getStatusCode(), INVALID_HEADERS_MESSAGE);
            return new ProcessingResult(response, formResponse(null, response, serverName), null);
        }
        catch (IOException e) {
            log.debug("No request read from connection: {}", e.toString());
            return new ProcessingResult(null, ConnectionState.CLOSE, null);
        }

        Optional<RouteMatch> route = router.getRoute(headers.startLine().method(), headers.startLine().path());
        if (route.isEmpty()) {
            HttpServerResponse response = errorHandler.handleError(HttpStatus.NOT_FOUND, NO_MAPPING_MESSAGE);
            return new ProcessingResult(response, formResponse(null, response, serverName), null);
        }

        HttpServerRequest request = new HttpServerRequest(headers.startLine(), route.get().pathVariables(),
                headers.headers(), input.asInputStream(), bodyDecoder);
        HttpServerResponse response;
        try {
            response = intercept(interceptors, request);
            if (response == null) {
                response = checkResponse(route.get().endpoint().handle(request));
            }
        }
        catch (Exception e) {
            response = renderFailure(errorHandler, e);
        }
        return new ProcessingResult(response, formResponse(request, response, serverName), request);
    }

    /**
     * @return the response of the first interceptor that produces one, or null
     */
    static HttpServerResponse intercept(List<RequestInterceptor> interceptors, HttpServerRequest request) throws HttpError {
        for (RequestInterceptor interceptor: interceptors) {
            Optional<HttpServerResponse> response = interceptor.intercept(request);
            if (response.isPresent()) {
                return response.get();
            }
        }
        return null;
    }

    static HttpServerResponse checkResponse(HttpServerResponse response) {
        if (response == null) {
            throw new IllegalStateException("Endpoint did not produce a response");
        }
        if (!response.isStatusSet()) {
            throw new IllegalStateException("Endpoint response has no status");
        }
        return response;
    }

    static HttpServerResponse renderFailure(ErrorHandler errorHandler, Throwable failure) {
        Throwable cause = unwrap(failure);
        if (cause instanceof HttpError) {
            HttpError httpError = (HttpError) cause;
            return errorHandler.handleError(httpError.getStatusCode(), messageOf(httpError), httpError.getHeaders());
        }
        log.debug("Request processing failed", cause);
        return errorHandler.handleError(HttpStatus.INTERNAL_SERVER_ERROR, messageOf(cause));
    }

    static ConnectionState formResponse(HttpServerRequest request, HttpServerResponse response, String serverName) {
        response.putHeaderIfAbsent(HttpConstants.HEADER_SERVER, serverName);
        return ConnectionStateRule.considerConnectionState(request, response);
    }

    static Throwable unwrap(Throwable failure) {
        Throwable cause = failure;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException) && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }

    private static String messageOf(Throwable failure) {
        return failure.getMessage() != null ? failure.getMessage() : UNKNOWN_ERROR_MESSAGE;
    }

    /**
     * Outcome of processing one request.
     */
    public static class ProcessingResult {

        private final HttpServerResponse response;
        private final ConnectionState connectionState;
        private final HttpServerRequest request;

        ProcessingResult(HttpServerResponse response, ConnectionState connectionState, HttpServerRequest request) {
            this.response = response;
            this.connectionState = connectionState;
            this.request = request;
        }

        /**
         * @return the response to send, or null when nothing should be sent and the connection must be dropped
         */
        public HttpServerResponse response() {
            return response;
        }

        public ConnectionState connectionState() {
            return connectionState;
        }

        /**
         * @return the request, or null when no (routable) request was read
         */
        public HttpServerRequest request() {
            return request;
        }
    }

    /**
     * What the processing pipeline works with; shared by all connections of a handler. Interceptors and error handler
     * can be changed while connections are being served.
     */
    public static class Components {

        private final HttpRouter router;
        private final BodyDecoder bodyDecoder;
        private final HttpServerConfig config;
        private final List<RequestInterceptor> interceptors;
        private volatile ErrorHandler errorHandler;

        public Components(HttpRouter router, BodyDecoder bodyDecoder, HttpServerConfig config) {
            this.router = router;
            this.bodyDecoder = bodyDecoder;
            this.config = config;
            this.interceptors = new CopyOnWriteArrayList<>();
            this.errorHandler = new DefaultErrorHandler(config.serverName());
        }

        public HttpRouter router() {
            return router;
        }

        public BodyDecoder bodyDecoder() {
            return bodyDecoder;
        }

        public HttpServerConfig config() {
            return config;
        }

        public RequestHeadersReader headersReader() {
            return config.createHeadersReader();
        }

        public List<RequestInterceptor> interceptors() {
            return interceptors;
        }

        public ErrorHandler errorHandler() {
            return errorHandler;
        }

        public void addRequestInterceptor(RequestInterceptor interceptor) {
            interceptors.add(interceptor);
        }

        /**
         * @param errorHandler  the handler to use, or null to restore the default one
         */
        public void setErrorHandler(ErrorHandler errorHandler) {
            this.errorHandler = errorHandler != null ? errorHandler : new DefaultErrorHandler(config.serverName());
        }
    }
}
