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
import tech.kwik.weir.http.HttpError;
import tech.kwik.weir.http.HttpStatus;
import tech.kwik.weir.http.incoming.HttpServerRequest;
import tech.kwik.weir.http.incoming.RequestHeadersReader;
import tech.kwik.weir.http.outgoing.ConnectionState;
import tech.kwik.weir.http.outgoing.HttpServerResponse;
import tech.kwik.weir.http.outgoing.ResponseWriter;
import tech.kwik.weir.network.BrokenPipeException;
import tech.kwik.weir.network.BufferedInput;
import tech.kwik.weir.network.Connection;
import tech.kwik.weir.network.ConnectionHandler;
import tech.kwik.weir.server.router.RouteMatch;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Processes the requests of one connection as a state machine that never blocks on the connection: reading headers,
 * invoking the endpoint, sending the response and discarding an unread request body suspend the machine until the
 * operation can make progress, after which it resumes on the executor. Steps of one coroutine never run concurrently, and a request is only read after the
 * response to the previous one has been sent completely.
 * <p>
 * The connection must be in non-blocking mode for both input and output.
 */
public class HttpProcessorCoroutine {

    private static final Logger log = LoggerFactory.getLogger(HttpProcessorCoroutine.class);

    enum State {
        READ_HEADERS,
        ROUTE_AND_INTERCEPT,
        INVOKE_ENDPOINT,
        FORM_RESPONSE,
        SEND_RESPONSE,
        DECIDE,
        FINISHED
    }

    private final HttpProcessor.Components components;
    private final Connection connection;
    private final Executor executor;
    private final ResponseWriter responseWriter;
    private final RequestHeadersReader headersReader;
    private final BufferedInput input;
    private final ByteArrayOutputStream headersOutBuffer;
    private final CompletableFuture<Void> completion;

    private State state;
    private RequestHeadersReader.Result headers;
    private RouteMatch currentRoute;
    private HttpServerRequest currentRequest;
    private HttpServerResponse currentResponse;
    private ConnectionState connectionState;
    private boolean responseCommitted;
    private boolean recovering;
    private volatile boolean upgraded;

    // Guarded by this
    private CompletableFuture<?> pending;
    private boolean cancelled;

    public HttpProcessorCoroutine(HttpProcessor.Components components, Connection connection, Executor executor) {
        this(components, connection, executor, new ResponseWriter());
    }

    HttpProcessorCoroutine(HttpProcessor.Components components, Connection connection, Executor executor,
                           ResponseWriter responseWriter) {
        this.components = components;
        this.connection = connection;
        this.executor = executor;
        this.responseWriter = responseWriter;
        this.headersReader = components.headersReader();
        HttpServerConfig config = components.config();
        this.input = new BufferedInput(connection, config.inputBufferSize());
        this.headersOutBuffer = new ByteArrayOutputStream(config.headersBufferCapacity());
        this.completion = new CompletableFuture<>();
        this.state = State.READ_HEADERS;
    }

    /**
     * Schedules the first step on the executor.
     * @return future that completes when the coroutine has finished; completes exceptionally when processing ended
     * because of a failure that could not be turned into a response
     */
    public CompletableFuture<Void> start() {
        try {
            executor.execute(() -> drive(Action.advance(State.READ_HEADERS)));
        }
        catch (RejectedExecutionException e) {
            state = State.FINISHED;
            completion.completeExceptionally(e);
        }
        return completion;
    }

    /**
     * Cancels the pending suspension, if any, or else the next one. Cancellation ends the coroutine without
     * sending a (further) response.
     */
    public void cancel() {
        CompletableFuture<?> toCancel;
        synchronized (this) {
            cancelled = true;
            toCancel = pending;
        }
        if (toCancel != null) {
            toCancel.cancel(true);
        }
    }

    /**
     * @return true when the connection has been handed over to an upgrade handler; it must then not be closed
     */
    public boolean isUpgraded() {
        return upgraded;
    }

    State state() {
        return state;
    }

    private void drive(Action action) {
        while (true) {
            switch (action.kind) {
                case ADVANCE:
                    state = action.next;
                    action = step();
                    break;
                case AWAIT:
                    suspend(action);
                    return;
                case FINISH:
                    state = State.FINISHED;
                    completion.complete(null);
                    return;
                case FAIL:
                    state = State.FINISHED;
                    completion.completeExceptionally(action.error);
                    return;
                default:
                    throw new IllegalStateException("unknown action " + action.kind);
            }
        }
    }

    private Action step() {
        try {
            switch (state) {
                case READ_HEADERS:
                    return readHeaders();
                case ROUTE_AND_INTERCEPT:
                    return routeAndIntercept();
                case INVOKE_ENDPOINT:
                    return invokeEndpoint();
                case FORM_RESPONSE:
                    return formResponse();
                case SEND_RESPONSE:
                    return sendResponse();
                case DECIDE:
                    return decide();
                default:
                    return Action.finish();
            }
        }
        catch (Exception e) {
            return handleError(e);
        }
    }

    private void suspend(Action action) {
        boolean cancelNow;
        synchronized (this) {
            pending = action.future;
            cancelNow = cancelled;
        }
        action.future.handleAsync((value, error) -> {
            synchronized (this) {
                pending = null;
            }
            drive(resume(action, value, error));
            return null;
        }, executor).exceptionally(failure -> {
            // Executor refused to run the continuation, e.g. because it was shut down.
            state = State.FINISHED;
            completion.completeExceptionally(failure);
            return null;
        });
        if (cancelNow) {
            action.future.cancel(true);
        }
    }

    private Action resume(Action action, Object value, Throwable error) {
        if (error != null) {
            return handleError(error);
        }
        try {
            return action.continuation.resume(value);
        }
        catch (Exception e) {
            return handleError(e);
        }
    }

    private Action readHeaders() {
        headers = null;
        currentRoute = null;
        currentRequest = null;
        currentResponse = null;
        connectionState = null;
        responseCommitted = false;
        return Action.await(headersReader.readHeadersAsync(input, executor), result -> {
            headers = result;
            return Action.advance(State.ROUTE_AND_INTERCEPT);
        });
    }

    private Action routeAndIntercept() throws HttpError {
        Optional<RouteMatch> route = components.router().getRoute(headers.startLine().method(), headers.startLine().path());
        if (route.isEmpty()) {
            currentResponse = components.errorHandler().handleError(HttpStatus.NOT_FOUND, HttpProcessor.NO_MAPPING_MESSAGE);
            return Action.advance(State.FORM_RESPONSE);
        }
        currentRoute = route.get();
        currentRequest = new HttpServerRequest(headers.startLine(), currentRoute.pathVariables(), headers.headers(),
                input.asInputStream(), components.bodyDecoder());
        HttpServerResponse intercepted = HttpProcessor.intercept(components.interceptors(), currentRequest);
        if (intercepted != null) {
            currentResponse = intercepted;
            return Action.advance(State.FORM_RESPONSE);
        }
        return Action.advance(State.INVOKE_ENDPOINT);
    }

    private Action invokeEndpoint() {
        return Action.await(currentRoute.endpoint().handleAsync(currentRequest), response -> {
            currentResponse = HttpProcessor.checkResponse(response);
            return Action.advance(State.FORM_RESPONSE);
        });
    }

    private Action formResponse() {
        connectionState = HttpProcessor.formResponse(currentRequest, currentResponse, components.config().serverName());
        return Action.advance(State.SEND_RESPONSE);
    }

    private Action sendResponse() {
        responseCommitted = true;
        return Action.await(responseWriter.sendAsync(currentResponse, connection, headersOutBuffer, executor),
                sent -> Action.advance(State.DECIDE));
    }

    private Action decide() {
        recovering = false;
        switch (connectionState) {
            case KEEP_ALIVE:
                return discardBody();
            case UPGRADE:
                Optional<ConnectionHandler> upgradeHandler = currentResponse.upgradeHandler();
                if (upgradeHandler.isPresent()) {
                    upgraded = true;
                    upgradeHandler.get().handleConnection(input.asConnection(), currentResponse.upgradeParameters());
                }
                else {
                    log.warn("Connection upgrade requested, but response has no upgrade handler; closing connection");
                }
                return Action.finish();
            default:
                return Action.finish();
        }
    }

    /**
     * Drops the unread rest of the request body before the next request is read, suspending until more of it arrives
     * instead of waiting on a worker.
     */
    private Action discardBody() {
        try {
            if (currentRequest.discardAvailableBody()) {
                return Action.advance(State.READ_HEADERS);
            }
        }
        catch (IOException e) {
            log.debug("Discarding request body failed, closing connection: {}", e.toString());
            return Action.finish();
        }
        if (input.isEndOfStream()) {
            log.debug("Connection closed before end of request body");
            return Action.finish();
        }
        return Action.await(input.awaitReadable(), ready -> discardBody());
    }

    private Action handleError(Throwable error) {
        Throwable cause = HttpProcessor.unwrap(error);
        if (cause instanceof CancellationException) {
            log.debug("Request processing cancelled in state {}", state);
            return Action.fail(cause);
        }
        if (cause instanceof BrokenPipeException) {
            return Action.fail(cause);
        }
        if (state == State.READ_HEADERS) {
            if (cause instanceof HttpError) {
                log.debug("Invalid request headers: {}", cause.getMessage());
                currentResponse = components.errorHandler().handleError(((HttpError) cause).getStatusCode(),
                        HttpProcessor.INVALID_HEADERS_MESSAGE);
                return Action.advance(State.FORM_RESPONSE);
            }
            if (cause instanceof IOException) {
                log.debug("No request read from connection: {}", cause.toString());
                return Action.finish();
            }
        }
        if (responseCommitted || recovering) {
            log.error("Unhandled error in state {}, dropping connection", state, cause);
            return Action.fail(cause);
        }
        recovering = true;
        currentResponse = HttpProcessor.renderFailure(components.errorHandler(), cause);
        return Action.advance(State.FORM_RESPONSE);
    }

    @FunctionalInterface
    interface Continuation<T> {
        Action resume(T value) throws Exception;
    }

    /**
     * What the driver loop does after a step.
     */
    static final class Action {

        enum Kind { ADVANCE, AWAIT, FINISH, FAIL }

        private static final Action FINISH = new Action(Kind.FINISH, null, null, null, null);

        final Kind kind;
        final State next;
        final CompletableFuture<?> future;
        final Continuation<Object> continuation;
        final Throwable error;

        private Action(Kind kind, State next, CompletableFuture<?> future, Continuation<Object> continuation, Throwable error) {
            this.kind = kind;
            this.next = next;
            this.future = future;
            this.continuation = continuation;
            this.error = error;
        }

        static Action advance(State next) {
            return new Action(Kind.ADVANCE, next, null, null, null);
        }

        @SuppressWarnings("unchecked")
        static <T> Action await(CompletableFuture<T> future, Continuation<T> continuation) {
            return new Action(Kind.AWAIT, null, future, (Continuation<Object>) continuation, null);
        }

        static Action finish() {
            return FINISH;
        }

        static Action fail(Throwable error) {
            return new Action(Kind.FAIL, null, null, null, error);
        }
    }
}
