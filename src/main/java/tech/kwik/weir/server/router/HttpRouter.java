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
package tech.kwik.weir.server.router;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Maps (method, path) to an endpoint. Routes are tried in registration order; the first match wins.
 * Routes can be added while the server is running.
 */
public class HttpRouter {

    private final List<Route> routes = new CopyOnWriteArrayList<>();

    public HttpRouter route(String method, String pathTemplate, Endpoint endpoint) {
        routes.add(new Route(method, new PathPattern(pathTemplate), endpoint));
        return this;
    }

    public Optional<RouteMatch> getRoute(String method, String path) {
        for (Route route: routes) {
            if (route.method.equals(method)) {
                Optional<Map<String, String>> variables = route.pattern.match(path);
                if (variables.isPresent()) {
                    return Optional.of(new RouteMatch(route.endpoint, variables.get()));
                }
            }
        }
        return Optional.empty();
    }

    private static class Route {
        final String method;
        final PathPattern pattern;
        final Endpoint endpoint;

        Route(String method, PathPattern pattern, Endpoint endpoint) {
            this.method = method;
            this.pattern = pattern;
            this.endpoint = endpoint;
        }
    }
}
