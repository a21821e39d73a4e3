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

import java.util.Map;

public class RouteMatch {

    private final Endpoint endpoint;
    private final Map<String, String> pathVariables;

    public RouteMatch(Endpoint endpoint, Map<String, String> pathVariables) {
        this.endpoint = endpoint;
        this.pathVariables = Map.copyOf(pathVariables);
    }

    public Endpoint endpoint() {
        return endpoint;
    }

    public Map<String, String> pathVariables() {
        return pathVariables;
    }
}
