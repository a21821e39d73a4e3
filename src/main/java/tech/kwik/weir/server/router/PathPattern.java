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

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Path template: literal segments, "{name}" segments binding one path segment to a variable, and an optional
 * trailing "*" matching the remainder of the path (bound to variable "*").
 */
public class PathPattern {

    public static final String WILDCARD = "*";

    private final String template;
    private final String[] segments;
    private final boolean wildcard;

    public PathPattern(String template) {
        if (!template.startsWith("/")) {
            throw new IllegalArgumentException("path template must start with '/': " + template);
        }
        this.template = template;
        String[] parts = split(template);
        wildcard = parts.length > 0 && parts[parts.length - 1].equals(WILDCARD);
        if (wildcard) {
            String[] withoutWildcard = new String[parts.length - 1];
            System.arraycopy(parts, 0, withoutWildcard, 0, withoutWildcard.length);
            segments = withoutWildcard;
        }
        else {
            segments = parts;
        }
        for (String segment: segments) {
            if (segment.equals(WILDCARD)) {
                throw new IllegalArgumentException("wildcard only allowed as last segment: " + template);
            }
            if (isVariable(segment) && segment.length() == 2) {
                throw new IllegalArgumentException("empty variable name in " + template);
            }
        }
    }

    /**
     * @return the variable bindings when the path matches this pattern
     */
    public Optional<Map<String, String>> match(String path) {
        String[] parts = split(path);
        if (parts.length < segments.length || (!wildcard && parts.length != segments.length)) {
            return Optional.empty();
        }
        Map<String, String> variables = new HashMap<>();
        for (int i = 0; i < segments.length; i++) {
            String segment = segments[i];
            if (isVariable(segment)) {
                if (parts[i].isEmpty()) {
                    return Optional.empty();
                }
                variables.put(segment.substring(1, segment.length() - 1), parts[i]);
            }
            else if (!segment.equals(parts[i])) {
                return Optional.empty();
            }
        }
        if (wildcard) {
            variables.put(WILDCARD, String.join("/", Arrays.copyOfRange(parts, segments.length, parts.length)));
        }
        return Optional.of(variables);
    }

    public String template() {
        return template;
    }

    private static boolean isVariable(String segment) {
        return segment.startsWith("{") && segment.endsWith("}");
    }

    private static String[] split(String path) {
        String trimmed = path.startsWith("/") ? path.substring(1) : path;
        if (trimmed.isEmpty()) {
            return new String[0];
        }
        return trimmed.split("/", -1);
    }

    @Override
    public String toString() {
        return template;
    }
}
