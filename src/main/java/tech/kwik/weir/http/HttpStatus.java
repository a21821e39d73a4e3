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
package tech.kwik.weir.http;

import java.util.HashMap;
import java.util.Map;

/**
 * Reason phrases for the status codes of https://www.rfc-editor.org/rfc/rfc9110.html#name-status-codes
 */
public final class HttpStatus {

    public static final int SWITCHING_PROTOCOLS = 101;
    public static final int OK = 200;
    public static final int NO_CONTENT = 204;
    public static final int NOT_MODIFIED = 304;
    public static final int BAD_REQUEST = 400;
    public static final int FORBIDDEN = 403;
    public static final int NOT_FOUND = 404;
    public static final int REQUEST_HEADER_FIELDS_TOO_LARGE = 431;
    public static final int INTERNAL_SERVER_ERROR = 500;
    public static final int HTTP_VERSION_NOT_SUPPORTED = 505;

    private static final Map<Integer, String> reasonPhrases = new HashMap<>();

    static {
        reasonPhrases.put(100, "Continue");
        reasonPhrases.put(101, "Switching Protocols");
        reasonPhrases.put(200, "OK");
        reasonPhrases.put(201, "Created");
        reasonPhrases.put(202, "Accepted");
        reasonPhrases.put(204, "No Content");
        reasonPhrases.put(206, "Partial Content");
        reasonPhrases.put(301, "Moved Permanently");
        reasonPhrases.put(302, "Found");
        reasonPhrases.put(303, "See Other");
        reasonPhrases.put(304, "Not Modified");
        reasonPhrases.put(307, "Temporary Redirect");
        reasonPhrases.put(308, "Permanent Redirect");
        reasonPhrases.put(400, "Bad Request");
        reasonPhrases.put(401, "Unauthorized");
        reasonPhrases.put(403, "Forbidden");
        reasonPhrases.put(404, "Not Found");
        reasonPhrases.put(405, "Method Not Allowed");
        reasonPhrases.put(408, "Request Timeout");
        reasonPhrases.put(409, "Conflict");
        reasonPhrases.put(411, "Length Required");
        reasonPhrases.put(413, "Content Too Large");
        reasonPhrases.put(414, "URI Too Long");
        reasonPhrases.put(415, "Unsupported Media Type");
        reasonPhrases.put(426, "Upgrade Required");
        reasonPhrases.put(429, "Too Many Requests");
        reasonPhrases.put(431, "Request Header Fields Too Large");
        reasonPhrases.put(500, "Internal Server Error");
        reasonPhrases.put(501, "Not Implemented");
        reasonPhrases.put(502, "Bad Gateway");
        reasonPhrases.put(503, "Service Unavailable");
        reasonPhrases.put(504, "Gateway Timeout");
        reasonPhrases.put(505, "HTTP Version Not Supported");
    }

    private HttpStatus() {
    }

    public static String reasonPhrase(int statusCode) {
        return reasonPhrases.getOrDefault(statusCode, "Unknown");
    }

    /**
     * https://www.rfc-editor.org/rfc/rfc9110.html#name-content-length
     * "A server MUST NOT send a Content-Length header field in any response with a status code of 1xx (Informational)
     *  or 204 (No Content)."
     */
    public static boolean mayHaveContent(int statusCode) {
        return statusCode >= 200 && statusCode != NO_CONTENT && statusCode != NOT_MODIFIED;
    }
}
