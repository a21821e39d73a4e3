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

public final class HttpConstants {

    public static final String PROTOCOL_HTTP_1_0 = "HTTP/1.0";
    public static final String PROTOCOL_HTTP_1_1 = "HTTP/1.1";

    public static final String HEADER_SERVER = "Server";
    public static final String HEADER_CONNECTION = "Connection";
    public static final String HEADER_CONTENT_LENGTH = "Content-Length";
    public static final String HEADER_CONTENT_TYPE = "Content-Type";
    public static final String HEADER_TRANSFER_ENCODING = "Transfer-Encoding";
    public static final String HEADER_UPGRADE = "Upgrade";
    public static final String HEADER_HOST = "Host";

    public static final String CONNECTION_CLOSE = "close";
    public static final String CONNECTION_KEEP_ALIVE = "keep-alive";
    public static final String CONNECTION_UPGRADE = "Upgrade";

    public static final String TRANSFER_ENCODING_CHUNKED = "chunked";

    public static final String CONTENT_TYPE_TEXT_PLAIN = "text/plain; charset=utf-8";

    private HttpConstants() {
    }
}
