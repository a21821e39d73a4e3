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
package tech.kwik.weir.http.incoming;

import tech.kwik.weir.http.HttpConstants;

import java.io.IOException;
import java.io.InputStream;
import java.net.ProtocolException;
import java.net.http.HttpHeaders;
import java.util.List;

/**
 * https://www.rfc-editor.org/rfc/rfc9112.html#name-message-body-length
 * Supports chunked transfer coding and Content-Length; a request without either has no body. The bodies returned
 * implement {@link SkippableBody}.
 */
public class SimpleBodyDecoder implements BodyDecoder {

    @Override
    public InputStream decode(HttpHeaders headers, InputStream connectionInput) throws IOException {
        List<String> transferEncoding = headers.allValues(HttpConstants.HEADER_TRANSFER_ENCODING);
        if (!transferEncoding.isEmpty()) {
            // "If a Transfer-Encoding header field is present in a request and the chunked transfer coding is not the
            //  final encoding, the message body length cannot be determined reliably; the server MUST respond with the
            //  400 (Bad Request) status code and then close the connection."
            String last = transferEncoding.get(transferEncoding.size() - 1);
            String[] codings = last.split(",");
            if (!codings[codings.length - 1].trim().equalsIgnoreCase(HttpConstants.TRANSFER_ENCODING_CHUNKED)) {
                throw new ProtocolException("Unsupported transfer encoding: " + last);
            }
            return new ChunkedInputStream(connectionInput);
        }
        List<String> contentLength = headers.allValues(HttpConstants.HEADER_CONTENT_LENGTH);
        if (!contentLength.isEmpty()) {
            return new FixedLengthInputStream(connectionInput, parseContentLength(contentLength));
        }
        return new FixedLengthInputStream(connectionInput, 0);
    }

    private static long parseContentLength(List<String> values) throws ProtocolException {
        long length = -1;
        for (String value: values) {
            for (String element: value.split(",")) {
                long parsed;
                try {
                    parsed = Long.parseLong(element.trim());
                }
                catch (NumberFormatException e) {
                    throw new ProtocolException("Invalid Content-Length: " + value);
                }
                if (parsed < 0 || (length >= 0 && parsed != length)) {
                    throw new ProtocolException("Invalid Content-Length: " + value);
                }
                length = parsed;
            }
        }
        return length;
    }
}
