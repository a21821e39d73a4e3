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

import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpHeaders;

/**
 * Turns the raw connection input into the request body, as framed by the request headers.
 */
@FunctionalInterface
public interface BodyDecoder {

    /**
     * @param headers          request headers determining the body framing
     * @param connectionInput  blocking connection input, positioned at the start of the body; must not be closed
     * @return a stream that ends at the end of the body
     */
    InputStream decode(HttpHeaders headers, InputStream connectionInput) throws IOException;
}
