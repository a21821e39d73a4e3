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

/**
 * Request body that can be consumed without waiting for data that has not arrived yet.
 */
public interface SkippableBody {

    /**
     * Skips the body bytes that can be read without blocking.
     * @return true when the end of the body has been reached, false when more data has to arrive first
     * @throws IOException when the framing is invalid or reading fails
     */
    boolean skipAvailable() throws IOException;
}
