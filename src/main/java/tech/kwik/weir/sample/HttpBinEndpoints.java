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
package tech.kwik.weir.sample;

import org.json.JSONObject;
import tech.kwik.weir.http.HttpConstants;
import tech.kwik.weir.http.HttpError;
import tech.kwik.weir.http.HttpStatus;
import tech.kwik.weir.http.incoming.HttpServerRequest;
import tech.kwik.weir.http.outgoing.HttpServerResponse;
import tech.kwik.weir.server.router.HttpRouter;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Map;
import java.util.TreeMap;

/**
 * A few httpbin (https://httpbin.org) style endpoints, handy for trying out the server.
 */
public class HttpBinEndpoints {

    public static final String CONTENT_TYPE_JSON = "application/json";

    public HttpRouter register(HttpRouter router) {
        return router
                .route("GET", "/headers", this::headers)
                .route("GET", "/status/{code}", this::status)
                .route("POST", "/status/{code}", this::status)
                .route("GET", "/anything", this::anything)
                .route("POST", "/anything", this::anything)
                .route("GET", "/anything/*", this::anything)
                .route("POST", "/anything/*", this::anything)
                .route("POST", "/md5", this::md5);
    }

    HttpServerResponse headers(HttpServerRequest request) throws IOException {
        JSONObject json = new JSONObject().put("headers", headersJson(request));
        return json(HttpStatus.OK, json);
    }

    HttpServerResponse status(HttpServerRequest request) throws HttpError {
        String code = request.pathVariable("code").orElse("");
        int status;
        try {
            status = Integer.parseInt(code);
        }
        catch (NumberFormatException e) {
            throw new HttpError("Invalid status code: " + code, HttpStatus.BAD_REQUEST);
        }
        if (status < 200 || status > 599) {
            throw new HttpError("Status code out of range: " + code, HttpStatus.BAD_REQUEST);
        }
        return new HttpServerResponse(status);
    }

    HttpServerResponse anything(HttpServerRequest request) throws IOException {
        String body = new String(request.body().readAllBytes(), StandardCharsets.UTF_8);
        JSONObject json = new JSONObject()
                .put("method", request.method())
                .put("path", request.path())
                .put("query", request.query().orElse(""))
                .put("headers", headersJson(request))
                .put("data", body);
        request.pathVariable("*").ifPresent(rest -> json.put("rest", rest));
        return json(HttpStatus.OK, json);
    }

    HttpServerResponse md5(HttpServerRequest request) throws IOException {
        MessageDigest md5;
        try {
            md5 = MessageDigest.getInstance("MD5");
        }
        catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
        byte[] buffer = new byte[4096];
        int bytesRead;
        InputStream body = request.body();
        while ((bytesRead = body.read(buffer)) != -1) {
            md5.update(buffer, 0, bytesRead);
        }
        StringBuilder hash = new StringBuilder();
        for (byte b : md5.digest()) {
            hash.append(String.format("%02x", b));
        }
        return json(HttpStatus.OK, new JSONObject().put("md5", hash.toString()));
    }

    private static JSONObject headersJson(HttpServerRequest request) {
        Map<String, String> headers = new TreeMap<>();
        request.headers().map().forEach((name, values) -> headers.put(name, String.join(",", values)));
        return new JSONObject(headers);
    }

    private static HttpServerResponse json(int status, JSONObject json) throws IOException {
        HttpServerResponse response = new HttpServerResponse(status);
        response.setHeader(HttpConstants.HEADER_CONTENT_TYPE, CONTENT_TYPE_JSON);
        Writer writer = new OutputStreamWriter(response.getOutputStream(), StandardCharsets.UTF_8);
        json.write(writer, 2, 0);
        writer.flush();
        return response;
    }
}
