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

import tech.kwik.weir.network.Connection;
import tech.kwik.weir.network.ConnectionHandler;
import tech.kwik.weir.network.Server;
import tech.kwik.weir.network.virtual.VirtualClientConnectionProvider;
import tech.kwik.weir.network.virtual.VirtualServerConnectionProvider;
import tech.kwik.weir.server.AsyncHttpConnectionHandler;
import tech.kwik.weir.server.HttpConnectionHandler;
import tech.kwik.weir.server.HttpServerConfig;
import tech.kwik.weir.server.router.HttpRouter;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Runs the httpbin endpoints on a virtual interface and requests the given paths from it, printing the responses.
 */
public class VirtualHttpBinServer {

    public static final String INTERFACE_NAME = "httpbin";

    private final Server server;
    private final VirtualClientConnectionProvider client;

    public static void main(String[] args) throws Exception {
        if (args.length < 2 || !(args[0].equals("threaded") || args[0].equals("async"))) {
            usageAndExit();
        }
        List<String> argList = List.of(args);
        VirtualHttpBinServer httpBinServer = new VirtualHttpBinServer(argList.get(0).equals("async"));
        httpBinServer.start();
        try {
            for (String path: argList.subList(1, argList.size())) {
                System.out.println(httpBinServer.get(path));
            }
        }
        finally {
            httpBinServer.stop();
        }
    }

    private static void usageAndExit() {
        System.err.println("Usage: threaded|async path...");
        System.exit(1);
    }

    public VirtualHttpBinServer(boolean async) {
        HttpRouter router = new HttpBinEndpoints().register(new HttpRouter());
        HttpServerConfig config = HttpServerConfig.builder()
                .serverName("weir-httpbin/1.0")
                .build();
        ConnectionHandler connectionHandler = async?
                new AsyncHttpConnectionHandler(router, config): new HttpConnectionHandler(router, config);
        server = new Server(new VirtualServerConnectionProvider(INTERFACE_NAME), connectionHandler);
        client = new VirtualClientConnectionProvider(INTERFACE_NAME);
    }

    public void start() {
        server.start();
    }

    public void stop() {
        client.close();
        server.stop();
    }

    /**
     * Sends a GET request for the given path on a new connection and returns the raw response.
     */
    public String get(String path) throws IOException {
        try (Connection connection = client.getConnection()) {
            OutputStream out = connection.getOutputStream();
            out.write(("GET " + path + " HTTP/1.1\r\nHost: " + INTERFACE_NAME + "\r\nConnection: close\r\n\r\n")
                    .getBytes(StandardCharsets.ISO_8859_1));
            out.flush();
            InputStream in = connection.getInputStream();
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
