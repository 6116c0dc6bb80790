/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.huginn.agent.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.function.Supplier;

/**
 * Simple HTTP health check service for the agent, serving {@code GET /health} and
 * {@code GET /status} as JSON.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-09
 * @version 1.0
 */
public class HealthService {

    private static final Logger logger = LoggerFactory.getLogger(HealthService.class);

    private final int port;
    private final Supplier<?> health;
    private final Supplier<?> status;
    private final ObjectMapper objectMapper;
    private HttpServer server;

    /**
     * @param port   the port to bind, or 0 for an ephemeral port
     * @param health supplies the body of {@code /health}
     * @param status supplies the body of {@code /status}
     */
    public HealthService(int port, Supplier<?> health, Supplier<?> status) {
        this.port = port;
        this.health = health;
        this.status = status;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public synchronized void start() throws IOException {
        if (server != null) {
            return;
        }
        server = HttpServer.create(new InetSocketAddress(port), 0);
        server.createContext("/health", new JsonHandler(health));
        server.createContext("/status", new JsonHandler(status));
        server.setExecutor(null); // Use default executor
        server.start();

        logger.info("Health service started on port {}", getPort());
    }

    /**
     * @return the bound port, or -1 when not started
     */
    public synchronized int getPort() {
        return server != null ? server.getAddress().getPort() : -1;
    }

    public synchronized void shutdown() {
        if (server != null) {
            server.stop(0);
            server = null;
            logger.info("Health service stopped");
        }
    }

    private class JsonHandler implements HttpHandler {
        private final Supplier<?> body;

        JsonHandler(Supplier<?> body) {
            this.body = body;
        }

        @Override
        public void handle(HttpExchange exchange) throws IOException {
            try {
                if (!"GET".equals(exchange.getRequestMethod())) {
                    exchange.sendResponseHeaders(405, -1); // Method not allowed
                    return;
                }
                byte[] response;
                int code = 200;
                try {
                    response = objectMapper.writeValueAsBytes(body.get());
                } catch (JsonProcessingException | RuntimeException e) {
                    logger.warn("Could not render {}: {}", exchange.getRequestURI(), e.getMessage());
                    response = "{\"status\":\"unhealthy\"}".getBytes(StandardCharsets.UTF_8);
                    code = 500;
                }
                exchange.getResponseHeaders().set("Content-Type", "application/json");
                exchange.sendResponseHeaders(code, response.length);
                try (OutputStream os = exchange.getResponseBody()) {
                    os.write(response);
                }
            } finally {
                exchange.close();
            }
        }
    }
}
