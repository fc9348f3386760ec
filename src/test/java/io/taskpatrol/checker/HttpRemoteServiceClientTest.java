package io.taskpatrol.checker;

import com.fasterxml.jackson.databind.JsonNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.taskpatrol.TestClock;
import io.taskpatrol.model.ErrorClassification;
import io.taskpatrol.security.SecretMaterial;
import io.taskpatrol.util.Hashing;
import io.taskpatrol.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicReference;

final class HttpRemoteServiceClientTest {

    @Test
    void signsRequestsAndReturnsParsedBody() throws Exception {
        AtomicReference<String> path = new AtomicReference<>();
        AtomicReference<String> body = new AtomicReference<>();
        AtomicReference<String> accessKey = new AtomicReference<>();
        AtomicReference<String> date = new AtomicReference<>();
        AtomicReference<String> signature = new AtomicReference<>();
        ExecutorService executor = Executors.newCachedThreadPool();
        HttpServer server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", exchange -> {
            path.set(exchange.getRequestURI().getPath());
            body.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            accessKey.set(exchange.getRequestHeaders().getFirst(HttpRemoteServiceClient.ACCESS_KEY_HEADER));
            date.set(exchange.getRequestHeaders().getFirst(HttpRemoteServiceClient.DATE_HEADER));
            signature.set(exchange.getRequestHeaders().getFirst(HttpRemoteServiceClient.SIGNATURE_HEADER));
            respond(exchange, 200, "{\"Regions\":[{\"RegionName\":\"us-east-1\"},{\"RegionName\":\"eu-west-1\"}]}");
        });
        server.setExecutor(executor);
        server.start();
        try {
            TestClock clock = new TestClock(Instant.parse("2026-03-01T12:00:00Z"));
            HttpRemoteServiceClient client = new HttpRemoteServiceClient(
                    "http://127.0.0.1:" + server.getAddress().getPort() + "/", Duration.ofSeconds(5), clock);

            JsonNode response;
            try (SecretMaterial material = material()) {
                response = client.invoke(new RemoteCall("ec2", "DescribeRegions", "eu-west-1",
                        Jsons.mapper().createObjectNode().put("AllRegions", true)), material);
            }

            Assertions.assertEquals(2, response.path("Regions").size());
            Assertions.assertEquals("/ec2/DescribeRegions", path.get());
            Assertions.assertEquals("AKIAEXAMPLEKEY000001", accessKey.get());
            Assertions.assertEquals(Long.toString(clock.millis()), date.get());
            JsonNode sent = Jsons.parse(body.get());
            Assertions.assertEquals("eu-west-1", sent.path("region").asText());
            Assertions.assertTrue(sent.path("parameters").path("AllRegions").asBoolean());
            Assertions.assertFalse(body.get().contains("wJalr"));

            String expected = HttpRemoteServiceClient.sign("wJalrSecret".toCharArray(),
                    "POST\n/ec2/DescribeRegions\n" + date.get() + "\n" + Hashing.sha256Hex(body.get()));
            Assertions.assertEquals(expected, signature.get());
        } finally {
            server.stop(0);
            executor.shutdownNow();
        }
    }

    @Test
    void temporaryCredentialsSendTheirTokenAndSignIt() throws Exception {
        AtomicReference<String> body = new AtomicReference<>();
        AtomicReference<String> date = new AtomicReference<>();
        AtomicReference<String> token = new AtomicReference<>();
        AtomicReference<String> signature = new AtomicReference<>();
        ExecutorService executor = Executors.newCachedThreadPool();
        HttpServer server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", exchange -> {
            body.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            date.set(exchange.getRequestHeaders().getFirst(HttpRemoteServiceClient.DATE_HEADER));
            token.set(exchange.getRequestHeaders().getFirst(HttpRemoteServiceClient.SESSION_TOKEN_HEADER));
            signature.set(exchange.getRequestHeaders().getFirst(HttpRemoteServiceClient.SIGNATURE_HEADER));
            respond(exchange, 200, "{\"MetricAlarms\":[]}");
        });
        server.setExecutor(executor);
        server.start();
        try {
            HttpRemoteServiceClient client = new HttpRemoteServiceClient(
                    "http://127.0.0.1:" + server.getAddress().getPort(), Duration.ofSeconds(5));
            try (SecretMaterial material = new SecretMaterial("crd_2", "ASIAEXAMPLEKEY000002", "wJalrSecret".toCharArray(),
                    "FwoGZXIvYXdzEXAMPLE".toCharArray(), "us-east-1")) {
                client.invoke(new RemoteCall("cloudwatch", "DescribeAlarms", "us-east-1", null), material);
            }

            Assertions.assertEquals("FwoGZXIvYXdzEXAMPLE", token.get());
            Assertions.assertFalse(body.get().contains("FwoGZXIv"));
            Assertions.assertEquals(HttpRemoteServiceClient.sign("wJalrSecret".toCharArray(),
                    HttpRemoteServiceClient.stringToSign("/cloudwatch/DescribeAlarms", date.get(), body.get(), "FwoGZXIvYXdzEXAMPLE")),
                    signature.get());
            Assertions.assertNotEquals(HttpRemoteServiceClient.sign("wJalrSecret".toCharArray(),
                    HttpRemoteServiceClient.stringToSign("/cloudwatch/DescribeAlarms", date.get(), body.get(), null)),
                    signature.get());
        } finally {
            server.stop(0);
            executor.shutdownNow();
        }
    }

    @Test
    void connectTimeoutIsCappedBelowLongRequestTimeouts() {
        Assertions.assertEquals(Duration.ofSeconds(10),
                new HttpRemoteServiceClient("http://127.0.0.1:1", Duration.ofMinutes(5)).connectTimeout());
        Assertions.assertEquals(Duration.ofMillis(300),
                new HttpRemoteServiceClient("http://127.0.0.1:1", Duration.ofMillis(300)).connectTimeout());
    }

    @Test
    void providerErrorCarriesCodeAndStatus() throws Exception {
        ExecutorService executor = Executors.newCachedThreadPool();
        HttpServer server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/s3/ListBuckets", exchange -> {
            exchange.getRequestBody().readAllBytes();
            respond(exchange, 403, "{\"error\":{\"code\":\"AccessDenied\",\"message\":\"s3:ListAllMyBuckets denied\"}}");
        });
        server.createContext("/iam/ListUsers", exchange -> {
            exchange.getRequestBody().readAllBytes();
            respond(exchange, 502, "upstream unavailable");
        });
        server.setExecutor(executor);
        server.start();
        try {
            HttpRemoteServiceClient client = new HttpRemoteServiceClient(
                    "http://127.0.0.1:" + server.getAddress().getPort(), Duration.ofSeconds(5));

            try (SecretMaterial material = material()) {
                RemoteCallException denied = Assertions.assertThrows(RemoteCallException.class,
                        () -> client.invoke(new RemoteCall("s3", "ListBuckets", "us-east-1", null), material));
                Assertions.assertEquals("AccessDenied", denied.errorCode());
                Assertions.assertEquals(403, denied.httpStatus());
                Assertions.assertFalse(denied.timeout());
                Assertions.assertTrue(denied.getMessage().contains("s3:ListAllMyBuckets denied"));

                RemoteCallException upstream = Assertions.assertThrows(RemoteCallException.class,
                        () -> client.invoke(new RemoteCall("iam", "ListUsers", "us-east-1", null), material));
                Assertions.assertEquals("HTTP502", upstream.errorCode());
                Assertions.assertTrue(upstream.getMessage().contains("upstream unavailable"));
            }
        } finally {
            server.stop(0);
            executor.shutdownNow();
        }
    }

    @Test
    void slowResponseIsReportedAsTimeout() throws Exception {
        ExecutorService executor = Executors.newCachedThreadPool();
        HttpServer server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", exchange -> {
            try {
                Thread.sleep(2_000L);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            respond(exchange, 200, "{}");
        });
        server.setExecutor(executor);
        server.start();
        try {
            HttpRemoteServiceClient client = new HttpRemoteServiceClient(
                    "http://127.0.0.1:" + server.getAddress().getPort(), Duration.ofMillis(300));
            try (SecretMaterial material = material()) {
                RemoteCallException e = Assertions.assertThrows(RemoteCallException.class,
                        () -> client.invoke(new RemoteCall("ec2", "DescribeRegions", "us-east-1", null), material));
                Assertions.assertTrue(e.timeout());
                Assertions.assertEquals(ErrorClassification.SERVICE_LIMIT_ERROR,
                        AbstractServiceChecker.classify(e));
            }
        } finally {
            server.stop(0);
            executor.shutdownNow();
        }
    }

    private static SecretMaterial material() {
        return new SecretMaterial("crd_1", "AKIAEXAMPLEKEY000001", "wJalrSecret".toCharArray(), "us-east-1");
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }
}
