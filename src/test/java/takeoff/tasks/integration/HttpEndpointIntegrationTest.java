package takeoff.tasks.integration;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.*;
import takeoff.tasks.config.Dependencies;
import takeoff.tasks.config.TrackerConfig;
import takeoff.tasks.server.TrackerNettyServer;
import takeoff.tasks.util.Jsons;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration test that hits actual HTTP endpoints through the Netty server.
 */
class HttpEndpointIntegrationTest {

        private static final int TEST_PORT = 18080;
        private static final String AGENT_KEY = "test-agent-key";
        private static final String BASE_URL = "http://localhost:" + TEST_PORT;

        private Dependencies deps;
        private TrackerNettyServer server;
        private HttpClient httpClient;

        @BeforeEach
        void setUp() {
                TrackerConfig config = TrackerConfig.defaults()
                                .withDatabaseUrl("jdbc:h2:mem:test-http-" + System.nanoTime()
                                                + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE")
                                .withServerPort(TEST_PORT)
                                .withAgentKey(AGENT_KEY);
                deps = Dependencies.create(config);
                server = new TrackerNettyServer(deps.routerHandler());
                server.start("127.0.0.1", TEST_PORT);

                httpClient = HttpClient.newBuilder()
                                .connectTimeout(Duration.ofSeconds(5))
                                .build();
        }

        @AfterEach
        void tearDown() {
                if (server != null) {
                        server.stop();
                }
                if (deps != null) {
                        deps.close();
                }
        }

        private HttpResponse<String> get(String path) throws Exception {
                return httpClient.send(
                                HttpRequest.newBuilder()
                                                .uri(URI.create(BASE_URL + path))
                                                .header("X-Takeoff-Key", AGENT_KEY)
                                                .GET()
                                                .build(),
                                HttpResponse.BodyHandlers.ofString());
        }

        private HttpResponse<String> post(String path, String body) throws Exception {
                return httpClient.send(
                                HttpRequest.newBuilder()
                                                .uri(URI.create(BASE_URL + path))
                                                .header("Content-Type", "application/json")
                                                .header("X-Takeoff-Key", AGENT_KEY)
                                                .POST(HttpRequest.BodyPublishers.ofString(body))
                                                .build(),
                                HttpResponse.BodyHandlers.ofString());
        }

        private void registerTask(String taskId, String type) throws Exception {
                String body = String.format("""
                                {
                                    "taskId": "%s",
                                    "taskType": "%s",
                                    "taskName": "Process %s",
                                    "projectId": "proj-1",
                                    "entityType": "document",
                                    "entityId": "doc-%s",
                                    "metadata": {"filename": "%s.pdf"}
                                }
                                """, taskId, type, taskId, taskId, taskId);
                HttpResponse<String> response = post("/internal/v1/tasks", body);
                assertEquals(201, response.statusCode(), "Register should return 201. Body: " + response.body());
        }

        @Test
        @DisplayName("Worker hooks drive a task to SUCCESS, public API reflects it")
        void fullLifecycleViaHttp() throws Exception {
                registerTask("t-http-1", "document_processing");

                JsonNode pending = Jsons.mapper().readTree(get("/api/v1/tasks/t-http-1").body());
                assertEquals("PENDING", pending.get("status").asText());
                assertEquals("doc-t-http-1", pending.get("entityId").asText());

                HttpResponse<String> started = post("/internal/v1/tasks/t-http-1/started", "");
                assertEquals(200, started.statusCode());
                assertTrue(Jsons.mapper().readTree(started.body()).get("ok").asBoolean());

                HttpResponse<String> progress = post("/internal/v1/tasks/t-http-1/progress",
                                "{\"percent\": 40, \"step\": \"parsing\", \"detail\": \"page 4 of 10\"}");
                assertEquals(200, progress.statusCode());

                JsonNode inProgress = Jsons.mapper().readTree(get("/api/v1/tasks/t-http-1").body());
                assertEquals("PROGRESS", inProgress.get("status").asText());
                assertEquals(40.0, inProgress.get("progress").get("percent").asDouble());
                assertEquals("parsing", inProgress.get("progress").get("step").asText());

                HttpResponse<String> complete = post("/internal/v1/tasks/t-http-1/complete",
                                "{\"result\": {\"pages\": 12}}");
                assertEquals(200, complete.statusCode());
                assertEquals("applied", Jsons.mapper().readTree(complete.body()).get("result").asText());

                JsonNode done = Jsons.mapper().readTree(get("/api/v1/tasks/t-http-1").body());
                assertEquals("SUCCESS", done.get("status").asText());
                assertEquals(100.0, done.get("progress").get("percent").asDouble());
                assertEquals(12, done.get("result").get("pages").asInt());

                // Late progress after completion is dropped but not an error
                HttpResponse<String> late = post("/internal/v1/tasks/t-http-1/progress", "{\"percent\": 50}");
                assertEquals(200, late.statusCode());
                JsonNode lateBody = Jsons.mapper().readTree(late.body());
                assertFalse(lateBody.get("ok").asBoolean());
                assertEquals("stale_write", lateBody.get("result").asText());
        }

        @Test
        @DisplayName("Cancel endpoint revokes and is idempotent")
        void cancelViaHttp() throws Exception {
                registerTask("t-http-2", "export");
                post("/internal/v1/tasks/t-http-2/started", "");

                HttpResponse<String> cancel = post("/api/v1/tasks/t-http-2/cancel", "");
                assertEquals(200, cancel.statusCode());
                JsonNode body = Jsons.mapper().readTree(cancel.body());
                assertEquals("REVOKED", body.get("status").asText());
                assertEquals("Cancellation signal sent", body.get("message").asText());

                JsonNode flag = Jsons.mapper().readTree(get("/internal/v1/tasks/t-http-2/cancelled").body());
                assertTrue(flag.get("cancelled").asBoolean());

                JsonNode again = Jsons.mapper().readTree(post("/api/v1/tasks/t-http-2/cancel", "").body());
                assertEquals("already completed", again.get("message").asText());

                HttpResponse<String> missing = post("/api/v1/tasks/nope/cancel", "");
                assertEquals(404, missing.statusCode());
        }

        @Test
        @DisplayName("Project listing filters, paginates and counts")
        void listTasksViaHttp() throws Exception {
                registerTask("l-1", "export");
                registerTask("l-2", "export");
                registerTask("l-3", "import");
                post("/internal/v1/tasks/l-1/fail", "{\"error\": \"quota exceeded\"}");
                post("/api/v1/tasks/l-2/cancel", "");

                JsonNode all = Jsons.mapper().readTree(get("/api/v1/projects/proj-1/tasks").body());
                assertEquals(3, all.get("total").asInt());
                assertEquals(1, all.get("running").asInt());
                assertEquals(1, all.get("failed").asInt());
                assertEquals(1, all.get("cancelled").asInt());
                assertEquals(0, all.get("completed").asInt());

                JsonNode exports = Jsons.mapper().readTree(
                                get("/api/v1/projects/proj-1/tasks?type=export&limit=1&offset=0").body());
                assertEquals(2, exports.get("total").asInt());
                assertEquals(1, exports.get("tasks").size());

                JsonNode failed = Jsons.mapper().readTree(
                                get("/api/v1/projects/proj-1/tasks?status=failure").body());
                assertEquals(1, failed.get("total").asInt());
                assertEquals("quota exceeded", failed.get("tasks").get(0).get("error").asText());

                assertEquals(400, get("/api/v1/projects/proj-1/tasks?limit=500").statusCode());
                assertEquals(400, get("/api/v1/projects/proj-1/tasks?offset=-1").statusCode());
                assertEquals(400, get("/api/v1/projects/proj-1/tasks?status=bogus").statusCode());
        }

        @Test
        void duplicateRegistrationIsConflict() throws Exception {
                registerTask("dup-1", "export");
                HttpResponse<String> again = post("/internal/v1/tasks",
                                "{\"taskId\":\"dup-1\",\"taskType\":\"export\",\"taskName\":\"Again\"}");
                assertEquals(409, again.statusCode());
        }

        @Test
        void unknownTaskIsNotFound() throws Exception {
                assertEquals(404, get("/api/v1/tasks/missing").statusCode());
                assertEquals(404, post("/internal/v1/tasks/missing/started", "").statusCode());
                assertEquals(404, get("/api/v1/unknown").statusCode());
        }

        @Test
        void internalEndpointsRequireAgentKey() throws Exception {
                HttpResponse<String> response = httpClient.send(
                                HttpRequest.newBuilder()
                                                .uri(URI.create(BASE_URL + "/internal/v1/tasks"))
                                                .header("Content-Type", "application/json")
                                                .POST(HttpRequest.BodyPublishers.ofString(
                                                                "{\"taskId\":\"k-1\",\"taskType\":\"x\",\"taskName\":\"y\"}"))
                                                .build(),
                                HttpResponse.BodyHandlers.ofString());
                assertEquals(403, response.statusCode());
        }

        @Test
        void badRequestsAreRejected() throws Exception {
                registerTask("bad-1", "export");
                assertEquals(400, post("/internal/v1/tasks/bad-1/progress", "{\"percent\": 150}").statusCode());
                assertEquals(400, post("/internal/v1/tasks/bad-1/progress", "not json").statusCode());
                assertEquals(400, post("/internal/v1/tasks", "{\"taskId\":\"bad-2\"}").statusCode());
        }

        @Test
        void healthReportsActiveTasks() throws Exception {
                registerTask("h-1", "export");

                HttpResponse<String> response = get("/api/v1/health");
                assertEquals(200, response.statusCode());
                JsonNode health = Jsons.mapper().readTree(response.body());
                assertEquals("healthy", health.get("status").asText());
                assertEquals(1, health.get("activeTasks").asInt());
        }
}
