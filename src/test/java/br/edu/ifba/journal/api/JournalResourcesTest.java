package br.edu.ifba.journal.api;

import br.edu.ifba.journal.client.ChatMessage;
import br.edu.ifba.journal.client.EmbeddingRequest;
import br.edu.ifba.journal.client.EmbeddingResponse;
import br.edu.ifba.journal.client.LlmChatClient;
import br.edu.ifba.journal.client.LlmChatRequest;
import br.edu.ifba.journal.client.LlmChatResponse;
import br.edu.ifba.journal.client.LlmEmbeddingClient;
import br.edu.ifba.journal.prompt.PromptTemplates;
import br.edu.ifba.journal.support.FakeEmbeddingFunction;
import io.quarkus.test.InjectMock;
import io.quarkus.test.junit.QuarkusTest;
import io.restassured.http.ContentType;
import org.eclipse.microprofile.rest.client.inject.RestClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.notNullValue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

/**
 * HTTP tests of the journal endpoints with the model endpoints mocked.
 * Every test uses its own owner id, since the in-memory storages live as long as the application.
 */
@QuarkusTest
class JournalResourcesTest {

    private static final String REPLY = "That sounds draining. What made it feel so long?";
    private static final String SUMMARY = "The user had a long day at work.";

    @InjectMock
    @RestClient
    LlmChatClient chatClient;

    @InjectMock
    @RestClient
    LlmEmbeddingClient embeddingClient;

    private String owner;

    @BeforeEach
    void setUp() {
        owner = "user-" + UUID.randomUUID();

        when(chatClient.chat(any(LlmChatRequest.class))).thenAnswer(invocation -> {
            LlmChatRequest request = invocation.getArgument(0);
            String content;
            if (request.responseFormat() != null) {
                content = "{\"entities\": [], \"emotions\": [], \"relationships\": [], \"intent\": \"general\"}";
            } else if (Integer.valueOf(150).equals(request.maxTokens())) {
                content = SUMMARY;
            } else {
                content = REPLY;
            }
            return chatResponse(content);
        });

        when(embeddingClient.embed(any(EmbeddingRequest.class))).thenAnswer(invocation -> {
            EmbeddingRequest request = invocation.getArgument(0);
            List<EmbeddingResponse.Embedding> data = new ArrayList<>();
            for (int i = 0; i < request.input().size(); i++) {
                data.add(new EmbeddingResponse.Embedding(toDoubles(FakeEmbeddingFunction.vectorOf(request.input().get(i))), i));
            }
            return new EmbeddingResponse("test-embedding", data);
        });
    }

    @Test
    void turnReturnsReply() {
        given()
            .contentType(ContentType.JSON)
            .body("{\"message\": \"Work was long today\"}")
        .when()
            .post("/journal/{owner}/sessions/{session}/turns", owner, "s1")
        .then()
            .statusCode(200)
            .body("reply", equalTo(REPLY))
            .body("flagged", equalTo(false))
            .body("degraded", equalTo(false));
    }

    @Test
    void turnDegradesWhenChatModelIsDown() {
        when(chatClient.chat(any(LlmChatRequest.class))).thenThrow(new IllegalStateException("connection refused"));

        given()
            .contentType(ContentType.JSON)
            .body("{\"message\": \"Work was long today\"}")
        .when()
            .post("/journal/{owner}/sessions/{session}/turns", owner, "s1")
        .then()
            .statusCode(200)
            .body("reply", equalTo(PromptTemplates.STATIC_APOLOGY))
            .body("degraded", equalTo(true));
    }

    @Test
    void blankMessageIsRejected() {
        given()
            .contentType(ContentType.JSON)
            .body("{\"message\": \"  \"}")
        .when()
            .post("/journal/{owner}/sessions/{session}/turns", owner, "s1")
        .then()
            .statusCode(400);
    }

    @Test
    void savedSessionCanBeListedReadAndDeleted() {
        given()
            .contentType(ContentType.JSON)
            .body("{\"message\": \"Work was long today\"}")
            .post("/journal/{owner}/sessions/{session}/turns", owner, "s1")
            .then()
            .statusCode(200);

        String id = given()
        .when()
            .post("/journal/{owner}/sessions/{session}/entries", owner, "s1")
        .then()
            .statusCode(201)
            .header("Location", containsString("/journal/" + owner + "/entries/"))
            .body("id", notNullValue())
            .body("degraded", empty())
            .extract().path("id");

        given()
            .get("/journal/{owner}/entries/{id}", owner, id)
        .then()
            .statusCode(200)
            .body("summary", equalTo(SUMMARY))
            .body("transcript", hasSize(2))
            .body("transcript[0]", equalTo("User: Work was long today"));

        given()
            .queryParam("limit", 10)
            .get("/journal/{owner}/entries", owner)
        .then()
            .statusCode(200)
            .body("", hasSize(1));

        given()
            .get("/journal/{owner}/entries/recent", owner)
        .then()
            .statusCode(200)
            .body("[0].id", equalTo(id));

        given()
            .delete("/journal/{owner}/entries/{id}", owner, id)
        .then()
            .statusCode(204);

        given()
            .get("/journal/{owner}/entries/{id}", owner, id)
        .then()
            .statusCode(404)
            .contentType("application/problem+json");
    }

    @Test
    void savingAnEmptySessionIsABadRequest() {
        given()
        .when()
            .post("/journal/{owner}/sessions/{session}/entries", owner, "never-used")
        .then()
            .statusCode(400)
            .contentType("application/problem+json")
            .body("status", equalTo(400));
    }

    @Test
    void entriesAreScopedToTheirOwner() {
        given()
            .contentType(ContentType.JSON)
            .body("{\"message\": \"Work was long today\"}")
            .post("/journal/{owner}/sessions/{session}/turns", owner, "s1")
            .then()
            .statusCode(200);
        String id = given()
            .post("/journal/{owner}/sessions/{session}/entries", owner, "s1")
            .then()
            .statusCode(201)
            .extract().path("id");

        String stranger = "user-" + UUID.randomUUID();
        given()
            .get("/journal/{owner}/entries/{id}", stranger, id)
        .then()
            .statusCode(404);
        given()
            .get("/journal/{owner}/entries", stranger)
        .then()
            .statusCode(200)
            .body("", hasSize(0));
    }

    @Test
    void invalidLimitIsRejected() {
        given()
            .queryParam("limit", 0)
            .get("/journal/{owner}/entries", owner)
        .then()
            .statusCode(400);
    }

    private static LlmChatResponse chatResponse(String content) {
        return new LlmChatResponse(
            "test-id",
            "test-chat",
            List.of(new LlmChatResponse.Choice(0, new ChatMessage("assistant", content), "stop")),
            new LlmChatResponse.Usage(10, 10, 20));
    }

    private static List<Double> toDoubles(float[] vector) {
        List<Double> values = new ArrayList<>(vector.length);
        for (float value : vector) {
            values.add((double) value);
        }
        return values;
    }
}
