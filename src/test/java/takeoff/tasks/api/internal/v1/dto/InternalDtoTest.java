package takeoff.tasks.api.internal.v1.dto;

import org.junit.jupiter.api.Test;
import takeoff.tasks.model.TaskRegistration;
import takeoff.tasks.model.TransitionResult;
import takeoff.tasks.util.Jsons;

import static org.junit.jupiter.api.Assertions.*;

class InternalDtoTest {

    @Test
    void registerRequestMapsToRegistration() throws Exception {
        String json = """
                {"taskId":"t-1","taskType":"export","taskName":"Export",
                 "projectId":"p-1","entityType":"document","entityId":"d-1",
                 "metadata":{"format":"pdf"}}
                """;
        RegisterTaskRequest request = Jsons.mapper().readValue(json, RegisterTaskRequest.class);
        request.validate();

        TaskRegistration registration = request.toRegistration();
        assertEquals("t-1", registration.taskId());
        assertEquals("p-1", registration.projectId());
        assertEquals("d-1", registration.entity().entityId());
        assertEquals("pdf", registration.metadata().get("format").asText());
    }

    @Test
    void registerRequestWithoutEntity() throws Exception {
        RegisterTaskRequest request = Jsons.mapper().readValue(
                "{\"taskId\":\"t-1\",\"taskType\":\"export\",\"taskName\":\"Export\"}", RegisterTaskRequest.class);
        assertNull(request.toRegistration().entity());
    }

    @Test
    void registerRequestValidation() throws Exception {
        RegisterTaskRequest missingName = Jsons.mapper().readValue(
                "{\"taskId\":\"t-1\",\"taskType\":\"export\"}", RegisterTaskRequest.class);
        assertThrows(IllegalArgumentException.class, missingName::validate);

        RegisterTaskRequest badMetadata = Jsons.mapper().readValue(
                "{\"taskId\":\"t-1\",\"taskType\":\"export\",\"taskName\":\"x\",\"metadata\":[1]}",
                RegisterTaskRequest.class);
        assertThrows(IllegalArgumentException.class, badMetadata::validate);
    }

    @Test
    void progressRequiresPercent() throws Exception {
        ProgressRequest request = Jsons.mapper().readValue("{\"step\":\"x\"}", ProgressRequest.class);
        assertThrows(IllegalArgumentException.class, request::validate);
    }

    @Test
    void failRequiresError() {
        assertThrows(IllegalArgumentException.class, () -> new FailRequest(" ", null).validate());
    }

    @Test
    void metadataMustBeObject() throws Exception {
        MetadataRequest request = Jsons.mapper().readValue("{\"metadata\":\"nope\"}", MetadataRequest.class);
        assertThrows(IllegalArgumentException.class, request::validate);
    }

    @Test
    void operationResponseReflectsResult() {
        assertTrue(OperationResponse.from(TransitionResult.APPLIED).ok());
        assertTrue(OperationResponse.from(TransitionResult.ALREADY_APPLIED).ok());
        assertFalse(OperationResponse.from(TransitionResult.STALE_WRITE).ok());
        assertEquals("stale_write", OperationResponse.from(TransitionResult.STALE_WRITE).result());
    }
}
