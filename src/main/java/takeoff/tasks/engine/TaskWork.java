package takeoff.tasks.engine;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A long-running operation (document ingestion, detection, export rendering).
 * Implementations report checkpoints and poll for cancellation through the
 * context.
 */
@FunctionalInterface
public interface TaskWork {

    /**
     * @param ctx execution context of this task
     * @return result summary, may be null
     * @throws TaskCancelledException when the operation stopped because it was cancelled
     * @throws Exception              any failure of the operation
     */
    JsonNode run(TaskContext ctx) throws Exception;
}
