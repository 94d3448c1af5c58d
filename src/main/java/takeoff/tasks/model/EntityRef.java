package takeoff.tasks.model;

/**
 * Reference to the domain object a task operates on (a document, a page, an
 * export job).
 */
public record EntityRef(String entityType, String entityId) {

    public static EntityRef of(String entityType, String entityId) {
        return new EntityRef(entityType, entityId);
    }
}
