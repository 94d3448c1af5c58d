package takeoff.tasks.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable durable description of one unit of asynchronous work.
 * One row per task in the record store; authoritative once terminal.
 */
public final class TaskRecord {
    private final String taskId;
    private final String projectId;
    private final String taskType;
    private final String taskName;
    private final TaskStatus status;
    private final double progressPercent;
    private final String progressStep;
    private final String progressDetail;
    private final String entityType;
    private final String entityId;
    private final JsonNode resultSummary; // SUCCESS only
    private final String errorMessage; // FAILURE only
    private final String errorTrace;
    private final Instant createdAt;
    private final Instant startedAt;
    private final Instant completedAt;
    private final Long durationMs;
    private final String initiatedBy;
    private final String provider;
    private final JsonNode metadata;

    private TaskRecord(Builder builder) {
        this.taskId = Objects.requireNonNull(builder.taskId, "taskId is required");
        this.projectId = builder.projectId;
        this.taskType = Objects.requireNonNull(builder.taskType, "taskType is required");
        this.taskName = Objects.requireNonNull(builder.taskName, "taskName is required");
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.progressPercent = builder.progressPercent;
        this.progressStep = builder.progressStep;
        this.progressDetail = builder.progressDetail;
        this.entityType = builder.entityType;
        this.entityId = builder.entityId;
        this.resultSummary = builder.resultSummary;
        this.errorMessage = builder.errorMessage;
        this.errorTrace = builder.errorTrace;
        this.createdAt = builder.createdAt;
        this.startedAt = builder.startedAt;
        this.completedAt = builder.completedAt;
        this.durationMs = builder.durationMs;
        this.initiatedBy = builder.initiatedBy;
        this.provider = builder.provider;
        this.metadata = builder.metadata;
    }

    public String taskId() {
        return taskId;
    }

    public String projectId() {
        return projectId;
    }

    public String taskType() {
        return taskType;
    }

    public String taskName() {
        return taskName;
    }

    public TaskStatus status() {
        return status;
    }

    public double progressPercent() {
        return progressPercent;
    }

    public String progressStep() {
        return progressStep;
    }

    public String progressDetail() {
        return progressDetail;
    }

    public String entityType() {
        return entityType;
    }

    public String entityId() {
        return entityId;
    }

    public JsonNode resultSummary() {
        return resultSummary;
    }

    public String errorMessage() {
        return errorMessage;
    }

    public String errorTrace() {
        return errorTrace;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant completedAt() {
        return completedAt;
    }

    public Long durationMs() {
        return durationMs;
    }

    public String initiatedBy() {
        return initiatedBy;
    }

    public String provider() {
        return provider;
    }

    public JsonNode metadata() {
        return metadata;
    }

    /** Check if task is in terminal state */
    public boolean isTerminal() {
        return status.isTerminal();
    }

    /** Create a builder from this record (for updates) */
    public Builder toBuilder() {
        return new Builder()
                .taskId(taskId)
                .projectId(projectId)
                .taskType(taskType)
                .taskName(taskName)
                .status(status)
                .progressPercent(progressPercent)
                .progressStep(progressStep)
                .progressDetail(progressDetail)
                .entityType(entityType)
                .entityId(entityId)
                .resultSummary(resultSummary)
                .errorMessage(errorMessage)
                .errorTrace(errorTrace)
                .createdAt(createdAt)
                .startedAt(startedAt)
                .completedAt(completedAt)
                .durationMs(durationMs)
                .initiatedBy(initiatedBy)
                .provider(provider)
                .metadata(metadata);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String taskId;
        private String projectId;
        private String taskType;
        private String taskName;
        private TaskStatus status = TaskStatus.PENDING;
        private double progressPercent = 0.0;
        private String progressStep;
        private String progressDetail;
        private String entityType;
        private String entityId;
        private JsonNode resultSummary;
        private String errorMessage;
        private String errorTrace;
        private Instant createdAt;
        private Instant startedAt;
        private Instant completedAt;
        private Long durationMs;
        private String initiatedBy;
        private String provider;
        private JsonNode metadata;

        public Builder taskId(String taskId) {
            this.taskId = taskId;
            return this;
        }

        public Builder projectId(String projectId) {
            this.projectId = projectId;
            return this;
        }

        public Builder taskType(String taskType) {
            this.taskType = taskType;
            return this;
        }

        public Builder taskName(String taskName) {
            this.taskName = taskName;
            return this;
        }

        public Builder status(TaskStatus status) {
            this.status = status;
            return this;
        }

        public Builder progressPercent(double progressPercent) {
            this.progressPercent = progressPercent;
            return this;
        }

        public Builder progressStep(String progressStep) {
            this.progressStep = progressStep;
            return this;
        }

        public Builder progressDetail(String progressDetail) {
            this.progressDetail = progressDetail;
            return this;
        }

        public Builder entityType(String entityType) {
            this.entityType = entityType;
            return this;
        }

        public Builder entityId(String entityId) {
            this.entityId = entityId;
            return this;
        }

        public Builder entity(EntityRef ref) {
            this.entityType = ref != null ? ref.entityType() : null;
            this.entityId = ref != null ? ref.entityId() : null;
            return this;
        }

        public Builder resultSummary(JsonNode resultSummary) {
            this.resultSummary = resultSummary;
            return this;
        }

        public Builder errorMessage(String errorMessage) {
            this.errorMessage = errorMessage;
            return this;
        }

        public Builder errorTrace(String errorTrace) {
            this.errorTrace = errorTrace;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder completedAt(Instant completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        public Builder durationMs(Long durationMs) {
            this.durationMs = durationMs;
            return this;
        }

        public Builder initiatedBy(String initiatedBy) {
            this.initiatedBy = initiatedBy;
            return this;
        }

        public Builder provider(String provider) {
            this.provider = provider;
            return this;
        }

        public Builder metadata(JsonNode metadata) {
            this.metadata = metadata;
            return this;
        }

        public TaskRecord build() {
            return new TaskRecord(this);
        }
    }

    /**
     * Field-by-field comparison, used to verify that dropped writes leave the row
     * untouched. {@link #equals(Object)} compares identity by task id only.
     */
    public boolean sameContentAs(TaskRecord other) {
        if (other == null) {
            return false;
        }
        return taskId.equals(other.taskId)
                && Objects.equals(projectId, other.projectId)
                && taskType.equals(other.taskType)
                && taskName.equals(other.taskName)
                && status == other.status
                && Double.compare(progressPercent, other.progressPercent) == 0
                && Objects.equals(progressStep, other.progressStep)
                && Objects.equals(progressDetail, other.progressDetail)
                && Objects.equals(entityType, other.entityType)
                && Objects.equals(entityId, other.entityId)
                && Objects.equals(resultSummary, other.resultSummary)
                && Objects.equals(errorMessage, other.errorMessage)
                && Objects.equals(errorTrace, other.errorTrace)
                && Objects.equals(createdAt, other.createdAt)
                && Objects.equals(startedAt, other.startedAt)
                && Objects.equals(completedAt, other.completedAt)
                && Objects.equals(durationMs, other.durationMs)
                && Objects.equals(initiatedBy, other.initiatedBy)
                && Objects.equals(provider, other.provider)
                && Objects.equals(metadata, other.metadata);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TaskRecord record))
            return false;
        return Objects.equals(taskId, record.taskId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(taskId);
    }

    @Override
    public String toString() {
        return "TaskRecord{taskId='" + taskId + "', type='" + taskType + "', status=" + status
                + ", progress=" + progressPercent + "}";
    }
}
