package work.labinv.sp.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import work.labinv.sp.report.Explanation;
import work.labinv.sp.report.ResultView;

/**
 * Outcome of a {@link SetupParamRunner} invocation. Only {@link Status#SUCCESS} carries a view; an unsupported
 * type or a failure never exposes a partial result.
 */
public record RunResult(
    Status status,
    String typeName,
    Optional<ResultView> view,
    String message,
    Instant startedAt,
    Instant finishedAt
) {
    private static final ObjectWriter WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    public RunResult {
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(view, "view");
        message = message == null ? "" : message;
    }

    public static RunResult success(String typeName, ResultView view, Instant startedAt) {
        return new RunResult(Status.SUCCESS, typeName, Optional.of(view), "", startedAt, Instant.now());
    }

    public static RunResult unsupported(String typeName, String message, Instant startedAt) {
        return new RunResult(Status.UNSUPPORTED, typeName, Optional.empty(), message, startedAt, Instant.now());
    }

    public static RunResult failure(String typeName, String message, Instant startedAt) {
        return new RunResult(Status.FAILURE, typeName, Optional.empty(), message, startedAt, Instant.now());
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("status", status.name().toLowerCase(Locale.ROOT));
        serializable.put("type", typeName);
        view.ifPresent(v -> {
            serializable.put("values", v.result().asMap());
            serializable.put("formatted", v.formattedValues());
        });
        if (!message.isEmpty()) {
            serializable.put("message", message);
        }
        serializable.put("startedAt", startedAt.toString());
        serializable.put("finishedAt", finishedAt.toString());
        return serializable;
    }

    public String toPrettyJson() {
        return toPrettyJson(List.of());
    }

    /**
     * Pretty JSON of {@link #toSerializableMap()}, with an {@code explanations} array when any are given.
     */
    public String toPrettyJson(List<Explanation> explanations) {
        Map<String, Object> serializable = toSerializableMap();
        if (explanations != null && !explanations.isEmpty()) {
            serializable.put("explanations", explanations.stream().map(Explanation::toMap).collect(Collectors.toList()));
        }
        try {
            return WRITER.writeValueAsString(serializable);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to serialize " + status + " result of " + typeName, ex);
        }
    }

    public enum Status {
        SUCCESS(0),
        FAILURE(1),
        UNSUPPORTED(2);

        private final int exitCode;

        Status(int exitCode) {
            this.exitCode = exitCode;
        }

        public int exitCode() {
            return exitCode;
        }
    }
}
