package com.aerocharts.core.error;

import java.util.Objects;

/**
 * 차트 해석 실패(타입 있는 오류). kind로 분기하고, 원인 예외는 cause로 보존.
 * sourceId/identifier는 오케스트레이터가 알고 있는 만큼 채운다.
 */
public class ChartSourceException extends Exception {
    private static final long serialVersionUID = 1L;

    private final ChartFailureKind kind;
    private final String sourceId;
    private final String identifier;

    public ChartSourceException(ChartFailureKind kind, String message) {
        this(kind, message, null, null, null);
    }

    public ChartSourceException(ChartFailureKind kind, String message, Throwable cause) {
        this(kind, message, null, null, cause);
    }

    public ChartSourceException(ChartFailureKind kind, String message,
                                String sourceId, String identifier, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.sourceId = sourceId;
        this.identifier = identifier;
    }

    public ChartFailureKind kind() { return kind; }
    public String sourceId() { return sourceId; }
    public String identifier() { return identifier; }
    public boolean isRetryable() { return kind.isRetryable(); }

    /** 같은 kind/메시지/원인에 컨텍스트(sourceId, identifier)를 채운 사본 */
    public ChartSourceException withContext(String sourceId, String identifier) {
        if (Objects.equals(this.sourceId, sourceId) && Objects.equals(this.identifier, identifier)) return this;
        ChartSourceException copy = new ChartSourceException(kind, getMessage(),
                this.sourceId != null ? this.sourceId : sourceId,
                this.identifier != null ? this.identifier : identifier,
                getCause());
        copy.setStackTrace(getStackTrace());
        return copy;
    }

    @Override
    public String toString() {
        return "ChartSourceException{" + kind
                + (sourceId == null ? "" : ", source=" + sourceId)
                + (identifier == null ? "" : ", id=" + identifier)
                + ", " + getMessage() + '}';
    }
}
