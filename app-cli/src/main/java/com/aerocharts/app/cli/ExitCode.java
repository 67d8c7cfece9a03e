package com.aerocharts.app.cli;

import com.aerocharts.core.error.ChartFailureKind;

/** 프로세스 종료 코드 */
public enum ExitCode {
    OK(0),
    NO_CHARTS(2),
    UNKNOWN_AIRPORT(3),
    UNREACHABLE(4),
    NOT_FOUND(5),
    STRUCTURE_CHANGED(6),
    ACCESS_RESTRICTED(7),
    USAGE(64);

    private final int code;

    ExitCode(int code) { this.code = code; }

    public int code() { return code; }

    public static ExitCode forFailure(ChartFailureKind kind) {
        switch (kind) {
            case UNKNOWN_SOURCE:       return UNKNOWN_AIRPORT;
            case NOT_FOUND:            return NOT_FOUND;
            case PARSE_MISMATCH:       return STRUCTURE_CHANGED;
            case ACCESS_RESTRICTED:    return ACCESS_RESTRICTED;
            case UPSTREAM_UNAVAILABLE:
            case BACKEND_TIMEOUT:
            case VERSION_UNRESOLVED:
            default:                   return UNREACHABLE;
        }
    }
}
