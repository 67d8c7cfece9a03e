package com.aerocharts.core.util;

import java.time.Instant;
import java.util.Arrays;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * JSON 라인 이벤트 로거(JUL 위에서 동작).
 * with(k, v)로 source/icao 같은 공통 필드를 묶은 자식 로거를 만든다.
 *
 * 예) {"ts":"...","lvl":"INFO","comp":"ChartResolutionService","event":"resolve-done","source":"faa","count":12}
 */
public final class StructuredLog {
    private final Logger jul;
    private final String comp;
    private final Object[] bound;

    private StructuredLog(Logger jul, String comp, Object[] bound) {
        this.jul = jul;
        this.comp = comp;
        this.bound = bound;
    }

    public static StructuredLog get(Class<?> cls) {
        return new StructuredLog(Logger.getLogger(cls.getName()), cls.getSimpleName(), new Object[0]);
    }

    /** 필드를 추가로 묶은 새 로거(원본 불변) */
    public StructuredLog with(String key, Object value) {
        Object[] next = Arrays.copyOf(bound, bound.length + 2);
        next[bound.length] = key;
        next[bound.length + 1] = value;
        return new StructuredLog(jul, comp, next);
    }

    public void debug(String event, Object... kvs) { log(Level.FINE, event, null, kvs); }
    public void info(String event, Object... kvs)  { log(Level.INFO, event, null, kvs); }
    public void warn(String event, Object... kvs)  { log(Level.WARNING, event, null, kvs); }
    public void warn(String event, Throwable t, Object... kvs) { log(Level.WARNING, event, t, kvs); }
    public void error(String event, Throwable t, Object... kvs) { log(Level.SEVERE, event, t, kvs); }

    private void log(Level lvl, String event, Throwable t, Object[] kvs) {
        if (!jul.isLoggable(lvl)) return;
        String line = toJson(lvl, event, t, kvs);
        if (t == null) jul.log(lvl, line); else jul.log(lvl, line, t);
    }

    String toJson(Level lvl, String event, Throwable t, Object[] kvs) {
        JsonLine j = new JsonLine()
                .put("ts", Instant.now().toString())
                .put("lvl", lvl.getName())
                .put("comp", comp)
                .put("thread", Thread.currentThread().getName())
                .put("event", event)
                .putAll(bound)
                .putAll(kvs);
        if (t != null) {
            j.put("error", t.getClass().getSimpleName()).put("message", t.getMessage());
        }
        return j.toString();
    }

    /** 한 줄 JSON 객체 빌더(문자열/숫자/불리언만) */
    static final class JsonLine {
        private final StringBuilder sb = new StringBuilder(160).append('{');
        private boolean first = true;

        JsonLine put(String k, Object v) {
            if (!first) sb.append(',');
            first = false;
            quote(k);
            sb.append(':');
            if (v == null) sb.append("null");
            else if (v instanceof Number || v instanceof Boolean) sb.append(v);
            else quote(String.valueOf(v));
            return this;
        }

        JsonLine putAll(Object[] kvs) {
            if (kvs == null) return this;
            for (int i = 0; i + 1 < kvs.length; i += 2) put(String.valueOf(kvs[i]), kvs[i + 1]);
            if (kvs.length % 2 == 1) put("_kv_mismatch", true);
            return this;
        }

        private void quote(String s) {
            sb.append('"');
            for (int i = 0; i < s.length(); i++) {
                char c = s.charAt(i);
                switch (c) {
                    case '"':  sb.append("\\\""); break;
                    case '\\': sb.append("\\\\"); break;
                    case '\n': sb.append("\\n");  break;
                    case '\r': sb.append("\\r");  break;
                    case '\t': sb.append("\\t");  break;
                    default:
                        if (c < 0x20) sb.append(String.format("\\u%04x", (int) c));
                        else sb.append(c);
                }
            }
            sb.append('"');
        }

        @Override public String toString() { return sb + "}"; }
    }
}
