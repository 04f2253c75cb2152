package com.stackprobe.core.util;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * JSON 라인 기반 구조화 로거(JUL 위에서 동작).
 * withContext(...)로 batchId 같은 공통 필드를 묶어 두면 모든 이벤트에 함께 찍힌다.
 */
public final class StructuredLog {
    private final Logger jul;
    private final String comp;
    private final Map<String, Object> context;

    private StructuredLog(Logger jul, String comp, Map<String, Object> context) {
        this.jul = jul;
        this.comp = comp;
        this.context = context;
    }

    public static StructuredLog get(Class<?> cls) {
        return new StructuredLog(Logger.getLogger(cls.getName()), cls.getSimpleName(), Map.of());
    }

    /** 공통 필드가 추가된 사본 */
    public StructuredLog withContext(String key, Object value) {
        Map<String, Object> m = new LinkedHashMap<>(context);
        m.put(key, value);
        return new StructuredLog(jul, comp, Map.copyOf(m));
    }

    public void debug(String event, Object... kvs) { log(Level.FINE,    event, null, kvs); }
    public void info (String event, Object... kvs) { log(Level.INFO,    event, null, kvs); }
    public void warn (String event, Object... kvs) { log(Level.WARNING, event, null, kvs); }
    public void error(String event, Throwable t, Object... kvs) { log(Level.SEVERE, event, t, kvs); }

    private void log(Level lvl, String event, Throwable t, Object... kvs) {
        if (!jul.isLoggable(lvl)) return;
        String line = toJson(lvl, event, t, kvs);
        if (t == null) jul.log(lvl, line); else jul.log(lvl, line, t);
    }

    String toJson(Level lvl, String event, Throwable t, Object... kvs) {
        StringBuilder sb = new StringBuilder(160);
        sb.append('{');
        kv(sb, "ts", Instant.now().toString());
        kv(sb, "lvl", lvl.getName());
        kv(sb, "comp", comp);
        kv(sb, "thread", Thread.currentThread().getName());
        kv(sb, "event", event);
        context.forEach((k, v) -> kv(sb, k, v));

        if (kvs != null) {
            for (int i = 0; i + 1 < kvs.length; i += 2) {
                kv(sb, String.valueOf(kvs[i]), kvs[i + 1]);
            }
            if (kvs.length % 2 == 1) kv(sb, "_kv_mismatch", true);
        }
        if (t != null) {
            kv(sb, "error", t.getClass().getSimpleName());
            kv(sb, "message", t.getMessage());
        }
        sb.setLength(sb.length() - 1);   // 마지막 콤마
        sb.append('}');
        return sb.toString();
    }

    private static void kv(StringBuilder sb, String k, Object v) {
        sb.append('"').append(esc(k)).append("\":");
        if (v == null) {
            sb.append("null");
        } else if (v instanceof Number || v instanceof Boolean) {
            sb.append(v);
        } else {
            sb.append('"').append(esc(String.valueOf(v))).append('"');
        }
        sb.append(',');
    }

    private static String esc(String s) {
        StringBuilder r = new StringBuilder(s.length() + 8);
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"':  r.append("\\\""); break;
                case '\\': r.append("\\\\"); break;
                case '\n': r.append("\\n");  break;
                case '\r': r.append("\\r");  break;
                case '\t': r.append("\\t");  break;
                default:
                    if (c < 0x20) r.append(String.format("\\u%04x", (int) c));
                    else r.append(c);
            }
        }
        return r.toString();
    }
}
