package com.linkscout.core.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;

/**
 * JSON 라인 기반 구조화 로거(SLF4J 위).
 * 사람이 읽는 로그는 각 클래스의 LOG, 기계가 읽는 이벤트는 여기(SLOG)로 남긴다.
 */
public final class StructuredLog {
    private static final ObjectMapper OM = new ObjectMapper();

    private final Logger log;
    private final String comp;

    private StructuredLog(Class<?> cls) {
        this.log = LoggerFactory.getLogger(cls);
        this.comp = cls.getSimpleName();
    }

    public static StructuredLog get(Class<?> cls) {
        return new StructuredLog(cls);
    }

    public void debug(String event, Object... kvs) { if (log.isDebugEnabled()) log.debug(render("DEBUG", event, null, kvs)); }
    public void info (String event, Object... kvs) { if (log.isInfoEnabled())  log.info(render("INFO", event, null, kvs)); }
    public void warn (String event, Object... kvs) { if (log.isWarnEnabled())  log.warn(render("WARN", event, null, kvs)); }
    public void error(String event, Throwable t, Object... kvs) {
        if (!log.isErrorEnabled()) return;
        String line = render("ERROR", event, t, kvs);
        if (t == null) log.error(line); else log.error(line, t);
    }

    /** 한 줄 JSON. kvs는 key, value 쌍의 나열 */
    String render(String lvl, String event, Throwable t, Object... kvs) {
        ObjectNode n = OM.createObjectNode();
        n.put("ts", Instant.now().toString());
        n.put("lvl", lvl);
        n.put("comp", comp);
        n.put("thread", Thread.currentThread().getName());
        n.put("event", event);

        if (kvs != null && kvs.length > 0) {
            for (int i = 0; i + 1 < kvs.length; i += 2) {
                put(n, String.valueOf(kvs[i]), kvs[i + 1]);
            }
            if (kvs.length % 2 == 1) n.put("_kv_mismatch", true);
        }
        if (t != null) {
            n.put("error", t.getClass().getSimpleName());
            n.put("message", t.getMessage());
        }
        try {
            return OM.writeValueAsString(n);
        } catch (JsonProcessingException e) {
            // ObjectNode 직렬화는 사실상 실패하지 않음. 실패 시 이벤트 이름만이라도 남긴다
            return "{\"event\":\"" + event + "\",\"_encode_error\":\"" + e.getOriginalMessage() + "\"}";
        }
    }

    private static void put(ObjectNode n, String k, Object v) {
        if (v == null) n.putNull(k);
        else if (v instanceof Integer i) n.put(k, i);
        else if (v instanceof Long l) n.put(k, l);
        else if (v instanceof Double d) n.put(k, d);
        else if (v instanceof Boolean b) n.put(k, b);
        else if (v instanceof Number num) n.put(k, num.doubleValue());
        else n.put(k, String.valueOf(v));
    }
}
