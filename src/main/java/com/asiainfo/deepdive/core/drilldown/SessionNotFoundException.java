package com.asiainfo.deepdive.core.drilldown;

/**
 * 会话不存在或已过期
 */
public class SessionNotFoundException extends RuntimeException {

    public SessionNotFoundException(String sessionId) {
        super("Drill-down session not found: " + sessionId);
    }
}
