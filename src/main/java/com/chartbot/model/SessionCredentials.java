package com.chartbot.model;

public final class SessionCredentials {
    public final String sessionId;
    public final String sessionIdSign;

    public SessionCredentials(String sessionId, String sessionIdSign) {
        this.sessionId = sessionId;
        this.sessionIdSign = sessionIdSign;
    }

    @Override
    public String toString() {
        return "SessionCredentials{sessionId=***, sessionIdSign=***}";
    }
}
