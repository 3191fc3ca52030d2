package com.webresearch.core.exception;

/**
 * 리서치 엔진 예외 기본 클래스
 */
public class ResearchEngineException extends RuntimeException {

    private final String errorCode;
    private final String sessionId;

    public ResearchEngineException(String message) {
        super(message);
        this.errorCode = "RESEARCH_ERROR";
        this.sessionId = null;
    }

    public ResearchEngineException(String message, Throwable cause) {
        super(message, cause);
        this.errorCode = "RESEARCH_ERROR";
        this.sessionId = null;
    }

    public ResearchEngineException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
        this.sessionId = null;
    }

    public ResearchEngineException(String errorCode, String message, String sessionId) {
        super(message);
        this.errorCode = errorCode;
        this.sessionId = sessionId;
    }

    public ResearchEngineException(String errorCode, String message, String sessionId, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.sessionId = sessionId;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public String getSessionId() {
        return sessionId;
    }
}
