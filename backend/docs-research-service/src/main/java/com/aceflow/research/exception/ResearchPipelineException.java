package com.aceflow.research.exception;

/**
 * 리서치 파이프라인 예외 기본 클래스
 */
public class ResearchPipelineException extends RuntimeException {

    private final String errorCode;

    public ResearchPipelineException(String message) {
        super(message);
        this.errorCode = "RESEARCH_ERROR";
    }

    public ResearchPipelineException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public ResearchPipelineException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
