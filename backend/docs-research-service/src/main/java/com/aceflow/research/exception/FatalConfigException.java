package com.aceflow.research.exception;

import java.nio.file.Path;

/**
 * 실행 전 설정 오류. 어떤 fetch도 시작되기 전에 파이프라인을 중단합니다.
 */
public class FatalConfigException extends ResearchPipelineException {

    public FatalConfigException(String message) {
        super("FATAL_CONFIG", message);
    }

    public FatalConfigException(String message, Throwable cause) {
        super("FATAL_CONFIG", message, cause);
    }

    /**
     * 출력 경로에 쓸 수 없음
     */
    public static FatalConfigException unwritableOutput(Path path, Throwable cause) {
        return new FatalConfigException("Output path is not writable: " + path, cause);
    }

    /**
     * 패턴에 대한 타겟도, fallback 타겟도 없음
     */
    public static FatalConfigException noTargetsResolvable(String pattern) {
        return new FatalConfigException(
                "No targets resolvable for pattern '" + pattern + "' and the core-framework fallback set is empty");
    }

    /**
     * 필수 인자 누락
     */
    public static FatalConfigException missingArgument(String name) {
        return new FatalConfigException("Missing required argument: --" + name);
    }
}
