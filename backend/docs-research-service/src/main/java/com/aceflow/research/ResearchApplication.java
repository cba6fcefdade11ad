package com.aceflow.research;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * ACE-Flow Documentation Research Application
 *
 * (domain, architecture pattern) 요청을 받아 참조 문서를 수집하고
 * 코드 패턴, gotcha, 커버리지 점수를 담은 리서치 번들을 생성하는 CLI
 * - 카탈로그 기반 대상 resolve
 * - 호스트별 제한이 있는 병렬 fetch + 재시도 + 캐시
 * - 커버리지 검증 게이트 (complete / incomplete)
 */
@SpringBootApplication
public class ResearchApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(ResearchApplication.class, args)));
    }
}
