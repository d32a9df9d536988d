package com.contextinsight.pipeline;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * ContextInsight Context Pipeline Service Application
 *
 * Spring Boot 기반의 컨텍스트 생성/검색 파이프라인
 * - 토픽별 시드 URL에서 관련 문서 크롤링 (경량 HTTP / 렌더링 전략)
 * - 버전 관리되는 문서/레코드 저장소 (PostgreSQL)
 * - 문서 분류 및 구조화 필드 추출
 * - 하이브리드 랭킹 기반 컨텍스트 번들 생성
 */
@SpringBootApplication
public class PipelineApplication {

    public static void main(String[] args) {
        SpringApplication.run(PipelineApplication.class, args);
    }
}
