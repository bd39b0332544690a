package com.greenwashradar.pipeline;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Greenwash Radar verification pipeline
 *
 * 지속가능경영보고서의 ESG 주장을 추출하고 뉴스 증거와 교차 검증하는 서비스
 * - 단계별 체크포인트 저장 및 재개
 * - 뉴스 검색 폴백 쿼리와 병렬 수집
 * - 외부 분석 호출의 재시도, 서킷 브레이커, 요청 속도 제한
 */
@SpringBootApplication
public class VerificationPipelineApplication {

    public static void main(String[] args) {
        SpringApplication.run(VerificationPipelineApplication.class, args);
    }
}
