package com.webresearch.core;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Web Research Core Service Application
 *
 * 웹 리서치 오케스트레이션 코어
 * - 목표를 질문, 소스, 실행 경로로 분해하는 플래너
 * - 소스 신뢰도 평가와 클레임 교차 검증
 * - 다층 TTL 캐시와 세션 단위 텔레메트리/제어
 */
@SpringBootApplication
public class ResearchCoreApplication {

    public static void main(String[] args) {
        SpringApplication.run(ResearchCoreApplication.class, args);
    }
}
