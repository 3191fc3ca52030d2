package com.webresearch.core;

import com.webresearch.core.scheduler.ResearchMaintenanceScheduler;
import com.webresearch.core.service.ResearchOrchestrationService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationContext;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 스프링 컨텍스트 로드 테스트
 * 애플리케이션 설정이 올바르게 구성되었는지 확인합니다.
 */
@SpringBootTest
@ActiveProfiles("test")
class ResearchCoreApplicationTests {

    @Autowired
    private ApplicationContext context;

    @Test
    void contextLoads() {
        // 스프링 컨텍스트가 정상적으로 로드되면 테스트 통과
        assertThat(context.getBean(ResearchOrchestrationService.class)).isNotNull();
    }

    @Test
    void maintenanceSchedulerDisabledInTests() {
        // test 프로필에서는 유지보수 스케줄러 비활성화
        assertThat(context.getBeansOfType(ResearchMaintenanceScheduler.class)).isEmpty();
    }
}
