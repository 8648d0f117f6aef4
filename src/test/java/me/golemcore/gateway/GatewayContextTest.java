package me.golemcore.gateway;

import me.golemcore.gateway.domain.service.MediationOrchestrator;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.port.outbound.IsolatedExecutionPort;
import me.golemcore.gateway.port.outbound.OutputSafetyPort;
import me.golemcore.gateway.port.outbound.RiskAssessmentPort;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.NONE)
class GatewayContextTest {

    @Autowired
    private ApplicationContext context;

    @Autowired
    private GatewayProperties properties;

    @Test
    void shouldWireMediationPipeline() {
        assertNotNull(context.getBean(MediationOrchestrator.class));
        assertNotNull(context.getBean(RiskAssessmentPort.class));
        assertNotNull(context.getBean(OutputSafetyPort.class));
        assertNotNull(context.getBean(IsolatedExecutionPort.class));
    }

    @Test
    void shouldBindGatewayProperties() {
        assertEquals(Duration.ofSeconds(5), properties.getRequestTimeout());
        assertEquals("http://localhost:1", properties.getRisk().getUrl());
        assertEquals(Duration.ofSeconds(2), properties.getRisk().getTimeout());
        assertEquals(Duration.ofSeconds(15), properties.getSandbox().getTimeout());
    }
}
