package com.ryuqq.provisioner.adapter.web;

import com.ryuqq.provisioner.core.workflow.WorkflowDefinition;
import com.ryuqq.provisioner.testkit.fake.FakeIdentityDirectory;
import com.ryuqq.provisioner.testkit.fake.FakeWorkflowEngine;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.context.annotation.Primary;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * 전체 컨텍스트 테스트. 외부 의존성만 fake 로 교체합니다.
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@Import(ProvisionerApplicationTest.FakeDependencies.class)
class ProvisionerApplicationTest {

    @TestConfiguration
    static class FakeDependencies {

        @Bean
        @Primary
        FakeWorkflowEngine fakeWorkflowEngine() {
            return new FakeWorkflowEngine();
        }

        @Bean
        @Primary
        FakeIdentityDirectory fakeIdentityDirectory() {
            return new FakeIdentityDirectory().addUser("user-1", "Alice Kim", "alice@example.com");
        }
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private FakeWorkflowEngine workflowEngine;

    @Autowired
    private MeterRegistry meterRegistry;

    @Test
    void 설정이_반영된_상태로_요청을_처리() throws Exception {
        // 등급 덮어쓰기 (large → cpu 16)
        mockMvc.perform(post("/namespaces").contentType(MediaType.APPLICATION_JSON).content(body("orders-dev", "large")))
            .andExpect(status().isAccepted())
            .andExpect(jsonPath("$.status").value("PROVISIONING"));

        WorkflowDefinition submitted = workflowEngine.submitted().get(workflowEngine.submitted().size() - 1);
        assertThat(submitted.getParameters()).containsEntry("cpu-limit", "16").containsEntry("team-name", "orders");
        assertThat(submitted.getAnnotations()).containsEntry("platform.io/owner", "Alice Kim");

        // 팀 할당량 2
        mockMvc.perform(post("/namespaces").contentType(MediaType.APPLICATION_JSON).content(body("orders-stg", "small")))
            .andExpect(status().isAccepted());
        mockMvc.perform(post("/namespaces").contentType(MediaType.APPLICATION_JSON).content(body("orders-prd", "small")))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.reason").value("QUOTA_EXCEEDED"));

        mockMvc.perform(get("/namespaces").param("team", "orders"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(3));

        assertThat(meterRegistry.find("provisioner.circuitbreaker.state").tag("name", "workflow-engine").gauge())
            .isNotNull();
    }

    @Test
    void 허용_목록에_없는_기능은_400() throws Exception {
        String body = body("billing-dev", "small").replace("monitoring-enhanced", "istio-injection");

        mockMvc.perform(post("/namespaces").contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.violations[0]").value("Invalid features: istio-injection"));
    }

    private static String body(String namespaceName, String tier) {
        return """
            {
              "namespaceName": "%s",
              "team": "%s",
              "environment": "development",
              "resourceTier": "%s",
              "features": ["monitoring-enhanced"],
              "requestedBy": "alice@example.com",
              "ownerPrincipalId": "user-1"
            }
            """.formatted(namespaceName, namespaceName.substring(0, namespaceName.indexOf('-')), tier);
    }
}
