package com.example.console;

import com.example.console.config.properties.IdentityGatewayProperties;
import com.example.console.config.properties.RbacProperties;
import com.example.console.gateway.IdentityGatewayClient;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class ConsoleApplicationTests {

    @Autowired
    private ApplicationContext context;

    @Test
    void contextLoads() {
        assertThat(context.getBean(IdentityGatewayClient.class)).isNotNull();
    }

    @Test
    void bindsGatewayAndRbacSettings() {
        IdentityGatewayProperties gateway = context.getBean(IdentityGatewayProperties.class);
        RbacProperties rbac = context.getBean(RbacProperties.class);

        assertThat(gateway.baseUrl()).isEqualTo("http://localhost:18080");
        assertThat(gateway.timeout()).isEqualTo(Duration.ofSeconds(2));
        assertThat(rbac.maxInheritanceDepth()).isEqualTo(10);
        assertThat(rbac.verifyRevocation()).isTrue();
    }
}
