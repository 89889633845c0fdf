package com.eyelevel.batchorchestrator;

import com.eyelevel.batchorchestrator.service.session.BatchSessionStore;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class BatchOrchestratorApplicationTests {

    @Autowired
    private BatchSessionStore sessionStore;

    @Test
    void contextLoads() {
        assertThat(sessionStore).isNotNull();
    }
}
