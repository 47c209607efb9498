package com.koni.energy;

import com.koni.energy.application.command.ProcessBatchCommandHandler;
import com.koni.energy.domain.service.AnomalyClassifier;
import com.koni.energy.tags.IntegrationTest;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

@IntegrationTest
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.NONE)
@ActiveProfiles("test")
class EnergyPipelineApplicationTests {

	@Autowired
	private ProcessBatchCommandHandler processBatchCommandHandler;

	@Autowired
	private AnomalyClassifier anomalyClassifier;

	@Autowired
	private CircuitBreaker alertCircuitBreaker;

	@Test
	void contextLoads() {
		// Spring context loads with H2 and no reachable broker
		assertThat(processBatchCommandHandler).isNotNull();
	}

	@Test
	void shouldWireConfiguredThresholds() {
		assertThat(anomalyClassifier.getThresholds().getMaxReadingKwh()).isEqualByComparingTo(new BigDecimal("10000"));
		assertThat(alertCircuitBreaker.getName()).isEqualTo("alerts");
	}
}
