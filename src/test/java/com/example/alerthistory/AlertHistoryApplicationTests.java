package com.example.alerthistory;

import com.example.alerthistory.config.AlertHistoryProperties;
import com.example.alerthistory.inhibition.InhibitionRuleRegistry;
import com.example.alerthistory.suppression.AlertSuppressor;
import com.example.alerthistory.suppression.FailOpenAlertSuppressor;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("test")
class AlertHistoryApplicationTests {

    @Autowired
    private AlertHistoryProperties properties;

    @Autowired
    private AlertSuppressor alertSuppressor;

    @Autowired
    private InhibitionRuleRegistry ruleRegistry;

    @Test
    void contextLoads() {
        assertNotNull(properties);
        assertNotNull(ruleRegistry);
    }

    @Test
    void failOpenSuppressorIsPrimary() {
        assertInstanceOf(FailOpenAlertSuppressor.class, alertSuppressor);
    }

    @Test
    void rulesAreLoadedAtStartup() {
        assertEquals(3, ruleRegistry.current().size());
    }

    @Test
    void configurationIsLoaded() {
        assertEquals(2000, properties.getSuppression().getQueryTimeoutMs());
        assertTrue(properties.getSilences().isCacheEnabled());
        assertEquals(24, properties.getInhibition().getStateTtlHours());
    }
}
