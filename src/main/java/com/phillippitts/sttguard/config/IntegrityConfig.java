package com.phillippitts.sttguard.config;

import com.phillippitts.sttguard.config.properties.IntegrityProperties;
import com.phillippitts.sttguard.service.policy.PolicyConfig;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Freezes {@link IntegrityProperties} into the single {@link PolicyConfig} shared by all
 * data-channel connections.
 */
@Configuration
public class IntegrityConfig {

    private static final Logger LOG = LogManager.getLogger(IntegrityConfig.class);

    @Bean
    public PolicyConfig policyConfig(IntegrityProperties props) {
        PolicyConfig policy = PolicyConfig.from(props);
        if (policy.rejectEnabled() && !policy.verifyEnabled()) {
            LOG.warn("stt.integrity.reject-enabled=true has no effect while verify-enabled=false");
        }
        LOG.info("Data integrity policy: verify={}, reject={}, threshold={}, extendedLogging={}",
                policy.verifyEnabled(), policy.rejectEnabled(), policy.corruptionThreshold(),
                policy.extendedLogging());
        return policy;
    }
}
