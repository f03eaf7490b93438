package com.phillippitts.sttguard;

import com.phillippitts.sttguard.service.policy.PolicyConfig;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("integration")
@SpringBootTest(
    webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
    properties = {
        "stt.integrity.verify-enabled=true",
        "stt.integrity.corruption-threshold=2"
    }
)
class SttGuardApplicationTests {

    @Autowired
    private PolicyConfig policy;

    @Test
    void contextLoads() {
        assertThat(policy).isEqualTo(new PolicyConfig(true, false, 2, false));
    }

}
