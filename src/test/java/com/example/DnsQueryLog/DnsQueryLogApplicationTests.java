package com.example.DnsQueryLog;

import com.example.DnsQueryLog.service.QueryLogService;
import com.example.DnsQueryLog.service.ServiceState;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.NONE)
class DnsQueryLogApplicationTests {

    @TempDir
    static Path dataDir;

    @DynamicPropertySource
    static void queryLogFiles(DynamicPropertyRegistry registry) {
        registry.add("querylog.file", () -> dataDir.resolve("querylog.json").toString());
        registry.add("querylog.settings-file", () -> dataDir.resolve("querylog-settings.json").toString());
    }

    @Autowired
    private QueryLogService queryLogService;

    @Test
    void contextLoads() {
        assertThat(queryLogService.getState()).isEqualTo(ServiceState.RUNNING);
        assertThat(queryLogService.getEntries()).isEmpty();
    }
}
