package io.nooa.app;

import static org.assertj.core.api.Assertions.assertThat;

import io.nooa.core.daemon.DaemonEntrypoint;
import java.util.List;
import org.junit.jupiter.api.Test;

class NooaApplicationTest {

    @Test
    void shouldRelaunchItselfAsForegroundDaemon() {
        List<String> entrypoint = DaemonEntrypoint.forMainClass(NooaApplication.class, "cron", "daemon", "run");

        assertThat(entrypoint.get(1)).isEqualTo("-cp");
        assertThat(entrypoint.get(2)).isEqualTo(System.getProperty("java.class.path"));
        assertThat(entrypoint).endsWith("io.nooa.app.NooaApplication", "cron", "daemon", "run");
    }

    @Test
    void shouldShipLoggingConfigurationAndDriverRegistration() {
        ClassLoader loader = NooaApplication.class.getClassLoader();

        assertThat(loader.getResource("logback.xml")).isNotNull();
        assertThat(loader.getResource("META-INF/services/java.sql.Driver")).isNotNull();
    }
}
