package com.yuzhi.dts.iac.cli;

import static org.assertj.core.api.Assertions.assertThat;

import com.yuzhi.dts.iac.domain.ResourceKind;
import com.yuzhi.dts.iac.service.config.DesiredConfigLoader;
import com.yuzhi.dts.iac.service.config.DesiredResourceMapper;
import com.yuzhi.dts.iac.support.IacTestSupport;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.DefaultApplicationArguments;

class IacCommandRunnerTest {

    private final IacTestSupport support = new IacTestSupport();
    private final ByteArrayOutputStream output = new ByteArrayOutputStream();
    private final IacCommandRunner runner = new IacCommandRunner(
        new DesiredConfigLoader(new DesiredResourceMapper()),
        support.reconciliationService,
        support.formatter,
        support.properties,
        new PrintStream(output, true, StandardCharsets.UTF_8)
    );

    @TempDir
    Path configDir;

    @BeforeEach
    void writeConfig() throws IOException {
        Files.writeString(
            configDir.resolve(DesiredConfigLoader.CONNECTIONS_FILE),
            """
            - name: warehouse
              host: db.internal
              port: 5432
            """
        );
        support.properties.setConfigDir(configDir.toString());
    }

    @Test
    void requiresExactlyOneMode() {
        assertThat(runner.execute(new DefaultApplicationArguments())).isEqualTo(IacCommandRunner.FAILED);
        assertThat(runner.execute(new DefaultApplicationArguments("--check", "--apply"))).isEqualTo(IacCommandRunner.FAILED);
    }

    @Test
    void checkPrintsThePlanWithoutApplying() {
        int exit = runner.execute(new DefaultApplicationArguments("--check"));

        assertThat(exit).isEqualTo(IacCommandRunner.OK);
        assertThat(text()).contains("--- Connection ---", "[+] CREATE Connection 'warehouse'");
        assertThat(support.client.getMutations()).isEmpty();
    }

    @Test
    void applyExecutesThenReportsNothingToApply() {
        assertThat(runner.execute(new DefaultApplicationArguments("--apply"))).isEqualTo(IacCommandRunner.OK);
        assertThat(text()).contains("Connection: 1 succeeded, 0 failed");
        assertThat(support.client.findByName(ResourceKind.CONNECTION, "warehouse")).isPresent();

        output.reset();
        assertThat(runner.execute(new DefaultApplicationArguments("--apply"))).isEqualTo(IacCommandRunner.OK);
        assertThat(text()).contains("No changes detected for Connection.", "Nothing to apply.");
    }

    @Test
    void failedItemsFailTheRun() {
        support.client.failMutations(ResourceKind.CONNECTION, "warehouse");

        assertThat(runner.execute(new DefaultApplicationArguments("--apply"))).isEqualTo(IacCommandRunner.FAILED);
        assertThat(text()).contains("Connection: 0 succeeded, 1 failed");
    }

    @Test
    void unreadableKindFailsTheCheck() {
        support.client.failListing(ResourceKind.CONNECTION);

        assertThat(runner.execute(new DefaultApplicationArguments("--check"))).isEqualTo(IacCommandRunner.FAILED);
        assertThat(text()).contains("! Could not read live Connection state");
    }

    @Test
    void invalidConfigFailsBeforePlanning() throws IOException {
        Files.writeString(
            configDir.resolve(DesiredConfigLoader.ROLES_FILE),
            """
            roles:
              - name: Analyst
                permission_set: Nowhere
                model_set: All
            """
        );

        assertThat(runner.execute(new DefaultApplicationArguments("--check"))).isEqualTo(IacCommandRunner.FAILED);
        assertThat(text()).isEmpty();
    }

    @Test
    void configDirOptionOverridesTheProperty() {
        support.properties.setConfigDir(configDir.resolve("missing").toString());

        assertThat(runner.execute(new DefaultApplicationArguments("--check"))).isEqualTo(IacCommandRunner.FAILED);
        assertThat(runner.execute(new DefaultApplicationArguments("--check", "--config-dir=" + configDir))).isEqualTo(IacCommandRunner.OK);
    }

    private String text() {
        return output.toString(StandardCharsets.UTF_8);
    }
}
