package com.yuzhi.dts.iac.service.directory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class WorkspaceScopeTest {

    private final InMemoryDirectoryClient client = new InMemoryDirectoryClient();

    @Test
    void switchesForTheBlockAndRestoresAfterwards() {
        try (WorkspaceScope scope = WorkspaceScope.enter(client, "dev", "production")) {
            assertThat(client.currentWorkspace()).isEqualTo("dev");
            assertThat(scope.getPrevious()).isEqualTo("production");
        }

        assertThat(client.currentWorkspace()).isEqualTo("production");
        assertThat(client.getMutations()).containsExactly("switchWorkspace dev", "switchWorkspace production");
    }

    @Test
    void restoresWhenTheBlockThrows() {
        assertThatThrownBy(() -> {
                try (WorkspaceScope ignored = WorkspaceScope.enter(client, "dev", "production")) {
                    throw new IllegalStateException("boom");
                }
            })
            .isInstanceOf(IllegalStateException.class);

        assertThat(client.currentWorkspace()).isEqualTo("production");
    }

    @Test
    void noSwitchWhenAlreadyInTheWorkspace() {
        client.switchWorkspace("dev");
        client.clearMutations();

        try (WorkspaceScope ignored = WorkspaceScope.enter(client, "dev", "production")) {
            assertThat(client.currentWorkspace()).isEqualTo("dev");
        }

        assertThat(client.getMutations()).isEmpty();
    }

    @Test
    void fallbackWorkspaceIsRestoredWhenTheSessionReportsNone() {
        InMemoryDirectoryClient sessionWithoutWorkspace = new InMemoryDirectoryClient() {
            @Override
            public String currentWorkspace() {
                return null;
            }
        };

        try (WorkspaceScope scope = WorkspaceScope.enter(sessionWithoutWorkspace, "dev", "production")) {
            assertThat(scope.getPrevious()).isEqualTo("production");
        }

        assertThat(sessionWithoutWorkspace.getMutations()).containsExactly("switchWorkspace dev", "switchWorkspace production");
    }
}
