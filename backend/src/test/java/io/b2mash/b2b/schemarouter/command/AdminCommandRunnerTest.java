package io.b2mash.b2b.schemarouter.command;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;

@ExtendWith(MockitoExtension.class)
class AdminCommandRunnerTest {

  @Mock private TenantAdminCommands commands;

  @Test
  void noCommandOptionDoesNothing() {
    var runner = new AdminCommandRunner(commands);

    runner.run(new DefaultApplicationArguments("--server.port=8080"));

    assertThat(runner.executed()).isFalse();
    assertThat(runner.getExitCode()).isZero();
    verifyNoInteractions(commands);
  }

  @Test
  void dispatchesMigrateTenantWithTarget() {
    when(commands.migrateTenant("all")).thenReturn(TenantAdminCommands.FAILURE);
    var runner = new AdminCommandRunner(commands);

    runner.run(
        new DefaultApplicationArguments("--admin.command=migrate-tenant", "--admin.target=all"));

    assertThat(runner.executed()).isTrue();
    assertThat(runner.getExitCode()).isEqualTo(TenantAdminCommands.FAILURE);
  }

  @Test
  void dispatchesCreateTenantSchema() {
    when(commands.createTenantSchema("acme")).thenReturn(TenantAdminCommands.SUCCESS);
    var runner = new AdminCommandRunner(commands);

    runner.run(
        new DefaultApplicationArguments(
            "--admin.command=create-tenant-schema", "--admin.target=acme"));

    verify(commands).createTenantSchema("acme");
    assertThat(runner.getExitCode()).isZero();
  }

  @Test
  void makeMigrationsUsesNameOption() {
    when(commands.makeMigrationsTenant("add_invoice")).thenReturn(TenantAdminCommands.SUCCESS);
    var runner = new AdminCommandRunner(commands);

    runner.run(
        new DefaultApplicationArguments(
            "--admin.command=makemigrations-tenant", "--admin.name=add_invoice"));

    verify(commands).makeMigrationsTenant("add_invoice");
  }

  @Test
  void unknownCommandIsUsageError() {
    var runner = new AdminCommandRunner(commands);

    runner.run(new DefaultApplicationArguments("--admin.command=frobnicate"));

    assertThat(runner.executed()).isTrue();
    assertThat(runner.getExitCode()).isEqualTo(TenantAdminCommands.USAGE_ERROR);
    verifyNoInteractions(commands);
  }
}
