package io.b2mash.b2b.schemarouter.command;

import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Dispatches {@code --admin.command=<name>} to {@link TenantAdminCommands}. The resulting code is
 * exposed through {@link ExitCodeGenerator}, so {@code SpringApplication.exit} returns it.
 */
@Component
@Order(1)
public class AdminCommandRunner implements ApplicationRunner, ExitCodeGenerator {

  private static final Logger log = LoggerFactory.getLogger(AdminCommandRunner.class);

  public static final String COMMAND_OPTION = "admin.command";
  public static final String TARGET_OPTION = "admin.target";
  public static final String NAME_OPTION = "admin.name";

  private final TenantAdminCommands commands;
  private volatile int exitCode = TenantAdminCommands.SUCCESS;
  private volatile boolean executed;

  public AdminCommandRunner(TenantAdminCommands commands) {
    this.commands = commands;
  }

  @Override
  public void run(ApplicationArguments args) {
    String command = option(args, COMMAND_OPTION);
    if (command == null) {
      return;
    }
    log.info("Running administrative command {}", command);
    exitCode = dispatch(command, option(args, TARGET_OPTION), option(args, NAME_OPTION));
    executed = true;
    log.info("Administrative command {} finished with exit code {}", command, exitCode);
  }

  int dispatch(String command, String target, String name) {
    return switch (command) {
      case "create-tenant-schema" -> commands.createTenantSchema(target);
      case "makemigrations-tenant" -> commands.makeMigrationsTenant(name != null ? name : target);
      case "migrate-tenant" -> commands.migrateTenant(target);
      case "migrate-shared" -> commands.migrateShared();
      case "show-migrations" -> commands.showMigrations(target);
      default -> {
        log.warn("Unknown administrative command {}", command);
        yield TenantAdminCommands.USAGE_ERROR;
      }
    };
  }

  /** Whether this process ran an administrative command and should exit afterwards. */
  public boolean executed() {
    return executed;
  }

  @Override
  public int getExitCode() {
    return exitCode;
  }

  private static String option(ApplicationArguments args, String name) {
    List<String> values = args.getOptionValues(name);
    if (values == null || values.isEmpty()) {
      return null;
    }
    return values.get(0);
  }
}
