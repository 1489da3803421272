package io.b2mash.b2b.schemarouter;

import io.b2mash.b2b.schemarouter.command.AdminCommandRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class SchemaRouterApplication {

  public static void main(String[] args) {
    var context = SpringApplication.run(SchemaRouterApplication.class, args);
    // Administrative commands run once and exit with the command's status
    if (context.getBean(AdminCommandRunner.class).executed()) {
      System.exit(SpringApplication.exit(context));
    }
  }
}
