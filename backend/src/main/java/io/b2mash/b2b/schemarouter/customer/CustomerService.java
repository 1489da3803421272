package io.b2mash.b2b.schemarouter.customer;

import io.b2mash.b2b.schemarouter.routing.RoutingDecisionEngine;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Customer access for the tenant bound to the current request. The routing check runs before the
 * transaction opens, so a call with no tenant bound fails without touching the database.
 */
@Service
public class CustomerService {

  static final String ENTITY_TYPE = "customer";

  private static final Logger log = LoggerFactory.getLogger(CustomerService.class);

  private final CustomerRepository customerRepository;
  private final RoutingDecisionEngine routing;
  private final TransactionTemplate txTemplate;

  public CustomerService(
      CustomerRepository customerRepository,
      RoutingDecisionEngine routing,
      PlatformTransactionManager txManager) {
    this.customerRepository = customerRepository;
    this.routing = routing;
    this.txTemplate = new TransactionTemplate(txManager);
  }

  public List<Customer> listCustomers() {
    routing.resolveSchemaFor(ENTITY_TYPE);
    return txTemplate.execute(tx -> customerRepository.findAllByOrderByIdAsc());
  }

  public Customer createCustomer(String name, String email) {
    String schema = routing.resolveSchemaFor(ENTITY_TYPE);
    Customer saved = txTemplate.execute(tx -> customerRepository.save(new Customer(name, email)));
    log.info("Created customer {} in schema {}", saved.getId(), schema);
    return saved;
  }
}
