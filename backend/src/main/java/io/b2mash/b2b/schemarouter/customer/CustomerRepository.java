package io.b2mash.b2b.schemarouter.customer;

import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;

public interface CustomerRepository extends JpaRepository<Customer, Long> {
  List<Customer> findAllByOrderByIdAsc();
}
