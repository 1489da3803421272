package io.b2mash.b2b.schemarouter.customer;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.net.URI;
import java.time.Instant;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Tenant-scoped customer endpoints; the tenant comes from the request's tenant header. */
@RestController
@RequestMapping("/api/customers")
public class CustomerController {

  private final CustomerService customerService;

  public CustomerController(CustomerService customerService) {
    this.customerService = customerService;
  }

  @GetMapping
  public ResponseEntity<List<CustomerResponse>> listCustomers() {
    return ResponseEntity.ok(
        customerService.listCustomers().stream().map(CustomerResponse::from).toList());
  }

  @PostMapping
  public ResponseEntity<CustomerResponse> createCustomer(
      @Valid @RequestBody CreateCustomerRequest request) {
    Customer customer = customerService.createCustomer(request.name(), request.email());
    return ResponseEntity.created(URI.create("/api/customers/" + customer.getId()))
        .body(CustomerResponse.from(customer));
  }

  public record CreateCustomerRequest(
      @NotBlank(message = "name is required") @Size(max = 255) String name,
      @Email(message = "email must be valid") @Size(max = 255) String email) {}

  public record CustomerResponse(Long id, String name, String email, Instant createdAt) {

    public static CustomerResponse from(Customer customer) {
      return new CustomerResponse(
          customer.getId(), customer.getName(), customer.getEmail(), customer.getCreatedAt());
    }
  }
}
