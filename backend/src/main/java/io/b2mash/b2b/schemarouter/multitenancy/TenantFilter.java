package io.b2mash.b2b.schemarouter.multitenancy;

import io.b2mash.b2b.schemarouter.exception.TenantNotFoundException;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Resolves the tenant named in the request header and makes its schema the active binding for the
 * rest of the request. The binding is popped when the chain returns, whatever the outcome.
 */
public class TenantFilter extends OncePerRequestFilter {

  private static final Logger log = LoggerFactory.getLogger(TenantFilter.class);

  static final String MDC_TENANT_ID = "tenantId";

  private final TenantRegistry registry;
  private final String tenantHeader;

  public TenantFilter(TenantRegistry registry, String tenantHeader) {
    this.registry = registry;
    this.tenantHeader = tenantHeader;
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    String identifier = request.getHeader(tenantHeader);
    if (identifier == null || identifier.isBlank()) {
      // No tenant named: continue unbound, tenant-scoped entities will fail closed
      filterChain.doFilter(request, response);
      return;
    }

    String schema;
    try {
      schema = registry.lookup(identifier);
    } catch (TenantNotFoundException e) {
      log.warn("Rejected request for unknown or inactive tenant {}", identifier);
      response.sendError(HttpServletResponse.SC_NOT_FOUND, "Tenant not found");
      return;
    }

    SchemaContext.push(schema);
    MDC.put(MDC_TENANT_ID, identifier);
    try {
      filterChain.doFilter(request, response);
    } finally {
      MDC.remove(MDC_TENANT_ID);
      SchemaContext.pop();
    }
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    String path = request.getRequestURI();
    return path.startsWith("/internal/") || path.startsWith("/actuator/");
  }
}
