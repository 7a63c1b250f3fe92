package com.gentoro.ragmcp.tenant;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.ragmcp.exception.SerializationException;
import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletRequestWrapper;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Enumeration;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Servlet filter guarding the MCP endpoint with a per-request tenant credential.
 *
 * <p>For requests whose path is the MCP endpoint, the credential is read from the dedicated
 * header (default {@code mongodb-uri}) or, when that header is absent, from an {@code
 * Authorization: Bearer <credential>} header, which is then hidden from downstream handlers.
 * Requests without a valid credential are answered with HTTP 400 and a single JSON-RPC error
 * event; the downstream chain is not invoked. Accepted credentials are attached to the request
 * under {@link #TENANT_ATTRIBUTE} for the duration of the chain and removed afterwards.
 *
 * <p>Every other path passes through untouched.
 */
public class TenantGate implements Filter {
  private static final org.slf4j.Logger log =
      com.gentoro.ragmcp.logging.LoggingService.getLogger(TenantGate.class);

  public static final String TENANT_ATTRIBUTE = TenantGate.class.getName() + ".tenant";
  public static final String DEFAULT_CREDENTIAL_HEADER = "mongodb-uri";
  public static final int INVALID_REQUEST_CODE = -32600;

  private static final String AUTHORIZATION = "authorization";
  private static final String BEARER_PREFIX = "bearer ";
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final String mcpPath;
  private final String credentialHeader;
  private final CredentialStore credentialStore;
  private final byte[] rejectionBody;

  public TenantGate(String mcpPath, String credentialHeader, CredentialStore credentialStore) {
    this.mcpPath = mcpPath;
    this.credentialHeader = credentialHeader.toLowerCase(Locale.ROOT);
    this.credentialStore = credentialStore;
    this.rejectionBody = buildRejectionBody(credentialHeader, credentialStore.describeSchemes());
  }

  /** The tenant published by this filter for the given request, if any. */
  public static Optional<TenantCredential> tenantOf(HttpServletRequest request) {
    Object value = request.getAttribute(TENANT_ATTRIBUTE);
    return value instanceof TenantCredential t ? Optional.of(t) : Optional.empty();
  }

  @Override
  public void doFilter(ServletRequest req, ServletResponse resp, FilterChain chain)
      throws IOException, ServletException {
    if (!(req instanceof HttpServletRequest request)
        || !(resp instanceof HttpServletResponse response)
        || !isGatedPath(request)) {
      chain.doFilter(req, resp);
      return;
    }

    Map<String, String> headers = normalizedHeaders(request);
    HttpServletRequest forwarded = request;
    String raw = headers.get(credentialHeader);
    if (raw == null || raw.isBlank()) {
      String auth = headers.get(AUTHORIZATION);
      if (auth != null && auth.toLowerCase(Locale.ROOT).startsWith(BEARER_PREFIX)) {
        raw = auth.substring(BEARER_PREFIX.length()).trim();
        forwarded = new AuthorizationStrippedRequest(request);
      }
    }

    Optional<TenantCredential> tenant = credentialStore.normalize(raw);
    if (tenant.isEmpty()) {
      log.info(
          "Rejected {} {}: missing or invalid '{}' header",
          request.getMethod(),
          request.getRequestURI(),
          credentialHeader);
      reject(response);
      return;
    }

    log.debug("Accepted request for tenant store {}", tenant.get().redacted());
    forwarded.setAttribute(TENANT_ATTRIBUTE, tenant.get());
    try {
      chain.doFilter(forwarded, response);
    } finally {
      forwarded.removeAttribute(TENANT_ATTRIBUTE);
    }
  }

  private boolean isGatedPath(HttpServletRequest request) {
    String path = request.getRequestURI();
    String contextPath = request.getContextPath();
    if (contextPath != null && !contextPath.isEmpty() && path.startsWith(contextPath)) {
      path = path.substring(contextPath.length());
    }
    return mcpPath.equals(path) || (mcpPath + "/").equals(path);
  }

  private static Map<String, String> normalizedHeaders(HttpServletRequest request) {
    Map<String, String> out = new HashMap<>();
    Enumeration<String> names = request.getHeaderNames();
    if (names == null) return out;
    while (names.hasMoreElements()) {
      String name = names.nextElement();
      out.putIfAbsent(name.toLowerCase(Locale.ROOT), request.getHeader(name));
    }
    return out;
  }

  private void reject(HttpServletResponse response) throws IOException {
    response.setStatus(HttpServletResponse.SC_BAD_REQUEST);
    response.setContentType("text/event-stream");
    response.setCharacterEncoding(StandardCharsets.UTF_8.name());
    response.setHeader("Cache-Control", "no-cache, no-transform");
    response.setContentLength(rejectionBody.length);
    try (OutputStream out = response.getOutputStream()) {
      out.write(rejectionBody);
    }
  }

  private static byte[] buildRejectionBody(String header, String schemes) {
    ObjectNode frame = MAPPER.createObjectNode();
    frame.put("jsonrpc", "2.0");
    ObjectNode error = frame.putObject("error");
    error.put("code", INVALID_REQUEST_CODE);
    error.put(
        "message", "Missing or invalid header '%s' (expected %s)".formatted(header, schemes));
    try {
      String event = "event: message\r\ndata: " + MAPPER.writeValueAsString(frame) + "\r\n\r\n";
      return event.getBytes(StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new SerializationException("Failed to encode gate rejection frame", e);
    }
  }

  /** Request view without the Authorization header once its token was consumed as credential. */
  static final class AuthorizationStrippedRequest extends HttpServletRequestWrapper {
    AuthorizationStrippedRequest(HttpServletRequest request) {
      super(request);
    }

    private static boolean isAuthorization(String name) {
      return name != null && AUTHORIZATION.equalsIgnoreCase(name);
    }

    @Override
    public String getHeader(String name) {
      return isAuthorization(name) ? null : super.getHeader(name);
    }

    @Override
    public Enumeration<String> getHeaders(String name) {
      return isAuthorization(name) ? Collections.emptyEnumeration() : super.getHeaders(name);
    }

    @Override
    public Enumeration<String> getHeaderNames() {
      List<String> names = Collections.list(super.getHeaderNames());
      names.removeIf(AuthorizationStrippedRequest::isAuthorization);
      return Collections.enumeration(names);
    }
  }
}
