package com.codeheadsystems.weft.dropwizard;

import com.codeheadsystems.weft.WeftApplication;
import com.codeheadsystems.weft.http.Request;
import com.codeheadsystems.weft.http.Response;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Gateway between the servlet container and a {@link WeftApplication}.
 * <p>
 * Every method is handled by {@link WeftApplication#handle(Request)}; routing and method
 * checks happen there. The request body is read up to one byte past the configured limit so
 * the application can answer oversized bodies with 413.
 */
public class WeftServlet extends HttpServlet {

  private static final long serialVersionUID = 1L;
  private static final Logger log = LoggerFactory.getLogger(WeftServlet.class);

  private final transient WeftApplication application;

  /**
   * Instantiates a new Weft servlet.
   *
   * @param application the application
   */
  public WeftServlet(WeftApplication application) {
    this.application = application;
  }

  @Override
  protected void service(HttpServletRequest servletRequest, HttpServletResponse servletResponse)
      throws IOException {
    Request request = toRequest(servletRequest);
    Response response = application.handle(request);
    log.debug("{} -> {}", request, response.status());
    write(response, servletResponse);
  }

  private Request toRequest(HttpServletRequest servletRequest) throws IOException {
    Request.Builder builder = Request.builder()
        .method(servletRequest.getMethod())
        .path(servletRequest.getPathInfo())
        .queryString(servletRequest.getQueryString())
        .remoteAddress(servletRequest.getRemoteAddr());
    for (String name : Collections.list(servletRequest.getHeaderNames())) {
      for (String value : Collections.list(servletRequest.getHeaders(name))) {
        builder.header(name, value);
      }
    }
    int limit = (int) Math.min(application.config().maxRequestBodyBytes() + 1, Integer.MAX_VALUE - 8);
    try (InputStream in = servletRequest.getInputStream()) {
      builder.body(in.readNBytes(limit));
    }
    return builder.build();
  }

  private static void write(Response response, HttpServletResponse servletResponse) throws IOException {
    servletResponse.setStatus(response.status());
    for (Map.Entry<String, List<String>> header : response.headers().asMap().entrySet()) {
      for (String value : header.getValue()) {
        servletResponse.addHeader(header.getKey(), value);
      }
    }
    byte[] body = response.body();
    servletResponse.setContentLength(body.length);
    try (OutputStream out = servletResponse.getOutputStream()) {
      out.write(body);
    }
  }
}
