package io.tracelogger.platform.starter.observability;

import static jakarta.servlet.DispatcherType.ASYNC;
import static jakarta.servlet.DispatcherType.ERROR;
import static jakarta.servlet.DispatcherType.REQUEST;

import io.tracelogger.platform.application.trace.TraceLogger;
import io.tracelogger.platform.http.filters.TraceLoggingFilter;
import io.tracelogger.platform.http.payload.PayloadParser;
import jakarta.servlet.DispatcherType;
import java.util.EnumSet;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.web.servlet.DispatcherServlet;

/** Registers {@link TraceLoggingFilter} for servlet applications. */
@AutoConfiguration(after = TraceLoggerAutoConfiguration.class)
@ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
@ConditionalOnClass({DispatcherServlet.class, TraceLoggingFilter.class})
@ConditionalOnBean(TraceLogger.class)
public class TraceLoggerWebAutoConfiguration {

  private static final EnumSet<DispatcherType> DEFAULT_DISPATCHERS =
      EnumSet.of(REQUEST, ERROR, ASYNC);

  /**
   * Registers {@link TraceLoggingFilter} on the configured URL patterns.
   *
   * @param traceLogger session factory
   * @param payloadParser body parser
   * @param p starter properties
   * @return a configured {@link FilterRegistrationBean}
   */
  @Bean(name = "traceLoggingFilterRegistration")
  @ConditionalOnMissingBean(name = "traceLoggingFilterRegistration")
  @ConditionalOnProperty(prefix = "tracelogger.filter", name = "enabled", matchIfMissing = true)
  public FilterRegistrationBean<TraceLoggingFilter> traceLoggingFilter(
      TraceLogger traceLogger, PayloadParser payloadParser, TraceLoggerProperties p) {
    var filter =
        new TraceLoggingFilter(traceLogger, payloadParser, p.getFilter().getMaxPayloadBytes());

    var reg = new FilterRegistrationBean<>(filter);
    reg.setDispatcherTypes(DEFAULT_DISPATCHERS);
    reg.setOrder(TraceLoggingFilter.ORDER);
    reg.setUrlPatterns(p.getFilter().getUrlPatterns());
    reg.setAsyncSupported(true);
    return reg;
  }
}
