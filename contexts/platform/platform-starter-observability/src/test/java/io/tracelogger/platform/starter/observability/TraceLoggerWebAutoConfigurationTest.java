package io.tracelogger.platform.starter.observability;

import static org.assertj.core.api.Assertions.assertThat;

import io.tracelogger.platform.http.filters.TraceLoggingFilter;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.WebApplicationContextRunner;
import org.springframework.boot.web.servlet.FilterRegistrationBean;

class TraceLoggerWebAutoConfigurationTest {

  private final WebApplicationContextRunner runner =
      new WebApplicationContextRunner()
          .withConfiguration(
              AutoConfigurations.of(
                  TraceLoggerAutoConfiguration.class, TraceLoggerWebAutoConfiguration.class))
          .withPropertyValues("tracelogger.auth-secret=s3cret");

  @Test
  @SuppressWarnings("unchecked")
  void registersFilterOnAllPathsByDefault() {
    runner.run(
        ctx -> {
          FilterRegistrationBean<TraceLoggingFilter> reg =
              ctx.getBean("traceLoggingFilterRegistration", FilterRegistrationBean.class);
          assertThat(reg.getFilter()).isInstanceOf(TraceLoggingFilter.class);
          assertThat(reg.getOrder()).isEqualTo(TraceLoggingFilter.ORDER);
          assertThat(reg.getUrlPatterns()).containsExactly("/*");
        });
  }

  @Test
  @SuppressWarnings("unchecked")
  void honoursConfiguredUrlPatterns() {
    runner
        .withPropertyValues("tracelogger.filter.url-patterns=/api/*,/v1/*")
        .run(
            ctx -> {
              FilterRegistrationBean<TraceLoggingFilter> reg =
                  ctx.getBean("traceLoggingFilterRegistration", FilterRegistrationBean.class);
              assertThat(reg.getUrlPatterns()).containsExactlyInAnyOrder("/api/*", "/v1/*");
            });
  }

  @Test
  void filterCanBeSwitchedOff() {
    runner
        .withPropertyValues("tracelogger.filter.enabled=false")
        .run(ctx -> assertThat(ctx).doesNotHaveBean("traceLoggingFilterRegistration"));
  }

  @Test
  void noFilterWhenTracingIsDisabled() {
    runner
        .withPropertyValues("tracelogger.enabled=false")
        .run(ctx -> assertThat(ctx).doesNotHaveBean("traceLoggingFilterRegistration"));
  }
}
