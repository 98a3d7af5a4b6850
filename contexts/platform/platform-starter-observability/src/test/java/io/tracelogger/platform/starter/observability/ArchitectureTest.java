package io.tracelogger.platform.starter.observability;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import io.tracelogger.platform.testing.ArchRules;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

class ArchitectureTest {

  private static JavaClasses classes;

  @BeforeAll
  static void importClasses() {
    classes =
        new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("io.tracelogger.platform");
  }

  @Test
  void coreIsFrameworkFree() {
    ArchRules.CORE_IS_FRAMEWORK_FREE.check(classes);
  }

  @Test
  void coreHasNoStereotypes() {
    ArchRules.CORE_HAS_NO_STEREOTYPES.check(classes);
  }

  @Test
  void domainDoesNotDependOutward() {
    ArchRules.DOMAIN_DOES_NOT_DEPEND_OUTWARD.check(classes);
  }

  @Test
  void adaptersAreIndependent() {
    ArchRules.ADAPTERS_ARE_INDEPENDENT.check(classes);
  }

  @Test
  void loggingGoesThroughSlf4j() {
    ArchRules.NO_STANDARD_STREAMS.check(classes);
    ArchRules.NO_JAVA_UTIL_LOGGING.check(classes);
  }
}
