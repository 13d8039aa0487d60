package com.mk.fx.qa.jmeter.execution.validation;

import static org.junit.jupiter.api.Assertions.*;

import com.google.common.hash.Hashing;
import com.mk.fx.qa.jmeter.execution.Fixtures;
import com.mk.fx.qa.jmeter.execution.cfg.RunnerCfg;
import com.mk.fx.qa.jmeter.execution.exception.DefinitionValidationException;
import java.nio.charset.StandardCharsets;
import org.apache.tika.detect.DefaultDetector;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

class DefinitionValidatorTest {

  private static final DefaultDetector DETECTOR = new DefaultDetector();

  private final DefinitionValidator validator = new DefinitionValidator(new RunnerCfg(), DETECTOR);

  private static byte[] xml(String body) {
    return ("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n" + body).getBytes(StandardCharsets.UTF_8);
  }

  @Test
  void validate_acceptsWellFormedPlan() {
    byte[] content = Fixtures.plan();

    var result = validator.validate(content, Fixtures.PLAN_NAME);

    assertTrue(result.accepted(), () -> "rejected: " + result.message());
    assertEquals(Fixtures.PLAN_NAME, result.sanitizedName());
    assertEquals(content.length, result.sizeBytes());
    assertEquals(Hashing.sha256().hashBytes(content).toString(), result.sha256());
    assertEquals("application/xml", result.contentType());
    assertNull(result.errorKind());
  }

  @Test
  void validate_sameInputTwice_givesEqualResults() {
    byte[] content = Fixtures.plan();
    assertEquals(
        validator.validate(content, Fixtures.PLAN_NAME),
        validator.validate(content, Fixtures.PLAN_NAME));

    byte[] png = {(byte) 0x89, 'P', 'N', 'G', 0x0D, 0x0A, 0x1A, 0x0A, 0, 0, 0, 0x0D};
    assertEquals(validator.validate(png, "img.jmx"), validator.validate(png, "img.jmx"));
  }

  @Test
  void validate_extensionIsCaseInsensitive() {
    assertTrue(validator.validate(Fixtures.plan(), "SMOKE.JMX").accepted());
  }

  @ParameterizedTest
  @NullAndEmptySource
  @ValueSource(strings = {"   "})
  void validate_missingName(String name) {
    var result = validator.validate(Fixtures.plan(), name);

    assertFalse(result.accepted());
    assertEquals(ValidationErrorKind.MISSING_NAME, result.errorKind());
  }

  @ParameterizedTest
  @ValueSource(
      strings = {
        "../etc/passwd.jmx",
        "dir/plan.jmx",
        "dir\\plan.jmx",
        ".hidden.jmx",
        "plan..jmx",
        "my plan.jmx",
        "plan;rm.jmx",
        "plän.jmx"
      })
  void validate_unsafeName(String name) {
    var result = validator.validate(Fixtures.plan(), name);

    assertEquals(ValidationErrorKind.UNSAFE_NAME, result.errorKind());
  }

  @Test
  void validate_overlongName() {
    String name = "a".repeat(DefinitionValidator.MAX_NAME_LENGTH) + ".jmx";

    assertEquals(
        ValidationErrorKind.UNSAFE_NAME, validator.validate(Fixtures.plan(), name).errorKind());
  }

  @Test
  void validate_wrongExtension() {
    var result = validator.validate(Fixtures.plan(), "plan.txt");

    assertEquals(ValidationErrorKind.BAD_EXTENSION, result.errorKind());
    assertTrue(result.message().contains(".jmx"));
  }

  @Test
  void validate_emptyFile() {
    assertEquals(
        ValidationErrorKind.EMPTY_FILE, validator.validate(new byte[0], "plan.jmx").errorKind());
  }

  @Test
  void validate_oversizedFile() {
    var cfg = new RunnerCfg();
    cfg.getValidation().setMaxSizeBytes(64);
    var small = new DefinitionValidator(cfg, DETECTOR);

    assertEquals(
        ValidationErrorKind.OVERSIZED, small.validate(Fixtures.plan(), "plan.jmx").errorKind());
  }

  @Test
  void validate_binaryContentBehindJmxName() {
    byte[] png = {(byte) 0x89, 'P', 'N', 'G', 0x0D, 0x0A, 0x1A, 0x0A, 0, 0, 0, 0x0D, 'I', 'H'};
    byte[] zip = {'P', 'K', 0x03, 0x04, 0x14, 0, 0, 0, 0x08, 0};

    assertEquals(
        ValidationErrorKind.SIGNATURE_MISMATCH, validator.validate(png, "plan.jmx").errorKind());
    assertEquals(
        ValidationErrorKind.SIGNATURE_MISMATCH, validator.validate(zip, "plan.jmx").errorKind());
  }

  private static byte[] utf16Plan(String comments) {
    String xml =
        "<?xml version=\"1.0\" encoding=\"UTF-16\"?>\n"
            + "<jmeterTestPlan version=\"1.2\">\n"
            + "  <hashTree>\n"
            + "    <TestPlan testname=\"Wide\">\n"
            + "      <stringProp name=\"TestPlan.comments\">"
            + comments
            + "</stringProp>\n"
            + "    </TestPlan>\n"
            + "  </hashTree>\n"
            + "</jmeterTestPlan>\n";
    return xml.getBytes(StandardCharsets.UTF_16);
  }

  @Test
  void validate_utf16Plan_isScannedInItsOwnEncoding() {
    byte[] content = utf16Plan("<![CDATA[<script>alert(1)</script>]]>");

    var result = validator.validate(content, "wide.jmx");

    assertFalse(result.accepted());
    assertEquals(ValidationErrorKind.UNSAFE_CONTENT, result.errorKind());
    assertTrue(result.message().endsWith("<script"));
  }

  @Test
  void validate_cleanUtf16Plan_isAccepted() {
    var result = validator.validate(utf16Plan("wide characters"), "wide.jmx");

    assertTrue(result.accepted(), () -> "rejected: " + result.message());
  }

  @Test
  void validate_denyListedConstructDeepInsidePlan() {
    byte[] content =
        xml(
            "<jmeterTestPlan version=\"1.2\">\n"
                + "  <hashTree>\n"
                + "    <TestPlan testname=\"Evil\">\n"
                + "      <stringProp name=\"TestPlan.comments\">harmless text</stringProp>\n"
                + "      <stringProp name=\"Sampler.url\">JavaScript:alert(1)</stringProp>\n"
                + "    </TestPlan>\n"
                + "  </hashTree>\n"
                + "</jmeterTestPlan>\n");

    var result = validator.validate(content, "plan.jmx");

    assertEquals(ValidationErrorKind.UNSAFE_CONTENT, result.errorKind());
    assertTrue(result.message().contains("javascript:"));
  }

  @Test
  void validate_wrongRootElement() {
    var result = validator.validate(xml("<testPlan><hashTree/></testPlan>\n"), "plan.jmx");

    assertEquals(ValidationErrorKind.INVALID_STRUCTURE, result.errorKind());
    assertTrue(result.message().contains("testPlan"));
  }

  @Test
  void validate_malformedXml() {
    var result =
        validator.validate(xml("<jmeterTestPlan><hashTree></jmeterTestPlan>\n"), "plan.jmx");

    assertEquals(ValidationErrorKind.INVALID_STRUCTURE, result.errorKind());
  }

  @Test
  void validate_plainTextIsNotAPlan() {
    byte[] text = "just some notes about the load test\n".getBytes(StandardCharsets.UTF_8);

    assertEquals(
        ValidationErrorKind.INVALID_STRUCTURE, validator.validate(text, "plan.jmx").errorKind());
  }

  @Test
  void validate_documentTypeDeclarationRejected() {
    byte[] content =
        xml(
            "<!DOCTYPE jmeterTestPlan [<!ENTITY payload \"boom\">]>\n"
                + "<jmeterTestPlan><hashTree>&payload;</hashTree></jmeterTestPlan>\n");

    assertEquals(
        ValidationErrorKind.INVALID_STRUCTURE, validator.validate(content, "plan.jmx").errorKind());
  }

  @Test
  void validate_firstFailingCheckWins() {
    // bad extension and empty content: the name checks run first
    assertEquals(
        ValidationErrorKind.BAD_EXTENSION, validator.validate(new byte[0], "plan.xml").errorKind());
  }

  @Test
  void orElseThrow_carriesKind() {
    var rejected = validator.validate(Fixtures.plan(), "plan.txt");

    var ex = assertThrows(DefinitionValidationException.class, rejected::orElseThrow);
    assertEquals(ValidationErrorKind.BAD_EXTENSION, ex.getKind());
  }
}
