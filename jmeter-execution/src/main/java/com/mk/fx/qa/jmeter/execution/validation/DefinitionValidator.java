package com.mk.fx.qa.jmeter.execution.validation;

import com.google.common.hash.Hashing;
import com.mk.fx.qa.jmeter.execution.cfg.RunnerCfg;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import lombok.extern.slf4j.Slf4j;
import org.apache.tika.detect.Detector;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.mime.MediaType;
import org.springframework.stereotype.Component;

/**
 * Decides whether uploaded bytes may become a definition file.
 *
 * <p>Checks run cheapest first and stop at the first failure:
 *
 * <ol>
 *   <li>name present, inside the safe charset and free of traversal sequences
 *   <li>extension in the allowed list (case-insensitive)
 *   <li>non-empty and not larger than the configured maximum
 *   <li>content type sniffed from magic bytes belongs to the XML/text family
 *   <li>no deny-listed construct anywhere in the content, read in the document's own encoding
 *   <li>well-formed XML whose root element is the JMeter test plan
 * </ol>
 *
 * <p>The validator has no side effects; validating the same input twice yields equal results.
 */
@Slf4j
@Component
public class DefinitionValidator {

  static final int MAX_NAME_LENGTH = 255;
  private static final Pattern SAFE_NAME = Pattern.compile("[A-Za-z0-9._-]+");

  private final RunnerCfg.Validation cfg;
  private final Detector detector;
  private final XMLInputFactory xmlInputFactory;

  public DefinitionValidator(RunnerCfg properties, Detector detector) {
    this.cfg = properties.getValidation();
    this.detector = detector;
    this.xmlInputFactory = XMLInputFactory.newFactory();
    xmlInputFactory.setProperty(XMLInputFactory.SUPPORT_DTD, false);
    xmlInputFactory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
  }

  public ValidationResult validate(byte[] content, String declaredName) {
    var nameCheck = checkName(declaredName);
    if (nameCheck != null) {
      return reject(declaredName, nameCheck);
    }
    if (!hasAllowedExtension(declaredName)) {
      return reject(
          declaredName,
          ValidationResult.rejected(
              ValidationErrorKind.BAD_EXTENSION,
              "File extension not allowed. Allowed: " + cfg.getAllowedExtensions()));
    }
    if (content == null || content.length == 0) {
      return reject(
          declaredName, ValidationResult.rejected(ValidationErrorKind.EMPTY_FILE, "File is empty"));
    }
    if (content.length > cfg.getMaxSizeBytes()) {
      return reject(
          declaredName,
          ValidationResult.rejected(
              ValidationErrorKind.OVERSIZED,
              "File too large. Max size: " + cfg.getMaxSizeBytes() + " bytes"));
    }

    MediaType detected = detectContentType(content);
    if (!cfg.getAllowedContentTypes().contains(detected.getBaseType().toString())) {
      return reject(
          declaredName,
          ValidationResult.rejected(
              ValidationErrorKind.SIGNATURE_MISMATCH,
              "File content looks like " + detected.getBaseType() + ", not a test plan"));
    }

    String pattern = findDenyListedPattern(content);
    if (pattern != null) {
      return reject(
          declaredName,
          ValidationResult.rejected(
              ValidationErrorKind.UNSAFE_CONTENT,
              "File contains potentially malicious content: " + pattern));
    }

    String structureProblem = checkStructure(content);
    if (structureProblem != null) {
      return reject(
          declaredName,
          ValidationResult.rejected(ValidationErrorKind.INVALID_STRUCTURE, structureProblem));
    }

    return ValidationResult.accepted(
        declaredName,
        content.length,
        Hashing.sha256().hashBytes(content).toString(),
        detected.getBaseType().toString());
  }

  /**
   * Checks only the name part of the rules. Returns null when the name is acceptable as a
   * definition identifier.
   */
  public ValidationResult checkName(String declaredName) {
    if (declaredName == null || declaredName.isBlank()) {
      return ValidationResult.rejected(ValidationErrorKind.MISSING_NAME, "No filename provided");
    }
    if (declaredName.length() > MAX_NAME_LENGTH
        || declaredName.contains("..")
        || declaredName.startsWith(".")
        || !SAFE_NAME.matcher(declaredName).matches()) {
      return ValidationResult.rejected(
          ValidationErrorKind.UNSAFE_NAME,
          "Filename must be at most "
              + MAX_NAME_LENGTH
              + " characters of [A-Za-z0-9._-] without path sequences");
    }
    return null;
  }

  private boolean hasAllowedExtension(String name) {
    String lower = name.toLowerCase(Locale.ROOT);
    return cfg.getAllowedExtensions().stream()
        .map(ext -> ext.toLowerCase(Locale.ROOT))
        .anyMatch(lower::endsWith);
  }

  private MediaType detectContentType(byte[] content) {
    // detection sees the bytes only, never the declared name
    try (InputStream stream = new ByteArrayInputStream(content)) {
      return detector.detect(stream, new Metadata());
    } catch (IOException e) {
      log.warn("Content type detection failed: {}", e.getMessage());
      return MediaType.OCTET_STREAM;
    }
  }

  private String findDenyListedPattern(byte[] content) {
    List<String> patterns = cfg.getDenyPatterns();
    if (patterns == null || patterns.isEmpty()) {
      return null;
    }
    Charset charset = documentCharset(content);
    String decoded = new String(content, charset).toLowerCase(Locale.ROOT);
    String raw =
        StandardCharsets.ISO_8859_1.equals(charset)
            ? decoded
            : new String(content, StandardCharsets.ISO_8859_1).toLowerCase(Locale.ROOT);
    for (String pattern : patterns) {
      String needle = pattern.toLowerCase(Locale.ROOT);
      if (decoded.contains(needle) || raw.contains(needle)) {
        return pattern;
      }
    }
    return null;
  }

  /**
   * Encoding the XML parser will read the document in: detected from the byte order mark or
   * leading bytes, else declared, else UTF-8. Content the parser cannot open is read byte-wise.
   */
  private Charset documentCharset(byte[] content) {
    XMLStreamReader reader = null;
    try {
      reader = xmlInputFactory.createXMLStreamReader(new ByteArrayInputStream(content));
      String encoding = reader.getEncoding();
      if (encoding == null) {
        encoding = reader.getCharacterEncodingScheme();
      }
      return encoding == null ? StandardCharsets.UTF_8 : Charset.forName(encoding);
    } catch (XMLStreamException | IllegalArgumentException e) {
      log.debug("Could not determine document encoding: {}", e.getMessage());
      return StandardCharsets.ISO_8859_1;
    } finally {
      closeQuietly(reader);
    }
  }

  private String checkStructure(byte[] content) {
    XMLStreamReader reader = null;
    try {
      reader = xmlInputFactory.createXMLStreamReader(new ByteArrayInputStream(content));
      String root = null;
      while (reader.hasNext()) {
        int event = reader.next();
        if (event == XMLStreamConstants.DTD) {
          return "Document type declarations are not allowed";
        }
        if (event == XMLStreamConstants.START_ELEMENT && root == null) {
          root = reader.getLocalName();
          if (!cfg.getRootElement().equals(root)) {
            return "Invalid JMX structure: root element is " + root;
          }
        }
      }
      return root == null ? "Invalid JMX structure: no root element" : null;
    } catch (XMLStreamException e) {
      return "XML parsing failed: " + e.getMessage();
    } finally {
      closeQuietly(reader);
    }
  }

  private static void closeQuietly(XMLStreamReader reader) {
    if (reader == null) {
      return;
    }
    try {
      reader.close();
    } catch (XMLStreamException e) {
      log.debug("Failed to close XML reader: {}", e.getMessage());
    }
  }

  private static ValidationResult reject(String declaredName, ValidationResult result) {
    log.warn("Definition {} rejected ({}): {}", declaredName, result.errorKind(), result.message());
    return result;
  }
}
