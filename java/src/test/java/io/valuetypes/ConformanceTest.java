package io.valuetypes;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DynamicTest;
import org.junit.jupiter.api.TestFactory;

/** Conformance tests loaded from spec/tests.json. */
public class ConformanceTest {
  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static JsonNode CASES;

  @BeforeAll
  static void loadCases() throws IOException {
    Path casesPath = Path.of("../spec/tests.json");
    String json = Files.readString(casesPath);
    CASES = MAPPER.readTree(json);
  }

  // Parse tests

  @TestFactory
  Stream<DynamicTest> parseTests() {
    List<DynamicTest> tests = new ArrayList<>();
    JsonNode parse = CASES.get("parse");
    parse
        .fieldNames()
        .forEachRemaining(
            section -> {
              if (section.equals("description")) return;
              JsonNode testsNode = parse.get(section).get("tests");
              if (testsNode == null || !testsNode.isArray()) return;

              for (JsonNode tc : testsNode) {
                String name = section + "/" + tc.get("name").asText();
                String input = tc.get("input").asText();

                tests.add(
                    DynamicTest.dynamicTest(
                        name,
                        () -> {
                          Date d = Date.parse(input);
                          assertEquals(tc.get("year").asInt(), d.year(), "year of " + input);
                          assertEquals(tc.get("month").asInt(), d.month(), "month of " + input);
                          assertEquals(tc.get("day").asInt(), d.day(), "day of " + input);

                          // Roundtrip test
                          assertEquals(input, d.toString(), "parse(" + input + ").toString()");
                          assertEquals(d, Date.tryParse(d.toString()).orElseThrow());
                        }));
              }
            });
    return tests.stream();
  }

  @TestFactory
  Stream<DynamicTest> parseErrorTests() {
    List<DynamicTest> tests = new ArrayList<>();
    JsonNode errorTests = CASES.get("parse_errors").get("tests");

    for (JsonNode tc : errorTests) {
      String name = tc.get("name").asText();
      String input = tc.get("input").asText();
      String kind = tc.get("kind").asText();
      Span span = new Span(tc.get("span").get(0).asInt(), tc.get("span").get(1).asInt());

      tests.add(
          DynamicTest.dynamicTest(
              name,
              () -> {
                DateException err =
                    assertThrows(
                        DateException.class,
                        () -> Date.parse(input),
                        "expected parse error for: " + input);
                assertEquals(kind, err.kind().value(), "error kind for: " + input);
                assertEquals(span, err.span().orElseThrow(), "error span for: " + input);
                assertEquals(input, err.input().orElseThrow());

                assertTrue(Date.tryParse(input).isEmpty(), "tryParse(" + input + ")");
                assertFalse(Date.validate(input), "validate(" + input + ")");
              }));
    }
    return tests.stream();
  }

  // Arithmetic tests

  @TestFactory
  Stream<DynamicTest> arithmeticTests() {
    List<DynamicTest> tests = new ArrayList<>();
    JsonNode arithmeticTests = CASES.get("arithmetic").get("tests");

    for (JsonNode tc : arithmeticTests) {
      String name = tc.get("name").asText();
      String op = tc.get("op").asText();
      long amount = tc.get("amount").asLong();
      JsonNode expectedNode = tc.get("expected");

      tests.add(
          DynamicTest.dynamicTest(
              op + "/" + name,
              () -> {
                Date start = Date.parse(tc.get("date").asText());
                if (expectedNode.isNull()) {
                  assertThrows(
                      DateTimeException.class,
                      () -> apply(start, op, amount),
                      op + "(" + amount + ") should leave the supported range");
                } else {
                  Date result = apply(start, op, amount);
                  assertEquals(expectedNode.asText(), result.toString(), op + "(" + amount + ")");
                  if (op.equals("plus_days")) {
                    assertEquals(start, result.minusDays(amount), "minusDays undoes plusDays");
                  }
                }
              }));
    }
    return tests.stream();
  }

  // Field tests

  @TestFactory
  Stream<DynamicTest> fieldTests() {
    List<DynamicTest> tests = new ArrayList<>();
    JsonNode fieldTests = CASES.get("fields").get("tests");

    for (JsonNode tc : fieldTests) {
      String name = tc.get("name").asText();
      String date = tc.get("date").asText();

      tests.add(
          DynamicTest.dynamicTest(
              name,
              () -> {
                Date d = Date.parse(date);
                assertEquals(
                    Weekday.parse(tc.get("day_of_week").asText()).orElseThrow(),
                    d.dayOfWeek(),
                    "dayOfWeek of " + date);
                assertEquals(tc.get("day_of_year").asInt(), d.dayOfYear(), "dayOfYear of " + date);
                assertEquals(tc.get("leap_year").asBoolean(), d.isLeapYear(), "leap of " + date);
                assertEquals(
                    tc.get("length_of_month").asInt(), d.lengthOfMonth(), "month of " + date);
              }));
    }
    return tests.stream();
  }

  // Ordering tests

  @TestFactory
  Stream<DynamicTest> orderingTests() {
    List<DynamicTest> tests = new ArrayList<>();
    JsonNode orderingTests = CASES.get("ordering").get("tests");

    for (JsonNode tc : orderingTests) {
      String name = tc.get("name").asText();
      int expected = tc.get("compare").asInt();

      tests.add(
          DynamicTest.dynamicTest(
              name,
              () -> {
                Date a = Date.parse(tc.get("a").asText());
                Date b = Date.parse(tc.get("b").asText());
                assertEquals(expected, Integer.signum(a.compareTo(b)), "a.compareTo(b)");
                assertEquals(-expected, Integer.signum(b.compareTo(a)), "b.compareTo(a)");
                assertEquals(expected == 0, a.equals(b), "a.equals(b)");
                assertEquals(expected < 0, a.isBefore(b), "a.isBefore(b)");
                assertEquals(expected > 0, a.isAfter(b), "a.isAfter(b)");
              }));
    }
    return tests.stream();
  }

  private static Date apply(Date d, String op, long amount) {
    return switch (op) {
      case "plus_days" -> d.plusDays(amount);
      case "plus_months" -> d.plusMonths(amount);
      case "plus_years" -> d.plusYears(amount);
      default -> throw new IllegalArgumentException("unknown op: " + op);
    };
  }
}
