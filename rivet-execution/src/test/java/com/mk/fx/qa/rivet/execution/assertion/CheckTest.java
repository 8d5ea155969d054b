package com.mk.fx.qa.rivet.execution.assertion;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CheckTest {

  @Test
  void checks_areClosedOverTheFourKinds() {
    assertTrue(Check.class.isSealed());
    assertThat(Check.class.getPermittedSubclasses())
        .containsExactlyInAnyOrder(
            StatusCheck.class, HeaderCheck.class, PathCheck.class, SchemaCheck.class);
  }

  @Test
  void everyCheckType_reportsTheKindItIsCastFor() {
    Map<Class<?>, CheckKind> expected =
        Map.of(
            StatusCheck.class, CheckKind.STATUS,
            HeaderCheck.class, CheckKind.HEADER,
            PathCheck.class, CheckKind.PATH,
            SchemaCheck.class, CheckKind.SCHEMA);
    List<Check> samples =
        List.of(
            StatusCheck.of(200),
            HeaderCheck.present("X-Trace"),
            PathCheck.exists("$.id"),
            SchemaCheck.body(JsonNodeFactory.instance.objectNode()));

    for (Check check : samples) {
      assertEquals(expected.get(check.getClass()), check.kind(), check.getClass().getSimpleName());
    }
  }
}
