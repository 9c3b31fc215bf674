package ca.gc.cra.prism.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {

  @Test
  void parsesKeyValuePairsInOrder() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {
        "files=/a.mp4,/b.jpg", "priority=high", "otelResourceAttributes=env=prod", "priority=critical"});

    assertEquals(List.of("files", "priority", "otelResourceAttributes"), List.copyOf(map.keySet()));
    assertEquals("critical", map.get("priority"));
    assertEquals("env=prod", map.get("otelResourceAttributes"));
  }

  @Test
  void emptyValueIsKept() {
    assertEquals("", CliArgsParser.toMap(new String[] {"otelEndpoint="}).get("otelEndpoint"));
    assertTrue(CliArgsParser.toMap(null).isEmpty());
  }

  @Test
  void rejectsMalformedArguments() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"files"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"=value"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"9key=value"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"key=a\u0007b"}));
  }
}
