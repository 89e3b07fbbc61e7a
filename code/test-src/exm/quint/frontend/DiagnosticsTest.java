package exm.quint.frontend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import com.google.common.collect.ListMultimap;

public class DiagnosticsTest {

  @Test
  public void testDefaultMessages() {
    Diagnostics diagnostics = new Diagnostics();
    assertTrue(diagnostics.isEmpty());
    Diagnostic d = diagnostics.add(3, DiagnosticCode.QNT007);
    assertEquals(DiagnosticCode.QNT007.defaultMessage, d.message);
    assertEquals(3, d.nodeId);
  }

  @Test
  public void testByNode() {
    Diagnostics diagnostics = new Diagnostics();
    diagnostics.add(3, DiagnosticCode.QNT007);
    diagnostics.add(5, DiagnosticCode.QNT012);
    diagnostics.add(3, DiagnosticCode.QNT012, "custom");
    ListMultimap<Long, Diagnostic> byNode = diagnostics.byNode();
    assertEquals(2, byNode.get(3L).size());
    assertEquals("custom", byNode.get(3L).get(1).message);
    assertEquals(DiagnosticCode.QNT012, byNode.get(5L).get(0).code);
    assertEquals(3, diagnostics.size());
  }
}
