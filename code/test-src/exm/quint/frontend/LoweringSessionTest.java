package exm.quint.frontend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.junit.Test;

import exm.quint.ast.Construct;
import exm.quint.ast.ConstructTree;
import exm.quint.ast.ConstructWalk;
import exm.quint.ast.UniformVisitor;
import exm.quint.common.Logging;
import exm.quint.common.Settings;
import exm.quint.ir.IrModule;

public class LoweringSessionTest {

  private static ConstructTree sample(ConstructBuilder b) {
    return b.module("Sample",
        b.typeSum("Shape", b.variant("Circle", b.intType()),
                           b.variant("Point")),
        b.val("origin", b.app("Point")),
        b.def("area", b.params("r"),
              b.binary("*", b.name("r"), b.name("r"))),
        b.val("pairSum", b.app("map",
            b.name("S"),
            b.tupleLambda(b.params("a", "b"),
                          b.binary("+", b.name("a"), b.name("b"))))));
  }

  @Test
  public void testDeterministic() {
    LoweringResult r1 = IrTrees.lower(sample(new ConstructBuilder()));
    LoweringResult r2 = IrTrees.lower(sample(new ConstructBuilder()));
    IrModule m1 = r1.singleModule();
    IrModule m2 = r2.singleModule();
    assertEquals(m1.toString(), m2.toString());
    assertEquals(IrTrees.collectIds(m1), IrTrees.collectIds(m2));
    assertEquals(r1.sourceMap.ids(), r2.sourceMap.ids());
  }

  @Test
  public void testConcurrentSessions() throws Exception {
    final String expected =
        IrTrees.lower(sample(new ConstructBuilder())).singleModule()
               .toString();
    ExecutorService pool = Executors.newFixedThreadPool(4);
    try {
      List<Future<String>> futures = new ArrayList<Future<String>>();
      for (int i = 0; i < 16; i++) {
        futures.add(pool.submit(new Callable<String>() {
          @Override
          public String call() {
            return IrTrees.lower(sample(new ConstructBuilder()))
                          .singleModule().toString();
          }
        }));
      }
      for (Future<String> f: futures) {
        assertEquals(expected, f.get());
      }
    } finally {
      pool.shutdown();
    }
  }

  @Test
  public void testFromSettings() throws Exception {
    String saved = Settings.get(Settings.CHECK_STACK_LEAKS);
    try {
      Settings.set(Settings.CHECK_STACK_LEAKS, "false");
      assertFalse(LoweringSession.fromSettings().state().checkLeaks);
      Settings.set(Settings.CHECK_STACK_LEAKS, "true");
      assertTrue(LoweringSession.fromSettings().state().checkLeaks);
    } finally {
      Settings.set(Settings.CHECK_STACK_LEAKS, saved);
    }
  }

  @Test
  public void testDisabledLeakCheckWarnsOnce() throws Exception {
    String saved = Settings.get(Settings.CHECK_STACK_LEAKS);
    try {
      Settings.set(Settings.CHECK_STACK_LEAKS, "false");
      LoweringSession.fromSettings();
      LoweringSession.fromSettings();
      // Already emitted by the first session
      assertFalse(Logging.addEmitted(Level.WARN,
          "Stack leak checks disabled by " + Settings.CHECK_STACK_LEAKS));
    } finally {
      Settings.set(Settings.CHECK_STACK_LEAKS, saved);
    }
  }

  /**
   * Feeding constructs one at a time gives the same result as a walk
   */
  @Test
  public void testIncrementalExit() {
    final LoweringSession incremental = new LoweringSession();
    UniformVisitor<Void> forwarder = new UniformVisitor<Void>() {
      @Override
      protected void visit(Void state, Construct c) {
        incremental.exit(c);
      }
    };
    ConstructWalk.walk(Logger.getLogger(LoweringSessionTest.class),
                       sample(new ConstructBuilder()), forwarder, null);

    IrModule walked = IrTrees.lower(sample(new ConstructBuilder()))
                             .singleModule();
    IrModule fed = incremental.result().singleModule();
    assertEquals(walked.toString(), fed.toString());
    assertEquals(IrTrees.collectIds(walked), IrTrees.collectIds(fed));
  }
}
