package exm.quint.ast;

import static org.junit.Assert.assertEquals;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.apache.log4j.Logger;
import org.junit.Test;

import exm.quint.ast.ExprConstructs.LiteralKind;
import exm.quint.ast.ExprConstructs.LiteralOrId;

public class ConstructWalkTest {
  private static final Logger logger =
                          Logger.getLogger(ConstructWalkTest.class);

  private static final SourceSpan SPAN = new SourceSpan("w.qnt", 0, 0, 0);

  /**
   * Appends the text of each visited construct
   */
  private static class Recorder extends UniformVisitor<List<String>> {
    @Override
    protected void visit(List<String> visited, Construct c) {
      visited.add(c.text());
    }
  }

  private static ConstructTree leaf(String text) {
    return ConstructTree.of(new LiteralOrId(SPAN, LiteralKind.NAME, text));
  }

  private static ConstructTree node(String text, ConstructTree... children) {
    return ConstructTree.of(new LiteralOrId(SPAN, LiteralKind.NAME, text),
                            children);
  }

  @Test
  public void testPostOrder() {
    ConstructTree tree = node("root",
        node("left", leaf("a"), leaf("b")),
        leaf("mid"),
        node("right", leaf("c")));
    List<String> visited = new ArrayList<String>();
    ConstructWalk.walk(logger, tree, new Recorder(), visited);
    assertEquals(Arrays.asList("a", "b", "left", "mid", "c", "right",
                               "root"), visited);
  }

  @Test
  public void testDeepTree() {
    ConstructTree tree = leaf("0");
    for (int i = 1; i <= 100000; i++) {
      tree = node(Integer.toString(i), tree);
    }
    List<String> visited = new ArrayList<String>();
    ConstructWalk.walk(logger, tree, new Recorder(), visited);
    assertEquals(100001, visited.size());
    assertEquals("0", visited.get(0));
    assertEquals("100000", visited.get(100000));
  }

  @Test
  public void testPrintTree() {
    String printed = node("root", leaf("a")).printTree();
    assertEquals("LiteralOrId root" + System.lineSeparator() +
                 "  LiteralOrId a" + System.lineSeparator(), printed);
  }
}
