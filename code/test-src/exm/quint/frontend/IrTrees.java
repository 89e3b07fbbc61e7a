package exm.quint.frontend;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import exm.quint.ast.ConstructTree;
import exm.quint.ir.IrNode;

/**
 * Helpers for inspecting lowered trees in tests
 */
public class IrTrees {

  /**
   * @return ids of the node and all nodes below it, in pre-order
   */
  public static List<Long> collectIds(IrNode root) {
    List<Long> ids = new ArrayList<Long>();
    Deque<IrNode> stack = new ArrayDeque<IrNode>();
    stack.push(root);
    while (!stack.isEmpty()) {
      IrNode n = stack.pop();
      ids.add(n.id());
      List<IrNode> children = n.children();
      for (int i = children.size() - 1; i >= 0; i--) {
        stack.push(children.get(i));
      }
    }
    return ids;
  }

  public static LoweringResult lower(ConstructTree tree) {
    LoweringSession session = new LoweringSession();
    session.walk(tree);
    return session.result();
  }
}
