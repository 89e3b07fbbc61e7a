package exm.quint.frontend;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import exm.quint.ir.Builtins;
import exm.quint.ir.Exprs.App;
import exm.quint.ir.Exprs.Expr;
import exm.quint.ir.Exprs.IntLit;
import exm.quint.ir.Exprs.Lambda;
import exm.quint.ir.Exprs.Let;
import exm.quint.ir.Exprs.Name;

/**
 * Just enough of an evaluator to run lowered integer and tuple code:
 * integers, tuples, names, let, lambda application, iadd and item.
 */
public class MiniEvaluator {

  public static Object apply(Lambda lambda, List<Object> args,
                             Map<String, Object> env) {
    if (lambda.params.size() != args.size()) {
      throw new IllegalArgumentException("arity mismatch: " + lambda);
    }
    Map<String, Object> inner = new HashMap<String, Object>(env);
    for (int i = 0; i < args.size(); i++) {
      inner.put(lambda.params.get(i).name, args.get(i));
    }
    return eval(lambda.body, inner);
  }

  public static Object eval(Expr e, Map<String, Object> env) {
    if (e instanceof IntLit) {
      return ((IntLit)e).value;
    } else if (e instanceof Name) {
      String name = ((Name)e).name;
      if (!env.containsKey(name)) {
        throw new IllegalStateException("unbound: " + name);
      }
      return env.get(name);
    } else if (e instanceof Let) {
      Let let = (Let)e;
      Map<String, Object> inner = new HashMap<String, Object>(env);
      inner.put(let.opdef.name, eval(let.opdef.expr, env));
      return eval(let.body, inner);
    } else if (e instanceof App) {
      App app = (App)e;
      List<Object> args = new ArrayList<Object>();
      for (Expr arg: app.args) {
        args.add(eval(arg, env));
      }
      if (app.opcode.equals(Builtins.IADD)) {
        return ((BigInteger)args.get(0)).add((BigInteger)args.get(1));
      } else if (app.opcode.equals(Builtins.TUP)) {
        return args;
      } else if (app.opcode.equals(Builtins.ITEM)) {
        int index = ((BigInteger)args.get(1)).intValue();
        return ((List<?>)args.get(0)).get(index - 1);
      }
      throw new UnsupportedOperationException(app.opcode);
    }
    throw new UnsupportedOperationException(e.toString());
  }
}
